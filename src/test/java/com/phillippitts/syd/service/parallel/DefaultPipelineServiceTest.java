package com.phillippitts.syd.service.parallel;

import com.phillippitts.syd.domain.StarConfiguration;
import com.phillippitts.syd.exception.ProcessingException;
import com.phillippitts.syd.service.metrics.PipelineMetrics;
import com.phillippitts.syd.service.resolve.ResolvedStars;
import com.phillippitts.syd.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class DefaultPipelineServiceTest {

    private SimpleMeterRegistry registry;
    private PipelineMetrics metrics;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new PipelineMetrics(registry);
        pool = Executors.newFixedThreadPool(3);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void serialRunsInRequestOrderOnCallingThread() {
        DefaultPipelineService svc = new DefaultPipelineService(new GroupPartitioner(() -> 2), new SyncExecutor(), metrics);
        List<String> seen = new ArrayList<>();
        Thread caller = Thread.currentThread();

        PipelineReport report = svc.run(stars("c", "a", "b"), config -> {
            assertThat(Thread.currentThread()).isSameAs(caller);
            seen.add(config.star());
        }, false, 0);

        assertThat(seen).containsExactly("c", "a", "b");
        assertThat(report.succeeded()).containsExactly("c", "a", "b");
        assertThat(report.groups()).isEqualTo(1);
        assertThat(report.hasFailures()).isFalse();
    }

    @Test
    void parallelProcessesEveryStarAndJoins() {
        DefaultPipelineService svc = new DefaultPipelineService(new GroupPartitioner(() -> 2), pool, metrics);
        Set<String> seen = ConcurrentHashMap.newKeySet();

        PipelineReport report = svc.run(stars("1", "2", "3", "4", "5"), config -> seen.add(config.star()), true, 3);

        assertThat(seen).containsExactlyInAnyOrder("1", "2", "3", "4", "5");
        assertThat(report.succeeded()).containsExactly("1", "2", "3", "4", "5");
        assertThat(report.groups()).isEqualTo(3);
        assertThat(registry.find("syd.pipeline.groups").counter().count()).isEqualTo(3.0);
    }

    @Test
    void oneFailingStarDoesNotStopTheOthers() {
        DefaultPipelineService svc = new DefaultPipelineService(new GroupPartitioner(() -> 2), pool, metrics);
        List<String> seen = Collections.synchronizedList(new ArrayList<>());

        PipelineReport report = svc.run(stars("a", "b", "c", "d"), config -> {
            if (config.star().equals("a")) {
                throw new ProcessingException("empty power spectrum", "a");
            }
            seen.add(config.star());
        }, true, 2);

        assertThat(seen).containsExactlyInAnyOrder("b", "c", "d");
        assertThat(report.succeeded()).containsExactly("b", "c", "d");
        assertThat(report.failures()).containsOnlyKeys("a");
        assertThat(report.failures().get("a")).contains("empty power spectrum");
        assertThat(report.total()).isEqualTo(4);
        assertThat(registry.find("syd.pipeline.star.failure").tag("reason", "ProcessingException").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.find("syd.pipeline.star.success").tag("mode", "parallel").counter().count())
                .isEqualTo(3.0);
    }

    @Test
    void starIdIsInThreadContextWhileProcessing() {
        DefaultPipelineService svc = new DefaultPipelineService(new GroupPartitioner(() -> 2), pool, metrics);
        Map<String, String> contextSeen = new ConcurrentHashMap<>();

        svc.run(stars("x", "y"), config -> contextSeen.put(config.star(), ThreadContext.get("star")), true, 2);

        assertThat(contextSeen).containsEntry("x", "x").containsEntry("y", "y");
        assertThat(ThreadContext.get("star")).isNull();
    }

    @Test
    void emptyStarSetRunsNothing() {
        DefaultPipelineService svc = new DefaultPipelineService(new GroupPartitioner(() -> 2), pool, metrics);

        PipelineReport report = svc.run(stars(), config -> {
            throw new IllegalStateException("should not run");
        }, true, 0);

        assertThat(report.total()).isZero();
        assertThat(report.groups()).isZero();
    }

    private static ResolvedStars stars(String... ids) {
        Map<String, StarConfiguration> map = new LinkedHashMap<>();
        for (String id : ids) {
            map.put(id, new StarConfiguration(id, Path.of("results", id), Map.of(), null));
        }
        return new ResolvedStars(map);
    }
}
