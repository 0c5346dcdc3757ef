package com.phillippitts.syd.service.parallel;

import com.phillippitts.syd.domain.StarConfiguration;
import com.phillippitts.syd.domain.StarGroup;
import com.phillippitts.syd.exception.SydException;
import com.phillippitts.syd.service.metrics.PipelineMetrics;
import com.phillippitts.syd.service.resolve.ResolvedStars;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

/**
 * Default pipeline dispatch.
 *
 * <p><b>Serial mode:</b> stars run in request order on the calling thread.
 *
 * <p><b>Parallel mode:</b> stars are split by {@link GroupPartitioner}, each group is submitted
 * as one task to the {@code starExecutor}, and the call blocks until every group has finished.
 * Within a group stars run sequentially in group order.
 *
 * <p><b>Error Handling:</b> a runtime exception from the processor fails only that star. It is
 * logged with the star id, counted and recorded in the {@link PipelineReport}; the remaining
 * stars still run. Each star runs with the Log4j2 ThreadContext key {@code star} set.
 */
@Service
public class DefaultPipelineService implements PipelineService {

    private static final Logger LOG = LogManager.getLogger(DefaultPipelineService.class);
    static final String STAR_CONTEXT_KEY = "star";

    private final GroupPartitioner partitioner;
    private final Executor executor;
    private final PipelineMetrics metrics;

    public DefaultPipelineService(GroupPartitioner partitioner,
                                  @Qualifier("starExecutor") Executor executor,
                                  PipelineMetrics metrics) {
        this.partitioner = Objects.requireNonNull(partitioner);
        this.executor = Objects.requireNonNull(executor);
        this.metrics = Objects.requireNonNull(metrics);
    }

    @Override
    public PipelineReport run(ResolvedStars stars, StarProcessor processor, boolean parallel, int nThreads) {
        Objects.requireNonNull(stars, "stars");
        Objects.requireNonNull(processor, "processor");

        Map<String, String> failures = new ConcurrentHashMap<>();
        int groupCount;
        if (parallel) {
            groupCount = runParallel(stars, processor, nThreads, failures);
        } else {
            groupCount = stars.isEmpty() ? 0 : 1;
            for (StarConfiguration config : stars) {
                runStar(config, processor, "serial", failures);
            }
        }
        return buildReport(stars, failures, groupCount);
    }

    private int runParallel(ResolvedStars stars, StarProcessor processor, int nThreads,
                            Map<String, String> failures) {
        List<StarGroup> groups = partitioner.partition(stars.stars(), nThreads);
        metrics.recordGroups(groups.size());
        LOG.info("Dispatching {} star(s) in {} group(s)", stars.size(), groups.size());

        List<CompletableFuture<Void>> futures = new ArrayList<>(groups.size());
        for (StarGroup group : groups) {
            futures.add(CompletableFuture.runAsync(() -> runGroup(group, stars, processor, failures), executor));
        }
        try {
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).get();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
            throw new SydException("Interrupted while waiting for star groups", ie);
        } catch (ExecutionException ee) {
            throw new SydException("Star group terminated abnormally", ee.getCause());
        }
        return groups.size();
    }

    private void runGroup(StarGroup group, ResolvedStars stars, StarProcessor processor,
                          Map<String, String> failures) {
        LOG.debug("Group {} starting with {} star(s)", group.index(), group.size());
        for (String star : group.stars()) {
            runStar(stars.get(star), processor, "parallel", failures);
        }
    }

    private void runStar(StarConfiguration config, StarProcessor processor, String mode,
                         Map<String, String> failures) {
        ThreadContext.put(STAR_CONTEXT_KEY, config.star());
        long t0 = System.nanoTime();
        try {
            processor.process(config);
            metrics.incrementSuccess(mode);
            LOG.debug("Star {} processed", config.star());
        } catch (RuntimeException e) {
            failures.put(config.star(), e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
            metrics.incrementFailure(mode, e.getClass().getSimpleName());
            LOG.error("Processing failed for star {}", config.star(), e);
        } finally {
            metrics.recordStarLatency(mode, System.nanoTime() - t0);
            ThreadContext.remove(STAR_CONTEXT_KEY);
        }
    }

    private static PipelineReport buildReport(ResolvedStars stars, Map<String, String> failures, int groups) {
        List<String> succeeded = new ArrayList<>();
        Map<String, String> ordered = new LinkedHashMap<>();
        for (String star : stars.stars()) {
            String failure = failures.get(star);
            if (failure == null) {
                succeeded.add(star);
            } else {
                ordered.put(star, failure);
            }
        }
        return new PipelineReport(succeeded, ordered, groups);
    }
}
