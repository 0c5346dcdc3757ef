package com.phillippitts.syd.service.aggregate;

import com.phillippitts.syd.service.metrics.PipelineMetrics;
import com.phillippitts.syd.service.output.CsvTables;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ResultAggregatorTest {

    @TempDir
    Path outdir;

    private SimpleMeterRegistry registry;
    private ResultAggregator aggregator;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        aggregator = new ResultAggregator(new PipelineMetrics(registry));
    }

    @Test
    void estimatesOrderedByStarId() throws IOException {
        estimate("10", "estimates.csv", "100.0");
        estimate("2", "estimates.csv", "20.0");
        estimate("KIC1", "estimates.csv", "1.0");

        AggregationResult result = aggregator.aggregate(outdir, false);

        EnsembleTable table = result.estimates().orElseThrow();
        assertThat(table.stars()).containsExactly("2", "10", "KIC1");
        assertThat(table.columns()).startsWith("star", "numax", "dnu", "snr");
        List<Map<String, String>> written = CsvTables.read(outdir.resolve("estimates.csv"));
        assertThat(written).extracting(r -> r.get("star")).containsExactly("2", "10", "KIC1");
        assertThat(written.get(1)).containsEntry("numax", "100.0");
        assertThat(result.global()).isEmpty();
        assertThat(outdir.resolve("global.csv")).doesNotExist();
    }

    @Test
    void globalTableUnionsColumnsAndAddsErrors() throws IOException {
        global("1", "global.csv", "parameter,value,uncertainty\nnumax_smooth,643.2,--\ndnu,30.1,--\n");
        global("2", "global.csv", "parameter,value,uncertainty\nnumax_smooth,1200.0,12.5\nA_smooth,3.4,0.2\n");

        EnsembleTable table = aggregator.aggregate(outdir, false).global().orElseThrow();

        assertThat(table.columns()).containsExactly("star", "numax_smooth", "dnu", "A_smooth",
                "numax_smooth_err", "A_smooth_err");
        assertThat(table.value("1", "dnu")).contains("30.1");
        assertThat(table.value("1", "numax_smooth_err")).isEmpty();
        assertThat(table.value("2", "numax_smooth_err")).contains("12.5");
        List<Map<String, String>> written = CsvTables.read(outdir.resolve("global.csv"));
        assertThat(written.get(0)).containsEntry("A_smooth", EnsembleTable.MISSING);
    }

    @Test
    void malformedArtifactSkippedWithoutAbortingOthers() throws IOException {
        estimate("1", "estimates.csv", "643.2");
        Files.createDirectories(outdir.resolve("2"));
        Files.writeString(outdir.resolve("2").resolve("estimates.csv"), "star,numax,dnu,snr\n");

        EnsembleTable table = aggregator.aggregate(outdir, false).estimates().orElseThrow();

        assertThat(table.stars()).containsExactly("1");
        assertThat(registry.counter("syd.pipeline.aggregate.skipped", "kind", "estimates").count())
                .isEqualTo(1.0);
    }

    @Test
    void picksMostRecentArtifactWithoutOverwrite() throws IOException {
        Path older = estimate("1", "estimates_2.csv", "1.0");
        Path newer = estimate("1", "estimates_1.csv", "2.0");
        Path canonical = estimate("1", "estimates.csv", "3.0");
        Instant now = Instant.now();
        Files.setLastModifiedTime(canonical, FileTime.from(now.minusSeconds(120)));
        Files.setLastModifiedTime(older, FileTime.from(now.minusSeconds(60)));
        Files.setLastModifiedTime(newer, FileTime.from(now));

        EnsembleTable table = aggregator.aggregate(outdir, false).estimates().orElseThrow();

        assertThat(table.value("1", "numax")).contains("2.0");
    }

    @Test
    void equalTimestampsPreferHighestSuffix() throws IOException {
        Path dir = outdir.resolve("1");
        FileTime same = FileTime.from(Instant.now().minusSeconds(30));
        for (String name : List.of("estimates.csv", "estimates_1.csv", "estimates_3.csv")) {
            Files.setLastModifiedTime(estimate("1", name, name), same);
        }

        assertThat(ResultAggregator.selectArtifact(dir, ResultAggregator.ESTIMATES, false))
                .contains(dir.resolve("estimates_3.csv"));
    }

    @Test
    void overwriteUsesCanonicalArtifactOnly() throws IOException {
        estimate("1", "estimates_1.csv", "2.0");
        Path dir = outdir.resolve("1");

        assertThat(ResultAggregator.selectArtifact(dir, ResultAggregator.ESTIMATES, true)).isEmpty();

        estimate("1", "estimates.csv", "3.0");
        assertThat(aggregator.aggregate(outdir, true).estimates().orElseThrow().value("1", "numax"))
                .contains("3.0");
    }

    @Test
    void missingOutputDirectoryAggregatesNothing() {
        AggregationResult result = aggregator.aggregate(outdir.resolve("absent"), false);

        assertThat(result.estimates()).isEmpty();
        assertThat(result.global()).isEmpty();
    }

    private Path estimate(String star, String fileName, String numax) throws IOException {
        Path dir = Files.createDirectories(outdir.resolve(star));
        return Files.writeString(dir.resolve(fileName),
                "star,numax,dnu,snr\n" + star + "," + numax + ",30.0,2.0\n");
    }

    private void global(String star, String fileName, String content) throws IOException {
        Path dir = Files.createDirectories(outdir.resolve(star));
        Files.writeString(dir.resolve(fileName), content);
    }
}
