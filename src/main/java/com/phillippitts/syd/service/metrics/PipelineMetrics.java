package com.phillippitts.syd.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Metrics for pipeline runs: per-star processing time and outcome, group dispatch and
 * ensemble consolidation.
 */
@Component
public class PipelineMetrics {

    private static final String METRIC_PREFIX = "syd.pipeline";

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records how long the fitting stage took for one star.
     *
     * @param mode run mode ({@code serial} or {@code parallel})
     * @param durationNanos duration in nanoseconds
     */
    public void recordStarLatency(String mode, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".star.latency")
                .description("Time taken to process one star")
                .tag("mode", mode)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSuccess(String mode) {
        Counter.builder(METRIC_PREFIX + ".star.success")
                .description("Number of stars processed successfully")
                .tag("mode", mode)
                .register(registry)
                .increment();
    }

    /**
     * @param reason exception simple name
     */
    public void incrementFailure(String mode, String reason) {
        Counter.builder(METRIC_PREFIX + ".star.failure")
                .description("Number of stars whose processing failed")
                .tag("mode", mode)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordGroups(int groups) {
        Counter.builder(METRIC_PREFIX + ".groups")
                .description("Number of star groups dispatched")
                .register(registry)
                .increment(groups);
    }

    /**
     * @param kind ensemble table kind ({@code estimates} or {@code global})
     * @param rows rows written
     */
    public void recordAggregatedRows(String kind, int rows) {
        Counter.builder(METRIC_PREFIX + ".aggregate.rows")
                .description("Rows written to ensemble tables")
                .tag("kind", kind)
                .register(registry)
                .increment(rows);
    }

    public void incrementSkippedArtifact(String kind) {
        Counter.builder(METRIC_PREFIX + ".aggregate.skipped")
                .description("Per-star artifacts skipped because they could not be read")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }
}
