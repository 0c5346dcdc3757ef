package com.phillippitts.syd.service.parallel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a pipeline run.
 *
 * @param succeeded star ids processed without error, in request order
 * @param failures  star id to failure message, in request order
 * @param groups    number of worker groups used (1 in serial mode)
 */
public record PipelineReport(List<String> succeeded, Map<String, String> failures, int groups) {

    public PipelineReport {
        succeeded = List.copyOf(succeeded);
        failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public int total() {
        return succeeded.size() + failures.size();
    }
}
