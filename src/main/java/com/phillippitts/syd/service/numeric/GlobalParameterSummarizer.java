package com.phillippitts.syd.service.numeric;

import com.phillippitts.syd.domain.GlobalFitResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reduces per-trial samples of each global parameter to a value and uncertainty.
 *
 * <p>The value is always the first (unperturbed) trial. The uncertainty is the MAD-based
 * standard deviation across trials, present only when more than one iteration ran.
 */
public final class GlobalParameterSummarizer {

    private GlobalParameterSummarizer() {
        // Utility class - prevent instantiation
    }

    /**
     * @param samples parameter name to per-trial values, in output order
     * @param mcIter  number of Monte-Carlo iterations that were run
     */
    public static List<GlobalFitResult> summarize(Map<String, double[]> samples, int mcIter) {
        List<GlobalFitResult> results = new ArrayList<>(samples.size());
        for (Map.Entry<String, double[]> e : samples.entrySet()) {
            double[] trials = e.getValue();
            double value = trials.length == 0 ? Double.NaN : trials[0];
            if (mcIter > 1) {
                results.add(GlobalFitResult.of(e.getKey(), value, UncertaintyEstimator.madStd(trials)));
            } else {
                results.add(GlobalFitResult.of(e.getKey(), value));
            }
        }
        return results;
    }
}
