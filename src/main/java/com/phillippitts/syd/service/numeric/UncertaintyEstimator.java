package com.phillippitts.syd.service.numeric;

import org.apache.commons.math3.stat.descriptive.rank.Median;

import java.util.Arrays;

/**
 * Robust spread of Monte-Carlo samples.
 */
public final class UncertaintyEstimator {

    /** Scales the median absolute deviation to a Gaussian standard deviation. */
    static final double MAD_TO_STD = 1.482602218505602;

    private UncertaintyEstimator() {
        // Utility class - prevent instantiation
    }

    /**
     * {@code 1.4826 * median(|s - median(s)|)}, ignoring NaN samples.
     *
     * @return NaN when no finite sample remains
     */
    public static double madStd(double[] samples) {
        double[] finite = Arrays.stream(samples).filter(v -> !Double.isNaN(v)).toArray();
        if (finite.length == 0) {
            return Double.NaN;
        }
        Median median = new Median();
        double center = median.evaluate(finite);
        double[] deviations = new double[finite.length];
        for (int i = 0; i < finite.length; i++) {
            deviations[i] = Math.abs(finite[i] - center);
        }
        return MAD_TO_STD * median.evaluate(deviations);
    }
}
