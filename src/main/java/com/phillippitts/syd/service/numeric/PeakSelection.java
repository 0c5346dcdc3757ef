package com.phillippitts.syd.service.numeric;

/**
 * Peaks chosen by {@link PeakSelector#maxElements}, highest weighted magnitude first.
 *
 * @param x       peak positions
 * @param y       unweighted magnitudes at those positions
 * @param weights weighting curve applied to the whole input series (all ones when unweighted)
 */
public record PeakSelection(double[] x, double[] y, double[] weights) {

    public int size() {
        return x.length;
    }

    public boolean isEmpty() {
        return x.length == 0;
    }
}
