package com.phillippitts.syd.service.numeric;

/**
 * Index-aligned output of {@link Binner#binData}: one entry per non-empty bin.
 */
public record BinnedSeries(double[] x, double[] y, double[] yErr) {

    static final BinnedSeries EMPTY = new BinnedSeries(new double[0], new double[0], new double[0]);

    public int size() {
        return x.length;
    }

    public boolean isEmpty() {
        return x.length == 0;
    }
}
