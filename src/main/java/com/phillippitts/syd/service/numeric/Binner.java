package com.phillippitts.syd.service.numeric;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Median;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Fixed-width binning of a series, linear or in log10 space.
 *
 * <p>Edges start at {@code min(x)} and advance by {@code width} while the edge does not exceed
 * {@code max(x)}; bin {@code k} covers {@code [edge_k, edge_k+1)}. Points beyond the last edge
 * fall outside every bin. Only occupied bins are materialized, so a width far below the data
 * spacing costs memory proportional to the number of points.
 */
public final class Binner {

    /** Largest bin index that a double still addresses exactly. */
    static final double MAX_BINS = 0x1p53;

    private Binner() {
        // Utility class - prevent instantiation
    }

    /**
     * @param width bin width in x units, or in decades when {@code log} is set
     * @return binned x, y and the standard error {@code std(y) / sqrt(n)} per bin; empty for
     *         empty input, a non-positive width, more than 2^53 bins, or log binning of
     *         non-positive x
     */
    public static BinnedSeries binData(double[] x, double[] y, double width, boolean log, BinMode mode) {
        int n = Math.min(x.length, y.length);
        if (n == 0 || !(width > 0)) {
            return BinnedSeries.EMPTY;
        }
        double[] domain = new double[n];
        for (int i = 0; i < n; i++) {
            if (log) {
                if (!(x[i] > 0)) {
                    return BinnedSeries.EMPTY;
                }
                domain[i] = Math.log10(x[i]);
            } else {
                domain[i] = x[i];
            }
        }
        double min = domain[0];
        double max = domain[0];
        for (double d : domain) {
            min = Math.min(min, d);
            max = Math.max(max, d);
        }
        double lastBin = Math.floor((max - min) / width);
        if (!(lastBin <= MAX_BINS)) {
            return BinnedSeries.EMPTY;
        }

        SortedMap<Long, List<Integer>> members = new TreeMap<>();
        for (int i = 0; i < n; i++) {
            double k = Math.floor((domain[i] - min) / width);
            if (k >= 0 && k < lastBin) {
                members.computeIfAbsent((long) k, key -> new ArrayList<>()).add(i);
            }
        }

        Mean mean = new Mean();
        Median median = new Median();
        StandardDeviation std = new StandardDeviation(false);
        List<double[]> rows = new ArrayList<>();
        for (List<Integer> idx : members.values()) {
            double[] bx = new double[idx.size()];
            double[] by = new double[idx.size()];
            for (int j = 0; j < idx.size(); j++) {
                bx[j] = x[idx.get(j)];
                by[j] = y[idx.get(j)];
            }
            double cx = mode == BinMode.MEDIAN ? median.evaluate(bx) : mean.evaluate(bx);
            double cy = mode == BinMode.MEDIAN ? median.evaluate(by) : mean.evaluate(by);
            double err = std.evaluate(by) / Math.sqrt(by.length);
            rows.add(new double[]{cx, cy, err});
        }

        double[] outX = new double[rows.size()];
        double[] outY = new double[rows.size()];
        double[] outErr = new double[rows.size()];
        for (int k = 0; k < rows.size(); k++) {
            outX[k] = rows.get(k)[0];
            outY[k] = rows.get(k)[1];
            outErr[k] = rows.get(k)[2];
        }
        return new BinnedSeries(outX, outY, outErr);
    }

    public static BinnedSeries binData(double[] x, double[] y, double width) {
        return binData(x, y, width, false, BinMode.MEAN);
    }
}
