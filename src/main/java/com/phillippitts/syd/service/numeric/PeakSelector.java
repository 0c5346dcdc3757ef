package com.phillippitts.syd.service.numeric;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalInt;

/**
 * Peak finding on sampled series such as power spectra and autocorrelation functions.
 *
 * <p>Degenerate input (empty or mismatched series, no local maxima) yields empty results,
 * never an exception, so one star's bad data cannot abort a batch.
 */
public final class PeakSelector {

    private static final double FWHM_TO_SIGMA = 2.35482;
    private static final double WEIGHT_WIDTH = 0.35;

    private PeakSelector() {
        // Utility class - prevent instantiation
    }

    /**
     * Finds the {@code npeaks} highest local maxima.
     *
     * <p>Local maxima exclude the endpoints; a flat plateau is reported at its middle index.
     * With {@code expDnu}, ranking uses {@code y} multiplied by a normalized Gaussian centred at
     * {@code expDnu} with {@code sigma = 0.35 * expDnu / 2.35482}. With {@code distance}, maxima
     * closer than that many index positions are thinned, keeping the higher one.
     *
     * @param distance minimum index separation, or null
     * @param expDnu   centre of the weighting curve, or null for no weighting
     */
    public static PeakSelection maxElements(double[] x, double[] y, int npeaks, Double distance, Double expDnu) {
        int n = Math.min(x.length, y.length);
        double[] weights = new double[n];
        Arrays.fill(weights, 1.0);
        if (expDnu != null) {
            double sig = WEIGHT_WIDTH * expDnu / FWHM_TO_SIGMA;
            double norm = 1.0 / (sig * Math.sqrt(2.0 * Math.PI));
            for (int i = 0; i < n; i++) {
                double d = x[i] - expDnu;
                weights[i] = Math.exp(-d * d / (2.0 * sig * sig)) * norm;
            }
        }
        double[] ranked = new double[n];
        for (int i = 0; i < n; i++) {
            ranked[i] = y[i] * weights[i];
        }

        List<Integer> peaks = localMaxima(ranked);
        if (distance != null && distance > 1.0) {
            peaks = thin(peaks, ranked, (int) Math.ceil(distance));
        }
        peaks.sort(byMagnitude(ranked));

        int count = Math.max(0, Math.min(npeaks, peaks.size()));
        double[] px = new double[count];
        double[] py = new double[count];
        for (int k = 0; k < count; k++) {
            px[k] = x[peaks.get(k)];
            py[k] = y[peaks.get(k)];
        }
        return new PeakSelection(px, py, weights);
    }

    public static PeakSelection maxElements(double[] x, double[] y, int npeaks) {
        return maxElements(x, y, npeaks, null, null);
    }

    /**
     * Global maximum of {@code y} (first occurrence), or with {@code expDnu} the point whose
     * {@code x} is nearest to it regardless of magnitude.
     *
     * @return the selected point, {@link MaxPoint#EMPTY} for an empty series
     */
    public static MaxPoint returnMax(double[] x, double[] y, Double expDnu) {
        int n = Math.min(x.length, y.length);
        if (n == 0) {
            return MaxPoint.EMPTY;
        }
        int idx = 0;
        if (expDnu != null) {
            double best = Math.abs(x[0] - expDnu);
            for (int i = 1; i < n; i++) {
                double d = Math.abs(x[i] - expDnu);
                if (d < best) {
                    best = d;
                    idx = i;
                }
            }
        } else {
            for (int i = 1; i < n; i++) {
                if (y[i] > y[idx]) {
                    idx = i;
                }
            }
        }
        return new MaxPoint(OptionalInt.of(idx), x[idx], y[idx]);
    }

    public static MaxPoint returnMax(double[] x, double[] y) {
        return returnMax(x, y, null);
    }

    static List<Integer> localMaxima(double[] y) {
        List<Integer> peaks = new ArrayList<>();
        int i = 1;
        int last = y.length - 1;
        while (i < last) {
            if (y[i - 1] < y[i]) {
                int ahead = i + 1;
                while (ahead < last && y[ahead] == y[i]) {
                    ahead++;
                }
                if (y[ahead] < y[i]) {
                    int right = ahead - 1;
                    peaks.add((i + right) / 2);
                    i = ahead;
                    continue;
                }
            }
            i++;
        }
        return peaks;
    }

    private static List<Integer> thin(List<Integer> peaks, double[] ranked, int distance) {
        List<Integer> byPriority = new ArrayList<>(peaks);
        byPriority.sort(byMagnitude(ranked));
        boolean[] removed = new boolean[ranked.length];
        List<Integer> kept = new ArrayList<>();
        for (int p : byPriority) {
            if (removed[p]) {
                continue;
            }
            kept.add(p);
            for (int q : peaks) {
                if (q != p && Math.abs(q - p) < distance) {
                    removed[q] = true;
                }
            }
        }
        kept.sort(Comparator.naturalOrder());
        return kept;
    }

    private static Comparator<Integer> byMagnitude(double[] ranked) {
        return Comparator.<Integer>comparingDouble(i -> ranked[i]).reversed()
                .thenComparing(Comparator.naturalOrder());
    }
}
