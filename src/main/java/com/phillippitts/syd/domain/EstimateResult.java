package com.phillippitts.syd.domain;

import java.util.Objects;

/**
 * Outcome of the numax search stage for one star.
 *
 * @param star  star id
 * @param numax estimated frequency of maximum power [muHz]
 * @param dnu   large separation expected at that numax [muHz]
 * @param snr   signal-to-noise ratio of the selected trial
 */
public record EstimateResult(String star, double numax, double dnu, double snr) {
    public EstimateResult {
        Objects.requireNonNull(star, "star");
    }
}
