package com.phillippitts.syd.domain;

/**
 * Frequency window [lower, upper] in muHz applied to the echelle diagram.
 */
public record EchelleMask(double lower, double upper) {
}
