package com.phillippitts.syd.service.noise;

/**
 * A stellar background model evaluated at one frequency.
 */
@FunctionalInterface
public interface BackgroundModel {

    /**
     * @param frequency  frequency in muHz
     * @param parameters model parameters: (tau, sigma) pairs, then white noise if it is free
     */
    double evaluate(double frequency, double... parameters);
}
