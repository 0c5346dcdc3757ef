package com.phillippitts.syd.service.noise;

/**
 * Harvey-like background component functions, supplied by the fitting stage.
 *
 * <p>Each function takes the frequency, one (tau, sigma) pair per component and the white
 * noise level.
 */
public interface HarveyModels {

    double none(double frequency, double whiteNoise);

    double one(double frequency, double tau1, double sigma1, double whiteNoise);

    double two(double frequency, double tau1, double sigma1, double tau2, double sigma2, double whiteNoise);

    double three(double frequency, double tau1, double sigma1, double tau2, double sigma2,
                 double tau3, double sigma3, double whiteNoise);
}
