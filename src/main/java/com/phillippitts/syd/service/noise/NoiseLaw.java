package com.phillippitts.syd.service.noise;

import com.phillippitts.syd.exception.ConfigurationException;
import com.phillippitts.syd.exception.ConfigurationExceptionBuilder;

/**
 * Number of Harvey-like components in a background model.
 *
 * <p>Each law offers two call shapes: {@link #pinned} with the white noise fixed beforehand
 * ({@code 2n} parameters) and {@link #free} with the white noise fitted as the last parameter
 * ({@code 2n + 1} parameters).
 */
public enum NoiseLaw {
    NONE(0),
    ONE(1),
    TWO(2),
    THREE(3);

    private final int components;

    NoiseLaw(int components) {
        this.components = components;
    }

    public int components() {
        return components;
    }

    public int pinnedParameterCount() {
        return 2 * components;
    }

    public int freeParameterCount() {
        return 2 * components + 1;
    }

    /**
     * @throws ConfigurationException if {@code n} is outside 0..3
     */
    public static NoiseLaw forComponents(int n) {
        for (NoiseLaw law : values()) {
            if (law.components == n) {
                return law;
            }
        }
        throw ConfigurationExceptionBuilder.create("Unsupported number of Harvey-like components")
                .parameter("n_laws")
                .expected("0.." + THREE.components)
                .actual(n)
                .build();
    }

    /**
     * Model with the white noise pinned to {@code whiteNoise}.
     */
    public BackgroundModel pinned(HarveyModels models, double whiteNoise) {
        return switch (this) {
            case NONE -> (f, p) -> {
                checked(p, 0);
                return models.none(f, whiteNoise);
            };
            case ONE -> (f, p) -> models.one(f, checked(p, 2)[0], p[1], whiteNoise);
            case TWO -> (f, p) -> models.two(f, checked(p, 4)[0], p[1], p[2], p[3], whiteNoise);
            case THREE -> (f, p) -> models.three(f, checked(p, 6)[0], p[1], p[2], p[3], p[4], p[5], whiteNoise);
        };
    }

    /**
     * Model whose last parameter is the white noise.
     */
    public BackgroundModel free(HarveyModels models) {
        return switch (this) {
            case NONE -> (f, p) -> models.none(f, checked(p, 1)[0]);
            case ONE -> (f, p) -> models.one(f, checked(p, 3)[0], p[1], p[2]);
            case TWO -> (f, p) -> models.two(f, checked(p, 5)[0], p[1], p[2], p[3], p[4]);
            case THREE -> (f, p) -> models.three(f, checked(p, 7)[0], p[1], p[2], p[3], p[4], p[5], p[6]);
        };
    }

    private static double[] checked(double[] parameters, int expected) {
        if (parameters.length != expected) {
            throw new IllegalArgumentException("Expected " + expected + " parameters, got " + parameters.length);
        }
        return parameters;
    }
}
