package com.phillippitts.syd.domain;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * One fitted global parameter and its Monte-Carlo uncertainty.
 *
 * @param parameter   parameter name, e.g. {@code numax_smooth} or {@code dnu}
 * @param value       value from the first (unperturbed) trial
 * @param uncertainty spread across trials, absent when a single trial ran
 */
public record GlobalFitResult(String parameter, double value, OptionalDouble uncertainty) {
    public GlobalFitResult {
        Objects.requireNonNull(parameter, "parameter");
        uncertainty = uncertainty == null ? OptionalDouble.empty() : uncertainty;
    }

    public static GlobalFitResult of(String parameter, double value) {
        return new GlobalFitResult(parameter, value, OptionalDouble.empty());
    }

    public static GlobalFitResult of(String parameter, double value, double uncertainty) {
        return new GlobalFitResult(parameter, value, OptionalDouble.of(uncertainty));
    }
}
