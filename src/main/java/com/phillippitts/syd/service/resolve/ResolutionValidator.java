package com.phillippitts.syd.service.resolve;

import com.phillippitts.syd.domain.EchelleOrders;
import com.phillippitts.syd.exception.ConfigurationException;
import com.phillippitts.syd.exception.ConfigurationExceptionBuilder;
import com.phillippitts.syd.service.schema.GlobalDefaults;
import com.phillippitts.syd.service.schema.ParameterDefinition;
import com.phillippitts.syd.service.schema.ParameterNames;
import com.phillippitts.syd.service.schema.ParameterType;

import java.util.List;

/**
 * Checks run-level inputs before any star is resolved.
 */
final class ResolutionValidator {

    private final int maxLaws;

    ResolutionValidator(int maxLaws) {
        this.maxLaws = maxLaws;
    }

    /**
     * @throws ConfigurationException on the first violation found
     */
    void validate(GlobalDefaults defaults, OverrideTable overrides, int starCount) {
        validateOverrideLengths(overrides, starCount);
        validateOversampling(defaults.get(ParameterNames.OVERSAMPLING_FACTOR));
        validateLaws(defaults.get(ParameterNames.N_LAWS));
        validateTypes(defaults);
        EchelleOrders.parse(defaults.getString(ParameterNames.NOY));
    }

    void validateOverrideLengths(OverrideTable overrides, int starCount) {
        for (String name : overrides.names()) {
            List<Double> seq = overrides.sequence(name);
            if (seq != null && seq.size() != starCount) {
                throw ConfigurationExceptionBuilder
                        .create("The number of values provided does not equal the number of stars")
                        .parameter(name)
                        .expected(starCount)
                        .actual(seq.size())
                        .build();
            }
        }
    }

    void validateOversampling(Object value) {
        if (value != null && !ParameterType.INT.accepts(value)) {
            throw ConfigurationExceptionBuilder
                    .create("The oversampling factor for the input power spectrum must be an integer")
                    .parameter(ParameterNames.OVERSAMPLING_FACTOR)
                    .actual(value)
                    .build();
        }
    }

    void validateLaws(Object value) {
        if (value == null) {
            return;
        }
        if (!ParameterType.INT.accepts(value)) {
            throw ConfigurationExceptionBuilder.create("The number of Harvey-like components must be an integer")
                    .parameter(ParameterNames.N_LAWS)
                    .actual(value)
                    .build();
        }
        long laws = ((Number) value).longValue();
        if (laws < 0 || laws > maxLaws) {
            throw ConfigurationExceptionBuilder
                    .create("Cannot resolve that many Harvey-like components, select a smaller number")
                    .parameter(ParameterNames.N_LAWS)
                    .expected("0.." + maxLaws)
                    .actual(laws)
                    .build();
        }
    }

    private void validateTypes(GlobalDefaults defaults) {
        for (ParameterDefinition d : defaults.catalog().definitions()) {
            Object value = defaults.values().get(d.name());
            if (!d.type().accepts(value)) {
                throw ConfigurationExceptionBuilder.create("Default value has the wrong type")
                        .parameter(d.name())
                        .expected(d.type())
                        .actual(value.getClass().getSimpleName() + " " + value)
                        .build();
            }
        }
    }
}
