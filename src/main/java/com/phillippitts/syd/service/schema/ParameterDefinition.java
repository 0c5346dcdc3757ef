package com.phillippitts.syd.service.schema;

import java.util.Objects;

/**
 * Declaration of one known parameter.
 *
 * @param name            parameter name as used in catalogs and configuration keys
 * @param type            declared value type
 * @param defaultValue    default value (may be null, meaning "not provided")
 * @param overrideCapable whether a per-star sequence may be supplied for this parameter
 * @param group           pipeline stage the parameter belongs to
 * @param description     short human-readable description
 */
public record ParameterDefinition(
        String name,
        ParameterType type,
        Object defaultValue,
        boolean overrideCapable,
        ParameterGroup group,
        String description
) {
    public ParameterDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(group, "group");
        if (!type.accepts(defaultValue)) {
            throw new IllegalArgumentException("Default for '" + name + "' is not of type " + type
                    + ": " + defaultValue);
        }
        defaultValue = type.normalize(defaultValue);
        description = description == null ? "" : description;
    }
}
