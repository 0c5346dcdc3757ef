package com.phillippitts.syd.service.schema;

import com.phillippitts.syd.exception.ConfigurationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Process-wide default value for every declared parameter.
 *
 * <p>Built once from a {@link ParameterCatalog}, optionally with caller-supplied values, and
 * immutable afterwards. Every declared name is present; absent values are {@code null}.
 * Values are stored as supplied: type conformance is checked when stars are resolved, so a
 * misconfigured value fails resolution before any per-star work.
 */
public final class GlobalDefaults {

    private final ParameterCatalog catalog;
    private final Map<String, Object> values;

    private GlobalDefaults(ParameterCatalog catalog, Map<String, Object> values) {
        this.catalog = catalog;
        this.values = Collections.unmodifiableMap(values);
    }

    public static GlobalDefaults of(ParameterCatalog catalog) {
        return builder(catalog).build();
    }

    public static Builder builder(ParameterCatalog catalog) {
        return new Builder(catalog);
    }

    public ParameterCatalog catalog() {
        return catalog;
    }

    /**
     * @return unmodifiable name to value map in declaration order (null values allowed)
     */
    public Map<String, Object> values() {
        return values;
    }

    public Object get(String name) {
        catalog.get(name);
        return values.get(name);
    }

    public String getString(String name) {
        Object v = get(name);
        return v == null ? null : v.toString();
    }

    public boolean isEnabled(String name) {
        return Boolean.TRUE.equals(get(name));
    }

    /**
     * Returns a builder seeded with these values, for deriving a variant.
     */
    public Builder toBuilder() {
        Builder b = new Builder(catalog);
        b.values.putAll(values);
        return b;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GlobalDefaults other)) {
            return false;
        }
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "GlobalDefaults" + values;
    }

    public static final class Builder {
        private final ParameterCatalog catalog;
        private final Map<String, Object> values = new LinkedHashMap<>();

        private Builder(ParameterCatalog catalog) {
            this.catalog = Objects.requireNonNull(catalog, "catalog");
            for (ParameterDefinition d : catalog.definitions()) {
                values.put(d.name(), d.defaultValue());
            }
        }

        /**
         * Sets the value of a declared parameter.
         *
         * @throws ConfigurationException if the name is not declared
         */
        public Builder set(String name, Object value) {
            if (!catalog.contains(name)) {
                throw new ConfigurationException("Unknown parameter", name);
            }
            values.put(name, value);
            return this;
        }

        /**
         * Sets a parameter from its text form, cast per the declared type. Blank text clears it.
         *
         * @throws ConfigurationException if the name is unknown or the text cannot be cast
         */
        public Builder setText(String name, String text) {
            ParameterDefinition d = catalog.get(name);
            if (text == null || text.isBlank()) {
                values.put(name, null);
                return this;
            }
            try {
                values.put(name, d.type().parse(text));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Cannot read '" + text + "' as " + d.type(), name, e);
            }
            return this;
        }

        public GlobalDefaults build() {
            return new GlobalDefaults(catalog, new LinkedHashMap<>(values));
        }
    }
}
