package com.phillippitts.syd.service.resolve;

import com.phillippitts.syd.exception.ConfigurationException;
import com.phillippitts.syd.service.schema.ParameterCatalog;
import com.phillippitts.syd.service.schema.ParameterDefinition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-star values for override-capable parameters, aligned by position with the requested
 * star list. Only names declared override-capable may be put.
 */
public final class OverrideTable {

    private static final OverrideTable EMPTY = new OverrideTable(Map.of());

    private final Map<String, List<Double>> sequences;

    private OverrideTable(Map<String, List<Double>> sequences) {
        this.sequences = sequences;
    }

    public static OverrideTable empty() {
        return EMPTY;
    }

    public static Builder builder(ParameterCatalog catalog) {
        return new Builder(catalog);
    }

    public boolean isEmpty() {
        return sequences.isEmpty();
    }

    public Set<String> names() {
        return sequences.keySet();
    }

    /**
     * @return the sequence for {@code name}, or null if none was supplied
     */
    public List<Double> sequence(String name) {
        return sequences.get(name);
    }

    public Double valueAt(String name, int position) {
        List<Double> seq = sequences.get(name);
        return seq == null ? null : seq.get(position);
    }

    public static final class Builder {
        private final ParameterCatalog catalog;
        private final Map<String, List<Double>> sequences = new LinkedHashMap<>();

        private Builder(ParameterCatalog catalog) {
            this.catalog = catalog;
        }

        /**
         * Sets the per-star sequence for a parameter. Elements may be null.
         *
         * @throws ConfigurationException if the parameter is unknown or not override-capable
         */
        public Builder put(String name, List<Double> values) {
            ParameterDefinition d = catalog.get(name);
            if (!d.overrideCapable()) {
                throw new ConfigurationException("Parameter does not accept per-star values", name);
            }
            if (values == null) {
                sequences.remove(name);
            } else {
                sequences.put(name, Collections.unmodifiableList(new ArrayList<>(values)));
            }
            return this;
        }

        public OverrideTable build() {
            return new OverrideTable(Collections.unmodifiableMap(new LinkedHashMap<>(sequences)));
        }
    }
}
