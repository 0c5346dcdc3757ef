package com.phillippitts.syd.domain;

import com.phillippitts.syd.exception.ConfigurationException;
import com.phillippitts.syd.service.schema.ParameterNames;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Fully resolved parameters for one star, including derived values.
 *
 * <p>Immutable with value semantics. Parameter values may be {@code null} ("not provided").
 * Derived entries live alongside declared parameters under {@link ParameterNames#FORCE} and
 * {@link ParameterNames#MASS}; the star's output directory is {@link #path()}.
 */
public final class StarConfiguration {

    private final String star;
    private final Path path;
    private final Map<String, Object> values;
    private final EchelleMask echelleMask;

    public StarConfiguration(String star, Path path, Map<String, Object> values, EchelleMask echelleMask) {
        this.star = Objects.requireNonNull(star, "star");
        this.path = Objects.requireNonNull(path, "path");
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.echelleMask = echelleMask;
    }

    public String star() {
        return star;
    }

    /**
     * Output directory of this star, {@code <outdir>/<star>}.
     */
    public Path path() {
        return path;
    }

    public Map<String, Object> values() {
        return values;
    }

    public boolean has(String name) {
        return values.get(name) != null;
    }

    public Object get(String name) {
        return values.get(name);
    }

    public Double getDouble(String name) {
        Object v = values.get(name);
        if (v == null) {
            return null;
        }
        if (v instanceof Number n) {
            return n.doubleValue();
        }
        throw typeMismatch(name, v, "number");
    }

    public Integer getInt(String name) {
        Object v = values.get(name);
        if (v == null) {
            return null;
        }
        if (v instanceof Integer i) {
            return i;
        }
        throw typeMismatch(name, v, "integer");
    }

    public boolean getBoolean(String name) {
        Object v = values.get(name);
        if (v == null) {
            return false;
        }
        if (v instanceof Boolean b) {
            return b;
        }
        throw typeMismatch(name, v, "boolean");
    }

    public String getString(String name) {
        Object v = values.get(name);
        return v == null ? null : v.toString();
    }

    public Double numax() {
        return getDouble(ParameterNames.NUMAX);
    }

    public Double dnu() {
        return getDouble(ParameterNames.DNU);
    }

    /**
     * The large separation supplied together with numax, which the global fit must use as is.
     */
    public Double forcedDnu() {
        return getDouble(ParameterNames.FORCE);
    }

    public Double mass() {
        return getDouble(ParameterNames.MASS);
    }

    public EchelleMask echelleMask() {
        return echelleMask;
    }

    /**
     * @throws ConfigurationException if the {@code noy} value is malformed
     */
    public EchelleOrders echelleOrders() {
        return EchelleOrders.parse(getString(ParameterNames.NOY));
    }

    public boolean estimateEnabled() {
        return getBoolean(ParameterNames.ESTIMATE);
    }

    private ConfigurationException typeMismatch(String name, Object value, String expected) {
        return new ConfigurationException("Expected " + expected + " for star " + star
                + " but found '" + value + "'", name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StarConfiguration other)) {
            return false;
        }
        return star.equals(other.star)
                && path.equals(other.path)
                && values.equals(other.values)
                && Objects.equals(echelleMask, other.echelleMask);
    }

    @Override
    public int hashCode() {
        return Objects.hash(star, path, values, echelleMask);
    }

    @Override
    public String toString() {
        return "StarConfiguration{star=" + star + ", path=" + path + ", numax=" + numax()
                + ", dnu=" + dnu() + ", estimate=" + estimateEnabled() + "}";
    }
}
