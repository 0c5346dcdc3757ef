package com.phillippitts.syd.service.schema;

import java.util.Locale;

/**
 * Declared value type of a pipeline parameter.
 *
 * <p>Catalog cells arrive as text and are cast with {@link #parse(String)}; programmatic values
 * are checked with {@link #accepts(Object)} and normalized with {@link #normalize(Object)}.
 */
public enum ParameterType {
    INT,
    FLOAT,
    BOOL,
    STRING;

    /**
     * Returns true if {@code value} may be stored under this type. Null is always accepted.
     */
    public boolean accepts(Object value) {
        if (value == null) {
            return true;
        }
        return switch (this) {
            case INT -> value instanceof Integer || value instanceof Long
                    || value instanceof Short || value instanceof Byte;
            case FLOAT -> value instanceof Number;
            case BOOL -> value instanceof Boolean;
            case STRING -> value instanceof String;
        };
    }

    /**
     * Converts an accepted value to its canonical Java type (Integer, Double, Boolean, String).
     *
     * @throws IllegalArgumentException if the value is not accepted by this type
     */
    public Object normalize(Object value) {
        if (!accepts(value)) {
            throw new IllegalArgumentException("Value '" + value + "' is not of type " + this);
        }
        if (value == null) {
            return null;
        }
        return switch (this) {
            case INT -> toInt(((Number) value).longValue());
            case FLOAT -> ((Number) value).doubleValue();
            case BOOL, STRING -> value;
        };
    }

    /**
     * Casts a raw text cell to this type.
     *
     * <p>Integers written with a zero fraction ({@code "20.0"}) are accepted, since numeric
     * columns with gaps are commonly exported as floats.
     *
     * @throws IllegalArgumentException if the text cannot be cast
     */
    public Object parse(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Cannot parse null as " + this);
        }
        String text = raw.trim();
        return switch (this) {
            case INT -> parseInt(text);
            case FLOAT -> Double.parseDouble(text);
            case BOOL -> parseBool(text);
            case STRING -> text;
        };
    }

    private static Integer parseInt(String text) {
        double d = Double.parseDouble(text);
        if (Double.isNaN(d) || Double.isInfinite(d) || d != Math.rint(d)) {
            throw new IllegalArgumentException("Not an integer: '" + text + "'");
        }
        if (d < Integer.MIN_VALUE || d > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Integer out of range: '" + text + "'");
        }
        return (int) d;
    }

    private static Integer toInt(long value) {
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Integer out of range: " + value);
        }
        return (int) value;
    }

    private static Boolean parseBool(String text) {
        switch (text.toLowerCase(Locale.ROOT)) {
            case "true", "t", "yes", "1", "1.0":
                return Boolean.TRUE;
            case "false", "f", "no", "0", "0.0":
                return Boolean.FALSE;
            default:
                throw new IllegalArgumentException("Not a boolean: '" + text + "'");
        }
    }
}
