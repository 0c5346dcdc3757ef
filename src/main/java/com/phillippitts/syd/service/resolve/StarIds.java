package com.phillippitts.syd.service.resolve;

import java.util.regex.Pattern;

/**
 * Canonical form of star identifiers, so ids exported as floats ({@code "1435467.0"})
 * match their integer spelling in star lists.
 */
public final class StarIds {

    private static final Pattern FLOAT_INTEGER = Pattern.compile("^(\\d+)\\.0+$");

    private StarIds() {
        // Utility class - prevent instantiation
    }

    public static String normalize(String id) {
        if (id == null) {
            return null;
        }
        String trimmed = id.trim();
        var m = FLOAT_INTEGER.matcher(trimmed);
        return m.matches() ? m.group(1) : trimmed;
    }
}
