package com.phillippitts.syd.service.numeric;

import com.phillippitts.syd.exception.ConfigurationException;

import java.util.Locale;

/**
 * Statistic used to reduce the points of a bin.
 */
public enum BinMode {
    MEAN,
    MEDIAN;

    /**
     * @throws ConfigurationException for anything other than {@code mean} or {@code median}
     */
    public static BinMode fromName(String name) {
        if (name == null) {
            return MEAN;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown binning mode '" + name + "'", "bin_mode", e);
        }
    }
}
