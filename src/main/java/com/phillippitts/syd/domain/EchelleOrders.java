package com.phillippitts.syd.domain;

import com.phillippitts.syd.exception.ConfigurationException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Number of radial orders shown on the echelle diagram and the shift of the central order,
 * parsed from text of the form {@code N}, {@code N+M} or {@code N-M}.
 *
 * <p>An order count of zero means "choose automatically".
 */
public record EchelleOrders(int orders, int shift) {

    private static final Pattern FORMAT = Pattern.compile("^(\\d+)([+-]\\d+)?$");

    /**
     * @throws ConfigurationException if the text does not match the expected form
     */
    public static EchelleOrders parse(String text) {
        if (text == null) {
            return new EchelleOrders(0, 0);
        }
        Matcher m = FORMAT.matcher(text.trim());
        if (!m.matches()) {
            throw new ConfigurationException(
                    "Echelle orders must be written as N, N+M or N-M, got '" + text + "'", "noy");
        }
        try {
            int orders = Integer.parseInt(m.group(1));
            int shift = m.group(2) == null ? 0 : Integer.parseInt(m.group(2));
            return new EchelleOrders(orders, shift);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Echelle orders out of range: '" + text + "'", "noy", e);
        }
    }
}
