package com.phillippitts.syd.service.aggregate;

import java.math.BigInteger;
import java.util.Comparator;

/**
 * Orders star ids: purely numeric ids first by integer value, then all other ids
 * lexicographically.
 */
public final class StarIdOrdering implements Comparator<String> {

    public static final StarIdOrdering INSTANCE = new StarIdOrdering();

    private StarIdOrdering() {
    }

    @Override
    public int compare(String a, String b) {
        boolean numA = isNumeric(a);
        boolean numB = isNumeric(b);
        if (numA && numB) {
            int c = new BigInteger(a).compareTo(new BigInteger(b));
            return c != 0 ? c : a.compareTo(b);
        }
        if (numA != numB) {
            return numA ? -1 : 1;
        }
        return a.compareTo(b);
    }

    static boolean isNumeric(String id) {
        if (id.isEmpty()) {
            return false;
        }
        for (int i = 0; i < id.length(); i++) {
            if (!Character.isDigit(id.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
