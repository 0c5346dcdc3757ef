package com.phillippitts.syd.service.numeric;

import java.util.OptionalInt;

/**
 * A selected point of a series. The index is empty and the coordinates are NaN when the series
 * was empty.
 */
public record MaxPoint(OptionalInt index, double x, double y) {

    public static final MaxPoint EMPTY = new MaxPoint(OptionalInt.empty(), Double.NaN, Double.NaN);

    public boolean isPresent() {
        return index.isPresent();
    }
}
