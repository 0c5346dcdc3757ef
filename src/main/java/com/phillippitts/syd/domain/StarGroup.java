package com.phillippitts.syd.domain;

import java.util.List;

/**
 * Stars assigned to one worker, in processing order.
 *
 * @param index zero-based group number
 * @param stars star ids
 */
public record StarGroup(int index, List<String> stars) {
    public StarGroup {
        stars = List.copyOf(stars);
    }

    public int size() {
        return stars.size();
    }
}
