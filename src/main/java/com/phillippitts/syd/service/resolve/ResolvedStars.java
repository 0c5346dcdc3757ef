package com.phillippitts.syd.service.resolve;

import com.phillippitts.syd.domain.StarConfiguration;

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolved configurations keyed by star id, in request order.
 */
public final class ResolvedStars implements Iterable<StarConfiguration> {

    private final Map<String, StarConfiguration> configurations;

    public ResolvedStars(Map<String, StarConfiguration> configurations) {
        this.configurations = Collections.unmodifiableMap(new LinkedHashMap<>(configurations));
    }

    public List<String> stars() {
        return List.copyOf(configurations.keySet());
    }

    public StarConfiguration get(String star) {
        return configurations.get(star);
    }

    public Collection<StarConfiguration> configurations() {
        return configurations.values();
    }

    public int size() {
        return configurations.size();
    }

    public boolean isEmpty() {
        return configurations.isEmpty();
    }

    @Override
    public Iterator<StarConfiguration> iterator() {
        return configurations.values().iterator();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ResolvedStars other && configurations.equals(other.configurations);
    }

    @Override
    public int hashCode() {
        return configurations.hashCode();
    }
}
