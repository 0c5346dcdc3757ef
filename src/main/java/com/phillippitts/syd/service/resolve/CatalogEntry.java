package com.phillippitts.syd.service.resolve;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * One row of the star information table: raw text cells keyed by column name.
 *
 * <p>A blank, missing or NaN cell ({@code nan}, {@code NA} in any case) means "not provided"
 * and never replaces a default.
 */
public record CatalogEntry(String star, Map<String, String> cells) {

    public CatalogEntry {
        Objects.requireNonNull(star, "star");
        cells = Collections.unmodifiableMap(new LinkedHashMap<>(cells));
    }

    private static final Set<String> MISSING_MARKERS = Set.of("nan", "na", "n/a");

    /**
     * @return the trimmed cell text, empty if the column is absent, blank or NaN
     */
    public Optional<String> cell(String column) {
        String v = cells.get(column);
        if (v == null || v.isBlank()) {
            return Optional.empty();
        }
        String text = v.trim();
        if (MISSING_MARKERS.contains(text.toLowerCase(Locale.ROOT))) {
            return Optional.empty();
        }
        return Optional.of(text);
    }
}
