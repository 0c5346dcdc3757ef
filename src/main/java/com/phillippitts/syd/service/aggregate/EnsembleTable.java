package com.phillippitts.syd.service.aggregate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * One row per star over the union of all columns seen, ordered by {@link StarIdOrdering}.
 * A cell a star did not report is {@link #MISSING}.
 */
public final class EnsembleTable {

    public static final String STAR_COLUMN = "star";
    public static final String MISSING = "";

    private final String kind;
    private final List<String> columns;
    private final Map<String, Map<String, String>> rows;

    private EnsembleTable(String kind, List<String> columns, Map<String, Map<String, String>> rows) {
        this.kind = kind;
        this.columns = List.copyOf(columns);
        this.rows = Collections.unmodifiableMap(rows);
    }

    public static Builder builder(String kind, List<String> initialColumns) {
        return new Builder(kind, initialColumns);
    }

    public String kind() {
        return kind;
    }

    /**
     * @return {@code star} followed by every other column in first-seen order
     */
    public List<String> columns() {
        return columns;
    }

    public List<String> stars() {
        return List.copyOf(rows.keySet());
    }

    public int rowCount() {
        return rows.size();
    }

    public Optional<String> value(String star, String column) {
        Map<String, String> row = rows.get(star);
        return row == null ? Optional.empty() : Optional.ofNullable(row.get(column));
    }

    /**
     * Rows as text cells in column order, the star id first.
     */
    public List<List<String>> cells() {
        List<List<String>> out = new ArrayList<>(rows.size());
        for (Map.Entry<String, Map<String, String>> e : rows.entrySet()) {
            List<String> line = new ArrayList<>(columns.size());
            line.add(e.getKey());
            for (String column : columns.subList(1, columns.size())) {
                line.add(e.getValue().getOrDefault(column, MISSING));
            }
            out.add(line);
        }
        return out;
    }

    public static final class Builder {
        private final String kind;
        private final Set<String> columns = new LinkedHashSet<>();
        private final Map<String, Map<String, String>> rows = new TreeMap<>(StarIdOrdering.INSTANCE);

        private Builder(String kind, List<String> initialColumns) {
            this.kind = kind;
            columns.add(STAR_COLUMN);
            columns.addAll(initialColumns);
        }

        /**
         * Adds or replaces the row of {@code star}. The star column of {@code cells} is ignored.
         */
        public Builder row(String star, Map<String, String> cells) {
            Map<String, String> row = new LinkedHashMap<>();
            cells.forEach((column, value) -> {
                if (!STAR_COLUMN.equals(column)) {
                    columns.add(column);
                    row.put(column, value == null ? MISSING : value);
                }
            });
            rows.put(star, row);
            return this;
        }

        public boolean isEmpty() {
            return rows.isEmpty();
        }

        public EnsembleTable build() {
            return new EnsembleTable(kind, new ArrayList<>(columns), new LinkedHashMap<>(rows));
        }
    }
}
