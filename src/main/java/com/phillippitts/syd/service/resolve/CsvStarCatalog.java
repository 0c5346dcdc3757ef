package com.phillippitts.syd.service.resolve;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.phillippitts.syd.exception.ConfigurationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Star catalog read from a CSV file with a header row.
 *
 * <p>The id column is {@code stars} (or {@code star}). Ids are normalized with
 * {@link StarIds#normalize(String)}; when an id repeats, the first row wins.
 */
public final class CsvStarCatalog implements StarCatalog {

    private static final Logger LOG = LogManager.getLogger(CsvStarCatalog.class);
    private static final CsvMapper MAPPER = new CsvMapper();
    private static final Set<String> ID_COLUMNS = Set.of("stars", "star");

    private final Map<String, CatalogEntry> entries;

    private CsvStarCatalog(Map<String, CatalogEntry> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    /**
     * @throws ConfigurationException if the file cannot be read or has no id column
     */
    public static CsvStarCatalog load(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader, file.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read star catalog " + file, "info", e);
        }
    }

    static CsvStarCatalog read(Reader reader, String source) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        Map<String, CatalogEntry> entries = new LinkedHashMap<>();
        try (MappingIterator<Map<String, String>> rows =
                     MAPPER.readerForMapOf(String.class).with(schema).readValues(reader)) {
            while (rows.hasNext()) {
                Map<String, String> row = trimKeys(rows.next());
                String id = ID_COLUMNS.stream()
                        .filter(row::containsKey)
                        .findFirst()
                        .map(row::get)
                        .orElseThrow(() -> new ConfigurationException(
                                "Star catalog " + source + " has no 'stars' column", "info"));
                String star = StarIds.normalize(id);
                if (star == null || star.isEmpty()) {
                    continue;
                }
                entries.putIfAbsent(star, new CatalogEntry(star, row));
            }
        }
        LOG.debug("Loaded {} catalog rows from {}", entries.size(), source);
        return new CsvStarCatalog(entries);
    }

    private static Map<String, String> trimKeys(Map<String, String> row) {
        Map<String, String> out = new LinkedHashMap<>();
        row.forEach((k, v) -> out.put(k.trim(), v));
        return out;
    }

    @Override
    public Optional<CatalogEntry> find(String star) {
        return Optional.ofNullable(entries.get(StarIds.normalize(star)));
    }

    public int size() {
        return entries.size();
    }
}
