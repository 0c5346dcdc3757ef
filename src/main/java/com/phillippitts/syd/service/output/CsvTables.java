package com.phillippitts.syd.service.output;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes header-first CSV tables of text cells.
 */
public final class CsvTables {

    private static final CsvMapper MAPPER = new CsvMapper();

    private CsvTables() {
        // Utility class - prevent instantiation
    }

    public static void write(Path file, List<String> header, List<List<String>> rows) throws IOException {
        CsvSchema.Builder schema = CsvSchema.builder();
        header.forEach(schema::addColumn);
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             SequenceWriter out = MAPPER.writerFor(List.class)
                     .with(schema.build().withHeader())
                     .writeValues(writer)) {
            for (List<String> row : rows) {
                out.write(row);
            }
        }
    }

    /**
     * @return one column name to cell map per data row, in file order
     */
    public static List<Map<String, String>> read(Path file) throws IOException {
        List<Map<String, String>> rows = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             MappingIterator<Map<String, String>> it = MAPPER.readerForMapOf(String.class)
                     .with(CsvSchema.emptySchema().withHeader())
                     .readValues(reader)) {
            while (it.hasNext()) {
                Map<String, String> row = new LinkedHashMap<>();
                it.next().forEach((k, v) -> row.put(k.trim(), v));
                rows.add(row);
            }
        }
        return rows;
    }

    static String format(double value) {
        return Double.isNaN(value) ? "NaN" : Double.toString(value);
    }
}
