package com.phillippitts.syd.service.output;

import com.phillippitts.syd.domain.EstimateResult;
import com.phillippitts.syd.domain.GlobalFitResult;
import com.phillippitts.syd.domain.StarConfiguration;
import com.phillippitts.syd.exception.ProcessingException;
import com.phillippitts.syd.service.schema.ParameterNames;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Writes the per-star artifacts consumed by the ensemble aggregation.
 *
 * <p>With {@code overwrite} off an existing artifact is never replaced: the next free name
 * {@code estimates_1.csv}, {@code estimates_2.csv}, ... is used instead.
 */
@Component
public class ResultWriter {

    private static final Logger LOG = LogManager.getLogger(ResultWriter.class);

    public static final String ESTIMATES_FILE = "estimates.csv";
    public static final String GLOBAL_FILE = "global.csv";
    public static final String SAMPLES_FILE = "samples.csv";
    /** Written in place of an uncertainty when a single trial ran. */
    public static final String NO_UNCERTAINTY = "--";

    static final List<String> ESTIMATE_COLUMNS = List.of("star", "numax", "dnu", "snr");
    static final List<String> GLOBAL_COLUMNS = List.of("parameter", "value", "uncertainty");

    /**
     * @return the file written
     * @throws ProcessingException if the file cannot be written
     */
    public Path writeEstimate(StarConfiguration config, EstimateResult estimate) {
        List<String> row = List.of(estimate.star(), CsvTables.format(estimate.numax()),
                CsvTables.format(estimate.dnu()), CsvTables.format(estimate.snr()));
        return write(config, ESTIMATES_FILE, ESTIMATE_COLUMNS, List.of(row));
    }

    /**
     * @return the file written
     * @throws ProcessingException if the file cannot be written
     */
    public Path writeGlobal(StarConfiguration config, List<GlobalFitResult> results) {
        List<List<String>> rows = new ArrayList<>(results.size());
        for (GlobalFitResult r : results) {
            String uncertainty = r.uncertainty().isPresent()
                    ? CsvTables.format(r.uncertainty().getAsDouble())
                    : NO_UNCERTAINTY;
            rows.add(List.of(r.parameter(), CsvTables.format(r.value()), uncertainty));
        }
        return write(config, GLOBAL_FILE, GLOBAL_COLUMNS, rows);
    }

    /**
     * Writes every Monte-Carlo trial, one column per parameter, when the star has
     * {@code samples} enabled.
     *
     * @return the file written, empty if samples are not kept for this star
     */
    public Optional<Path> writeSamples(StarConfiguration config, Map<String, double[]> samples) {
        if (!config.getBoolean(ParameterNames.SAMPLES)) {
            return Optional.empty();
        }
        List<String> header = new ArrayList<>(samples.keySet());
        int trials = samples.values().stream().mapToInt(a -> a.length).max().orElse(0);
        List<List<String>> rows = new ArrayList<>(trials);
        for (int t = 0; t < trials; t++) {
            List<String> row = new ArrayList<>(header.size());
            for (double[] values : samples.values()) {
                row.add(t < values.length ? CsvTables.format(values[t]) : "");
            }
            rows.add(row);
        }
        return Optional.of(write(config, SAMPLES_FILE, header, rows));
    }

    /**
     * Returns {@code target} itself if it does not exist, else the first free
     * {@code <name>_<n>.<ext>} sibling.
     */
    public static Path nextAvailable(Path target) {
        if (!Files.exists(target)) {
            return target;
        }
        String fileName = target.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String base = dot < 0 ? fileName : fileName.substring(0, dot);
        String ext = dot < 0 ? "" : fileName.substring(dot);
        int count = 1;
        Path candidate;
        do {
            candidate = target.resolveSibling(base + "_" + count + ext);
            count++;
        } while (Files.exists(candidate));
        return candidate;
    }

    private Path write(StarConfiguration config, String fileName, List<String> header, List<List<String>> rows) {
        Path target = config.path().resolve(fileName);
        if (!config.getBoolean(ParameterNames.OVERWRITE)) {
            target = nextAvailable(target);
        }
        try {
            Files.createDirectories(config.path());
            CsvTables.write(target, header, rows);
        } catch (IOException e) {
            throw new ProcessingException("Cannot write " + target, config.star(), e);
        }
        LOG.debug("Wrote {} row(s) to {}", rows.size(), target);
        return target;
    }
}
