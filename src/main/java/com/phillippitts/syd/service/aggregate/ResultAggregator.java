package com.phillippitts.syd.service.aggregate;

import com.phillippitts.syd.exception.SydException;
import com.phillippitts.syd.service.metrics.PipelineMetrics;
import com.phillippitts.syd.service.output.CsvTables;
import com.phillippitts.syd.service.output.ResultWriter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Consolidates per-star artifacts under an output directory into ensemble tables.
 *
 * <p>For each star directory the canonical artifact is used in overwrite mode; otherwise the
 * most recently modified {@code estimates*.csv} / {@code global*.csv}, ties going to the highest
 * numeric suffix. A star whose artifact is missing or unreadable has no row in that table;
 * it never aborts aggregation of the other stars.
 *
 * <p>Must only run after every star has finished processing.
 */
@Service
public class ResultAggregator {

    private static final Logger LOG = LogManager.getLogger(ResultAggregator.class);

    static final String ESTIMATES = "estimates";
    static final String GLOBAL = "global";
    static final String ERROR_SUFFIX = "_err";

    private final PipelineMetrics metrics;

    public ResultAggregator(PipelineMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Builds and writes {@code <outdir>/estimates.csv} and {@code <outdir>/global.csv}.
     *
     * @throws SydException if the output directory cannot be listed or a table cannot
     *         be written
     */
    public AggregationResult aggregate(Path outdir, boolean overwrite) {
        List<Path> starDirs = listStarDirectories(outdir);

        EnsembleTable.Builder estimates = EnsembleTable.builder(ESTIMATES, List.of("numax", "dnu", "snr"));
        EnsembleTable.Builder global = EnsembleTable.builder(GLOBAL, List.of());
        for (Path dir : starDirs) {
            String star = dir.getFileName().toString();
            selectArtifact(dir, ESTIMATES, overwrite)
                    .flatMap(file -> readEstimate(star, file))
                    .ifPresent(cells -> estimates.row(star, cells));
            selectArtifact(dir, GLOBAL, overwrite)
                    .flatMap(file -> readGlobal(star, file))
                    .ifPresent(cells -> global.row(star, cells));
        }

        Optional<EnsembleTable> estimatesTable = writeIfPresent(outdir, estimates);
        Optional<EnsembleTable> globalTable = writeIfPresent(outdir, global);
        LOG.info("Aggregated {} star director(ies): {} estimate row(s), {} global row(s)", starDirs.size(),
                estimatesTable.map(EnsembleTable::rowCount).orElse(0),
                globalTable.map(EnsembleTable::rowCount).orElse(0));
        return new AggregationResult(estimatesTable, globalTable);
    }

    private List<Path> listStarDirectories(Path outdir) {
        if (!Files.isDirectory(outdir)) {
            LOG.warn("Output directory {} does not exist, nothing to aggregate", outdir);
            return List.of();
        }
        try (Stream<Path> entries = Files.list(outdir)) {
            return entries.filter(Files::isDirectory)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString(), StarIdOrdering.INSTANCE))
                    .toList();
        } catch (IOException e) {
            throw new SydException("Cannot list output directory " + outdir, e);
        }
    }

    /**
     * Picks the artifact of one kind in a star directory.
     */
    static Optional<Path> selectArtifact(Path dir, String kind, boolean overwrite) {
        if (overwrite) {
            Path canonical = dir.resolve(kind + ".csv");
            return Files.isRegularFile(canonical) ? Optional.of(canonical) : Optional.empty();
        }
        Pattern pattern = Pattern.compile("^" + kind + "(?:_(\\d+))?\\.csv$");
        List<Candidate> candidates = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, kind + "*.csv")) {
            for (Path file : files) {
                Matcher m = pattern.matcher(file.getFileName().toString());
                if (m.matches() && Files.isRegularFile(file)) {
                    long suffix = m.group(1) == null ? 0 : Long.parseLong(m.group(1));
                    candidates.add(new Candidate(file, Files.getLastModifiedTime(file), suffix));
                }
            }
        } catch (IOException | UncheckedIOException e) {
            LOG.warn("Cannot list {} artifacts in {}: {}", kind, dir, e.getMessage());
            return Optional.empty();
        }
        return candidates.stream()
                .max(Comparator.comparing(Candidate::modified).thenComparingLong(Candidate::suffix))
                .map(Candidate::file);
    }

    private Optional<Map<String, String>> readEstimate(String star, Path file) {
        try {
            List<Map<String, String>> rows = CsvTables.read(file);
            if (rows.isEmpty()) {
                return skip(ESTIMATES, star, file, "no data row");
            }
            return Optional.of(rows.get(0));
        } catch (IOException | RuntimeException e) {
            return skip(ESTIMATES, star, file, e.getMessage());
        }
    }

    private Optional<Map<String, String>> readGlobal(String star, Path file) {
        try {
            List<Map<String, String>> rows = CsvTables.read(file);
            if (rows.isEmpty()) {
                return skip(GLOBAL, star, file, "no data row");
            }
            Map<String, String> values = new LinkedHashMap<>();
            Map<String, String> errors = new LinkedHashMap<>();
            for (Map<String, String> row : rows) {
                String parameter = row.get("parameter");
                if (parameter == null || parameter.isBlank() || !row.containsKey("value")) {
                    return skip(GLOBAL, star, file, "missing parameter/value columns");
                }
                values.put(parameter, row.get("value"));
                String uncertainty = row.get("uncertainty");
                if (uncertainty != null && !uncertainty.isBlank()
                        && !ResultWriter.NO_UNCERTAINTY.equals(uncertainty.trim())) {
                    errors.put(parameter + ERROR_SUFFIX, uncertainty);
                }
            }
            values.putAll(errors);
            return Optional.of(values);
        } catch (IOException | RuntimeException e) {
            return skip(GLOBAL, star, file, e.getMessage());
        }
    }

    private Optional<Map<String, String>> skip(String kind, String star, Path file, String reason) {
        LOG.warn("Skipping malformed {} artifact for star {} ({}): {}", kind, star, file, reason);
        metrics.incrementSkippedArtifact(kind);
        return Optional.empty();
    }

    private Optional<EnsembleTable> writeIfPresent(Path outdir, EnsembleTable.Builder builder) {
        if (builder.isEmpty()) {
            return Optional.empty();
        }
        EnsembleTable table = builder.build();
        Path target = outdir.resolve(table.kind() + ".csv");
        try {
            CsvTables.write(target, table.columns(), table.cells());
        } catch (IOException e) {
            throw new SydException("Cannot write ensemble table " + target, e);
        }
        metrics.recordAggregatedRows(table.kind(), table.rowCount());
        return Optional.of(table);
    }

    private record Candidate(Path file, FileTime modified, long suffix) {
    }
}
