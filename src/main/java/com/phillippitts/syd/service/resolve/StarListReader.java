package com.phillippitts.syd.service.resolve;

import com.phillippitts.syd.exception.ConfigurationException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a star list file: the first whitespace-separated token of each non-blank line.
 */
public final class StarListReader {

    private StarListReader() {
        // Utility class - prevent instantiation
    }

    /**
     * @throws ConfigurationException if the file does not exist or cannot be read
     */
    public static List<String> read(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            throw new ConfigurationException("No stars or star list provided", "todo");
        }
        try {
            List<String> stars = new ArrayList<>();
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                String trimmed = line.trim();
                if (!trimmed.isEmpty()) {
                    stars.add(trimmed.split("\\s+")[0]);
                }
            }
            return stars;
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read star list " + file, "todo", e);
        }
    }
}
