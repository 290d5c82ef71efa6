package io.smellscan.report;

import io.smellscan.model.AnalysisResult;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Interface for report output formatters.
 */
public interface Reporter {

    /**
     * Returns the format name (e.g., "console", "json").
     */
    String format();

    /**
     * Writes the result to the given writer.
     */
    void write(AnalysisResult result, Writer writer) throws IOException;

    /**
     * Writes the result to the given file path.
     */
    default void write(AnalysisResult result, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(result, writer);
        }
    }

    /**
     * Returns the report as a string.
     */
    default String render(AnalysisResult result) {
        try {
            StringWriter writer = new StringWriter();
            write(result, writer);
            return writer.toString();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to generate report", e);
        }
    }
}
