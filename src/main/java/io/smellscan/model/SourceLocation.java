package io.smellscan.model;

import java.util.Comparator;

/**
 * Position of a finding in a source file. Lines and columns are 1-based.
 *
 * @param file        normalized file path (forward slashes)
 * @param startLine   first line of the offending element
 * @param startColumn first column on the start line
 * @param endLine     last line of the offending element
 * @param endColumn   last column on the end line
 */
public record SourceLocation(
        String file,
        int startLine,
        int startColumn,
        int endLine,
        int endColumn
) implements Comparable<SourceLocation> {

    private static final Comparator<SourceLocation> ORDER = Comparator
            .comparing(SourceLocation::file)
            .thenComparingInt(SourceLocation::startLine)
            .thenComparingInt(SourceLocation::startColumn)
            .thenComparingInt(SourceLocation::endLine)
            .thenComparingInt(SourceLocation::endColumn);

    public SourceLocation {
        if (file == null || file.isBlank()) {
            throw new IllegalArgumentException("file cannot be null or blank");
        }
        if (startLine < 1 || endLine < startLine) {
            throw new IllegalArgumentException("Invalid line range " + startLine + "-" + endLine + " in " + file);
        }
    }

    /**
     * Location that covers a whole file, used for file-level diagnostics.
     */
    public static SourceLocation wholeFile(String file) {
        return new SourceLocation(file, 1, 1, 1, 1);
    }

    @Override
    public int compareTo(SourceLocation other) {
        return ORDER.compare(this, other);
    }

    /**
     * Returns a display-friendly location string, e.g. {@code src/Foo.kt:3:5}.
     */
    public String display() {
        return file + ":" + startLine + ":" + startColumn;
    }
}
