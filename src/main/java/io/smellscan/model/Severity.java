package io.smellscan.model;

import java.util.Locale;

/**
 * Severity of a reported code smell.
 * Ordered from least to most severe.
 */
public enum Severity {
    /**
     * Style convention violation. Does not affect behavior.
     */
    STYLE(1, "Style"),

    /**
     * Code that works but is likely to cause maintenance problems.
     */
    WARNING(2, "Warning"),

    /**
     * Code that is very likely wrong or must not pass review.
     */
    ERROR(3, "Error"),

    /**
     * Code that is known to be defective.
     */
    DEFECT(4, "Defect");

    private final int rank;
    private final String label;

    Severity(int rank, String label) {
        this.rank = rank;
        this.label = label;
    }

    public int rank() {
        return rank;
    }

    public String label() {
        return label;
    }

    /**
     * Returns true if this severity is at least as severe as the given threshold.
     */
    public boolean isAtLeast(Severity threshold) {
        return this.rank >= threshold.rank;
    }

    /**
     * Parses a severity name, case-insensitively.
     *
     * @throws IllegalArgumentException if the value names no severity
     */
    public static Severity parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Severity cannot be blank");
        }
        try {
            return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown severity: " + value
                    + " (valid values: style, warning, error, defect)");
        }
    }
}
