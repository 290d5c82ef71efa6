package io.smellscan.model;

import java.util.Comparator;

/**
 * Replacement text proposed by an auto-correcting rule.
 * Applying it to the source file is up to the caller.
 *
 * @param ruleId      rule that produced the correction
 * @param location    range of source to replace
 * @param replacement new text for that range
 */
public record Correction(String ruleId, SourceLocation location, String replacement) {

    public static final Comparator<Correction> REPORT_ORDER = Comparator
            .comparing(Correction::location)
            .thenComparing(Correction::ruleId)
            .thenComparing(Correction::replacement);

    public Correction {
        if (ruleId == null || ruleId.isBlank()) {
            throw new IllegalArgumentException("ruleId cannot be null or blank");
        }
        if (location == null) {
            throw new IllegalArgumentException("location cannot be null");
        }
        if (replacement == null) {
            throw new IllegalArgumentException("replacement cannot be null");
        }
    }
}
