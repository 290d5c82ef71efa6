package io.smellscan.model;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Result of one worker's unit of work: a single file.
 *
 * @param file               normalized path of the file
 * @param status             how far the analysis of the file got
 * @param findings           findings to report, after inline suppression and baseline filtering
 * @param diagnostics        parse failures, rule errors or the reason the file is incomplete
 * @param corrections        fixes proposed by auto-correcting rules
 * @param inlineSuppressed   findings hidden by suppression directives
 * @param baselineSuppressed findings hidden by the baseline
 * @param fingerprints       fingerprints of all unsuppressed findings, for regenerating the baseline
 */
public record FileOutcome(
        String file,
        Status status,
        List<Finding> findings,
        List<Diagnostic> diagnostics,
        List<Correction> corrections,
        int inlineSuppressed,
        int baselineSuppressed,
        Set<String> fingerprints
) {
    public enum Status {
        COMPLETED,
        PARSE_FAILED,
        INCOMPLETE,
        EXCLUDED
    }

    public FileOutcome {
        if (file == null || file.isBlank()) {
            throw new IllegalArgumentException("file cannot be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        findings = findings == null ? List.of() : List.copyOf(findings);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
        corrections = corrections == null ? List.of() : List.copyOf(corrections);
        fingerprints = fingerprints == null
                ? Collections.emptySortedSet()
                : Collections.unmodifiableSortedSet(new TreeSet<>(fingerprints));
    }

    public static FileOutcome parseFailure(String file, String message) {
        return new FileOutcome(file, Status.PARSE_FAILED, List.of(), List.of(Diagnostic.parseFailure(file, message)),
                List.of(), 0, 0, Set.of());
    }

    public static FileOutcome incomplete(String file, String reason) {
        return new FileOutcome(file, Status.INCOMPLETE, List.of(), List.of(Diagnostic.incomplete(file, reason)),
                List.of(), 0, 0, Set.of());
    }

    public static FileOutcome excluded(String file) {
        return new FileOutcome(file, Status.EXCLUDED, List.of(), List.of(), List.of(), 0, 0, Set.of());
    }

    public boolean hasFindingsAtLeast(Severity threshold) {
        return findings.stream().anyMatch(f -> f.severity().isAtLeast(threshold));
    }

    public boolean hasRuleErrors() {
        return diagnostics.stream().anyMatch(d -> d.kind() == Diagnostic.Kind.INTERNAL_RULE_ERROR);
    }
}
