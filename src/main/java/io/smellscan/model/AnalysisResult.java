package io.smellscan.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Complete result of analyzing one module. Handed to report writers and to the pass/fail decision.
 * <p>
 * All lists are sorted deterministically, so two results built from the same input are equal
 * regardless of how many workers produced them.
 *
 * @param moduleName              Name of the analyzed module
 * @param findings                Reported findings, sorted by file, location and rule id
 * @param diagnostics             Parse failures, internal rule errors and incomplete files
 * @param corrections             Fixes proposed by auto-correcting rules
 * @param severityCounts          Number of reported findings per severity
 * @param notes                   Informational notes (degraded rules, baseline transparency)
 * @param warnings                Configuration warnings such as unknown rule ids
 * @param baselineSuppressedCount Findings hidden because their fingerprint is in the baseline
 * @param inlineSuppressedCount   Findings hidden by suppression directives in the source
 * @param filesAnalyzed           Files handed to the traversal engine
 * @param filesExcluded           Files skipped by exclude patterns
 * @param totalDebt               Sum of the debt of all reported findings
 * @param passed                  Outcome of the caller's failure policy
 * @param regeneratedBaseline     Full fingerprint set in update-baseline mode, otherwise null
 */
public record AnalysisResult(
        String moduleName,
        List<Finding> findings,
        List<Diagnostic> diagnostics,
        List<Correction> corrections,
        Map<Severity, Integer> severityCounts,
        List<String> notes,
        List<String> warnings,
        int baselineSuppressedCount,
        int inlineSuppressedCount,
        int filesAnalyzed,
        int filesExcluded,
        Debt totalDebt,
        boolean passed,
        List<String> regeneratedBaseline
) {
    /**
     * Compact constructor with validation.
     */
    public AnalysisResult {
        if (moduleName == null || moduleName.isBlank()) {
            throw new IllegalArgumentException("moduleName cannot be null or blank");
        }
        findings = findings == null ? List.of() : List.copyOf(findings);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
        corrections = corrections == null ? List.of() : List.copyOf(corrections);
        notes = notes == null ? List.of() : List.copyOf(notes);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        severityCounts = copyCounts(severityCounts);
        if (totalDebt == null) {
            totalDebt = Debt.ZERO;
        }
        if (regeneratedBaseline != null) {
            regeneratedBaseline = List.copyOf(regeneratedBaseline);
        }
    }

    private static Map<Severity, Integer> copyCounts(Map<Severity, Integer> counts) {
        Map<Severity, Integer> copy = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            copy.put(severity, 0);
        }
        if (counts != null) {
            copy.putAll(counts);
        }
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Returns findings grouped by file, in file path order.
     */
    public Map<String, List<Finding>> findingsByFile() {
        Map<String, List<Finding>> byFile = new LinkedHashMap<>();
        for (Finding finding : findings) {
            byFile.computeIfAbsent(finding.file(), k -> new ArrayList<>()).add(finding);
        }
        byFile.replaceAll((file, list) -> List.copyOf(list));
        return Collections.unmodifiableMap(byFile);
    }

    public int count(Severity severity) {
        return severityCounts.getOrDefault(severity, 0);
    }

    public int totalFindings() {
        return findings.size();
    }

    /**
     * Returns true if there are any findings at or above the given severity.
     */
    public boolean hasFindingsAtLeast(Severity threshold) {
        return findings.stream().anyMatch(f -> f.severity().isAtLeast(threshold));
    }

    public List<Diagnostic> diagnostics(Diagnostic.Kind kind) {
        return diagnostics.stream()
                .filter(d -> d.kind() == kind)
                .toList();
    }

    public Optional<List<String>> baselineUpdate() {
        return Optional.ofNullable(regeneratedBaseline);
    }

    /**
     * Builder for creating AnalysisResult instances.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String moduleName;
        private List<Finding> findings = List.of();
        private List<Diagnostic> diagnostics = List.of();
        private List<Correction> corrections = List.of();
        private Map<Severity, Integer> severityCounts = Map.of();
        private List<String> notes = List.of();
        private List<String> warnings = List.of();
        private int baselineSuppressedCount;
        private int inlineSuppressedCount;
        private int filesAnalyzed;
        private int filesExcluded;
        private Debt totalDebt = Debt.ZERO;
        private boolean passed = true;
        private List<String> regeneratedBaseline;

        public Builder moduleName(String moduleName) {
            this.moduleName = moduleName;
            return this;
        }

        public Builder findings(List<Finding> findings) {
            this.findings = findings;
            return this;
        }

        public Builder diagnostics(List<Diagnostic> diagnostics) {
            this.diagnostics = diagnostics;
            return this;
        }

        public Builder corrections(List<Correction> corrections) {
            this.corrections = corrections;
            return this;
        }

        public Builder severityCounts(Map<Severity, Integer> severityCounts) {
            this.severityCounts = severityCounts;
            return this;
        }

        public Builder notes(List<String> notes) {
            this.notes = notes;
            return this;
        }

        public Builder warnings(List<String> warnings) {
            this.warnings = warnings;
            return this;
        }

        public Builder baselineSuppressedCount(int count) {
            this.baselineSuppressedCount = count;
            return this;
        }

        public Builder inlineSuppressedCount(int count) {
            this.inlineSuppressedCount = count;
            return this;
        }

        public Builder filesAnalyzed(int filesAnalyzed) {
            this.filesAnalyzed = filesAnalyzed;
            return this;
        }

        public Builder filesExcluded(int filesExcluded) {
            this.filesExcluded = filesExcluded;
            return this;
        }

        public Builder totalDebt(Debt totalDebt) {
            this.totalDebt = totalDebt;
            return this;
        }

        public Builder passed(boolean passed) {
            this.passed = passed;
            return this;
        }

        public Builder regeneratedBaseline(List<String> fingerprints) {
            this.regeneratedBaseline = fingerprints;
            return this;
        }

        public AnalysisResult build() {
            return new AnalysisResult(
                    moduleName,
                    findings,
                    diagnostics,
                    corrections,
                    severityCounts,
                    notes,
                    warnings,
                    baselineSuppressedCount,
                    inlineSuppressedCount,
                    filesAnalyzed,
                    filesExcluded,
                    totalDebt,
                    passed,
                    regeneratedBaseline
            );
        }
    }
}
