package io.smellscan.report;

import io.smellscan.model.Correction;
import io.smellscan.model.Debt;
import io.smellscan.model.Diagnostic;
import io.smellscan.model.FileOutcome;
import io.smellscan.model.Finding;
import io.smellscan.model.Severity;
import io.smellscan.model.SourceLocation;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Hand-built outcomes for report tests.
 */
final class ReportFixtures {

    private ReportFixtures() {
    }

    static Finding finding(String file, int line, String ruleId, Severity severity) {
        return Finding.builder()
                .ruleId(ruleId)
                .severity(severity)
                .location(new SourceLocation(file, line, 1, line, 10))
                .message(ruleId + " at line " + line)
                .entitySignature(file + ":FILE[0]/BLOCK[" + line + "]")
                .fingerprint(file + "#" + ruleId + "#" + line)
                .debt(Debt.FIVE_MINS)
                .build();
    }

    static FileOutcome completed(String file, Finding... findings) {
        return completed(file, 0, 0, List.of(), findings);
    }

    static FileOutcome completed(String file, int inlineSuppressed, int baselineSuppressed,
                                 List<Correction> corrections, Finding... findings) {
        Set<String> fingerprints = List.of(findings).stream()
                .map(Finding::fingerprint)
                .collect(Collectors.toSet());
        return new FileOutcome(file, FileOutcome.Status.COMPLETED, List.of(findings), List.of(), corrections,
                inlineSuppressed, baselineSuppressed, fingerprints);
    }

    static FileOutcome withRuleError(String file, String ruleId, int line) {
        Diagnostic error = Diagnostic.ruleError(file, ruleId, new SourceLocation(file, line, 1, line, 10),
                "IllegalStateException: boom");
        return new FileOutcome(file, FileOutcome.Status.COMPLETED, List.of(), List.of(error), List.of(),
                0, 0, Set.of());
    }
}
