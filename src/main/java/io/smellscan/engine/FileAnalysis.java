package io.smellscan.engine;

import io.smellscan.model.Correction;
import io.smellscan.model.Diagnostic;
import io.smellscan.model.Finding;

import java.util.List;

/**
 * Output of the traversal engine for one file, before baseline filtering.
 *
 * @param file            normalized file path
 * @param findings        unsuppressed findings, in visit order
 * @param diagnostics     internal rule errors
 * @param corrections     fixes produced by correctors
 * @param suppressedCount findings hidden by suppression directives
 */
public record FileAnalysis(
        String file,
        List<Finding> findings,
        List<Diagnostic> diagnostics,
        List<Correction> corrections,
        int suppressedCount
) {
    public FileAnalysis {
        findings = List.copyOf(findings);
        diagnostics = List.copyOf(diagnostics);
        corrections = List.copyOf(corrections);
    }
}
