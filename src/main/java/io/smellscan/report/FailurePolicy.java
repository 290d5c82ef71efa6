package io.smellscan.report;

import io.smellscan.model.Finding;
import io.smellscan.model.Severity;

import java.util.List;

/**
 * Decides whether an analysis run passes.
 * <p>
 * A run fails if any reported finding is at or above {@code failOn}, or if more findings are
 * reported than {@code maxIssues} allows. Diagnostics never fail a run on their own.
 *
 * @param failOn    lowest failing severity, or null to ignore severities
 * @param maxIssues maximum number of reported findings, negative for no limit
 */
public record FailurePolicy(Severity failOn, int maxIssues) {

    public static final int UNLIMITED = -1;

    /**
     * Fails on Error and Defect findings, with no issue limit.
     */
    public static final FailurePolicy DEFAULT = new FailurePolicy(Severity.ERROR, UNLIMITED);

    /**
     * Never fails.
     */
    public static final FailurePolicy NEVER = new FailurePolicy(null, UNLIMITED);

    public static FailurePolicy failOn(Severity threshold) {
        return new FailurePolicy(threshold, UNLIMITED);
    }

    public FailurePolicy withMaxIssues(int limit) {
        return new FailurePolicy(failOn, limit);
    }

    public boolean hasIssueLimit() {
        return maxIssues >= 0;
    }

    public boolean passes(List<Finding> findings) {
        if (hasIssueLimit() && findings.size() > maxIssues) {
            return false;
        }
        return failOn == null || findings.stream().noneMatch(f -> f.severity().isAtLeast(failOn));
    }
}
