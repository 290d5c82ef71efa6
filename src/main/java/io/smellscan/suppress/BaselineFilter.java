package io.smellscan.suppress;

import io.smellscan.model.Finding;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Separates findings that are already accepted in the baseline from newly introduced ones.
 */
public final class BaselineFilter {

    private BaselineFilter() {
    }

    /**
     * Outcome of filtering one batch of findings.
     *
     * @param reported     findings to report: newly introduced ones, or all of them in update mode
     * @param baselined    findings hidden because their fingerprint is in the baseline
     * @param fingerprints fingerprints of every input finding, for regenerating the baseline
     */
    public record Result(List<Finding> reported, List<Finding> baselined, Set<String> fingerprints) {

        public Result {
            reported = List.copyOf(reported);
            baselined = List.copyOf(baselined);
            fingerprints = Collections.unmodifiableSortedSet(new TreeSet<>(fingerprints));
        }

        public int baselineSuppressedCount() {
            return baselined.size();
        }
    }

    /**
     * Filters findings against the baseline.
     *
     * @param findings   findings that survived inline suppression
     * @param baseline   accepted fingerprints
     * @param updateMode when true nothing is filtered; the full fingerprint set is returned instead
     */
    public static Result filter(List<Finding> findings, Baseline baseline, boolean updateMode) {
        Set<String> fingerprints = new TreeSet<>();
        for (Finding finding : findings) {
            fingerprints.add(finding.fingerprint());
        }
        if (updateMode) {
            return new Result(findings, List.of(), fingerprints);
        }

        List<Finding> reported = new ArrayList<>();
        List<Finding> baselined = new ArrayList<>();
        for (Finding finding : findings) {
            if (baseline.contains(finding.fingerprint())) {
                baselined.add(finding);
            } else {
                reported.add(finding);
            }
        }
        return new Result(reported, baselined, fingerprints);
    }
}
