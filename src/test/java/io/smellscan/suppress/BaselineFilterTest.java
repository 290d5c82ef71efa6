package io.smellscan.suppress;

import io.smellscan.model.Finding;
import io.smellscan.model.Severity;
import io.smellscan.model.SourceLocation;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class BaselineFilterTest {

    private static Finding finding(String fingerprint, int line) {
        return Finding.builder()
                .ruleId("no-empty-block")
                .severity(Severity.STYLE)
                .location(new SourceLocation("a.kt", line, 1, line, 3))
                .message("empty")
                .fingerprint(fingerprint)
                .build();
    }

    @Test
    void filter_hidesBaselinedFindingsAndCountsThem() {
        List<Finding> findings = List.of(finding("f1", 1), finding("f2", 2), finding("f3", 3));

        BaselineFilter.Result result = BaselineFilter.filter(findings, Baseline.of(Set.of("f2", "stale")), false);

        assertThat(result.reported()).extracting(Finding::fingerprint).containsExactly("f1", "f3");
        assertThat(result.baselineSuppressedCount()).isEqualTo(1);
    }

    @Test
    void filter_updateModeReportsEverythingAndCollectsFingerprints() {
        List<Finding> findings = List.of(finding("f2", 1), finding("f1", 2));

        BaselineFilter.Result result = BaselineFilter.filter(findings, Baseline.of(Set.of("f1")), true);

        assertThat(result.reported()).hasSize(2);
        assertThat(result.baselineSuppressedCount()).isZero();
        assertThat(result.fingerprints()).containsExactly("f1", "f2");
    }

    @Test
    void filter_emptyBaselineHidesNothing() {
        BaselineFilter.Result result = BaselineFilter.filter(List.of(finding("f1", 1)), Baseline.empty(), false);

        assertThat(result.reported()).hasSize(1);
    }
}
