package io.smellscan.report;

import io.smellscan.model.AnalysisResult;
import io.smellscan.model.Correction;
import io.smellscan.model.Diagnostic;
import io.smellscan.model.Severity;
import io.smellscan.model.SourceLocation;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.smellscan.report.ReportFixtures.finding;
import static org.assertj.core.api.Assertions.assertThat;

class ConsoleReporterTest {

    private static AnalysisResult.Builder sample() {
        return AnalysisResult.builder()
                .moduleName("app")
                .findings(List.of(
                        finding("src/A.kt", 3, "no-empty-block", Severity.STYLE),
                        finding("src/B.kt", 5, "too-many-functions", Severity.ERROR)))
                .diagnostics(List.of(Diagnostic.incomplete("src/C.kt", "Not analyzed: the module timeout expired")))
                .corrections(List.of(new Correction("fun-keyword-spacing",
                        new SourceLocation("src/A.kt", 9, 1, 9, 10), "fun run()")))
                .severityCounts(Map.of(Severity.STYLE, 1, Severity.ERROR, 1))
                .warnings(List.of("Unknown rule id 'nope' in configuration"))
                .notes(List.of("1 file(s) were not fully analyzed"))
                .filesAnalyzed(2);
    }

    @Test
    void write_printsSummaryFindingsAndNotes() {
        String output = new ConsoleReporter(false).render(sample().passed(false).build());

        assertThat(output)
                .contains("SMELL-SCAN REPORT")
                .contains("Module: app")
                .contains("Files: 2 analyzed | 0 excluded | 1 diagnostics")
                .contains("Findings: 0 defect | 1 error | 0 warning | 1 style")
                .contains("src/A.kt [1 findings]")
                .contains("[STYLE] 3:1 no-empty-block - no-empty-block at line 3")
                .contains("[ERROR] 5:1 too-many-functions")
                .contains("[Incomplete] src/C.kt: Not analyzed: the module timeout expired")
                .contains("Warning: Unknown rule id 'nope'")
                .contains("1 file(s) were not fully analyzed")
                .contains("FAILED: 2 finding(s) reported")
                .doesNotContain("\u001B[");
    }

    @Test
    void write_detailedModeAddsSignaturesAndCorrections() {
        String output = new ConsoleReporter(false, true).render(sample().passed(true).build());

        assertThat(output)
                .contains("Signature: src/A.kt:FILE[0]/BLOCK[3]")
                .contains("Fingerprint: src/A.kt#no-empty-block#3")
                .contains("CORRECTIONS (1)")
                .contains("src/A.kt:9:1 fun-keyword-spacing -> fun run()")
                .contains("PASSED with 2 finding(s)")
                .doesNotContain("Run with --verbose");
    }

    @Test
    void write_cleanResult() {
        String output = new ConsoleReporter(false).render(AnalysisResult.builder().moduleName("app").build());

        assertThat(output)
                .contains("No code smells found.")
                .doesNotContain("FINDINGS")
                .doesNotContain("DIAGNOSTICS")
                .doesNotContain("NOTES");
    }

    @Test
    void write_usesColorsWhenEnabled() {
        String output = new ConsoleReporter(true).render(sample().passed(false).build());

        assertThat(output).contains("\u001B[31m");
    }
}
