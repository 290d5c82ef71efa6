package io.smellscan.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.smellscan.model.AnalysisResult;
import io.smellscan.model.Correction;
import io.smellscan.model.Debt;
import io.smellscan.model.Diagnostic;
import io.smellscan.model.Severity;
import io.smellscan.model.SourceLocation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static io.smellscan.report.ReportFixtures.finding;
import static org.assertj.core.api.Assertions.assertThat;

class JsonReporterTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2024-05-01T10:15:30Z"), ZoneOffset.UTC);

    private final ObjectMapper mapper = new ObjectMapper();
    private final JsonReporter reporter = new JsonReporter(true, FIXED);

    private static AnalysisResult sampleResult() {
        return AnalysisResult.builder()
                .moduleName("app")
                .findings(List.of(
                        finding("src/A.kt", 3, "no-empty-block", Severity.STYLE),
                        finding("src/A.kt", 8, "fun-keyword-spacing", Severity.STYLE).withAutoCorrected(true)))
                .diagnostics(List.of(Diagnostic.parseFailure("src/B.kt", "Unexpected EOF")))
                .corrections(List.of(new Correction("fun-keyword-spacing",
                        new SourceLocation("src/A.kt", 8, 1, 8, 10), "fun run()")))
                .severityCounts(Map.of(Severity.STYLE, 2))
                .notes(List.of("1 finding(s) matched the baseline and were not reported"))
                .baselineSuppressedCount(1)
                .inlineSuppressedCount(4)
                .filesAnalyzed(1)
                .filesExcluded(2)
                .totalDebt(Debt.TEN_MINS)
                .passed(true)
                .build();
    }

    @Test
    void write_includesMetadataAndSummary() throws Exception {
        JsonNode json = mapper.readTree(reporter.render(sampleResult()));

        assertThat(json.at("/metadata/module").asText()).isEqualTo("app");
        assertThat(json.at("/metadata/generatedAt").asText()).isEqualTo("2024-05-01T10:15:30Z");
        assertThat(json.at("/metadata/filesAnalyzed").asInt()).isEqualTo(1);
        assertThat(json.at("/metadata/filesExcluded").asInt()).isEqualTo(2);

        JsonNode summary = json.get("summary");
        assertThat(summary.get("passed").asBoolean()).isTrue();
        assertThat(summary.get("total").asInt()).isEqualTo(2);
        assertThat(summary.at("/bySeverity/style").asInt()).isEqualTo(2);
        assertThat(summary.at("/bySeverity/defect").asInt()).isZero();
        assertThat(summary.get("baselineSuppressed").asInt()).isEqualTo(1);
        assertThat(summary.get("inlineSuppressed").asInt()).isEqualTo(4);
        assertThat(summary.get("debt").asText()).isEqualTo("10min");
        assertThat(summary.get("diagnostics").asInt()).isEqualTo(1);
    }

    @Test
    void write_includesFindingsDiagnosticsAndCorrections() throws Exception {
        JsonNode json = mapper.readTree(reporter.render(sampleResult()));

        JsonNode first = json.at("/findings/0");
        assertThat(first.get("ruleId").asText()).isEqualTo("no-empty-block");
        assertThat(first.get("severity").asText()).isEqualTo("style");
        assertThat(first.at("/location/startLine").asInt()).isEqualTo(3);
        assertThat(first.get("signature").asText()).isEqualTo("src/A.kt:FILE[0]/BLOCK[3]");
        assertThat(first.has("autoCorrected")).isFalse();
        assertThat(json.at("/findings/1/autoCorrected").asBoolean()).isTrue();

        assertThat(json.at("/diagnostics/0/kind").asText()).isEqualTo("PARSE_FAILURE");
        assertThat(json.at("/diagnostics/0/location").isMissingNode()).isTrue();
        assertThat(json.at("/corrections/0/replacement").asText()).isEqualTo("fun run()");
        assertThat(json.at("/notes/0").asText()).startsWith("1 finding(s)");
        assertThat(json.has("warnings")).isFalse();
    }

    @Test
    void write_omitsEmptyOptionalSections() throws Exception {
        AnalysisResult empty = AnalysisResult.builder().moduleName("app").build();

        JsonNode json = mapper.readTree(reporter.render(empty));

        assertThat(json.get("findings").isArray()).isTrue();
        assertThat(json.get("findings").size()).isZero();
        assertThat(json.has("corrections")).isFalse();
        assertThat(json.has("notes")).isFalse();
    }

    @Test
    void write_toFileCreatesParentDirectories(@TempDir Path tempDir) throws Exception {
        Path out = tempDir.resolve("reports/smells.json");

        new JsonReporter(false, FIXED).write(sampleResult(), out);

        String content = Files.readString(out);
        assertThat(content).doesNotContain("\n");
        assertThat(mapper.readTree(content).at("/metadata/module").asText()).isEqualTo("app");
    }

    @Test
    void format_isJson() {
        assertThat(reporter.format()).isEqualTo("json");
    }
}
