package io.smellscan.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.smellscan.model.AnalysisResult;
import io.smellscan.model.Correction;
import io.smellscan.model.Diagnostic;
import io.smellscan.model.Finding;
import io.smellscan.model.Severity;
import io.smellscan.model.SourceLocation;

import java.io.IOException;
import java.io.Writer;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Formats analysis results as JSON for machine processing.
 */
public class JsonReporter implements Reporter {

    private final ObjectMapper mapper;
    private final boolean prettyPrint;
    private final Clock clock;

    public JsonReporter() {
        this(true);
    }

    public JsonReporter(boolean prettyPrint) {
        this(prettyPrint, Clock.systemUTC());
    }

    public JsonReporter(boolean prettyPrint, Clock clock) {
        this.prettyPrint = prettyPrint;
        this.clock = clock;
        this.mapper = createMapper();
    }

    private ObjectMapper createMapper() {
        ObjectMapper m = new ObjectMapper();
        m.registerModule(new JavaTimeModule());
        m.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        m.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        if (prettyPrint) {
            m.enable(SerializationFeature.INDENT_OUTPUT);
        }
        return m;
    }

    @Override
    public String format() {
        return "json";
    }

    @Override
    public void write(AnalysisResult result, Writer writer) throws IOException {
        mapper.writeValue(writer, toJsonReport(result));
    }

    JsonReport toJsonReport(AnalysisResult result) {
        Map<String, Integer> bySeverity = new LinkedHashMap<>();
        for (Severity severity : Severity.values()) {
            bySeverity.put(severity.name().toLowerCase(Locale.ROOT), result.count(severity));
        }

        return new JsonReport(
                new JsonReport.Metadata(
                        result.moduleName(),
                        Instant.now(clock),
                        result.filesAnalyzed(),
                        result.filesExcluded()
                ),
                new JsonReport.Summary(
                        result.passed(),
                        result.totalFindings(),
                        bySeverity,
                        result.baselineSuppressedCount(),
                        result.inlineSuppressedCount(),
                        result.totalDebt().toString(),
                        result.diagnostics().size()
                ),
                result.findings().stream().map(this::toJsonFinding).toList(),
                result.diagnostics().stream().map(this::toJsonDiagnostic).toList(),
                result.corrections().isEmpty() ? null
                        : result.corrections().stream().map(this::toJsonCorrection).toList(),
                result.notes().isEmpty() ? null : result.notes(),
                result.warnings().isEmpty() ? null : result.warnings()
        );
    }

    private JsonReport.Finding toJsonFinding(Finding finding) {
        return new JsonReport.Finding(
                finding.ruleId(),
                finding.severity().name().toLowerCase(Locale.ROOT),
                toJsonLocation(finding.location()),
                finding.message(),
                finding.entitySignature(),
                finding.fingerprint(),
                finding.debt().toString(),
                finding.autoCorrected() ? Boolean.TRUE : null
        );
    }

    private JsonReport.Diagnostic toJsonDiagnostic(Diagnostic diagnostic) {
        return new JsonReport.Diagnostic(
                diagnostic.kind().name(),
                diagnostic.file(),
                diagnostic.ruleId(),
                diagnostic.location() != null ? toJsonLocation(diagnostic.location()) : null,
                diagnostic.message()
        );
    }

    private JsonReport.Correction toJsonCorrection(Correction correction) {
        return new JsonReport.Correction(
                correction.ruleId(),
                toJsonLocation(correction.location()),
                correction.replacement()
        );
    }

    private JsonReport.Location toJsonLocation(SourceLocation location) {
        return new JsonReport.Location(
                location.file(),
                location.startLine(),
                location.startColumn(),
                location.endLine(),
                location.endColumn()
        );
    }

    /**
     * JSON structure for the report.
     */
    public record JsonReport(
            Metadata metadata,
            Summary summary,
            List<Finding> findings,
            List<Diagnostic> diagnostics,
            List<Correction> corrections,
            List<String> notes,
            List<String> warnings
    ) {
        public record Metadata(
                String module,
                Instant generatedAt,
                int filesAnalyzed,
                int filesExcluded
        ) {}

        public record Summary(
                boolean passed,
                int total,
                Map<String, Integer> bySeverity,
                int baselineSuppressed,
                int inlineSuppressed,
                String debt,
                int diagnostics
        ) {}

        public record Location(
                String file,
                int startLine,
                int startColumn,
                int endLine,
                int endColumn
        ) {}

        public record Finding(
                String ruleId,
                String severity,
                Location location,
                String message,
                String signature,
                String fingerprint,
                String debt,
                Boolean autoCorrected
        ) {}

        public record Diagnostic(
                String kind,
                String file,
                String ruleId,
                Location location,
                String message
        ) {}

        public record Correction(
                String ruleId,
                Location location,
                String replacement
        ) {}
    }
}
