package io.smellscan.report;

import io.smellscan.config.EffectiveConfig;
import io.smellscan.model.AnalysisResult;
import io.smellscan.model.Correction;
import io.smellscan.model.Debt;
import io.smellscan.model.Diagnostic;
import io.smellscan.model.FileOutcome;
import io.smellscan.model.Finding;
import io.smellscan.model.Severity;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Merges per-file outcomes into one {@link AnalysisResult}.
 * <p>
 * Pure: the result depends only on the arguments, never on the order in which workers
 * finished, so the same input always produces an equal result.
 */
public class ReportAggregator {

    public AnalysisResult build(String moduleName,
                                List<FileOutcome> outcomes,
                                EffectiveConfig config,
                                FailurePolicy policy,
                                boolean updateBaseline) {
        List<Finding> findings = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();
        List<Correction> corrections = new ArrayList<>();
        Set<String> fingerprints = new TreeSet<>();
        int baselineSuppressed = 0;
        int inlineSuppressed = 0;
        int analyzed = 0;
        int excluded = 0;
        int incomplete = 0;
        int parseFailed = 0;

        for (FileOutcome outcome : outcomes) {
            switch (outcome.status()) {
                case COMPLETED -> analyzed++;
                case EXCLUDED -> excluded++;
                case INCOMPLETE -> incomplete++;
                case PARSE_FAILED -> parseFailed++;
            }
            findings.addAll(outcome.findings());
            diagnostics.addAll(outcome.diagnostics());
            corrections.addAll(outcome.corrections());
            fingerprints.addAll(outcome.fingerprints());
            baselineSuppressed += outcome.baselineSuppressed();
            inlineSuppressed += outcome.inlineSuppressed();
        }

        findings.sort(Finding.REPORT_ORDER);
        diagnostics.sort(Diagnostic.REPORT_ORDER);
        corrections.sort(Correction.REPORT_ORDER);

        Map<Severity, Integer> counts = new EnumMap<>(Severity.class);
        Debt totalDebt = Debt.ZERO;
        for (Finding finding : findings) {
            counts.merge(finding.severity(), 1, Integer::sum);
            totalDebt = totalDebt.plus(finding.debt());
        }

        List<String> notes = new ArrayList<>(config.notes());
        if (baselineSuppressed > 0) {
            notes.add(baselineSuppressed + " finding(s) matched the baseline and were not reported");
        }
        if (incomplete > 0) {
            notes.add(incomplete + " file(s) were not fully analyzed");
        }
        // A partial fingerprint set would drop accepted findings of the files that were skipped
        boolean regenerate = updateBaseline && incomplete == 0 && parseFailed == 0;
        if (regenerate) {
            notes.add("Baseline regenerated with " + fingerprints.size() + " fingerprint(s)");
        } else if (updateBaseline) {
            notes.add("Baseline not regenerated: " + (incomplete + parseFailed)
                    + " file(s) could not be fully analyzed");
        }

        FailurePolicy effectivePolicy = effectivePolicy(policy, config);

        return AnalysisResult.builder()
                .moduleName(moduleName)
                .findings(findings)
                .diagnostics(diagnostics)
                .corrections(corrections)
                .severityCounts(counts)
                .notes(notes)
                .warnings(config.warnings())
                .baselineSuppressedCount(baselineSuppressed)
                .inlineSuppressedCount(inlineSuppressed)
                .filesAnalyzed(analyzed)
                .filesExcluded(excluded)
                .totalDebt(totalDebt)
                .passed(effectivePolicy.passes(findings))
                .regeneratedBaseline(regenerate ? List.copyOf(fingerprints) : null)
                .build();
    }

    /**
     * An explicit issue limit from the caller wins over {@code build.maxIssues} from configuration.
     */
    static FailurePolicy effectivePolicy(FailurePolicy policy, EffectiveConfig config) {
        FailurePolicy base = policy != null ? policy : FailurePolicy.DEFAULT;
        if (!base.hasIssueLimit() && config.maxIssues() >= 0) {
            return base.withMaxIssues(config.maxIssues());
        }
        return base;
    }
}
