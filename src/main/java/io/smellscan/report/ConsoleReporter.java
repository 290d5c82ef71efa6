package io.smellscan.report;

import io.smellscan.model.AnalysisResult;
import io.smellscan.model.Correction;
import io.smellscan.model.Diagnostic;
import io.smellscan.model.Finding;
import io.smellscan.model.Severity;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Formats analysis results for console output with ANSI colors.
 * <p>
 * Layout:
 * - Summary header with compact stats
 * - Findings grouped by file
 * - Diagnostics (parse failures, rule errors, incomplete files)
 * - Notes and configuration warnings
 * <p>
 * Use the detailed mode to also print signatures, fingerprints and proposed corrections.
 */
public class ConsoleReporter implements Reporter {

    // ANSI color codes
    private static final String RESET = "\u001B[0m";
    private static final String BOLD = "\u001B[1m";
    private static final String RED = "\u001B[31m";
    private static final String YELLOW = "\u001B[33m";
    private static final String GREEN = "\u001B[32m";
    private static final String CYAN = "\u001B[36m";

    private static final int WIDTH = 70;

    private final boolean useColors;
    private final boolean detailed;

    public ConsoleReporter() {
        this(true, false);
    }

    public ConsoleReporter(boolean useColors) {
        this(useColors, false);
    }

    public ConsoleReporter(boolean useColors, boolean detailed) {
        this.useColors = useColors;
        this.detailed = detailed;
    }

    @Override
    public String format() {
        return "console";
    }

    @Override
    public void write(AnalysisResult result, Writer writer) throws IOException {
        PrintWriter out = new PrintWriter(writer);

        printHeader(out, result);
        printCompactSummary(out, result);

        if (!result.findings().isEmpty()) {
            printFindingsByFile(out, result);
        }
        if (!result.diagnostics().isEmpty()) {
            printDiagnostics(out, result.diagnostics());
        }
        if (detailed && !result.corrections().isEmpty()) {
            printCorrections(out, result.corrections());
        }
        if (!result.notes().isEmpty() || !result.warnings().isEmpty()) {
            printNotes(out, result);
        }

        printFooter(out, result);
        out.flush();
    }

    private void printHeader(PrintWriter out, AnalysisResult result) {
        out.println();
        out.println(line('=', WIDTH));
        out.println(center("SMELL-SCAN REPORT", WIDTH));
        out.println(line('=', WIDTH));
        out.println();
        out.println("Module: " + result.moduleName());
        out.println();
    }

    private void printCompactSummary(PrintWriter out, AnalysisResult result) {
        out.println(bold("SUMMARY"));
        out.println(line('-', WIDTH));

        out.printf("Files: %d analyzed | %d excluded | %d diagnostics%n",
                result.filesAnalyzed(),
                result.filesExcluded(),
                result.diagnostics().size());

        StringBuilder findings = new StringBuilder("Findings: ");
        Severity[] severities = Severity.values();
        for (int i = severities.length - 1; i >= 0; i--) {
            Severity severity = severities[i];
            int count = result.count(severity);
            String text = count + " " + severity.label().toLowerCase(Locale.ROOT);
            findings.append(count > 0 ? color(colorOf(severity), text) : text);
            if (i > 0) {
                findings.append(" | ");
            }
        }
        out.println(findings);

        out.println("Suppressed: " + result.inlineSuppressedCount() + " inline | "
                + result.baselineSuppressedCount() + " by baseline");
        out.println("Debt: " + result.totalDebt());
        out.println();
    }

    private void printFindingsByFile(PrintWriter out, AnalysisResult result) {
        Map<String, List<Finding>> byFile = result.findingsByFile();
        out.println(bold("FINDINGS") + color(CYAN, " (" + result.totalFindings() + " in " + byFile.size() + " files)"));
        out.println(line('=', WIDTH));

        for (Map.Entry<String, List<Finding>> entry : byFile.entrySet()) {
            out.println(bold(entry.getKey()) + color(CYAN, " [" + entry.getValue().size() + " findings]"));
            for (Finding finding : entry.getValue()) {
                printFinding(out, finding);
            }
            out.println();
        }
    }

    private void printFinding(PrintWriter out, Finding finding) {
        String corrected = finding.autoCorrected() ? color(GREEN, " (auto-corrected)") : "";
        out.printf("  %s %d:%d %s - %s%s%n",
                severityIndicator(finding.severity()),
                finding.location().startLine(),
                finding.location().startColumn(),
                finding.ruleId(),
                finding.message(),
                corrected);
        if (detailed) {
            out.println("      Signature: " + finding.entitySignature());
            out.println("      Fingerprint: " + finding.fingerprint());
            out.println("      Debt: " + finding.debt());
        }
    }

    private void printDiagnostics(PrintWriter out, List<Diagnostic> diagnostics) {
        out.println(bold("DIAGNOSTICS") + color(CYAN, " (" + diagnostics.size() + ")"));
        out.println(line('-', WIDTH));
        for (Diagnostic diagnostic : diagnostics) {
            StringBuilder text = new StringBuilder()
                    .append("  [").append(diagnostic.kind().displayName()).append("] ")
                    .append(diagnostic.location() != null ? diagnostic.location().display() : diagnostic.file());
            if (diagnostic.ruleId() != null) {
                text.append(" ").append(diagnostic.ruleId());
            }
            text.append(": ").append(diagnostic.message());
            out.println(color(YELLOW, text.toString()));
        }
        out.println();
    }

    private void printCorrections(PrintWriter out, List<Correction> corrections) {
        out.println(bold("CORRECTIONS") + color(CYAN, " (" + corrections.size() + ")"));
        out.println(line('-', WIDTH));
        for (Correction correction : corrections) {
            out.printf("  %s %s -> %s%n",
                    correction.location().display(),
                    correction.ruleId(),
                    correction.replacement().replace("\n", "\\n"));
        }
        out.println();
    }

    private void printNotes(PrintWriter out, AnalysisResult result) {
        out.println(bold("NOTES"));
        out.println(line('-', WIDTH));
        for (String warning : result.warnings()) {
            out.println("  " + color(YELLOW, "Warning: " + warning));
        }
        for (String note : result.notes()) {
            out.println("  " + note);
        }
        out.println();
    }

    private void printFooter(PrintWriter out, AnalysisResult result) {
        out.println(line('=', WIDTH));

        if (!result.passed()) {
            out.println(color(RED, bold("FAILED: " + result.totalFindings()
                    + " finding(s) reported, the failure policy was not met.")));
        } else if (result.totalFindings() > 0) {
            out.println(color(YELLOW, "PASSED with " + result.totalFindings() + " finding(s) below the failure threshold."));
        } else {
            out.println(color(GREEN, "No code smells found."));
        }

        if (!detailed && result.totalFindings() > 0) {
            out.println();
            out.println("Run with --verbose for signatures, fingerprints and corrections.");
        }

        out.println();
    }

    private String severityIndicator(Severity severity) {
        return switch (severity) {
            case DEFECT -> color(RED, "[DEFECT]");
            case ERROR -> color(RED, "[ERROR]");
            case WARNING -> color(YELLOW, "[WARN]");
            case STYLE -> "[STYLE]";
        };
    }

    private String colorOf(Severity severity) {
        return switch (severity) {
            case DEFECT, ERROR -> RED;
            case WARNING -> YELLOW;
            case STYLE -> CYAN;
        };
    }

    // Formatting helpers

    private String color(String color, String text) {
        if (!useColors) return text;
        return color + text + RESET;
    }

    private String bold(String text) {
        if (!useColors) return text;
        return BOLD + text + RESET;
    }

    private String line(char c, int length) {
        return String.valueOf(c).repeat(length);
    }

    private String center(String text, int width) {
        if (text.length() >= width) return text;
        int padding = (width - text.length()) / 2;
        return " ".repeat(padding) + text;
    }
}
