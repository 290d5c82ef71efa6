package io.smellscan.model;

import java.util.Comparator;

/**
 * A problem with the analysis itself rather than with the analyzed code.
 * Diagnostics are isolated to one file (or one rule within a file) and never abort a run.
 *
 * @param kind     What went wrong
 * @param file     The file the problem belongs to
 * @param ruleId   The failing rule, only for {@link Kind#INTERNAL_RULE_ERROR}
 * @param location Node the rule was visiting, if known
 * @param message  Description of the failure
 */
public record Diagnostic(
        Kind kind,
        String file,
        String ruleId,
        SourceLocation location,
        String message
) {
    public static final Comparator<Diagnostic> REPORT_ORDER = Comparator
            .comparing(Diagnostic::file)
            .thenComparing(Diagnostic::kind)
            .thenComparing(d -> d.location() != null ? d.location() : SourceLocation.wholeFile(d.file()))
            .thenComparing(d -> d.ruleId() != null ? d.ruleId() : "")
            .thenComparing(Diagnostic::message);

    public enum Kind {
        /**
         * The AST provider could not parse the file.
         */
        PARSE_FAILURE("Parse failure"),

        /**
         * A rule's visit callback threw while analyzing a node.
         */
        INTERNAL_RULE_ERROR("Internal rule error"),

        /**
         * Analysis of the file was cancelled (fail-fast) or abandoned (timeout).
         */
        INCOMPLETE("Incomplete");

        private final String displayName;

        Kind(String displayName) {
            this.displayName = displayName;
        }

        public String displayName() {
            return displayName;
        }
    }

    public Diagnostic {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (file == null || file.isBlank()) {
            throw new IllegalArgumentException("file cannot be null or blank");
        }
        if (message == null) {
            message = "";
        }
    }

    public static Diagnostic parseFailure(String file, String message) {
        return new Diagnostic(Kind.PARSE_FAILURE, file, null, null, message);
    }

    public static Diagnostic ruleError(String file, String ruleId, SourceLocation location, String message) {
        return new Diagnostic(Kind.INTERNAL_RULE_ERROR, file, ruleId, location, message);
    }

    public static Diagnostic incomplete(String file, String reason) {
        return new Diagnostic(Kind.INCOMPLETE, file, null, null, reason);
    }
}
