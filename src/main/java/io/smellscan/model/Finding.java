package io.smellscan.model;

import java.util.Comparator;

/**
 * A single reported code smell.
 *
 * @param ruleId          ID of the rule that reported this finding
 * @param severity        Effective severity after configuration overrides
 * @param location        Where the offending element is
 * @param message         Human-readable description of the problem
 * @param entitySignature Structural identity of the offending element, independent of line numbers
 * @param fingerprint     Hash used for suppression and baseline matching
 * @param debt            Estimated effort to fix
 * @param autoCorrected   True if a corrector produced a fix for this finding
 */
public record Finding(
        String ruleId,
        Severity severity,
        SourceLocation location,
        String message,
        String entitySignature,
        String fingerprint,
        Debt debt,
        boolean autoCorrected
) {
    /**
     * Report order: file, then position, then rule id.
     * Message and signature break the remaining ties so the order is total.
     */
    public static final Comparator<Finding> REPORT_ORDER = Comparator
            .comparing(Finding::location)
            .thenComparing(Finding::ruleId)
            .thenComparing(Finding::message)
            .thenComparing(Finding::entitySignature);

    /**
     * Compact constructor with validation.
     */
    public Finding {
        if (ruleId == null || ruleId.isBlank()) {
            throw new IllegalArgumentException("ruleId cannot be null or blank");
        }
        if (severity == null) {
            throw new IllegalArgumentException("severity cannot be null");
        }
        if (location == null) {
            throw new IllegalArgumentException("location cannot be null");
        }
        if (fingerprint == null || fingerprint.isBlank()) {
            throw new IllegalArgumentException("fingerprint cannot be null or blank");
        }
        if (message == null) {
            message = "";
        }
        if (entitySignature == null) {
            entitySignature = "";
        }
        if (debt == null) {
            debt = Debt.ZERO;
        }
    }

    public String file() {
        return location.file();
    }

    public Finding withAutoCorrected(boolean corrected) {
        return new Finding(ruleId, severity, location, message, entitySignature, fingerprint, debt, corrected);
    }

    /**
     * Builder for creating Finding instances.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String ruleId;
        private Severity severity;
        private SourceLocation location;
        private String message;
        private String entitySignature;
        private String fingerprint;
        private Debt debt = Debt.ZERO;
        private boolean autoCorrected;

        public Builder ruleId(String ruleId) {
            this.ruleId = ruleId;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder location(SourceLocation location) {
            this.location = location;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder entitySignature(String entitySignature) {
            this.entitySignature = entitySignature;
            return this;
        }

        public Builder fingerprint(String fingerprint) {
            this.fingerprint = fingerprint;
            return this;
        }

        public Builder debt(Debt debt) {
            this.debt = debt;
            return this;
        }

        public Builder autoCorrected(boolean autoCorrected) {
            this.autoCorrected = autoCorrected;
            return this;
        }

        public Finding build() {
            return new Finding(
                    ruleId,
                    severity,
                    location,
                    message,
                    entitySignature,
                    fingerprint,
                    debt,
                    autoCorrected
            );
        }
    }
}
