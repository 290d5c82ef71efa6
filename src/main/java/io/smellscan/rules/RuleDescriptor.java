package io.smellscan.rules;

import io.smellscan.model.Debt;
import io.smellscan.model.Severity;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Immutable description of a rule: its identity, defaults, node-kind interest and callbacks.
 *
 * @param id                     Unique rule id, e.g. {@code no-empty-block}
 * @param ruleSetId              Rule set the rule belongs to, e.g. {@code style}
 * @param description            One-line summary of what the rule reports
 * @param severity               Default severity
 * @param debt                   Estimated effort to fix one finding
 * @param defaultEnabled         Whether the rule is active without configuration
 * @param requiresTypeResolution Whether the rule needs semantic context beyond the syntax tree
 * @param nodeKinds              Node kinds the rule visits
 * @param visitor                Visit callback
 * @param corrector              Auto-correct callback, null if the rule cannot fix its findings
 */
public record RuleDescriptor(
        String id,
        String ruleSetId,
        String description,
        Severity severity,
        Debt debt,
        boolean defaultEnabled,
        boolean requiresTypeResolution,
        Set<String> nodeKinds,
        NodeVisitor visitor,
        Corrector corrector
) {
    private static final Pattern ID_PATTERN = Pattern.compile("[A-Za-z][A-Za-z0-9_-]*");

    /**
     * Compact constructor with validation.
     */
    public RuleDescriptor {
        if (id == null || !ID_PATTERN.matcher(id).matches()) {
            throw new IllegalArgumentException("Invalid rule id: " + id);
        }
        if (ruleSetId == null || ruleSetId.isBlank()) {
            throw new IllegalArgumentException("ruleSetId cannot be null or blank for rule " + id);
        }
        if (severity == null) {
            throw new IllegalArgumentException("severity cannot be null for rule " + id);
        }
        if (nodeKinds == null || nodeKinds.isEmpty()) {
            throw new IllegalArgumentException("Rule " + id + " must be interested in at least one node kind");
        }
        if (visitor == null) {
            throw new IllegalArgumentException("visitor cannot be null for rule " + id);
        }
        if (description == null) {
            description = "";
        }
        if (debt == null) {
            debt = Debt.FIVE_MINS;
        }
        nodeKinds = Set.copyOf(nodeKinds);
    }

    public boolean autoCorrectable() {
        return corrector != null;
    }

    public static Builder builder(String id) {
        return new Builder().id(id);
    }

    public static class Builder {
        private String id;
        private String ruleSetId;
        private String description;
        private Severity severity = Severity.STYLE;
        private Debt debt = Debt.FIVE_MINS;
        private boolean defaultEnabled = true;
        private boolean requiresTypeResolution;
        private final Set<String> nodeKinds = new LinkedHashSet<>();
        private NodeVisitor visitor;
        private Corrector corrector;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder ruleSetId(String ruleSetId) {
            this.ruleSetId = ruleSetId;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder debt(Debt debt) {
            this.debt = debt;
            return this;
        }

        public Builder defaultEnabled(boolean defaultEnabled) {
            this.defaultEnabled = defaultEnabled;
            return this;
        }

        public Builder requiresTypeResolution(boolean requiresTypeResolution) {
            this.requiresTypeResolution = requiresTypeResolution;
            return this;
        }

        public Builder nodeKinds(String... kinds) {
            this.nodeKinds.addAll(Set.of(kinds));
            return this;
        }

        public Builder visitor(NodeVisitor visitor) {
            this.visitor = visitor;
            return this;
        }

        public Builder corrector(Corrector corrector) {
            this.corrector = corrector;
            return this;
        }

        public RuleDescriptor build() {
            return new RuleDescriptor(
                    id,
                    ruleSetId,
                    description,
                    severity,
                    debt,
                    defaultEnabled,
                    requiresTypeResolution,
                    nodeKinds,
                    visitor,
                    corrector
            );
        }
    }
}
