package io.smellscan.config;

import io.smellscan.model.Severity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Partial settings for one rule inside a single configuration layer.
 * A null component means "not set by this layer".
 *
 * @param active      Whether the rule runs
 * @param severity    Severity override
 * @param parameters  Rule parameters; when set, they replace all parameters of earlier layers
 * @param autoCorrect Whether the rule's corrector should run
 * @param excludes    Path globs for files the rule skips; accumulated across layers
 */
public record RuleOverride(
        Boolean active,
        Severity severity,
        Map<String, Object> parameters,
        Boolean autoCorrect,
        Set<String> excludes
) {
    public RuleOverride {
        if (parameters != null) {
            Map<String, Object> copy = new LinkedHashMap<>();
            parameters.forEach((key, value) -> {
                if (key != null && value != null) {
                    copy.put(key, value);
                }
            });
            parameters = Collections.unmodifiableMap(copy);
        }
        excludes = excludes == null ? Set.of() : Collections.unmodifiableSortedSet(new TreeSet<>(excludes));
    }

    public static RuleOverride active(boolean active) {
        return new RuleOverride(active, null, null, null, Set.of());
    }

    /**
     * Combines this override with one from a later layer. Values set by {@code later} win,
     * parameters are replaced as a whole, excludes are unioned.
     */
    public RuleOverride then(RuleOverride later) {
        Set<String> mergedExcludes = new TreeSet<>(excludes);
        mergedExcludes.addAll(later.excludes);
        return new RuleOverride(
                later.active != null ? later.active : active,
                later.severity != null ? later.severity : severity,
                later.parameters != null ? later.parameters : parameters,
                later.autoCorrect != null ? later.autoCorrect : autoCorrect,
                mergedExcludes
        );
    }

    public Builder toBuilder() {
        return new Builder()
                .active(active)
                .severity(severity)
                .parameters(parameters)
                .autoCorrect(autoCorrect)
                .excludes(excludes);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Boolean active;
        private Severity severity;
        private Map<String, Object> parameters;
        private Boolean autoCorrect;
        private Set<String> excludes = Set.of();

        public Builder active(Boolean active) {
            this.active = active;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder parameters(Map<String, Object> parameters) {
            this.parameters = parameters;
            return this;
        }

        public Builder parameter(String name, Object value) {
            Map<String, Object> updated = parameters != null ? new LinkedHashMap<>(parameters) : new LinkedHashMap<>();
            updated.put(name, value);
            this.parameters = updated;
            return this;
        }

        public Builder autoCorrect(Boolean autoCorrect) {
            this.autoCorrect = autoCorrect;
            return this;
        }

        public Builder excludes(Set<String> excludes) {
            this.excludes = excludes;
            return this;
        }

        public RuleOverride build() {
            return new RuleOverride(active, severity, parameters, autoCorrect, excludes);
        }
    }
}
