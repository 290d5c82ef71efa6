package io.smellscan.config;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * One layer of configuration (defaults, global, module, in-file overrides), already reduced to
 * per-rule overrides. Layers are immutable and merged in order by {@link ConfigurationResolver}.
 *
 * @param name      Where the layer came from, used in warnings
 * @param rules     Overrides keyed by rule id
 * @param excludes  Path globs for files to skip entirely; accumulated across layers
 * @param failFast  Fail-fast override, null if not set
 * @param maxIssues Maximum number of findings before the run fails, null if not set
 */
public record ConfigLayer(
        String name,
        Map<String, RuleOverride> rules,
        Set<String> excludes,
        Boolean failFast,
        Integer maxIssues
) {
    public ConfigLayer {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Configuration layer name cannot be null or blank");
        }
        rules = rules == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(rules));
        excludes = excludes == null ? Set.of() : Collections.unmodifiableSortedSet(new TreeSet<>(excludes));
    }

    public static ConfigLayer empty(String name) {
        return new ConfigLayer(name, Map.of(), Set.of(), null, null);
    }

    /**
     * Combines this layer with a later one as if both had been applied in sequence.
     * Resolving {@code [merge(A, B), C]} gives the same configuration as {@code [A, B, C]}.
     */
    public ConfigLayer merge(ConfigLayer later) {
        Map<String, RuleOverride> mergedRules = new TreeMap<>(rules);
        later.rules.forEach((id, override) ->
                mergedRules.merge(id, override, RuleOverride::then));

        Set<String> mergedExcludes = new TreeSet<>(excludes);
        mergedExcludes.addAll(later.excludes);

        return new ConfigLayer(
                name + "+" + later.name,
                mergedRules,
                mergedExcludes,
                later.failFast != null ? later.failFast : failFast,
                later.maxIssues != null ? later.maxIssues : maxIssues
        );
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static class Builder {
        private final String name;
        private final Map<String, RuleOverride> rules = new TreeMap<>();
        private final Set<String> excludes = new TreeSet<>();
        private Boolean failFast;
        private Integer maxIssues;

        private Builder(String name) {
            this.name = name;
        }

        public Builder rule(String ruleId, RuleOverride override) {
            rules.merge(ruleId, override, RuleOverride::then);
            return this;
        }

        public Builder enable(String ruleId) {
            return rule(ruleId, RuleOverride.active(true));
        }

        public Builder disable(String ruleId) {
            return rule(ruleId, RuleOverride.active(false));
        }

        public Builder exclude(String glob) {
            excludes.add(glob);
            return this;
        }

        public Builder failFast(Boolean failFast) {
            this.failFast = failFast;
            return this;
        }

        public Builder maxIssues(Integer maxIssues) {
            this.maxIssues = maxIssues;
            return this;
        }

        public ConfigLayer build() {
            return new ConfigLayer(name, rules, excludes, failFast, maxIssues);
        }
    }
}
