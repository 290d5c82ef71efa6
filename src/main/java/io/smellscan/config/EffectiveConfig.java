package io.smellscan.config;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * The merged configuration governing one analysis run.
 * <p>
 * Read-only and shared by reference across all workers. Never reused across runs.
 */
public final class EffectiveConfig {

    public static final int UNLIMITED_ISSUES = -1;

    private final Map<String, RuleSetting> rules;
    private final Set<String> excludes;
    private final boolean failFast;
    private final int maxIssues;
    private final List<String> warnings;
    private final List<String> notes;

    private final PathFilter excludeFilter;
    private final Map<String, PathFilter> ruleExcludeFilters;

    EffectiveConfig(Map<String, RuleSetting> rules,
                    Set<String> excludes,
                    boolean failFast,
                    int maxIssues,
                    List<String> warnings,
                    List<String> notes) {
        this.rules = Collections.unmodifiableMap(new TreeMap<>(rules));
        this.excludes = Collections.unmodifiableSortedSet(new TreeSet<>(excludes));
        this.failFast = failFast;
        this.maxIssues = maxIssues;
        this.warnings = List.copyOf(warnings);
        this.notes = List.copyOf(notes);
        this.excludeFilter = PathFilter.of(this.excludes);
        this.ruleExcludeFilters = this.rules.entrySet().stream()
                .filter(e -> !e.getValue().excludes().isEmpty())
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, e -> PathFilter.of(e.getValue().excludes())));
    }

    public Map<String, RuleSetting> rules() {
        return rules;
    }

    public Optional<RuleSetting> setting(String ruleId) {
        return Optional.ofNullable(rules.get(ruleId));
    }

    public boolean isActive(String ruleId) {
        RuleSetting setting = rules.get(ruleId);
        return setting != null && setting.active();
    }

    /**
     * Returns the ids of all active rules, sorted.
     */
    public Set<String> activeRuleIds() {
        return rules.entrySet().stream()
                .filter(e -> e.getValue().active())
                .map(Map.Entry::getKey)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    public Set<String> excludes() {
        return excludes;
    }

    /**
     * Returns true if the file matches one of the module-wide exclude patterns.
     */
    public boolean isExcluded(String file) {
        return excludeFilter.matches(file);
    }

    /**
     * Returns true if the rule must skip the given file because of its own exclude patterns.
     */
    public boolean isExcludedForRule(String ruleId, String file) {
        PathFilter filter = ruleExcludeFilters.get(ruleId);
        return filter != null && filter.matches(file);
    }

    public boolean failFast() {
        return failFast;
    }

    public int maxIssues() {
        return maxIssues;
    }

    /**
     * Problems found while merging layers, such as unknown rule ids.
     */
    public List<String> warnings() {
        return warnings;
    }

    /**
     * Informational notes, such as rules disabled because type resolution is unavailable.
     */
    public List<String> notes() {
        return notes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EffectiveConfig other)) {
            return false;
        }
        return failFast == other.failFast
                && maxIssues == other.maxIssues
                && rules.equals(other.rules)
                && excludes.equals(other.excludes)
                && warnings.equals(other.warnings)
                && notes.equals(other.notes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rules, excludes, failFast, maxIssues, warnings, notes);
    }

    @Override
    public String toString() {
        return "EffectiveConfig{active=" + activeRuleIds() + ", excludes=" + excludes
                + ", failFast=" + failFast + ", maxIssues=" + maxIssues + "}";
    }
}
