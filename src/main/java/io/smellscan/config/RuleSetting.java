package io.smellscan.config;

import io.smellscan.model.Severity;
import io.smellscan.rules.RuleDescriptor;

import java.util.Map;
import java.util.Set;

/**
 * Fully resolved settings of one rule for an analysis run.
 */
public record RuleSetting(
        boolean active,
        Severity severity,
        Map<String, Object> parameters,
        boolean autoCorrect,
        Set<String> excludes
) {
    public RuleSetting {
        if (severity == null) {
            throw new IllegalArgumentException("severity cannot be null");
        }
        parameters = parameters == null ? Map.of() : parameters;
        excludes = excludes == null ? Set.of() : excludes;
    }

    /**
     * Settings of a rule that no layer mentions.
     */
    public static RuleSetting defaultsOf(RuleDescriptor descriptor) {
        return new RuleSetting(descriptor.defaultEnabled(), descriptor.severity(), Map.of(), false, Set.of());
    }

    /**
     * Applies a layer's override on top of these settings.
     */
    public RuleSetting apply(RuleOverride override) {
        RuleOverride merged = new RuleOverride(active, severity, parameters, autoCorrect, excludes).then(override);
        return new RuleSetting(
                merged.active(),
                merged.severity(),
                merged.parameters(),
                merged.autoCorrect(),
                merged.excludes()
        );
    }

    public RuleSetting deactivated() {
        return new RuleSetting(false, severity, parameters, autoCorrect, excludes);
    }
}
