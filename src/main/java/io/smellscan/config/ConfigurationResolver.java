package io.smellscan.config;

import io.smellscan.rules.RuleDescriptor;
import io.smellscan.rules.RuleRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Merges ordered configuration layers into one {@link EffectiveConfig}.
 * <p>
 * Resolution starts from the registry defaults. Each layer then overwrites the values it sets,
 * rule by rule: {@code active}, {@code severity} and {@code autoCorrect} are replaced,
 * {@code parameters} are replaced as a whole (no deep merge), exclude patterns accumulate.
 * Unknown rule ids are collected as warnings, one per id in id order, and do not stop the merge.
 * <p>
 * Without type resolution (degraded mode) every rule that needs it is disabled,
 * and a note records the downgrade.
 */
public class ConfigurationResolver {

    private static final Logger log = LoggerFactory.getLogger(ConfigurationResolver.class);

    public EffectiveConfig resolve(ModuleConfig moduleConfig, RuleRegistry registry, boolean typeResolutionAvailable) {
        return resolve(moduleConfig.layers(), moduleConfig.failFast(), registry, typeResolutionAvailable);
    }

    public EffectiveConfig resolve(List<ConfigLayer> layers, RuleRegistry registry, boolean typeResolutionAvailable) {
        return resolve(layers, false, registry, typeResolutionAvailable);
    }

    private EffectiveConfig resolve(List<ConfigLayer> layers,
                                    boolean failFast,
                                    RuleRegistry registry,
                                    boolean typeResolutionAvailable) {
        Map<String, RuleSetting> settings = new LinkedHashMap<>();
        for (RuleDescriptor descriptor : registry.all()) {
            settings.put(descriptor.id(), RuleSetting.defaultsOf(descriptor));
        }

        Set<String> excludes = new TreeSet<>();
        int maxIssues = EffectiveConfig.UNLIMITED_ISSUES;
        Set<String> unknownIds = new TreeSet<>();

        for (ConfigLayer layer : layers) {
            for (Map.Entry<String, RuleOverride> entry : layer.rules().entrySet()) {
                String ruleId = entry.getKey();
                RuleSetting current = settings.get(ruleId);
                if (current == null) {
                    log.warn("Unknown rule id '{}' in configuration layer '{}'", ruleId, layer.name());
                    unknownIds.add(ruleId);
                    continue;
                }
                settings.put(ruleId, current.apply(entry.getValue()));
            }
            excludes.addAll(layer.excludes());
            if (layer.failFast() != null) {
                failFast = layer.failFast();
            }
            if (layer.maxIssues() != null) {
                maxIssues = layer.maxIssues();
            }
        }

        // Worded without layer names so that merging layers beforehand gives the same warnings
        List<String> warnings = new ArrayList<>();
        for (String ruleId : unknownIds) {
            warnings.add("Unknown rule id '" + ruleId + "' in configuration");
        }

        List<String> notes = new ArrayList<>();
        if (!typeResolutionAvailable) {
            for (RuleDescriptor descriptor : registry.all()) {
                RuleSetting setting = settings.get(descriptor.id());
                if (descriptor.requiresTypeResolution() && setting.active()) {
                    settings.put(descriptor.id(), setting.deactivated());
                    notes.add("Rule '" + descriptor.id() + "' disabled: it requires type resolution, "
                            + "which is not available for this run");
                }
            }
        }

        EffectiveConfig config = new EffectiveConfig(settings, excludes, failFast, maxIssues, warnings, notes);
        log.debug("Resolved {} layer(s): {}", layers.size(), config);
        return config;
    }
}
