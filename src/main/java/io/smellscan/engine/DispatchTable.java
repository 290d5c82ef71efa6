package io.smellscan.engine;

import io.smellscan.config.EffectiveConfig;
import io.smellscan.rules.RuleDescriptor;
import io.smellscan.rules.RuleRegistry;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Node kind to interested active rules, built once per file so the walk never re-checks
 * interest or configuration per node. Each list is in ascending rule id order.
 */
final class DispatchTable {

    private final Map<String, List<RuleDescriptor>> rulesByKind;

    private DispatchTable(Map<String, List<RuleDescriptor>> rulesByKind) {
        this.rulesByKind = rulesByKind;
    }

    static DispatchTable build(EffectiveConfig config, RuleRegistry registry, String file) {
        Map<String, List<RuleDescriptor>> table = new HashMap<>();
        // registry.all() is sorted by id, so every list ends up sorted as well
        for (RuleDescriptor rule : registry.all()) {
            if (!config.isActive(rule.id()) || config.isExcludedForRule(rule.id(), file)) {
                continue;
            }
            for (String kind : rule.nodeKinds()) {
                table.computeIfAbsent(kind, k -> new ArrayList<>()).add(rule);
            }
        }
        table.replaceAll((kind, rules) -> List.copyOf(rules));
        return new DispatchTable(table);
    }

    List<RuleDescriptor> rulesFor(String kind) {
        return rulesByKind.getOrDefault(kind, List.of());
    }

    boolean isEmpty() {
        return rulesByKind.isEmpty();
    }
}
