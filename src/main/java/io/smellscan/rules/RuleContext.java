package io.smellscan.rules;

import io.smellscan.ast.Node;

import java.util.Map;

/**
 * What a rule sees while visiting a node: the file being analyzed, its resolved parameters,
 * and a sink for findings.
 */
public interface RuleContext {

    /**
     * Normalized path of the file being analyzed.
     */
    String file();

    /**
     * Parameters resolved for this rule from the configuration layers.
     */
    Map<String, Object> parameters();

    /**
     * Reports a finding on the given node.
     */
    void report(Node node, String message);

    default int intParameter(String name, int defaultValue) {
        Object value = parameters().get(name);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Parameter '" + name + "' is not an integer: " + s, e);
            }
        }
        return defaultValue;
    }
}
