package io.smellscan.rules;

import io.smellscan.ast.Node;

import java.util.Optional;

/**
 * Optional auto-correct callback of a rule.
 * Returns the replacement text for the offending node, or empty if no safe fix exists.
 */
@FunctionalInterface
public interface Corrector {

    Optional<String> correct(Node node);
}
