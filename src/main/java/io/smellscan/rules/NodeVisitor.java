package io.smellscan.rules;

import io.smellscan.ast.Node;

/**
 * Callback a rule registers for the node kinds it is interested in.
 * Called once per matching node during the single pre-order walk of a file.
 */
@FunctionalInterface
public interface NodeVisitor {

    /**
     * Inspects a node and reports findings through the context.
     *
     * @param node    node of one of the rule's declared kinds
     * @param context sink for findings plus access to the rule's resolved parameters
     */
    void visit(Node node, RuleContext context);
}
