package io.smellscan.rules.style;

import io.smellscan.ast.Node;
import io.smellscan.model.Debt;
import io.smellscan.model.Severity;
import io.smellscan.rules.NodeVisitor;
import io.smellscan.rules.RuleContext;
import io.smellscan.rules.RuleDescriptor;

/**
 * Reports files and classes that declare too many functions.
 * Thresholds are configurable with {@code thresholdInFiles} and {@code thresholdInClasses}.
 */
public class TooManyFunctionsRule implements NodeVisitor {

    public static final String ID = "too-many-functions";

    static final int DEFAULT_THRESHOLD = 11;

    public static RuleDescriptor descriptor() {
        return RuleDescriptor.builder(ID)
                .ruleSetId("style")
                .description("Too many functions inside a file or class make it hard to understand.")
                .severity(Severity.WARNING)
                .debt(Debt.TWENTY_MINS)
                .nodeKinds("FILE", "CLASS")
                .visitor(new TooManyFunctionsRule())
                .build();
    }

    @Override
    public void visit(Node node, RuleContext context) {
        boolean isFile = node.isKind("FILE");
        int threshold = isFile
                ? context.intParameter("thresholdInFiles", DEFAULT_THRESHOLD)
                : context.intParameter("thresholdInClasses", DEFAULT_THRESHOLD);

        long functions = node.children().stream()
                .filter(child -> child.isKind("FUNCTION"))
                .count();

        if (functions >= threshold) {
            String owner = isFile ? "File" : "Class '" + node.name().orElse("<anonymous>") + "'";
            context.report(node, String.format("%s has %d functions, the threshold is %d.", owner, functions, threshold));
        }
    }
}
