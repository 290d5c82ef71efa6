package io.smellscan.rules.style;

import io.smellscan.ast.Node;
import io.smellscan.model.Debt;
import io.smellscan.model.Severity;
import io.smellscan.rules.NodeVisitor;
import io.smellscan.rules.RuleContext;
import io.smellscan.rules.RuleDescriptor;

import java.util.regex.Pattern;

/**
 * Reports blocks that contain neither statements nor comments.
 * <p>
 * Empty blocks are either unfinished code or leftovers from refactoring. A block holding only
 * a comment is accepted, since the comment usually explains why nothing happens there.
 */
public class EmptyBlockRule implements NodeVisitor {

    public static final String ID = "no-empty-block";
    public static final String BLOCK = "BLOCK";

    private static final Pattern BRACES_AND_WHITESPACE = Pattern.compile("[{}\\s]");

    public static RuleDescriptor descriptor() {
        return RuleDescriptor.builder(ID)
                .ruleSetId("style")
                .description("Empty blocks of code serve no purpose and should be removed.")
                .severity(Severity.STYLE)
                .debt(Debt.FIVE_MINS)
                .nodeKinds(BLOCK)
                .visitor(new EmptyBlockRule())
                .build();
    }

    @Override
    public void visit(Node node, RuleContext context) {
        if (!node.children().isEmpty()) {
            return;
        }
        String content = BRACES_AND_WHITESPACE.matcher(node.text()).replaceAll("");
        if (content.isEmpty()) {
            context.report(node, "This empty block of code can be removed.");
        }
    }
}
