package io.smellscan.rules.formatting;

import io.smellscan.ast.Node;
import io.smellscan.model.Debt;
import io.smellscan.model.Severity;
import io.smellscan.rules.NodeVisitor;
import io.smellscan.rules.RuleContext;
import io.smellscan.rules.RuleDescriptor;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Checks that exactly one space follows the {@code fun} keyword.
 * Auto-correctable: the fix collapses the whitespace to a single space.
 */
public class FunKeywordSpacingRule implements NodeVisitor {

    public static final String ID = "fun-keyword-spacing";

    private static final Pattern BAD_SPACING = Pattern.compile("^((?:\\w+\\s+)*?)fun(?: {2,}|\\s*[\\t\\n\\r]\\s*)");

    public static RuleDescriptor descriptor() {
        return RuleDescriptor.builder(ID)
                .ruleSetId("formatting")
                .description("Checks the spacing after the fun keyword.")
                .severity(Severity.STYLE)
                .debt(Debt.FIVE_MINS)
                .nodeKinds("FUNCTION")
                .visitor(new FunKeywordSpacingRule())
                .corrector(FunKeywordSpacingRule::correct)
                .build();
    }

    @Override
    public void visit(Node node, RuleContext context) {
        if (BAD_SPACING.matcher(node.text()).find()) {
            context.report(node, "Single space needed after 'fun' keyword.");
        }
    }

    static Optional<String> correct(Node node) {
        String text = node.text();
        if (!BAD_SPACING.matcher(text).find()) {
            return Optional.empty();
        }
        return Optional.of(BAD_SPACING.matcher(text).replaceFirst("$1fun "));
    }
}
