package io.smellscan.rules.style;

import io.smellscan.ast.Node;
import io.smellscan.model.Debt;
import io.smellscan.model.Severity;
import io.smellscan.rules.NodeVisitor;
import io.smellscan.rules.RuleContext;
import io.smellscan.rules.RuleDescriptor;

import java.util.List;
import java.util.Set;

/**
 * Reports anonymous objects that only implement the single abstract method of a
 * functional interface and could be written as a lambda.
 * <p>
 * Needs type resolution: whether the super type is a SAM interface comes from the
 * {@code samType} attribute the parser adds when semantic information is available.
 * The method must have a body. Objects whose method references {@code this} or calls one of the
 * object's own members through the implicit receiver are skipped, since a lambda would change
 * what those resolve to. The parser marks such calls with {@code receiver=implicit-object}.
 */
public class ObjectLiteralToLambdaRule implements NodeVisitor {

    public static final String ID = "object-literal-to-lambda";
    public static final String OBJECT_LITERAL = "OBJECT_LITERAL";

    static final String SAM_TYPE = "samType";
    static final String SUPER_TYPE_COUNT = "superTypeCount";
    static final String RECEIVER = "receiver";
    static final String IMPLICIT_OBJECT_RECEIVER = "implicit-object";

    private static final Set<String> BODY_KINDS = Set.of("BLOCK", "EXPRESSION_BODY");

    public static RuleDescriptor descriptor() {
        return RuleDescriptor.builder(ID)
                .ruleSetId("style")
                .description("Report object literals that can be changed to lambdas.")
                .severity(Severity.STYLE)
                .debt(Debt.FIVE_MINS)
                .requiresTypeResolution(true)
                .nodeKinds(OBJECT_LITERAL)
                .visitor(new ObjectLiteralToLambdaRule())
                .build();
    }

    @Override
    public void visit(Node node, RuleContext context) {
        if (!"true".equals(node.attribute(SAM_TYPE).orElse("false"))) {
            return;
        }
        if (!"1".equals(node.attribute(SUPER_TYPE_COUNT).orElse("1"))) {
            return;
        }
        List<Node> declarations = node.children();
        if (declarations.size() != 1 || !declarations.get(0).isKind("FUNCTION")) {
            return;
        }
        Node function = declarations.get(0);
        if (!function.attribute("modifiers").orElse("").contains("override")) {
            return;
        }
        if (function.children().stream().noneMatch(child -> BODY_KINDS.contains(child.kind()))) {
            return;
        }
        if (referencesObject(function)) {
            return;
        }
        context.report(node, "This object literal can be converted to a lambda.");
    }

    private boolean referencesObject(Node node) {
        if (node.isKind("THIS_EXPRESSION")) {
            return true;
        }
        if (node.isKind("CALL") && IMPLICIT_OBJECT_RECEIVER.equals(node.attribute(RECEIVER).orElse(null))) {
            return true;
        }
        for (Node child : node.children()) {
            if (referencesObject(child)) {
                return true;
            }
        }
        return false;
    }
}
