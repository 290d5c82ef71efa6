package io.smellscan.rules.style;

import io.smellscan.ast.TreeNode;
import io.smellscan.rules.RecordingContext;
import org.junit.jupiter.api.Test;

import static io.smellscan.ast.Trees.node;
import static org.assertj.core.api.Assertions.assertThat;

class EmptyBlockRuleTest {

    private final EmptyBlockRule rule = new EmptyBlockRule();

    @Test
    void visit_reportsBlockWithOnlyBraces() {
        RecordingContext context = new RecordingContext();
        TreeNode block = node("BLOCK", 3).text("{\n    \n}").build();

        rule.visit(block, context);

        assertThat(context.reports()).hasSize(1);
        assertThat(context.reports().get(0).node()).isSameAs(block);
    }

    @Test
    void visit_acceptsBlockWithComment() {
        RecordingContext context = new RecordingContext();

        rule.visit(node("BLOCK", 3).text("{ // intentionally empty }").build(), context);

        assertThat(context.reports()).isEmpty();
    }

    @Test
    void visit_acceptsBlockWithStatements() {
        RecordingContext context = new RecordingContext();
        TreeNode block = node("BLOCK", 3).text("{ }")
                .child(node("CALL", 4).text("run()").build())
                .build();

        rule.visit(block, context);

        assertThat(context.reports()).isEmpty();
    }
}
