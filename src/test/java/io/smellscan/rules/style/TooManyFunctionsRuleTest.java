package io.smellscan.rules.style;

import io.smellscan.ast.TreeNode;
import io.smellscan.rules.RecordingContext;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static io.smellscan.ast.Trees.named;
import static org.assertj.core.api.Assertions.assertThat;

class TooManyFunctionsRuleTest {

    private final TooManyFunctionsRule rule = new TooManyFunctionsRule();

    private static TreeNode classWithFunctions(int count) {
        TreeNode.Builder clazz = named("CLASS", "Service", 1);
        for (int i = 0; i < count; i++) {
            clazz.child(named("FUNCTION", "f" + i, i + 2).build());
        }
        return clazz.build();
    }

    @Test
    void visit_reportsClassAtDefaultThreshold() {
        RecordingContext context = new RecordingContext();

        rule.visit(classWithFunctions(TooManyFunctionsRule.DEFAULT_THRESHOLD), context);

        assertThat(context.reports()).hasSize(1);
        assertThat(context.reports().get(0).message()).contains("Class 'Service' has 11 functions");
    }

    @Test
    void visit_ignoresClassBelowThreshold() {
        RecordingContext context = new RecordingContext();

        rule.visit(classWithFunctions(3), context);

        assertThat(context.reports()).isEmpty();
    }

    @Test
    void visit_usesConfiguredThreshold() {
        RecordingContext context = new RecordingContext(Map.of("thresholdInClasses", 3));

        rule.visit(classWithFunctions(3), context);

        assertThat(context.reports()).hasSize(1);
    }
}
