package io.smellscan.suppress;

import io.smellscan.ast.TreeNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.smellscan.ast.Trees.node;
import static org.assertj.core.api.Assertions.assertThat;

class SuppressionParserTest {

    private static List<SuppressionDirective> parse(String... annotations) {
        TreeNode.Builder builder = node("CLASS", 1);
        for (String annotation : annotations) {
            builder.annotation(annotation);
        }
        return SuppressionParser.parse(builder.build());
    }

    @Test
    void parse_readsSuppressAnnotationIds() {
        List<SuppressionDirective> directives = parse("@Suppress(\"no-empty-block\", \"too-many-functions\")");

        assertThat(directives).hasSize(1);
        assertThat(directives.get(0).ruleIds()).containsExactlyInAnyOrder("no-empty-block", "too-many-functions");
        assertThat(directives.get(0).scope()).isEqualTo(SuppressionDirective.Scope.NODE);
    }

    @Test
    void parse_stripsToolPrefixes() {
        List<SuppressionDirective> directives = parse("@SuppressWarnings(\"detekt:no-empty-block\", \"smellscan:style\")");

        assertThat(directives.get(0).ruleIds()).containsExactlyInAnyOrder("no-empty-block", "style");
    }

    @Test
    void parse_fileAnnotationHasFileScope() {
        List<SuppressionDirective> directives = parse("@file:Suppress(\"no-empty-block\")");

        assertThat(directives.get(0).scope()).isEqualTo(SuppressionDirective.Scope.FILE);
    }

    @Test
    void parse_commentWithoutIdsSuppressesAll() {
        List<SuppressionDirective> directives = parse("// smellscan:suppress");

        assertThat(directives.get(0).ruleIds()).containsExactly(SuppressionDirective.ALL);
    }

    @Test
    void parse_fileComment() {
        List<SuppressionDirective> directives = parse("/* smellscan:suppress-file no-empty-block, formatting */");

        assertThat(directives.get(0).scope()).isEqualTo(SuppressionDirective.Scope.FILE);
        assertThat(directives.get(0).ruleIds()).containsExactlyInAnyOrder("no-empty-block", "formatting");
    }

    @Test
    void parse_ignoresUnrelatedAnnotations() {
        assertThat(parse("@Deprecated", "// plain comment")).isEmpty();
    }

    @Test
    void isSuppressed_matchesRuleIdRuleSetOrAll() {
        List<SuppressionDirective> byId = parse("@Suppress(\"no-empty-block\")");
        List<SuppressionDirective> bySet = parse("@Suppress(\"style\")");
        List<SuppressionDirective> all = parse("@Suppress(\"all\")");

        assertThat(Suppressions.isSuppressed("no-empty-block", "style", byId)).isTrue();
        assertThat(Suppressions.isSuppressed("too-many-functions", "style", byId)).isFalse();
        assertThat(Suppressions.isSuppressed("too-many-functions", "style", bySet)).isTrue();
        assertThat(Suppressions.isSuppressed("fun-keyword-spacing", "formatting", all)).isTrue();
    }
}
