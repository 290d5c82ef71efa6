package io.smellscan.suppress;

import io.smellscan.ast.TreeNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.smellscan.ast.Trees.named;
import static io.smellscan.ast.Trees.node;
import static org.assertj.core.api.Assertions.assertThat;

class FingerprintTest {

    @Test
    void compute_ignoresWhitespaceInSnippet() {
        Fingerprint compact = Fingerprint.compute("rule", "a.kt:FILE/BLOCK[0]", "{}");
        Fingerprint spaced = Fingerprint.compute("rule", "a.kt:FILE/BLOCK[0]", "{ \n\t }");

        assertThat(spaced).isEqualTo(compact);
    }

    @Test
    void compute_dependsOnRuleAndSignature() {
        Fingerprint base = Fingerprint.compute("rule", "a.kt:FILE/BLOCK[0]", "{}");

        assertThat(Fingerprint.compute("other", "a.kt:FILE/BLOCK[0]", "{}")).isNotEqualTo(base);
        assertThat(Fingerprint.compute("rule", "a.kt:FILE/BLOCK[1]", "{}")).isNotEqualTo(base);
        assertThat(base.value()).hasSize(64).matches("[0-9a-f]+");
    }

    @Test
    void childSegments_namesAndIndexesSiblings() {
        TreeNode parent = node("CLASS", 1)
                .child(named("FUNCTION", "run", 2).build())
                .child(node("BLOCK", 3).build())
                .child(named("FUNCTION", "run", 4).build())
                .child(node("BLOCK", 5).build())
                .build();

        List<String> segments = StructuralPath.childSegments(parent);

        assertThat(segments).containsExactly("FUNCTION(run)", "BLOCK[0]", "FUNCTION(run)#1", "BLOCK[1]");
    }

    @Test
    void signature_doesNotDependOnLineNumbers() {
        TreeNode original = node("FILE", 1).child(named("CLASS", "Foo", 3).build()).build();
        TreeNode shifted = node("FILE", 1).child(named("CLASS", "Foo", 30).build()).build();

        String before = StructuralPath.signature("a.kt",
                List.of(StructuralPath.rootSegment(original), StructuralPath.childSegments(original).get(0)));
        String after = StructuralPath.signature("a.kt",
                List.of(StructuralPath.rootSegment(shifted), StructuralPath.childSegments(shifted).get(0)));

        assertThat(after).isEqualTo(before).isEqualTo("a.kt:FILE[0]/CLASS(Foo)");
    }
}
