package io.smellscan.suppress;

import io.smellscan.ast.Node;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds line-independent signatures of nodes from their position in the tree.
 * <p>
 * A named node contributes {@code KIND(name)}, with {@code #n} appended for the n-th repeated
 * name among its siblings (overloads). An unnamed node contributes {@code KIND[i]}, where i
 * counts earlier unnamed siblings of the same kind. A full signature is the file path followed
 * by the segments from the root down, e.g. {@code src/Foo.kt:FILE[0]/CLASS(Foo)/FUNCTION(bar)/BLOCK[0]}.
 */
public final class StructuralPath {

    private StructuralPath() {
    }

    public static String rootSegment(Node root) {
        return segment(root, 0);
    }

    /**
     * Returns the segment of each child of {@code parent}, in child order.
     */
    public static List<String> childSegments(Node parent) {
        List<Node> children = parent.children();
        List<String> segments = new ArrayList<>(children.size());
        Map<String, Integer> seen = new HashMap<>();
        for (Node child : children) {
            String key = child.kind() + child.name().map(n -> "(" + n + ")").orElse("");
            int occurrence = seen.merge(key, 1, Integer::sum) - 1;
            segments.add(segment(child, occurrence));
        }
        return segments;
    }

    public static String signature(String file, List<String> segments) {
        return file + ":" + String.join("/", segments);
    }

    private static String segment(Node node, int occurrence) {
        if (node.name().isPresent()) {
            String named = node.kind() + "(" + node.name().get() + ")";
            return occurrence == 0 ? named : named + "#" + occurrence;
        }
        return node.kind() + "[" + occurrence + "]";
    }
}
