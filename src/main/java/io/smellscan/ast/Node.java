package io.smellscan.ast;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A node of a parsed syntax tree, as produced by an {@link AstProvider}.
 * The engine only reads nodes; implementations must be safe to read from the worker thread
 * that owns the file.
 */
public interface Node {

    /**
     * Syntactic kind, e.g. {@code CLASS}, {@code FUNCTION}, {@code BLOCK}.
     */
    String kind();

    /**
     * Declared name for named elements (classes, functions, properties).
     */
    Optional<String> name();

    /**
     * Child nodes in source order.
     */
    List<Node> children();

    SourceRange range();

    /**
     * Source text covered by this node.
     */
    String text();

    /**
     * Annotation and comment text attached to this node, used for suppression directives.
     */
    List<String> annotations();

    /**
     * Additional parser-specific facts about the node (modifiers, resolved types, ...).
     */
    Map<String, String> attributes();

    default Optional<String> attribute(String key) {
        return Optional.ofNullable(attributes().get(key));
    }

    default boolean isKind(String kind) {
        return kind().equals(kind);
    }
}
