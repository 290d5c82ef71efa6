package io.smellscan.ast;

import java.nio.file.Path;

/**
 * Parsed file: its normalized path and root node.
 *
 * @param path file path with forward slashes, used for reporting and ordering
 * @param root root node of the tree, usually of kind {@code FILE}
 */
public record SyntaxTree(String path, Node root) {

    public SyntaxTree {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path cannot be null or blank");
        }
        if (root == null) {
            throw new IllegalArgumentException("root cannot be null");
        }
    }

    public static SyntaxTree of(Path file, Node root) {
        return new SyntaxTree(normalize(file), root);
    }

    /**
     * Converts a path to the form used in findings: forward slashes on every platform.
     */
    public static String normalize(Path file) {
        return file.normalize().toString().replace('\\', '/');
    }
}
