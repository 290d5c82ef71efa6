package io.smellscan.ast;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable {@link Node} implementation used by {@link JsonAstProvider} and by callers that build
 * trees programmatically.
 */
public final class TreeNode implements Node {

    private final String kind;
    private final String name;
    private final List<Node> children;
    private final SourceRange range;
    private final String text;
    private final List<String> annotations;
    private final Map<String, String> attributes;

    private TreeNode(Builder builder) {
        if (builder.kind == null || builder.kind.isBlank()) {
            throw new IllegalArgumentException("kind cannot be null or blank");
        }
        if (builder.range == null) {
            throw new IllegalArgumentException("range cannot be null for node " + builder.kind);
        }
        this.kind = builder.kind;
        this.name = builder.name;
        this.children = List.copyOf(builder.children);
        this.range = builder.range;
        this.text = builder.text != null ? builder.text : "";
        this.annotations = List.copyOf(builder.annotations);
        this.attributes = Map.copyOf(builder.attributes);
    }

    @Override
    public String kind() {
        return kind;
    }

    @Override
    public Optional<String> name() {
        return Optional.ofNullable(name);
    }

    @Override
    public List<Node> children() {
        return children;
    }

    @Override
    public SourceRange range() {
        return range;
    }

    @Override
    public String text() {
        return text;
    }

    @Override
    public List<String> annotations() {
        return annotations;
    }

    @Override
    public Map<String, String> attributes() {
        return attributes;
    }

    @Override
    public String toString() {
        return name != null ? kind + "(" + name + ")" : kind;
    }

    public static Builder builder(String kind) {
        return new Builder().kind(kind);
    }

    public static class Builder {
        private String kind;
        private String name;
        private final List<Node> children = new ArrayList<>();
        private SourceRange range;
        private String text;
        private final List<String> annotations = new ArrayList<>();
        private final Map<String, String> attributes = new LinkedHashMap<>();

        public Builder kind(String kind) {
            this.kind = kind;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder child(Node child) {
            this.children.add(child);
            return this;
        }

        public Builder children(List<? extends Node> children) {
            this.children.addAll(children);
            return this;
        }

        public Builder range(SourceRange range) {
            this.range = range;
            return this;
        }

        public Builder range(int startLine, int startColumn, int endLine, int endColumn) {
            return range(new SourceRange(startLine, startColumn, endLine, endColumn));
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder annotation(String annotation) {
            this.annotations.add(annotation);
            return this;
        }

        public Builder attribute(String key, String value) {
            this.attributes.put(key, value);
            return this;
        }

        public TreeNode build() {
            return new TreeNode(this);
        }
    }
}
