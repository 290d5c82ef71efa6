package io.smellscan.ast;

/**
 * Line and column span of a node. 1-based, inclusive.
 */
public record SourceRange(int startLine, int startColumn, int endLine, int endColumn) {

    public SourceRange {
        if (startLine < 1 || startColumn < 1) {
            throw new IllegalArgumentException("Source ranges are 1-based: " + startLine + ":" + startColumn);
        }
        if (endLine < startLine || (endLine == startLine && endColumn < startColumn)) {
            throw new IllegalArgumentException("Range end " + endLine + ":" + endColumn
                    + " is before start " + startLine + ":" + startColumn);
        }
    }
}
