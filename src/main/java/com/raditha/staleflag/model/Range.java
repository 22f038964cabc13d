package com.raditha.staleflag.model;

import com.github.javaparser.ast.Node;

/**
 * Represents a source code range (line and column positions).
 * Simplified wrapper around JavaParser's Range.
 * 
 * @param startLine   Starting line number (1-indexed)
 * @param endLine     Ending line number (1-indexed, inclusive)
 * @param startColumn Starting column number (1-indexed)
 * @param endColumn   Ending column number (1-indexed, inclusive)
 */
public record Range(
        int startLine,
        int endLine,
        int startColumn,
        int endColumn) {
    /**
     * Create from JavaParser Range.
     */
    public static Range from(com.github.javaparser.Range jpRange) {
        return new Range(
                jpRange.begin.line,
                jpRange.end.line,
                jpRange.begin.column,
                jpRange.end.column);
    }

    /**
     * Range of a node, or null for nodes created by a rewrite.
     */
    public static Range of(Node node) {
        return node.getRange().map(Range::from).orElse(null);
    }

    /**
     * Format as "L45-52" for display.
     */
    public String toDisplayString() {
        if (startLine == endLine) {
            return "L" + startLine + ":" + startColumn;
        }
        return "L" + startLine + "-" + endLine;
    }

    @Override
    public String toString() {
        return toDisplayString();
    }
}
