package com.raditha.staleflag.model;

import java.util.List;

/**
 * A line-range edit against the original text of a unit.
 *
 * @param kind      replace, delete or insert
 * @param startLine first original line affected (1-indexed); for inserts, the
 *                  line the new text goes before
 * @param endLine   last original line affected (inclusive); startLine - 1 for inserts
 * @param lines     replacement lines, empty for deletions
 */
public record Edit(EditKind kind, int startLine, int endLine, List<String> lines) {

    public Edit {
        if (startLine < 1) {
            throw new IllegalArgumentException("startLine must be >= 1");
        }
        if (endLine < startLine - 1) {
            throw new IllegalArgumentException("endLine must be >= startLine - 1");
        }
        lines = lines == null ? List.of() : List.copyOf(lines);
    }

    /**
     * Number of original lines this edit consumes.
     */
    public int span() {
        return endLine - startLine + 1;
    }

    /**
     * Edits are applied in ascending key order: bottom of the file first, so
     * applying one never moves the lines of another.
     */
    public int orderingKey() {
        return -startLine;
    }

    public boolean overlaps(Edit other) {
        if (span() == 0 && other.span() == 0) {
            return startLine == other.startLine;
        }
        if (span() == 0 || other.span() == 0) {
            return startLine > other.startLine && startLine <= other.endLine
                    || other.startLine > startLine && other.startLine <= endLine;
        }
        return startLine <= other.endLine && other.startLine <= endLine;
    }
}
