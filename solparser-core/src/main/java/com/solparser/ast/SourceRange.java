package com.solparser.ast;

/**
 * Source span of a node. Lines are 1-based, columns 0-based; the end position and the end
 * offset point just past the last character.
 */
public record SourceRange(
    int startLine,
    int startColumn,
    int endLine,
    int endColumn,
    int startOffset,
    int endOffset
) {
    public static SourceRange at(int line, int column, int offset) {
        return new SourceRange(line, column, line, column, offset, offset);
    }

    /**
     * Returns the smallest range covering both this range and {@code other}.
     */
    public SourceRange union(SourceRange other) {
        boolean thisStartsFirst = compare(startLine, startColumn, other.startLine, other.startColumn) <= 0;
        boolean thisEndsLast = compare(endLine, endColumn, other.endLine, other.endColumn) >= 0;
        return new SourceRange(
            thisStartsFirst ? startLine : other.startLine,
            thisStartsFirst ? startColumn : other.startColumn,
            thisEndsLast ? endLine : other.endLine,
            thisEndsLast ? endColumn : other.endColumn,
            Math.min(startOffset, other.startOffset),
            Math.max(endOffset, other.endOffset));
    }

    /**
     * Returns true if {@code other} lies within this range, bounds included.
     */
    public boolean encloses(SourceRange other) {
        return compare(startLine, startColumn, other.startLine, other.startColumn) <= 0
            && compare(other.endLine, other.endColumn, endLine, endColumn) <= 0
            && startOffset <= other.startOffset
            && other.endOffset <= endOffset;
    }

    private static int compare(int lineA, int columnA, int lineB, int columnB) {
        if (lineA != lineB) {
            return Integer.compare(lineA, lineB);
        }
        return Integer.compare(columnA, columnB);
    }

    @Override
    public String toString() {
        return startLine + ":" + startColumn + "-" + endLine + ":" + endColumn;
    }
}
