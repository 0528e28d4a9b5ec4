package io.github.eutro.mirlens.core.analysis;

import java.util.Objects;

/**
 * A range of source text. Columns are only shown when the range is on one line.
 */
public final class SourceRange {
    public final int startLine;
    public final int startCol;
    public final int endLine;
    public final int endCol;

    public SourceRange(int startLine, int startCol, int endLine, int endCol) {
        this.startLine = startLine;
        this.startCol = startCol;
        this.endLine = endLine;
        this.endCol = endCol;
    }

    public boolean isSingleLine() {
        return startLine == endLine;
    }

    /**
     * Format this range compactly.
     *
     * @return {@code L:c1-c2} for a single line, otherwise {@code A-B}.
     */
    public String format() {
        if (isSingleLine()) {
            return startLine + ":" + startCol + "-" + endCol;
        }
        return startLine + "-" + endLine;
    }

    /**
     * Format this range with a {@code line}/{@code lines} prefix.
     *
     * @return {@code line L:c1-c2} for a single line, otherwise {@code lines A-B}.
     */
    public String formatVerbose() {
        if (isSingleLine()) {
            return "line " + startLine + ":" + startCol + "-" + endCol;
        }
        return "lines " + startLine + "-" + endLine;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SourceRange that = (SourceRange) o;
        return startLine == that.startLine && startCol == that.startCol
                && endLine == that.endLine && endCol == that.endCol;
    }

    @Override
    public int hashCode() {
        return Objects.hash(startLine, startCol, endLine, endCol);
    }

    @Override
    public String toString() {
        return format();
    }
}
