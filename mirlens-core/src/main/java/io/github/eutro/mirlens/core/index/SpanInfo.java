package io.github.eutro.mirlens.core.index;

/**
 * A row of the span table: a source range in a file.
 */
public final class SpanInfo {
    public final long id;
    public final String file;
    public final int lineStart;
    public final int colStart;
    public final int lineEnd;
    public final int colEnd;

    public SpanInfo(long id, String file, int lineStart, int colStart, int lineEnd, int colEnd) {
        this.id = id;
        this.file = file;
        this.lineStart = lineStart;
        this.colStart = colStart;
        this.lineEnd = lineEnd;
        this.colEnd = colEnd;
    }

    /**
     * Get the start of this span.
     *
     * @return {@code file:line:col}.
     */
    public String shortForm() {
        return file + ":" + lineStart + ":" + colStart;
    }

    @Override
    public String toString() {
        return file + ":" + lineStart + ":" + colStart + "-" + lineEnd + ":" + colEnd;
    }
}
