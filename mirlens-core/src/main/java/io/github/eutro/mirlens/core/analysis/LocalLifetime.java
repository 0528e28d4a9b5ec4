package io.github.eutro.mirlens.core.analysis;

import io.github.eutro.mirlens.core.ir.Location;
import org.jetbrains.annotations.Nullable;

/**
 * The lexical lifetime of a local: its first scope-begin and last scope-end markers.
 */
public final class LocalLifetime {
    public final int local;
    public final @Nullable Location storageLive;
    public final @Nullable Location storageDead;
    /**
     * The source range between the two markers, if both resolve to spans in the same file.
     */
    public final @Nullable SourceRange sourceRange;

    public LocalLifetime(int local,
                         @Nullable Location storageLive,
                         @Nullable Location storageDead,
                         @Nullable SourceRange sourceRange) {
        this.local = local;
        this.storageLive = storageLive;
        this.storageDead = storageDead;
        this.sourceRange = sourceRange;
    }

    public boolean hasSourceInfo() {
        return sourceRange != null;
    }

    /**
     * Format this lifetime as an annotation.
     * <p>
     * The source range is preferred, then the marker locations.
     *
     * @return e.g. {@code '_1: lines 5-12}, {@code '_1: bb0[1] → bb3[2]} or {@code '_1: <unknown>}.
     */
    public String formatRange() {
        if (sourceRange != null) {
            return "'_" + local + ": " + sourceRange.formatVerbose();
        }
        if (storageLive != null && storageDead != null) {
            return "'_" + local + ": " + storageLive + " → " + storageDead;
        }
        return "'_" + local + ": <unknown>";
    }

    /**
     * Get just the range, without the lifetime name.
     *
     * @return The compact source range, or {@code <unknown>}.
     */
    public String rangeString() {
        return sourceRange == null ? "<unknown>" : sourceRange.format();
    }

    @Override
    public String toString() {
        return formatRange();
    }
}
