package io.github.eutro.mirlens.core.conf;

import java.util.Map;

/**
 * Options that alter how labels and descriptions are rendered.
 * <p>
 * These are always passed explicitly; nothing in this library reads the environment itself.
 * A host that wants the environment switches can call {@link #fromEnvironment(Map)} once with
 * {@link System#getenv()}.
 */
public final class RenderOptions {
    /**
     * The default options: no spans, no debug info, reference depth 2.
     */
    public static final RenderOptions DEFAULT = builder().build();

    private final boolean showSpans;
    private final boolean showDebug;
    private final int allocRefDepth;
    private final int maxStringPreview;
    private final int maxNumericBytes;

    private RenderOptions(Builder builder) {
        this.showSpans = builder.showSpans;
        this.showDebug = builder.showDebug;
        this.allocRefDepth = builder.allocRefDepth;
        this.maxStringPreview = builder.maxStringPreview;
        this.maxNumericBytes = builder.maxNumericBytes;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Build options from environment-style switches.
     * <p>
     * {@code SHOW_SPANS} turns on span suffixes and {@code DEBUG} turns on debug suffixes,
     * if they are present at all.
     *
     * @param env The environment.
     * @return The options.
     */
    public static RenderOptions fromEnvironment(Map<String, String> env) {
        return builder()
                .showSpans(env.containsKey("SHOW_SPANS"))
                .showDebug(env.containsKey("DEBUG"))
                .build();
    }

    public Builder toBuilder() {
        return new Builder()
                .showSpans(showSpans)
                .showDebug(showDebug)
                .allocRefDepth(allocRefDepth)
                .maxStringPreview(maxStringPreview)
                .maxNumericBytes(maxNumericBytes);
    }

    /**
     * Whether {@code @ file:line:col} suffixes are appended to statement and terminator labels.
     */
    public boolean showSpans() {
        return showSpans;
    }

    /**
     * Whether function-source debug suffixes are appended to call labels.
     */
    public boolean showDebug() {
        return showDebug;
    }

    /**
     * The depth used when describing allocations referenced from constants.
     */
    public int allocRefDepth() {
        return allocRefDepth;
    }

    /**
     * The maximum number of characters of a string allocation to preview.
     */
    public int maxStringPreview() {
        return maxStringPreview;
    }

    /**
     * The maximum number of bytes rendered as a single integer.
     */
    public int maxNumericBytes() {
        return maxNumericBytes;
    }

    public static final class Builder {
        private boolean showSpans;
        private boolean showDebug;
        private int allocRefDepth = 2;
        private int maxStringPreview = 20;
        private int maxNumericBytes = 8;

        private Builder() {
        }

        public Builder showSpans(boolean showSpans) {
            this.showSpans = showSpans;
            return this;
        }

        public Builder showDebug(boolean showDebug) {
            this.showDebug = showDebug;
            return this;
        }

        public Builder allocRefDepth(int allocRefDepth) {
            if (allocRefDepth < 0) throw new IllegalArgumentException("negative depth: " + allocRefDepth);
            this.allocRefDepth = allocRefDepth;
            return this;
        }

        public Builder maxStringPreview(int maxStringPreview) {
            if (maxStringPreview < 0) throw new IllegalArgumentException("negative preview length: " + maxStringPreview);
            this.maxStringPreview = maxStringPreview;
            return this;
        }

        public Builder maxNumericBytes(int maxNumericBytes) {
            if (maxNumericBytes < 0 || maxNumericBytes > 8) {
                throw new IllegalArgumentException("numeric bytes must be in 0..8: " + maxNumericBytes);
            }
            this.maxNumericBytes = maxNumericBytes;
            return this;
        }

        public RenderOptions build() {
            return new RenderOptions(this);
        }
    }
}
