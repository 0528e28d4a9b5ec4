package io.github.eutro.mirlens.core.explore;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

/**
 * A local declaration with its resolved type and lexical lifetime.
 */
public final class ExplorerLocal {
    public final int index;
    public final String type;
    public final boolean mutable;
    @JsonProperty("source_name")
    public final @Nullable String sourceName;
    public final String lifetime;

    @JsonCreator
    public ExplorerLocal(@JsonProperty("index") int index,
                         @JsonProperty("type") String type,
                         @JsonProperty("mutable") boolean mutable,
                         @JsonProperty("source_name") @Nullable String sourceName,
                         @JsonProperty("lifetime") String lifetime) {
        this.index = index;
        this.type = type;
        this.mutable = mutable;
        this.sourceName = sourceName;
        this.lifetime = lifetime;
    }
}
