package io.github.eutro.mirlens.core.explore;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An outgoing edge, as shown on an edge button.
 */
public final class ExplorerEdge {
    public final int target;
    public final String label;
    /**
     * The {@link io.github.eutro.mirlens.core.ir.EdgeKind#getId() id} of the edge kind.
     */
    public final String kind;
    public final String annotation;

    @JsonCreator
    public ExplorerEdge(@JsonProperty("target") int target,
                        @JsonProperty("label") String label,
                        @JsonProperty("kind") String kind,
                        @JsonProperty("annotation") String annotation) {
        this.target = target;
        this.label = label;
        this.kind = kind;
        this.annotation = annotation;
    }
}
