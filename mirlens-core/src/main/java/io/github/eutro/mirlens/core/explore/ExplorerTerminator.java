package io.github.eutro.mirlens.core.explore;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public final class ExplorerTerminator {
    /**
     * A short kind tag, such as {@code goto}, {@code switch} or {@code call}.
     */
    public final String kind;
    public final String mir;
    public final String annotation;
    public final List<ExplorerEdge> edges;

    @JsonCreator
    public ExplorerTerminator(@JsonProperty("kind") String kind,
                              @JsonProperty("mir") String mir,
                              @JsonProperty("annotation") String annotation,
                              @JsonProperty("edges") List<ExplorerEdge> edges) {
        this.kind = kind;
        this.mir = mir;
        this.annotation = annotation;
        this.edges = edges;
    }
}
