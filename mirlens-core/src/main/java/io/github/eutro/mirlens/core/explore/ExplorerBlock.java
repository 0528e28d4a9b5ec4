package io.github.eutro.mirlens.core.explore;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public final class ExplorerBlock {
    public final int id;
    public final List<ExplorerStmt> statements;
    public final ExplorerTerminator terminator;
    /**
     * One entry per incoming edge.
     */
    public final List<Integer> predecessors;
    /**
     * The {@link io.github.eutro.mirlens.core.cfg.BlockRole#getId() id} of the block's role.
     */
    public final String role;
    public final String summary;

    @JsonCreator
    public ExplorerBlock(@JsonProperty("id") int id,
                         @JsonProperty("statements") List<ExplorerStmt> statements,
                         @JsonProperty("terminator") ExplorerTerminator terminator,
                         @JsonProperty("predecessors") List<Integer> predecessors,
                         @JsonProperty("role") String role,
                         @JsonProperty("summary") String summary) {
        this.id = id;
        this.statements = statements;
        this.terminator = terminator;
        this.predecessors = predecessors;
        this.role = role;
        this.summary = summary;
    }
}
