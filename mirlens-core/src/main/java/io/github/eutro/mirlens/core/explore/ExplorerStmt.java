package io.github.eutro.mirlens.core.explore;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public final class ExplorerStmt {
    public final String mir;
    public final String annotation;
    /**
     * Indices of the borrows live at this statement.
     */
    @JsonProperty("live_borrows")
    public final List<Integer> liveBorrows;

    @JsonCreator
    public ExplorerStmt(@JsonProperty("mir") String mir,
                        @JsonProperty("annotation") String annotation,
                        @JsonProperty("live_borrows") List<Integer> liveBorrows) {
        this.mir = mir;
        this.annotation = annotation;
        this.liveBorrows = liveBorrows;
    }
}
