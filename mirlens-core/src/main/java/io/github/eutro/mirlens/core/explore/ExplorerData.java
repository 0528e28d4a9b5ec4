package io.github.eutro.mirlens.core.explore;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The explorer document for a whole program, serialized with {@link Json}.
 */
public final class ExplorerData {
    public final String name;
    public final List<ExplorerFunction> functions;

    @JsonCreator
    public ExplorerData(@JsonProperty("name") String name,
                        @JsonProperty("functions") List<ExplorerFunction> functions) {
        this.name = name;
        this.functions = functions;
    }
}
