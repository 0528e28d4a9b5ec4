package io.github.eutro.mirlens.core.explore;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public final class ExplorerFunction {
    public final String name;
    @JsonProperty("short_name")
    public final String shortName;
    public final List<ExplorerBlock> blocks;
    public final List<ExplorerLocal> locals;
    public final List<ExplorerBorrow> borrows;
    /**
     * Human-readable notable properties, such as {@code Contains panic path}.
     */
    public final List<String> properties;
    @JsonProperty("entry_block")
    public final int entryBlock;

    @JsonCreator
    public ExplorerFunction(@JsonProperty("name") String name,
                            @JsonProperty("short_name") String shortName,
                            @JsonProperty("blocks") List<ExplorerBlock> blocks,
                            @JsonProperty("locals") List<ExplorerLocal> locals,
                            @JsonProperty("borrows") List<ExplorerBorrow> borrows,
                            @JsonProperty("properties") List<String> properties,
                            @JsonProperty("entry_block") int entryBlock) {
        this.name = name;
        this.shortName = shortName;
        this.blocks = blocks;
        this.locals = locals;
        this.borrows = borrows;
        this.properties = properties;
        this.entryBlock = entryBlock;
    }

    /**
     * Get a block by id.
     *
     * @param id The block id.
     * @return The block.
     * @throws IndexOutOfBoundsException If there is no such block.
     */
    public ExplorerBlock getBlock(int id) {
        return blocks.get(id);
    }
}
