package io.github.eutro.mirlens.core.ir;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The immutable body of a function: its blocks and its local declarations.
 * <p>
 * Block 0 is the entry.
 */
public final class FunctionBody {
    public final List<BasicBlock> blocks;
    public final List<LocalDecl> locals;
    /**
     * The span of the whole function, if known.
     */
    public final @Nullable Long spanId;

    public FunctionBody(List<BasicBlock> blocks, List<LocalDecl> locals, @Nullable Long spanId) {
        if (blocks.isEmpty()) throw new MalformedIrException("function body has no blocks");
        this.blocks = Collections.unmodifiableList(new ArrayList<>(blocks));
        this.locals = Collections.unmodifiableList(new ArrayList<>(locals));
        this.spanId = spanId;
    }

    public int blockCount() {
        return blocks.size();
    }

    /**
     * Get a block by index.
     *
     * @param index The block index.
     * @return The block.
     * @throws MalformedIrException If there is no such block.
     */
    public BasicBlock getBlock(int index) {
        if (index < 0 || index >= blocks.size()) {
            throw new MalformedIrException("block bb" + index + " out of range, body has " + blocks.size() + " blocks");
        }
        return blocks.get(index);
    }

    /**
     * Get the span id of the statement or terminator at a location.
     *
     * @param loc The location.
     * @return The span id.
     * @throws MalformedIrException If the location is outside the body.
     */
    public long spanAt(Location loc) {
        BasicBlock block = getBlock(loc.block);
        if (loc.statement < block.statements.size()) {
            return block.statements.get(loc.statement).spanId;
        }
        if (loc.statement == block.statements.size()) {
            return block.terminator.spanId;
        }
        throw new MalformedIrException("location " + loc + " out of range");
    }
}
