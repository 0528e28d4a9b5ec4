package io.github.eutro.mirlens.core.ext;

import io.github.eutro.mirlens.core.analysis.BorrowIndex;
import io.github.eutro.mirlens.core.analysis.FunctionProperties;
import io.github.eutro.mirlens.core.analysis.LifetimeIndex;
import io.github.eutro.mirlens.core.cfg.BlockRole;
import io.github.eutro.mirlens.core.cfg.Function;
import io.github.eutro.mirlens.core.passes.meta.*;

import java.util.List;
import java.util.Set;

/**
 * The {@link Ext}s that analyses attach to a {@link Function}.
 */
public class CommonExts {
    /**
     * Attached to a {@link Function}. Records which analyses have run.
     *
     * @see MetadataState
     */
    public static final Ext<MetadataState> METADATA_STATE = Ext.create(MetadataState.class, "METADATA_STATE");

    /**
     * The predecessors of each block, indexed by block. A block appears once per edge into it.
     * <p>
     * Computed by {@link ComputePreds}.
     */
    public static final Ext<List<List<Integer>>> PREDS = Ext.create(List.class, "PREDS");

    /**
     * The blocks that can reach themselves through one or more edges.
     * <p>
     * Computed by {@link ComputeLoops}.
     */
    public static final Ext<Set<Integer>> LOOP_BLOCKS = Ext.create(Set.class, "LOOP_BLOCKS");

    /**
     * The blocks that can only be reached by unwinding.
     * <p>
     * Computed by {@link ComputeCleanup}.
     */
    public static final Ext<Set<Integer>> CLEANUP_BLOCKS = Ext.create(Set.class, "CLEANUP_BLOCKS");

    /**
     * The role of each block, indexed by block.
     * <p>
     * Computed by {@link InferBlockRoles}.
     */
    public static final Ext<List<BlockRole>> BLOCK_ROLES = Ext.create(List.class, "BLOCK_ROLES");

    /**
     * Computed by {@link ComputeBorrows}.
     */
    public static final Ext<BorrowIndex> BORROWS = Ext.create(BorrowIndex.class, "BORROWS");

    /**
     * Computed by {@link ComputeLifetimes}.
     */
    public static final Ext<LifetimeIndex> LIFETIMES = Ext.create(LifetimeIndex.class, "LIFETIMES");

    /**
     * Computed by {@link ComputeProperties}.
     */
    public static final Ext<FunctionProperties> PROPERTIES = Ext.create(FunctionProperties.class, "PROPERTIES");
}
