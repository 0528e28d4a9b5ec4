package io.github.eutro.mirlens.core.passes.meta;

import io.github.eutro.mirlens.core.cfg.Function;
import io.github.eutro.mirlens.core.ext.CommonExts;
import io.github.eutro.mirlens.core.ext.MetadataState;
import io.github.eutro.mirlens.core.ir.Edge;
import io.github.eutro.mirlens.core.passes.InPlaceIRPass;
import io.github.eutro.mirlens.core.util.GraphWalker;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * Computes {@link CommonExts#CLEANUP_BLOCKS}.
 * <p>
 * A cleanup block is reachable from the target of some unwind edge, but not
 * from the entry without taking an unwind edge.
 */
public class ComputeCleanup implements InPlaceIRPass<Function> {
    private static final Logger logger = LogManager.getLogger(ComputeCleanup.class);
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeCleanup INSTANCE = new ComputeCleanup();

    @Override
    public void runInPlace(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(func, MetadataState.PREDS);

        Set<Integer> normal = new HashSet<>(GraphWalker.blockWalker(func, 0, false).preOrder().toList());

        Set<Integer> cleanup = new TreeSet<>();
        for (int i = 0; i < func.blockCount(); i++) {
            for (Edge edge : func.body.blocks.get(i).terminator.edges()) {
                if (!edge.isUnwind() || cleanup.contains(edge.target)) continue;
                for (Integer reached : GraphWalker.blockWalker(func, edge.target, true).preOrder()) {
                    if (!normal.contains(reached)) cleanup.add(reached);
                }
            }
        }
        logger.debug("{}: {} cleanup blocks", func.name, cleanup.size());
        func.attachExt(CommonExts.CLEANUP_BLOCKS, Collections.unmodifiableSet(cleanup));

        ms.validate(MetadataState.CLEANUP);
    }
}
