package io.github.eutro.mirlens.core.passes.meta;

import io.github.eutro.mirlens.core.cfg.Function;
import io.github.eutro.mirlens.core.ext.CommonExts;
import io.github.eutro.mirlens.core.ext.MetadataState;
import io.github.eutro.mirlens.core.passes.InPlaceIRPass;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Computes {@link CommonExts#LOOP_BLOCKS}: the blocks that can reach themselves.
 * <p>
 * Each block gets its own depth-first search over successors, so this is
 * quadratic in the worst case.
 */
public class ComputeLoops implements InPlaceIRPass<Function> {
    private static final Logger logger = LogManager.getLogger(ComputeLoops.class);
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeLoops INSTANCE = new ComputeLoops();

    @Override
    public void runInPlace(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(func, MetadataState.PREDS);

        int n = func.blockCount();
        List<List<Integer>> succs = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            succs.add(func.body.blocks.get(i).terminator.successors());
        }

        Set<Integer> loops = new TreeSet<>();
        for (int start = 0; start < n; start++) {
            if (reachesItself(start, succs)) loops.add(start);
        }
        logger.debug("{}: {} loop blocks", func.name, loops.size());
        func.attachExt(CommonExts.LOOP_BLOCKS, Collections.unmodifiableSet(loops));

        ms.validate(MetadataState.LOOPS);
    }

    private static boolean reachesItself(int start, List<List<Integer>> succs) {
        BitSet seen = new BitSet(succs.size());
        Deque<Integer> stack = new ArrayDeque<>(succs.get(start));
        while (!stack.isEmpty()) {
            int next = stack.pop();
            if (next == start) return true;
            if (!seen.get(next)) {
                seen.set(next);
                for (int succ : succs.get(next)) {
                    stack.push(succ);
                }
            }
        }
        return false;
    }
}
