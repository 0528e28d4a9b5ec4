package io.github.eutro.mirlens.core.passes.meta;

import io.github.eutro.mirlens.core.cfg.Function;
import io.github.eutro.mirlens.core.ext.CommonExts;
import io.github.eutro.mirlens.core.ext.MetadataState;
import io.github.eutro.mirlens.core.ir.BasicBlock;
import io.github.eutro.mirlens.core.ir.Edge;
import io.github.eutro.mirlens.core.ir.MalformedIrException;
import io.github.eutro.mirlens.core.passes.InPlaceIRPass;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes {@link CommonExts#PREDS} for a function, checking that every edge targets a block.
 */
public class ComputePreds implements InPlaceIRPass<Function> {
    private static final Logger logger = LogManager.getLogger(ComputePreds.class);
    /**
     * A singleton instance of this pass.
     */
    public static final ComputePreds INSTANCE = new ComputePreds();

    @Override
    public void runInPlace(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);

        int n = func.blockCount();
        List<List<Integer>> preds = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            preds.add(new ArrayList<>());
        }
        for (int i = 0; i < n; i++) {
            BasicBlock block = func.body.blocks.get(i);
            for (Edge edge : block.terminator.edges()) {
                if (edge.target < 0 || edge.target >= n) {
                    logger.error("{}: bb{} has an edge to bb{}, but there are only {} blocks",
                            func.name, i, edge.target, n);
                    throw new MalformedIrException("edge bb" + i + " -> bb" + edge.target
                            + " out of range in " + func.name);
                }
                preds.get(edge.target).add(i);
            }
        }
        func.attachExt(CommonExts.PREDS, preds);

        ms.validate(MetadataState.PREDS);
    }
}
