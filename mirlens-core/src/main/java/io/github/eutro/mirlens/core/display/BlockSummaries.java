package io.github.eutro.mirlens.core.display;

import io.github.eutro.mirlens.core.cfg.BlockRole;
import io.github.eutro.mirlens.core.ir.BasicBlock;
import io.github.eutro.mirlens.core.ir.Statement;
import io.github.eutro.mirlens.core.ir.Terminator;

/**
 * One-line summaries of blocks, chosen by their {@link BlockRole}.
 */
public class BlockSummaries {
    private final Annotations annotations;

    public BlockSummaries(Annotations annotations) {
        this.annotations = annotations;
    }

    /**
     * Summarise a block.
     *
     * @param role      The role of the block.
     * @param block     The block.
     * @param predCount The number of incoming edges.
     * @param currentFn The short name of the containing function.
     * @return The summary.
     */
    public String summarize(BlockRole role, BasicBlock block, int predCount, String currentFn) {
        String termAnnotation = annotations.terminator(block.terminator, currentFn);
        switch (role) {
            case ENTRY:
                return "Entry point";
            case CLEANUP:
                return "Cleanup/unwind handler";
            case LOOP:
                return "In loop: " + termAnnotation;
            case RETURN:
                return "Function returns";
            case PANIC:
                return block.terminator instanceof Terminator.Unreachable
                        ? "Unreachable code"
                        : "Panic path: " + termAnnotation;
            case BRANCH:
                return "Branches: " + termAnnotation;
            case MERGE:
                return "Merge point (" + predCount + " incoming paths)";
            default:
                for (Statement stmt : block.statements) {
                    String annotation = annotations.statement(stmt);
                    if (!annotation.isEmpty()) return annotation;
                }
                return termAnnotation;
        }
    }
}
