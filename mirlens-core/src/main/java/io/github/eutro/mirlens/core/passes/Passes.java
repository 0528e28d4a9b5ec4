package io.github.eutro.mirlens.core.passes;

import io.github.eutro.mirlens.core.cfg.Function;
import io.github.eutro.mirlens.core.cfg.Program;
import io.github.eutro.mirlens.core.ext.CommonExts;
import io.github.eutro.mirlens.core.ext.MetadataState;
import io.github.eutro.mirlens.core.passes.misc.ForPass;

/**
 * Some pre-composed passes.
 */
public class Passes {
    /**
     * Run every analysis on a function that has not already run.
     */
    public static final InPlaceIRPass<Function> ANALYZE = func -> func
            .getExtOrThrow(CommonExts.METADATA_STATE)
            .ensureValid(func,
                    MetadataState.PREDS,
                    MetadataState.LOOPS,
                    MetadataState.CLEANUP,
                    MetadataState.BLOCK_ROLES,
                    MetadataState.BORROWS,
                    MetadataState.LIFETIMES,
                    MetadataState.PROPERTIES);

    /**
     * {@link #ANALYZE} every function of a program.
     */
    public static final IRPass<Program, Program> ANALYZE_PROGRAM = ForPass.liftFunctions(ANALYZE);
}
