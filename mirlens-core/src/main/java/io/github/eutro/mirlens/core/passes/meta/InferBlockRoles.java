package io.github.eutro.mirlens.core.passes.meta;

import io.github.eutro.mirlens.core.cfg.BlockRole;
import io.github.eutro.mirlens.core.cfg.Function;
import io.github.eutro.mirlens.core.ext.CommonExts;
import io.github.eutro.mirlens.core.ext.MetadataState;
import io.github.eutro.mirlens.core.index.Indices;
import io.github.eutro.mirlens.core.ir.Terminator;
import io.github.eutro.mirlens.core.passes.InPlaceIRPass;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Computes {@link CommonExts#BLOCK_ROLES}.
 * <p>
 * Roles are assigned in precedence order: entry, cleanup, loop, then whatever the
 * terminator says (return or panic), then branch or merge by edge counts.
 */
public class InferBlockRoles implements InPlaceIRPass<Function> {
    private static final Logger logger = LogManager.getLogger(InferBlockRoles.class);
    /**
     * A singleton instance of this pass.
     */
    public static final InferBlockRoles INSTANCE = new InferBlockRoles();

    /**
     * Get whether a callee name looks like it belongs to a panicking function.
     *
     * @param name The callee name.
     * @return Whether it mentions {@code panic} or {@code assert_failed}.
     */
    public static boolean isPanicCallee(String name) {
        return name.contains("panic") || name.contains("assert_failed");
    }

    @Override
    public void runInPlace(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(func, MetadataState.PREDS, MetadataState.LOOPS, MetadataState.CLEANUP);

        List<List<Integer>> preds = func.getExtOrThrow(CommonExts.PREDS);
        Set<Integer> loops = func.getExtOrThrow(CommonExts.LOOP_BLOCKS);
        Set<Integer> cleanup = func.getExtOrThrow(CommonExts.CLEANUP_BLOCKS);
        TerminatorRole terminatorRole = new TerminatorRole(func.indices);

        List<BlockRole> roles = new ArrayList<>(func.blockCount());
        for (int i = 0; i < func.blockCount(); i++) {
            Terminator terminator = func.body.blocks.get(i).terminator;
            BlockRole role;
            if (i == 0) {
                role = BlockRole.ENTRY;
            } else if (cleanup.contains(i)) {
                role = BlockRole.CLEANUP;
            } else if (loops.contains(i)) {
                role = BlockRole.LOOP;
            } else {
                role = terminator.accept(terminatorRole);
                if (role == null) {
                    if (terminator.edges().size() >= 2) {
                        role = BlockRole.BRANCH;
                    } else if (preds.get(i).size() >= 2) {
                        role = BlockRole.MERGE;
                    } else {
                        role = BlockRole.NORMAL;
                    }
                }
            }
            roles.add(role);
        }
        logger.debug("{}: block roles {}", func.name, roles);
        func.attachExt(CommonExts.BLOCK_ROLES, Collections.unmodifiableList(roles));

        ms.validate(MetadataState.BLOCK_ROLES);
    }

    /**
     * The role a terminator implies by its kind alone, or null if it implies none.
     */
    private static class TerminatorRole implements Terminator.Visitor<BlockRole> {
        private final Indices indices;

        TerminatorRole(Indices indices) {
            this.indices = indices;
        }

        @Override
        public BlockRole visitGoto(Terminator.Goto t) {
            return null;
        }

        @Override
        public BlockRole visitSwitchInt(Terminator.SwitchInt t) {
            // a switch with only an otherwise edge is decided by edge counts like any other
            return null;
        }

        @Override
        public BlockRole visitResume(Terminator.Resume t) {
            return BlockRole.PANIC;
        }

        @Override
        public BlockRole visitAbort(Terminator.Abort t) {
            return BlockRole.PANIC;
        }

        @Override
        public BlockRole visitReturn(Terminator.Return t) {
            return BlockRole.RETURN;
        }

        @Override
        public BlockRole visitUnreachable(Terminator.Unreachable t) {
            return BlockRole.PANIC;
        }

        @Override
        public BlockRole visitDrop(Terminator.Drop t) {
            return null;
        }

        @Override
        public BlockRole visitCall(Terminator.Call t) {
            if (t.target == null) return BlockRole.PANIC;
            Optional<String> callee = indices.resolveCallTarget(t.func);
            if (callee.isPresent() && isPanicCallee(callee.get())) return BlockRole.PANIC;
            return null;
        }

        @Override
        public BlockRole visitAssert(Terminator.Assert t) {
            return null;
        }

        @Override
        public BlockRole visitInlineAsm(Terminator.InlineAsm t) {
            return null;
        }
    }
}
