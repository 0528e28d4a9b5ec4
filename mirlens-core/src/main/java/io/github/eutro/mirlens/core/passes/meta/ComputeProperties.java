package io.github.eutro.mirlens.core.passes.meta;

import io.github.eutro.mirlens.core.analysis.FunctionProperties;
import io.github.eutro.mirlens.core.cfg.Function;
import io.github.eutro.mirlens.core.ext.CommonExts;
import io.github.eutro.mirlens.core.ext.MetadataState;
import io.github.eutro.mirlens.core.index.FunctionIndex;
import io.github.eutro.mirlens.core.ir.BasicBlock;
import io.github.eutro.mirlens.core.ir.Rvalue;
import io.github.eutro.mirlens.core.ir.Statement;
import io.github.eutro.mirlens.core.ir.Terminator;
import io.github.eutro.mirlens.core.passes.InPlaceIRPass;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Optional;

/**
 * Computes {@link CommonExts#PROPERTIES}.
 */
public class ComputeProperties implements InPlaceIRPass<Function> {
    private static final Logger logger = LogManager.getLogger(ComputeProperties.class);
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeProperties INSTANCE = new ComputeProperties();

    @Override
    public void runInPlace(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);

        FunctionProperties props = new FunctionProperties();
        String self = func.shortName();
        for (BasicBlock block : func.body.blocks) {
            for (Statement stmt : block.statements) {
                if (!(stmt instanceof Statement.Assign)) continue;
                Rvalue rvalue = ((Statement.Assign) stmt).rvalue;
                if (rvalue instanceof Rvalue.CheckedBinaryOp) {
                    props.hasCheckedOps = true;
                } else if (rvalue instanceof Rvalue.Ref || rvalue instanceof Rvalue.AddressOf) {
                    props.hasBorrows = true;
                }
            }
            block.terminator.accept(new Terminator.Visitor<Void>() {
                @Override
                public Void visitGoto(Terminator.Goto t) {
                    return null;
                }

                @Override
                public Void visitSwitchInt(Terminator.SwitchInt t) {
                    props.hasSwitches = true;
                    return null;
                }

                @Override
                public Void visitResume(Terminator.Resume t) {
                    props.hasPanicPath = true;
                    return null;
                }

                @Override
                public Void visitAbort(Terminator.Abort t) {
                    props.hasPanicPath = true;
                    return null;
                }

                @Override
                public Void visitReturn(Terminator.Return t) {
                    return null;
                }

                @Override
                public Void visitUnreachable(Terminator.Unreachable t) {
                    props.hasPanicPath = true;
                    return null;
                }

                @Override
                public Void visitDrop(Terminator.Drop t) {
                    props.hasDrops = true;
                    return null;
                }

                @Override
                public Void visitCall(Terminator.Call t) {
                    Optional<String> callee = func.indices.resolveCallTarget(t.func);
                    if (callee.isPresent()) {
                        if (FunctionIndex.shortName(callee.get()).equals(self)) props.hasRecursion = true;
                        if (InferBlockRoles.isPanicCallee(callee.get())) props.hasPanicPath = true;
                    }
                    if (t.target == null) props.hasPanicPath = true;
                    return null;
                }

                @Override
                public Void visitAssert(Terminator.Assert t) {
                    props.hasAssertions = true;
                    props.hasPanicPath = true;
                    return null;
                }

                @Override
                public Void visitInlineAsm(Terminator.InlineAsm t) {
                    return null;
                }
            });
        }
        logger.debug("{}: properties [{}]", func.name, props);
        func.attachExt(CommonExts.PROPERTIES, props);

        ms.validate(MetadataState.PROPERTIES);
    }
}
