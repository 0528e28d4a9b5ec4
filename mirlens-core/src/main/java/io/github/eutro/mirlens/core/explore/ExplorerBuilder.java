package io.github.eutro.mirlens.core.explore;

import io.github.eutro.mirlens.core.analysis.BorrowIndex;
import io.github.eutro.mirlens.core.analysis.BorrowInfo;
import io.github.eutro.mirlens.core.analysis.FunctionProperties;
import io.github.eutro.mirlens.core.analysis.LifetimeIndex;
import io.github.eutro.mirlens.core.analysis.LocalLifetime;
import io.github.eutro.mirlens.core.cfg.BlockRole;
import io.github.eutro.mirlens.core.cfg.Function;
import io.github.eutro.mirlens.core.cfg.Program;
import io.github.eutro.mirlens.core.conf.RenderOptions;
import io.github.eutro.mirlens.core.display.Annotations;
import io.github.eutro.mirlens.core.display.BlockSummaries;
import io.github.eutro.mirlens.core.display.LabelRenderer;
import io.github.eutro.mirlens.core.ext.CommonExts;
import io.github.eutro.mirlens.core.ir.*;
import io.github.eutro.mirlens.core.passes.Passes;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Builds {@link ExplorerData explorer documents} from analysed functions.
 * <p>
 * Functions are analysed with {@link Passes#ANALYZE} first, if they have not been already.
 */
public class ExplorerBuilder {
    private static final Logger logger = LogManager.getLogger(ExplorerBuilder.class);

    private final RenderOptions options;

    public ExplorerBuilder(RenderOptions options) {
        this.options = options;
    }

    public ExplorerBuilder() {
        this(RenderOptions.DEFAULT);
    }

    /**
     * Check whether a function belongs to the standard library, and should be left out
     * of the explorer.
     *
     * @param name The full function name.
     * @return Whether the function is skipped.
     */
    public static boolean isLibraryFunction(String name) {
        return name.contains("std::") || name.contains("core::");
    }

    public ExplorerData build(Program program) {
        List<ExplorerFunction> functions = new ArrayList<>();
        for (Function func : program.getFunctions()) {
            if (isLibraryFunction(func.name)) {
                logger.trace("skipping library function {}", func.name);
                continue;
            }
            functions.add(buildFunction(func));
        }
        logger.debug("built explorer for {} with {} functions", program.name, functions.size());
        return new ExplorerData(program.name, functions);
    }

    public ExplorerFunction buildFunction(Function func) {
        Passes.ANALYZE.run(func);
        List<List<Integer>> preds = func.getExtOrThrow(CommonExts.PREDS);
        List<BlockRole> roles = func.getExtOrThrow(CommonExts.BLOCK_ROLES);
        BorrowIndex borrows = func.getExtOrThrow(CommonExts.BORROWS);
        LifetimeIndex lifetimes = func.getExtOrThrow(CommonExts.LIFETIMES);
        FunctionProperties props = func.getExtOrThrow(CommonExts.PROPERTIES);

        LabelRenderer renderer = new LabelRenderer(func.indices, options);
        Annotations annotations = new Annotations(renderer);
        BlockSummaries summaries = new BlockSummaries(annotations);
        String shortName = func.shortName();

        List<ExplorerBlock> blocks = new ArrayList<>(func.blockCount());
        for (int b = 0; b < func.blockCount(); b++) {
            BasicBlock block = func.body.blocks.get(b);
            List<ExplorerStmt> stmts = new ArrayList<>(block.statements.size());
            for (int s = 0; s < block.statements.size(); s++) {
                Statement stmt = block.statements.get(s);
                stmts.add(new ExplorerStmt(
                        renderer.renderStatement(stmt),
                        annotations.statement(stmt),
                        new ArrayList<>(borrows.activeAt(b, s))));
            }
            List<ExplorerEdge> edges = new ArrayList<>();
            for (Edge edge : block.terminator.edges()) {
                edges.add(new ExplorerEdge(edge.target,
                        edge.label,
                        edge.kind.getId(),
                        annotations.edge(block.terminator, edge)));
            }
            ExplorerTerminator term = new ExplorerTerminator(
                    terminatorKind(block.terminator),
                    renderer.renderTerminator(block.terminator),
                    annotations.terminator(block.terminator, shortName),
                    edges);
            BlockRole role = roles.get(b);
            blocks.add(new ExplorerBlock(b,
                    stmts,
                    term,
                    preds.get(b),
                    role.getId(),
                    summaries.summarize(role, block, preds.get(b).size(), shortName)));
        }

        List<ExplorerLocal> locals = new ArrayList<>(func.body.locals.size());
        for (int i = 0; i < func.body.locals.size(); i++) {
            LocalDecl decl = func.body.locals.get(i);
            LocalLifetime lifetime = lifetimes.get(i);
            locals.add(new ExplorerLocal(i,
                    func.indices.types.getName(decl.typeId),
                    decl.mutable,
                    decl.sourceName,
                    lifetime == null ? "'_" + i + ": <unknown>" : lifetime.formatRange()));
        }

        List<ExplorerBorrow> explorerBorrows = new ArrayList<>(borrows.borrows().size());
        for (BorrowInfo borrow : borrows.borrows()) {
            List<String> live = new ArrayList<>();
            for (Location loc : new TreeSet<>(borrows.liveLocations(borrow.index))) {
                live.add(loc.toString());
            }
            explorerBorrows.add(new ExplorerBorrow(borrow.index,
                    borrow.borrower,
                    borrow.borrowed,
                    borrow.kind.getId(),
                    borrow.kind == BorrowKind.MUTABLE,
                    borrow.start.toString(),
                    borrows.findBorrowEnd(borrow.index).map(Location::toString).orElse(null),
                    func.indices.spans.describe(borrow.spanId),
                    borrow.spanId,
                    borrows.formatLifetimeRange(borrow.index),
                    live));
        }

        return new ExplorerFunction(func.name,
                shortName,
                blocks,
                locals,
                explorerBorrows,
                props.describe(),
                0);
    }

    static String terminatorKind(Terminator terminator) {
        return terminator.accept(new Terminator.Visitor<String>() {
            @Override
            public String visitGoto(Terminator.Goto t) {
                return "goto";
            }

            @Override
            public String visitSwitchInt(Terminator.SwitchInt t) {
                return "switch";
            }

            @Override
            public String visitResume(Terminator.Resume t) {
                return "resume";
            }

            @Override
            public String visitAbort(Terminator.Abort t) {
                return "abort";
            }

            @Override
            public String visitReturn(Terminator.Return t) {
                return "return";
            }

            @Override
            public String visitUnreachable(Terminator.Unreachable t) {
                return "unreachable";
            }

            @Override
            public String visitDrop(Terminator.Drop t) {
                return "drop";
            }

            @Override
            public String visitCall(Terminator.Call t) {
                return "call";
            }

            @Override
            public String visitAssert(Terminator.Assert t) {
                return "assert";
            }

            @Override
            public String visitInlineAsm(Terminator.InlineAsm t) {
                return "asm";
            }
        });
    }
}
