package io.github.eutro.mirlens.core.passes.meta;

import io.github.eutro.mirlens.core.analysis.BorrowIndex;
import io.github.eutro.mirlens.core.analysis.BorrowInfo;
import io.github.eutro.mirlens.core.cfg.Function;
import io.github.eutro.mirlens.core.ext.CommonExts;
import io.github.eutro.mirlens.core.ext.MetadataState;
import io.github.eutro.mirlens.core.ir.BasicBlock;
import io.github.eutro.mirlens.core.ir.FunctionBody;
import io.github.eutro.mirlens.core.ir.Location;
import io.github.eutro.mirlens.core.ir.Rvalue;
import io.github.eutro.mirlens.core.ir.Statement;
import io.github.eutro.mirlens.core.passes.InPlaceIRPass;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Computes {@link CommonExts#BORROWS}: every borrow of a whole local into a whole local,
 * and where each is live.
 * <p>
 * A borrow is live from where it is created, along every path, up to but not including the
 * first statement or terminator that kills it (see {@link BorrowIndex#killsBorrow}).
 * The creating statement itself never counts as a kill. Unwind edges are followed too.
 */
public class ComputeBorrows implements InPlaceIRPass<Function> {
    private static final Logger logger = LogManager.getLogger(ComputeBorrows.class);
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeBorrows INSTANCE = new ComputeBorrows();

    @Override
    public void runInPlace(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        // validates the edges the walk follows
        ms.ensureValid(func, MetadataState.PREDS);

        List<BorrowInfo> borrows = findBorrows(func.body);
        List<Set<Location>> live = new ArrayList<>(borrows.size());
        List<Set<Location>> visited = new ArrayList<>(borrows.size());
        for (BorrowInfo borrow : borrows) {
            Set<Location> liveHere = new HashSet<>();
            Set<Location> seen = new HashSet<>();
            computeLiveness(func.body, borrow, liveHere, seen);
            live.add(liveHere);
            visited.add(seen);
        }

        BorrowIndex index = new BorrowIndex(func.body, func.indices.spans, borrows, live, visited);
        logger.debug("{}: {} borrows", func.name, borrows.size());
        func.attachExt(CommonExts.BORROWS, index);

        ms.validate(MetadataState.BORROWS);
    }

    static List<BorrowInfo> findBorrows(FunctionBody body) {
        List<BorrowInfo> borrows = new ArrayList<>();
        for (int b = 0; b < body.blocks.size(); b++) {
            List<Statement> statements = body.blocks.get(b).statements;
            for (int s = 0; s < statements.size(); s++) {
                Statement stmt = statements.get(s);
                if (!(stmt instanceof Statement.Assign)) continue;
                Statement.Assign assign = (Statement.Assign) stmt;
                if (!assign.place.isWholeLocal() || !(assign.rvalue instanceof Rvalue.Ref)) continue;
                Rvalue.Ref ref = (Rvalue.Ref) assign.rvalue;
                if (!ref.place.isWholeLocal()) continue;
                borrows.add(new BorrowInfo(
                        borrows.size(),
                        assign.place.local,
                        ref.place.local,
                        ref.kind,
                        Location.of(b, s),
                        stmt.spanId
                ));
            }
        }
        return borrows;
    }

    private static void computeLiveness(FunctionBody body,
                                        BorrowInfo borrow,
                                        Set<Location> live,
                                        Set<Location> visited) {
        Deque<Location> worklist = new ArrayDeque<>();
        worklist.push(borrow.start);
        while (!worklist.isEmpty()) {
            Location entry = worklist.pop();
            BasicBlock block = body.getBlock(entry.block);
            int i = entry.statement;
            while (true) {
                Location loc = Location.of(entry.block, i);
                // everything after an already-visited location was walked from there
                if (!visited.add(loc)) break;
                if (i < block.statements.size()) {
                    if (!loc.equals(borrow.start)
                            && BorrowIndex.killsBorrow(block.statements.get(i), borrow.borrower)) {
                        break;
                    }
                    live.add(loc);
                    i++;
                } else {
                    if (BorrowIndex.terminatorKillsBorrow(block.terminator, borrow.borrower)) break;
                    live.add(loc);
                    for (int succ : block.terminator.successors()) {
                        worklist.push(Location.of(succ, 0));
                    }
                    break;
                }
            }
        }
    }
}
