package io.github.eutro.mirlens.test;

import io.github.eutro.mirlens.core.analysis.BorrowIndex;
import io.github.eutro.mirlens.core.analysis.BorrowInfo;
import io.github.eutro.mirlens.core.cfg.Function;
import io.github.eutro.mirlens.core.ext.CommonExts;
import io.github.eutro.mirlens.core.ir.*;
import org.junit.jupiter.api.Test;

import java.util.*;

import static io.github.eutro.mirlens.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class BorrowLivenessTest {
    static BorrowIndex borrows(Function func) {
        return func.getExtOrThrow(CommonExts.BORROWS);
    }

    /**
     * bb0: _2 = &_1; goto bb1. bb1: nop; goto bb2. bb2: switch back to bb1, or to bb3.
     * bb3: return.
     */
    static FunctionBody loopingBorrow() {
        BodyBuilder bb = new BodyBuilder();
        bb.newLocal(TY_UNIT, false, null);
        bb.newLocal(TY_I32, false, "x");
        bb.newLocal(TY_REF, false, "r");
        int b0 = bb.newBlock(), b1 = bb.newBlock(), b2 = bb.newBlock(), b3 = bb.newBlock();
        bb.setBlock(b0).setSpan(SPAN_BORROW).assign(place(2), ref(1)).goTo(b1);
        bb.setBlock(b1).setSpan(SPAN_USE).insert(new Statement.Nop(SPAN_USE)).goTo(b2);
        bb.setBlock(b2).insertTerminator(switchInt(1, b3, 0, b1));
        bb.setBlock(b3).setSpan(SPAN_END).ret();
        return bb.build();
    }

    @Test
    void testStorageDeadKills() {
        BorrowIndex borrows = borrows(analyzed("demo::dead", borrowThenDead()));
        assertEquals(1, borrows.borrows().size());
        BorrowInfo borrow = borrows.get(0);
        assertNotNull(borrow);
        assertEquals(2, borrow.borrower);
        assertEquals(1, borrow.borrowed);
        assertEquals(BorrowKind.SHARED, borrow.kind);
        assertEquals(Location.of(0, 0), borrow.start);

        assertEquals(Collections.singleton(0), borrows.activeAt(0, 0));
        assertTrue(borrows.activeAt(0, 1).isEmpty());
        assertTrue(borrows.activeAt(0, 2).isEmpty());
        assertEquals(Collections.singleton(Location.of(0, 0)), borrows.liveLocations(0));
        assertEquals(Optional.of(Location.of(0, 1)), borrows.findBorrowEnd(0));
    }

    @Test
    void testCyclicTerminates() {
        Function func = analyzed("demo::loop", loopingBorrow());
        BorrowIndex borrows = borrows(func);
        assertEquals(new TreeSet<>(Arrays.asList(
                Location.of(0, 0),
                Location.of(0, 1),
                Location.of(1, 0),
                Location.of(1, 1),
                Location.of(2, 0)
        )), borrows.liveLocations(0));
        assertTrue(borrows.activeAt(3, 0).isEmpty());
        assertTrue(borrows.visited(0).contains(Location.of(3, 0)));
        assertEquals(Optional.of(Location.of(3, 0)), borrows.findBorrowEnd(0));
    }

    @Test
    void testMonotonicAlongKillFreePaths() {
        Function func = analyzed("demo::loop", loopingBorrow());
        BorrowIndex borrows = borrows(func);
        for (BorrowInfo borrow : borrows.borrows()) {
            for (Location loc : borrows.liveLocations(borrow.index)) {
                BasicBlock block = func.body.getBlock(loc.block);
                List<Location> next = new ArrayList<>();
                if (loc.statement < block.terminatorOffset()) {
                    next.add(Location.of(loc.block, loc.statement + 1));
                } else {
                    for (int succ : block.terminator.successors()) {
                        next.add(Location.of(succ, 0));
                    }
                }
                for (Location succ : next) {
                    if (kills(func.body, succ, borrow.borrower)) continue;
                    assertTrue(borrows.activeAt(succ).contains(borrow.index),
                            borrow + " live at " + loc + " but not " + succ);
                }
            }
        }
    }

    static boolean kills(FunctionBody body, Location loc, int borrower) {
        BasicBlock block = body.getBlock(loc.block);
        if (loc.statement < block.terminatorOffset()) {
            return BorrowIndex.killsBorrow(block.statements.get(loc.statement), borrower);
        }
        return BorrowIndex.terminatorKillsBorrow(block.terminator, borrower);
    }

    @Test
    void testReassignmentKills() {
        BodyBuilder bb = new BodyBuilder();
        bb.newLocal(TY_UNIT, false, null);
        bb.newLocal(TY_I32, false, "x");
        bb.newLocal(TY_REF, true, "r");
        bb.newLocal(TY_I32, false, "y");
        bb.newBlock();
        bb.assign(place(2), ref(1))
                .assign(place(2), ref(3))
                .ret();
        BorrowIndex borrows = borrows(analyzed("demo::reassign", bb.build()));
        assertEquals(2, borrows.borrows().size());
        assertEquals(Collections.singleton(0), borrows.activeAt(0, 0));
        assertEquals(Collections.singleton(1), borrows.activeAt(0, 1));
        assertTrue(borrows.activeAt(0, 2).isEmpty());
    }

    @Test
    void testProjectedAssignmentDoesNotKill() {
        BodyBuilder bb = new BodyBuilder();
        bb.newLocal(TY_UNIT, false, null);
        bb.newLocal(TY_I32, false, "x");
        bb.newLocal(TY_REF, true, "r");
        bb.newBlock();
        bb.assign(place(2), ref(1))
                .assign(place(2).project(ProjectionElem.DEREF), new Rvalue.Use(copy(1)))
                .storageDead(2)
                .ret();
        BorrowIndex borrows = borrows(analyzed("demo::deref", bb.build()));
        assertEquals(1, borrows.borrows().size());
        assertEquals(Collections.singleton(0), borrows.activeAt(0, 1));
        assertTrue(borrows.activeAt(0, 2).isEmpty());
    }

    @Test
    void testDropKills() {
        BodyBuilder bb = new BodyBuilder();
        bb.newLocal(TY_UNIT, false, null);
        bb.newLocal(TY_I32, false, "x");
        bb.newLocal(TY_REF, false, "r");
        int b0 = bb.newBlock(), b1 = bb.newBlock();
        bb.setBlock(b0).assign(place(2), ref(1))
                .insertTerminator(new Terminator.Drop(0, place(2), b1, UnwindAction.CONTINUE));
        bb.setBlock(b1).ret();
        BorrowIndex borrows = borrows(analyzed("demo::drop", bb.build()));
        assertEquals(Collections.singleton(Location.of(0, 0)), borrows.liveLocations(0));
        assertEquals(Optional.of(Location.of(0, 1)), borrows.findBorrowEnd(0));
    }

    @Test
    void testUnwindSuccessors() {
        BodyBuilder bb = new BodyBuilder();
        bb.newLocal(TY_I32, false, null);
        bb.newLocal(TY_I32, false, "x");
        bb.newLocal(TY_REF, false, "r");
        int b0 = bb.newBlock(), b1 = bb.newBlock(), b2 = bb.newBlock();
        bb.setBlock(b0).assign(place(2), ref(1))
                .insertTerminator(new Terminator.Call(0, fn(TY_FOO), Collections.singletonList(copy(2)),
                        place(0), b1, UnwindAction.cleanup(b2)));
        bb.setBlock(b1).ret();
        bb.setBlock(b2).storageDead(2).insertTerminator(new Terminator.Resume(0));
        BorrowIndex borrows = borrows(analyzed("demo::unwinds", bb.build()));
        assertTrue(borrows.activeAt(0, 1).contains(0));
        assertTrue(borrows.activeAt(1, 0).isEmpty());
        assertTrue(borrows.activeAt(2, 0).isEmpty());
        assertTrue(borrows.visited(0).contains(Location.of(2, 0)));
    }

    @Test
    void testLineFolding() {
        Function func = analyzed("demo::loop", loopingBorrow());
        BorrowIndex borrows = borrows(func);
        assertEquals(Collections.singleton(0), borrows.activeAtLine(5));
        assertEquals(Collections.singleton(0), borrows.activeAtLine(6));
        assertTrue(borrows.activeAtLine(7).isEmpty());
        assertEquals(new TreeSet<>(Arrays.asList(5, 6)), new TreeSet<>(borrows.linesWithBorrows()));
    }

    @Test
    void testSourceRange() {
        BorrowIndex borrows = borrows(analyzed("demo::dead", borrowThenDead()));
        assertEquals(Optional.of(new BorrowIndex.LineRange(5, 7)), borrows.borrowSourceRange(0));
        assertEquals("'b0: lines 5-7", borrows.formatLifetimeRange(0));
        assertEquals("'b0: line 5", borrows.formatLifetimeRange(0, 5));
        assertEquals("'b0: from line 5", borrows.formatLifetimeRange(0, null));
    }

    @Test
    void testNoBorrows() {
        BorrowIndex borrows = borrows(analyzed("demo::looping", loopingSwitch()));
        assertTrue(borrows.isEmpty());
        assertNull(borrows.get(0));
        assertEquals(Optional.empty(), borrows.findBorrowEnd(0));
        assertEquals(Optional.empty(), borrows.borrowSourceRange(0));
    }
}
