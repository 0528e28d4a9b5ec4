package io.github.eutro.mirlens.core.analysis;

import io.github.eutro.mirlens.core.index.SpanIndex;
import io.github.eutro.mirlens.core.index.SpanInfo;
import io.github.eutro.mirlens.core.ir.BasicBlock;
import io.github.eutro.mirlens.core.ir.FunctionBody;
import io.github.eutro.mirlens.core.ir.Location;
import io.github.eutro.mirlens.core.ir.Statement;
import io.github.eutro.mirlens.core.ir.Terminator;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * The borrows of a function, and where each one is considered live.
 * <p>
 * Liveness here is a conservative may-analysis: a borrow is live from its creation
 * until its borrower is killed, along every path. It does not model partial moves,
 * disjoint field borrows or non-lexical lifetimes, and it over-approximates.
 */
public final class BorrowIndex {
    private final FunctionBody body;
    private final SpanIndex spans;
    private final List<BorrowInfo> borrows;
    private final List<Set<Location>> liveLocations;
    private final List<Set<Location>> visited;
    private final Map<Location, SortedSet<Integer>> activeAtLocation = new TreeMap<>();
    private final Map<Integer, SortedSet<Integer>> activeAtLine = new TreeMap<>();

    /**
     * Build the index from computed liveness.
     *
     * @param body          The function body.
     * @param spans         The span index, for folding liveness onto source lines.
     * @param borrows       The borrows, in index order.
     * @param liveLocations For each borrow, where it is live.
     * @param visited       For each borrow, every location the liveness walk inspected.
     */
    public BorrowIndex(FunctionBody body,
                       SpanIndex spans,
                       List<BorrowInfo> borrows,
                       List<Set<Location>> liveLocations,
                       List<Set<Location>> visited) {
        if (borrows.size() != liveLocations.size() || borrows.size() != visited.size()) {
            throw new IllegalArgumentException("mismatched borrow liveness");
        }
        this.body = body;
        this.spans = spans;
        this.borrows = Collections.unmodifiableList(new ArrayList<>(borrows));
        this.liveLocations = new ArrayList<>(liveLocations.size());
        for (Set<Location> live : liveLocations) {
            this.liveLocations.add(Collections.unmodifiableSet(new TreeSet<>(live)));
        }
        this.visited = new ArrayList<>(visited.size());
        for (Set<Location> seen : visited) {
            this.visited.add(Collections.unmodifiableSet(new TreeSet<>(seen)));
        }

        for (BorrowInfo borrow : borrows) {
            SpanInfo fallback = spans.getNullable(borrow.spanId);
            for (Location loc : this.liveLocations.get(borrow.index)) {
                activeAtLocation.computeIfAbsent(loc, $ -> new TreeSet<>()).add(borrow.index);
                SpanInfo info = spans.getNullable(body.spanAt(loc));
                if (info == null) info = fallback;
                if (info == null) continue;
                for (int line = info.lineStart; line <= info.lineEnd; line++) {
                    activeAtLine.computeIfAbsent(line, $ -> new TreeSet<>()).add(borrow.index);
                }
            }
        }
    }

    /**
     * Get whether a statement kills a borrow held by {@code borrower}.
     * <p>
     * The borrow dies when the borrower's storage ends, or when the whole
     * borrower is assigned a new value.
     *
     * @param stmt     The statement.
     * @param borrower The borrower local.
     * @return Whether the statement kills the borrow.
     */
    public static boolean killsBorrow(Statement stmt, int borrower) {
        return stmt.accept(new StatementKills(borrower));
    }

    /**
     * Get whether a terminator kills a borrow held by {@code borrower}.
     * <p>
     * Returning kills every borrow, as does dropping the whole borrower.
     *
     * @param term     The terminator.
     * @param borrower The borrower local.
     * @return Whether the terminator kills the borrow.
     */
    public static boolean terminatorKillsBorrow(Terminator term, int borrower) {
        return term.accept(new TerminatorKills(borrower));
    }

    public List<BorrowInfo> borrows() {
        return borrows;
    }

    public @Nullable BorrowInfo get(int index) {
        return index >= 0 && index < borrows.size() ? borrows.get(index) : null;
    }

    public boolean isEmpty() {
        return borrows.isEmpty();
    }

    /**
     * Get the borrows live at a location.
     *
     * @param loc The location.
     * @return The borrow indices, ascending. Empty if there are none.
     */
    public SortedSet<Integer> activeAt(Location loc) {
        SortedSet<Integer> set = activeAtLocation.get(loc);
        return set == null ? Collections.emptySortedSet() : Collections.unmodifiableSortedSet(set);
    }

    public SortedSet<Integer> activeAt(int block, int statement) {
        return activeAt(Location.of(block, statement));
    }

    /**
     * Get the borrows live somewhere on a source line.
     *
     * @param line The line.
     * @return The borrow indices, ascending. Empty if there are none.
     */
    public SortedSet<Integer> activeAtLine(int line) {
        SortedSet<Integer> set = activeAtLine.get(line);
        return set == null ? Collections.emptySortedSet() : Collections.unmodifiableSortedSet(set);
    }

    /**
     * Get every source line with at least one live borrow.
     *
     * @return The lines, ascending.
     */
    public Set<Integer> linesWithBorrows() {
        return Collections.unmodifiableSet(activeAtLine.keySet());
    }

    /**
     * Get the locations a borrow is live at.
     *
     * @param borrow The borrow index.
     * @return The locations, in program order.
     */
    public Set<Location> liveLocations(int borrow) {
        return liveLocations.get(borrow);
    }

    /**
     * Get every location the liveness walk of a borrow inspected, kill locations included.
     *
     * @param borrow The borrow index.
     * @return The locations, in program order.
     */
    public Set<Location> visited(int borrow) {
        return visited.get(borrow);
    }

    /**
     * Find the first location, reachable from a borrow's creation, that kills it.
     *
     * @param borrowIdx The borrow index.
     * @return The kill location, or empty if the borrow is never killed or does not exist.
     */
    public Optional<Location> findBorrowEnd(int borrowIdx) {
        BorrowInfo borrow = get(borrowIdx);
        if (borrow == null) return Optional.empty();

        Set<Location> seen = new HashSet<>();
        Deque<Location> worklist = new ArrayDeque<>();
        worklist.push(borrow.start);
        while (!worklist.isEmpty()) {
            Location entry = worklist.pop();
            if (!seen.add(entry)) continue;
            BasicBlock block = body.getBlock(entry.block);
            for (int i = entry.statement; i < block.statements.size(); i++) {
                Location loc = Location.of(entry.block, i);
                if (!loc.equals(borrow.start) && killsBorrow(block.statements.get(i), borrow.borrower)) {
                    return Optional.of(loc);
                }
            }
            if (terminatorKillsBorrow(block.terminator, borrow.borrower)) {
                return Optional.of(Location.of(entry.block, block.terminatorOffset()));
            }
            for (int succ : block.terminator.successors()) {
                worklist.push(Location.of(succ, 0));
            }
        }
        return Optional.empty();
    }

    /**
     * Get the source lines a borrow spans, from its creation to its end.
     *
     * @param borrowIdx The borrow index.
     * @return The range, or empty if the creation span is unknown. If the end is unknown,
     * the range covers only the start line.
     */
    public Optional<LineRange> borrowSourceRange(int borrowIdx) {
        BorrowInfo borrow = get(borrowIdx);
        if (borrow == null) return Optional.empty();
        SpanInfo start = spans.getNullable(borrow.spanId);
        if (start == null) return Optional.empty();
        int endLine = start.lineStart;
        Optional<Location> end = findBorrowEnd(borrowIdx);
        if (end.isPresent()) {
            SpanInfo endInfo = spans.getNullable(body.spanAt(end.get()));
            if (endInfo != null) endLine = endInfo.lineEnd;
        }
        return Optional.of(new LineRange(start.lineStart, endLine));
    }

    /**
     * Format a borrow's lifetime as an annotation.
     *
     * @param borrowIdx The borrow index.
     * @param endLine   The line the borrow ends on, or null if it is unknown.
     * @return e.g. {@code 'b0: line 5}, {@code 'b0: lines 5-12} or {@code 'b0: from line 5}.
     */
    public String formatLifetimeRange(int borrowIdx, @Nullable Integer endLine) {
        BorrowInfo borrow = borrows.get(borrowIdx);
        SpanInfo info = spans.getNullable(borrow.spanId);
        int startLine = info == null ? 0 : info.lineStart;
        if (endLine == null) {
            return borrow.lifetimeName() + ": from line " + startLine;
        }
        if (endLine == startLine) {
            return borrow.lifetimeName() + ": line " + startLine;
        }
        return borrow.lifetimeName() + ": lines " + startLine + "-" + endLine;
    }

    /**
     * Format a borrow's lifetime, ending where {@link #findBorrowEnd(int)} finds it ends.
     *
     * @param borrowIdx The borrow index.
     * @return The annotation.
     */
    public String formatLifetimeRange(int borrowIdx) {
        Integer endLine = null;
        Optional<Location> end = findBorrowEnd(borrowIdx);
        if (end.isPresent()) {
            SpanInfo endInfo = spans.getNullable(body.spanAt(end.get()));
            if (endInfo != null) endLine = endInfo.lineEnd;
        }
        return formatLifetimeRange(borrowIdx, endLine);
    }

    private static final class StatementKills implements Statement.Visitor<Boolean> {
        private final int borrower;

        StatementKills(int borrower) {
            this.borrower = borrower;
        }

        @Override
        public Boolean visitAssign(Statement.Assign s) {
            return s.place.isWholeLocal(borrower);
        }

        @Override
        public Boolean visitFakeRead(Statement.FakeRead s) {
            return false;
        }

        @Override
        public Boolean visitSetDiscriminant(Statement.SetDiscriminant s) {
            return false;
        }

        @Override
        public Boolean visitDeinit(Statement.Deinit s) {
            return false;
        }

        @Override
        public Boolean visitStorageLive(Statement.StorageLive s) {
            return false;
        }

        @Override
        public Boolean visitStorageDead(Statement.StorageDead s) {
            return s.local == borrower;
        }

        @Override
        public Boolean visitRetag(Statement.Retag s) {
            return false;
        }

        @Override
        public Boolean visitPlaceMention(Statement.PlaceMention s) {
            return false;
        }

        @Override
        public Boolean visitAscribeUserType(Statement.AscribeUserType s) {
            return false;
        }

        @Override
        public Boolean visitCoverage(Statement.Coverage s) {
            return false;
        }

        @Override
        public Boolean visitIntrinsic(Statement.Intrinsic s) {
            return false;
        }

        @Override
        public Boolean visitConstEvalCounter(Statement.ConstEvalCounter s) {
            return false;
        }

        @Override
        public Boolean visitNop(Statement.Nop s) {
            return false;
        }
    }

    private static final class TerminatorKills implements Terminator.Visitor<Boolean> {
        private final int borrower;

        TerminatorKills(int borrower) {
            this.borrower = borrower;
        }

        @Override
        public Boolean visitGoto(Terminator.Goto t) {
            return false;
        }

        @Override
        public Boolean visitSwitchInt(Terminator.SwitchInt t) {
            return false;
        }

        @Override
        public Boolean visitResume(Terminator.Resume t) {
            return false;
        }

        @Override
        public Boolean visitAbort(Terminator.Abort t) {
            return false;
        }

        @Override
        public Boolean visitReturn(Terminator.Return t) {
            return true;
        }

        @Override
        public Boolean visitUnreachable(Terminator.Unreachable t) {
            return false;
        }

        @Override
        public Boolean visitDrop(Terminator.Drop t) {
            return t.place.isWholeLocal(borrower);
        }

        @Override
        public Boolean visitCall(Terminator.Call t) {
            return false;
        }

        @Override
        public Boolean visitAssert(Terminator.Assert t) {
            return false;
        }

        @Override
        public Boolean visitInlineAsm(Terminator.InlineAsm t) {
            return false;
        }
    }

    /**
     * An inclusive range of source lines.
     */
    public static final class LineRange {
        public final int startLine;
        public final int endLine;

        public LineRange(int startLine, int endLine) {
            this.startLine = startLine;
            this.endLine = endLine;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            LineRange that = (LineRange) o;
            return startLine == that.startLine && endLine == that.endLine;
        }

        @Override
        public int hashCode() {
            return 31 * startLine + endLine;
        }

        @Override
        public String toString() {
            return startLine + "-" + endLine;
        }
    }
}
