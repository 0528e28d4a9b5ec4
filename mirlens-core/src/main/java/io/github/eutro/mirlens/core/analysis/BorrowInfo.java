package io.github.eutro.mirlens.core.analysis;

import io.github.eutro.mirlens.core.ir.BorrowKind;
import io.github.eutro.mirlens.core.ir.Location;

/**
 * A borrow: an assignment {@code borrower = &borrowed} of one whole local to another.
 */
public final class BorrowInfo {
    /**
     * The index of this borrow in its function, in discovery order.
     */
    public final int index;
    /**
     * The local receiving the reference.
     */
    public final int borrower;
    /**
     * The local being borrowed.
     */
    public final int borrowed;
    public final BorrowKind kind;
    /**
     * Where the borrow is created.
     */
    public final Location start;
    public final long spanId;

    public BorrowInfo(int index, int borrower, int borrowed, BorrowKind kind, Location start, long spanId) {
        this.index = index;
        this.borrower = borrower;
        this.borrowed = borrowed;
        this.kind = kind;
        this.start = start;
        this.spanId = spanId;
    }

    /**
     * Get the lifetime name of this borrow.
     *
     * @return {@code 'bN}.
     */
    public String lifetimeName() {
        return "'b" + index;
    }

    @Override
    public String toString() {
        return lifetimeName() + ": _" + borrower + " = &" + (kind == BorrowKind.MUTABLE ? "mut " : "")
                + "_" + borrowed + " at " + start;
    }
}
