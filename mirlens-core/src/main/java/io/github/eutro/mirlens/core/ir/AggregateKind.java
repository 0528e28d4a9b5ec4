package io.github.eutro.mirlens.core.ir;

/**
 * What an {@link Rvalue.Aggregate} constructs.
 */
public final class AggregateKind {
    public enum Kind {
        ARRAY,
        TUPLE,
        ADT,
        CLOSURE,
        COROUTINE,
        RAW_PTR,
    }

    public final Kind kind;
    /**
     * The variant index, for {@link Kind#ADT}.
     */
    public final int variant;
    /**
     * The element or pointee type, for {@link Kind#ARRAY} and {@link Kind#RAW_PTR}.
     */
    public final long typeId;
    /**
     * Mutability, for {@link Kind#RAW_PTR}.
     */
    public final boolean mutable;

    private AggregateKind(Kind kind, int variant, long typeId, boolean mutable) {
        this.kind = kind;
        this.variant = variant;
        this.typeId = typeId;
        this.mutable = mutable;
    }

    public static final AggregateKind TUPLE = new AggregateKind(Kind.TUPLE, 0, -1, false);
    public static final AggregateKind CLOSURE = new AggregateKind(Kind.CLOSURE, 0, -1, false);
    public static final AggregateKind COROUTINE = new AggregateKind(Kind.COROUTINE, 0, -1, false);

    public static AggregateKind array(long elementType) {
        return new AggregateKind(Kind.ARRAY, 0, elementType, false);
    }

    public static AggregateKind adt(int variant) {
        return new AggregateKind(Kind.ADT, variant, -1, false);
    }

    public static AggregateKind rawPtr(long pointee, boolean mutable) {
        return new AggregateKind(Kind.RAW_PTR, 0, pointee, mutable);
    }
}
