package io.github.eutro.mirlens.core.ir;

/**
 * One step of a {@link Place} projection.
 */
public abstract class ProjectionElem {
    ProjectionElem() {
    }

    /**
     * Dispatch on the kind of projection.
     *
     * @param visitor The visitor.
     * @param <R>     The result type.
     * @return The visitor's result.
     */
    public abstract <R> R accept(Visitor<R> visitor);

    /**
     * A visitor over every kind of projection.
     *
     * @param <R> The result type.
     */
    public interface Visitor<R> {
        R visitDeref(Deref p);

        R visitField(Field p);

        R visitIndex(Index p);

        R visitConstantIndex(ConstantIndex p);

        R visitSubslice(Subslice p);

        R visitDowncast(Downcast p);

        R visitOpaqueCast(OpaqueCast p);

        R visitSubtype(Subtype p);
    }

    public static final Deref DEREF = new Deref();

    public static final class Deref extends ProjectionElem {
        private Deref() {
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDeref(this);
        }
    }

    public static final class Field extends ProjectionElem {
        public final int field;
        public final long typeId;

        public Field(int field, long typeId) {
            this.field = field;
            this.typeId = typeId;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitField(this);
        }
    }

    public static final class Index extends ProjectionElem {
        public final int local;

        public Index(int local) {
            this.local = local;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIndex(this);
        }
    }

    public static final class ConstantIndex extends ProjectionElem {
        public final long offset;
        public final long minLength;
        public final boolean fromEnd;

        public ConstantIndex(long offset, long minLength, boolean fromEnd) {
            this.offset = offset;
            this.minLength = minLength;
            this.fromEnd = fromEnd;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitConstantIndex(this);
        }
    }

    public static final class Subslice extends ProjectionElem {
        public final long from;
        public final long to;
        public final boolean fromEnd;

        public Subslice(long from, long to, boolean fromEnd) {
            this.from = from;
            this.to = to;
            this.fromEnd = fromEnd;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSubslice(this);
        }
    }

    public static final class Downcast extends ProjectionElem {
        public final int variant;

        public Downcast(int variant) {
            this.variant = variant;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDowncast(this);
        }
    }

    public static final class OpaqueCast extends ProjectionElem {
        public final long typeId;

        public OpaqueCast(long typeId) {
            this.typeId = typeId;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitOpaqueCast(this);
        }
    }

    public static final class Subtype extends ProjectionElem {
        public final long typeId;

        public Subtype(long typeId) {
            this.typeId = typeId;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSubtype(this);
        }
    }
}
