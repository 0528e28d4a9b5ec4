package io.github.eutro.mirlens.core.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The right-hand side of an {@link Statement.Assign assignment}.
 * <p>
 * The set of kinds is closed; consumers dispatch through {@link Visitor},
 * so a new kind fails to compile every consumer until it is handled.
 */
public abstract class Rvalue {
    Rvalue() {
    }

    public abstract <R> R accept(Visitor<R> visitor);

    public interface Visitor<R> {
        R visitAddressOf(AddressOf rv);

        R visitAggregate(Aggregate rv);

        R visitBinaryOp(BinaryOp rv);

        R visitCheckedBinaryOp(CheckedBinaryOp rv);

        R visitCast(Cast rv);

        R visitCopyForDeref(CopyForDeref rv);

        R visitDiscriminant(Discriminant rv);

        R visitLen(Len rv);

        R visitRef(Ref rv);

        R visitRepeat(Repeat rv);

        R visitShallowInitBox(ShallowInitBox rv);

        R visitThreadLocalRef(ThreadLocalRef rv);

        R visitNullaryOp(NullaryOp rv);

        R visitUnaryOp(UnaryOp rv);

        R visitUse(Use rv);
    }

    /**
     * {@code &raw const place} or {@code &raw mut place}.
     */
    public static final class AddressOf extends Rvalue {
        public final boolean mutable;
        public final Place place;

        public AddressOf(boolean mutable, Place place) {
            this.mutable = mutable;
            this.place = place;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAddressOf(this);
        }
    }

    public static final class Aggregate extends Rvalue {
        public final AggregateKind kind;
        public final List<Operand> operands;

        public Aggregate(AggregateKind kind, List<Operand> operands) {
            this.kind = kind;
            this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAggregate(this);
        }
    }

    public static final class BinaryOp extends Rvalue {
        public final BinOp op;
        public final Operand lhs;
        public final Operand rhs;

        public BinaryOp(BinOp op, Operand lhs, Operand rhs) {
            this.op = op;
            this.lhs = lhs;
            this.rhs = rhs;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinaryOp(this);
        }
    }

    /**
     * A binary operation that also yields an overflow flag.
     */
    public static final class CheckedBinaryOp extends Rvalue {
        public final BinOp op;
        public final Operand lhs;
        public final Operand rhs;

        public CheckedBinaryOp(BinOp op, Operand lhs, Operand rhs) {
            this.op = op;
            this.lhs = lhs;
            this.rhs = rhs;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCheckedBinaryOp(this);
        }
    }

    public static final class Cast extends Rvalue {
        /**
         * The cast kind, as the compiler names it (e.g. {@code IntToInt}).
         */
        public final String castKind;
        public final Operand operand;
        public final long typeId;

        public Cast(String castKind, Operand operand, long typeId) {
            this.castKind = castKind;
            this.operand = operand;
            this.typeId = typeId;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCast(this);
        }
    }

    public static final class CopyForDeref extends Rvalue {
        public final Place place;

        public CopyForDeref(Place place) {
            this.place = place;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCopyForDeref(this);
        }
    }

    public static final class Discriminant extends Rvalue {
        public final Place place;

        public Discriminant(Place place) {
            this.place = place;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDiscriminant(this);
        }
    }

    public static final class Len extends Rvalue {
        public final Place place;

        public Len(Place place) {
            this.place = place;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLen(this);
        }
    }

    /**
     * A reference-creating operation, {@code &place} or {@code &mut place}.
     */
    public static final class Ref extends Rvalue {
        public final BorrowKind kind;
        public final Place place;

        public Ref(BorrowKind kind, Place place) {
            this.kind = kind;
            this.place = place;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRef(this);
        }
    }

    public static final class Repeat extends Rvalue {
        public final Operand operand;
        public final long count;

        public Repeat(Operand operand, long count) {
            this.operand = operand;
            this.count = count;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRepeat(this);
        }
    }

    public static final class ShallowInitBox extends Rvalue {
        public final Operand operand;
        public final long typeId;

        public ShallowInitBox(Operand operand, long typeId) {
            this.operand = operand;
            this.typeId = typeId;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitShallowInitBox(this);
        }
    }

    public static final class ThreadLocalRef extends Rvalue {
        public final String item;

        public ThreadLocalRef(String item) {
            this.item = item;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitThreadLocalRef(this);
        }
    }

    /**
     * An operation on a type alone, such as {@code SizeOf} or {@code AlignOf}.
     */
    public static final class NullaryOp extends Rvalue {
        public final String op;
        public final long typeId;

        public NullaryOp(String op, long typeId) {
            this.op = op;
            this.typeId = typeId;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNullaryOp(this);
        }
    }

    public static final class UnaryOp extends Rvalue {
        public final UnOp op;
        public final Operand operand;

        public UnaryOp(UnOp op, Operand operand) {
            this.op = op;
            this.operand = operand;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnaryOp(this);
        }
    }

    public static final class Use extends Rvalue {
        public final Operand operand;

        public Use(Operand operand) {
            this.operand = operand;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUse(this);
        }
    }
}
