package io.github.eutro.mirlens.core.ir;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A constant, with the type it has.
 */
public abstract class ConstOperand {
    /**
     * The type of the constant.
     */
    public final long typeId;

    ConstOperand(long typeId) {
        this.typeId = typeId;
    }

    public abstract <R> R accept(Visitor<R> visitor);

    public interface Visitor<R> {
        R visitAllocated(Allocated c);

        R visitZeroSized(ZeroSized c);

        R visitTyConst(TyConst c);

        R visitUnevaluated(Unevaluated c);

        R visitParam(Param c);
    }

    /**
     * A constant with backing bytes, which may point into other allocations.
     */
    public static final class Allocated extends ConstOperand {
        /**
         * The bytes of the constant; null elements are uninitialized.
         */
        public final List<Byte> bytes;
        /**
         * The allocations this constant points to.
         */
        public final List<Long> provenance;

        public Allocated(long typeId, List<Byte> bytes, List<Long> provenance) {
            super(typeId);
            this.bytes = Collections.unmodifiableList(new ArrayList<>(bytes));
            this.provenance = Collections.unmodifiableList(new ArrayList<>(provenance));
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAllocated(this);
        }
    }

    /**
     * A zero-sized constant, such as a function item or unit.
     */
    public static final class ZeroSized extends ConstOperand {
        public ZeroSized(long typeId) {
            super(typeId);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitZeroSized(this);
        }
    }

    public static final class TyConst extends ConstOperand {
        public TyConst(long typeId) {
            super(typeId);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTyConst(this);
        }
    }

    /**
     * A constant item that has not been evaluated yet.
     */
    public static final class Unevaluated extends ConstOperand {
        @Nullable
        public final String name;

        public Unevaluated(long typeId, @Nullable String name) {
            super(typeId);
            this.name = name;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnevaluated(this);
        }
    }

    public static final class Param extends ConstOperand {
        public Param(long typeId) {
            super(typeId);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitParam(this);
        }
    }
}
