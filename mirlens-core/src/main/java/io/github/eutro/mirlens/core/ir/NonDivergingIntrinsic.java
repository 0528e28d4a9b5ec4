package io.github.eutro.mirlens.core.ir;

/**
 * An intrinsic that is lowered to a statement rather than a call, because it always returns.
 */
public abstract class NonDivergingIntrinsic {
    NonDivergingIntrinsic() {
    }

    public abstract <R> R accept(Visitor<R> visitor);

    public interface Visitor<R> {
        R visitAssume(Assume intr);

        R visitCopyNonOverlapping(CopyNonOverlapping intr);
    }

    public static final class Assume extends NonDivergingIntrinsic {
        public final Operand operand;

        public Assume(Operand operand) {
            this.operand = operand;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAssume(this);
        }
    }

    public static final class CopyNonOverlapping extends NonDivergingIntrinsic {
        public final Operand src;
        public final Operand dst;
        public final Operand count;

        public CopyNonOverlapping(Operand src, Operand dst, Operand count) {
            this.src = src;
            this.dst = dst;
            this.count = count;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCopyNonOverlapping(this);
        }
    }
}
