package io.github.eutro.mirlens.core.ir;

import org.jetbrains.annotations.Nullable;

/**
 * An argument of an rvalue or terminator.
 */
public abstract class Operand {
    Operand() {
    }

    public abstract <R> R accept(Visitor<R> visitor);

    /**
     * Get the place this operand reads, if it reads one.
     *
     * @return The place, or null for constants.
     */
    public abstract @Nullable Place place();

    public interface Visitor<R> {
        R visitCopy(Copy op);

        R visitMove(Move op);

        R visitConstant(Constant op);
    }

    public static Copy copy(Place place) {
        return new Copy(place);
    }

    public static Move move(Place place) {
        return new Move(place);
    }

    public static Constant constant(ConstOperand value) {
        return new Constant(value);
    }

    public static final class Copy extends Operand {
        public final Place place;

        Copy(Place place) {
            this.place = place;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCopy(this);
        }

        @Override
        public Place place() {
            return place;
        }
    }

    public static final class Move extends Operand {
        public final Place place;

        Move(Place place) {
            this.place = place;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMove(this);
        }

        @Override
        public Place place() {
            return place;
        }
    }

    public static final class Constant extends Operand {
        public final ConstOperand value;

        Constant(ConstOperand value) {
            this.value = value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitConstant(this);
        }

        @Override
        public @Nullable Place place() {
            return null;
        }
    }
}
