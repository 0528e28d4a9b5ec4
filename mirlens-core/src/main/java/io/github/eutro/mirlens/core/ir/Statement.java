package io.github.eutro.mirlens.core.ir;

/**
 * A straight-line instruction inside a {@link BasicBlock}.
 * <p>
 * Every statement records the span it was lowered from, as an id into the span table.
 */
public abstract class Statement {
    /**
     * The source span id of this statement.
     */
    public final long spanId;

    Statement(long spanId) {
        this.spanId = spanId;
    }

    public abstract <R> R accept(Visitor<R> visitor);

    public interface Visitor<R> {
        R visitAssign(Assign s);

        R visitFakeRead(FakeRead s);

        R visitSetDiscriminant(SetDiscriminant s);

        R visitDeinit(Deinit s);

        R visitStorageLive(StorageLive s);

        R visitStorageDead(StorageDead s);

        R visitRetag(Retag s);

        R visitPlaceMention(PlaceMention s);

        R visitAscribeUserType(AscribeUserType s);

        R visitCoverage(Coverage s);

        R visitIntrinsic(Intrinsic s);

        R visitConstEvalCounter(ConstEvalCounter s);

        R visitNop(Nop s);
    }

    /**
     * {@code place = rvalue}.
     */
    public static final class Assign extends Statement {
        public final Place place;
        public final Rvalue rvalue;

        public Assign(long spanId, Place place, Rvalue rvalue) {
            super(spanId);
            this.place = place;
            this.rvalue = rvalue;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAssign(this);
        }
    }

    public static final class FakeRead extends Statement {
        public final Place place;

        public FakeRead(long spanId, Place place) {
            super(spanId);
            this.place = place;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFakeRead(this);
        }
    }

    public static final class SetDiscriminant extends Statement {
        public final Place place;
        public final int variant;

        public SetDiscriminant(long spanId, Place place, int variant) {
            super(spanId);
            this.place = place;
            this.variant = variant;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSetDiscriminant(this);
        }
    }

    public static final class Deinit extends Statement {
        public final Place place;

        public Deinit(long spanId, Place place) {
            super(spanId);
            this.place = place;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDeinit(this);
        }
    }

    /**
     * The scope-begin marker of a local.
     */
    public static final class StorageLive extends Statement {
        public final int local;

        public StorageLive(long spanId, int local) {
            super(spanId);
            if (local < 0) throw new MalformedIrException("negative local _" + local);
            this.local = local;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStorageLive(this);
        }
    }

    /**
     * The scope-end marker of a local.
     */
    public static final class StorageDead extends Statement {
        public final int local;

        public StorageDead(long spanId, int local) {
            super(spanId);
            if (local < 0) throw new MalformedIrException("negative local _" + local);
            this.local = local;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStorageDead(this);
        }
    }

    public static final class Retag extends Statement {
        public final Place place;

        public Retag(long spanId, Place place) {
            super(spanId);
            this.place = place;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRetag(this);
        }
    }

    public static final class PlaceMention extends Statement {
        public final Place place;

        public PlaceMention(long spanId, Place place) {
            super(spanId);
            this.place = place;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPlaceMention(this);
        }
    }

    public static final class AscribeUserType extends Statement {
        public final Place place;
        public final String projections;

        public AscribeUserType(long spanId, Place place, String projections) {
            super(spanId);
            this.place = place;
            this.projections = projections;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAscribeUserType(this);
        }
    }

    public static final class Coverage extends Statement {
        public Coverage(long spanId) {
            super(spanId);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCoverage(this);
        }
    }

    public static final class Intrinsic extends Statement {
        public final NonDivergingIntrinsic intrinsic;

        public Intrinsic(long spanId, NonDivergingIntrinsic intrinsic) {
            super(spanId);
            this.intrinsic = intrinsic;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIntrinsic(this);
        }
    }

    public static final class ConstEvalCounter extends Statement {
        public ConstEvalCounter(long spanId) {
            super(spanId);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitConstEvalCounter(this);
        }
    }

    public static final class Nop extends Statement {
        public Nop(long spanId) {
            super(spanId);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNop(this);
        }
    }
}
