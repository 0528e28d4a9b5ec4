package io.github.eutro.mirlens.core.ext;

import io.github.eutro.mirlens.core.cfg.Function;
import io.github.eutro.mirlens.core.passes.IRPass;
import io.github.eutro.mirlens.core.passes.meta.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keeps track of which analyses have been computed for a {@link Function}.
 * <p>
 * Function bodies never change, so once valid, metadata stays valid unless it is
 * explicitly {@link #invalidate(MetaKind...) invalidated}. Invalidating a kind also
 * invalidates every kind computed from it.
 */
public class MetadataState {
    private static final List<MetaKind> ALL_KINDS = new ArrayList<>();

    /**
     * A kind of metadata whose presence can be checked on {@link MetadataState}.
     */
    public static class MetaKind {
        private static final AtomicInteger COUNTER = new AtomicInteger();
        final int id = COUNTER.getAndIncrement();
        final String name;
        final List<MetaKind> dependencies;

        MetaKind(String name, MetaKind... dependencies) {
            this.name = name;
            this.dependencies = Collections.unmodifiableList(Arrays.asList(dependencies));
            ALL_KINDS.add(this);
        }

        /**
         * Get the kinds this one is computed from.
         *
         * @return The direct dependencies.
         */
        public List<MetaKind> getDependencies() {
            return dependencies;
        }

        @Override
        public boolean equals(Object o) {
            return this == o;
        }

        @Override
        public int hashCode() {
            return id;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * A kind of metadata that also specifies the pass that computes it.
     *
     * @param <T> The IR on which the pass must be run to compute the metadata.
     */
    public static class ComputableMetaKind<T> extends MetaKind {
        private final IRPass<T, T> pass;

        ComputableMetaKind(String name, IRPass<T, T> pass, MetaKind... dependencies) {
            super(name, dependencies);
            if (!pass.isInPlace()) {
                throw new IllegalArgumentException(name + " must be computed by an in-place pass");
            }
            this.pass = pass;
        }

        void computeFor(T t) {
            pass.run(t);
        }
    }

    public static final ComputableMetaKind<Function> PREDS =
            new ComputableMetaKind<>("PREDS", ComputePreds.INSTANCE);
    public static final ComputableMetaKind<Function> LOOPS =
            new ComputableMetaKind<>("LOOPS", ComputeLoops.INSTANCE, PREDS);
    public static final ComputableMetaKind<Function> CLEANUP =
            new ComputableMetaKind<>("CLEANUP", ComputeCleanup.INSTANCE, PREDS);
    public static final ComputableMetaKind<Function> BLOCK_ROLES =
            new ComputableMetaKind<>("BLOCK_ROLES", InferBlockRoles.INSTANCE, PREDS, LOOPS, CLEANUP);
    public static final ComputableMetaKind<Function> BORROWS =
            new ComputableMetaKind<>("BORROWS", ComputeBorrows.INSTANCE, PREDS);
    public static final ComputableMetaKind<Function> LIFETIMES =
            new ComputableMetaKind<>("LIFETIMES", ComputeLifetimes.INSTANCE);
    public static final ComputableMetaKind<Function> PROPERTIES =
            new ComputableMetaKind<>("PROPERTIES", ComputeProperties.INSTANCE);

    private final BitSet validSet = new BitSet();

    /**
     * Check whether the given metadata is valid.
     *
     * @param kind The kind of metadata.
     * @return Whether it is valid on this.
     */
    public boolean isValid(MetaKind kind) {
        return validSet.get(kind.id);
    }

    /**
     * Make sure the given metadata are valid, computing any that are not after
     * the metadata they depend on.
     *
     * @param t     The thing that passes can be run on.
     * @param first The first metadata kind.
     * @param kinds The other metadata kinds.
     * @param <T>   The type of {@code t}.
     */
    @SafeVarargs
    public final <T> void ensureValid(T t, ComputableMetaKind<T> first, ComputableMetaKind<T>... kinds) {
        ensureValid0(t, first);
        for (ComputableMetaKind<T> kind : kinds) {
            ensureValid0(t, kind);
        }
    }

    @SuppressWarnings("unchecked")
    private <T> void ensureValid0(T t, ComputableMetaKind<T> kind) {
        if (isValid(kind)) return;
        for (MetaKind dep : kind.dependencies) {
            // dependencies of a kind are computed on the same IR
            ensureValid0(t, (ComputableMetaKind<T>) dep);
        }
        kind.computeFor(t);
        validate(kind);
    }

    /**
     * Mark the given metadata as valid.
     *
     * @param kinds The metadata kinds.
     */
    public void validate(MetaKind... kinds) {
        for (MetaKind kind : kinds) {
            validSet.set(kind.id, true);
        }
    }

    /**
     * Mark the given metadata, and everything computed from it, as invalid,
     * so it is recomputed when next needed.
     *
     * @param kinds The metadata kinds.
     */
    public void invalidate(MetaKind... kinds) {
        for (MetaKind kind : kinds) {
            validSet.clear(kind.id);
            for (MetaKind other : ALL_KINDS) {
                if (other.dependencies.contains(kind)) {
                    invalidate(other);
                }
            }
        }
    }
}
