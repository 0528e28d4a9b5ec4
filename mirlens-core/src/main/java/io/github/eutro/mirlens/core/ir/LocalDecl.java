package io.github.eutro.mirlens.core.ir;

import org.jetbrains.annotations.Nullable;

/**
 * The declaration of a local variable.
 */
public final class LocalDecl {
    public final long typeId;
    public final boolean mutable;
    /**
     * The user-facing name of the local, if it has one.
     */
    public final @Nullable String sourceName;

    public LocalDecl(long typeId, boolean mutable, @Nullable String sourceName) {
        this.typeId = typeId;
        this.mutable = mutable;
        this.sourceName = sourceName;
    }
}
