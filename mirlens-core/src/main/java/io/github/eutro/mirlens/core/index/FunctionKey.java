package io.github.eutro.mirlens.core.index;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * The key functions are looked up by: the function's type, and which instance of it this is.
 * <p>
 * Generic functions can have several instances sharing one type, which the
 * instance descriptor tells apart.
 */
public final class FunctionKey {
    public final long typeId;
    public final @Nullable String instanceDesc;

    public FunctionKey(long typeId, @Nullable String instanceDesc) {
        this.typeId = typeId;
        this.instanceDesc = instanceDesc;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FunctionKey that = (FunctionKey) o;
        return typeId == that.typeId && Objects.equals(instanceDesc, that.instanceDesc);
    }

    @Override
    public int hashCode() {
        return Objects.hash(typeId, instanceDesc);
    }

    @Override
    public String toString() {
        return instanceDesc == null ? TypeIndex.label(typeId) : TypeIndex.label(typeId) + " " + instanceDesc;
    }
}
