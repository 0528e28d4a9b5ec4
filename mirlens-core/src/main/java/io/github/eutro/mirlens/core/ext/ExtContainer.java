package io.github.eutro.mirlens.core.ext;

import org.jetbrains.annotations.Nullable;

import java.util.Optional;

/**
 * Something analysis facts can be attached to. See the {@link io.github.eutro.mirlens.core.ext package docs}.
 */
public interface ExtContainer {
    /**
     * Store {@code value} under {@code ext}, replacing any previous value.
     *
     * @param ext   The ext.
     * @param value The value.
     * @param <T>   The value type.
     */
    <T> void attachExt(Ext<T> ext, T value);

    /**
     * Remove the value stored under {@code ext}, if any.
     *
     * @param ext The ext.
     * @param <T> The value type.
     */
    <T> void removeExt(Ext<T> ext);

    /**
     * Get the value stored under {@code ext}, or null.
     *
     * @param ext The ext.
     * @param <T> The value type.
     * @return The value, or null if absent.
     */
    <T> @Nullable T getNullable(Ext<T> ext);

    /**
     * Get the value stored under {@code ext}, if any.
     *
     * @param ext The ext.
     * @param <T> The value type.
     * @return The value.
     */
    default <T> Optional<T> getExt(Ext<T> ext) {
        return Optional.ofNullable(getNullable(ext));
    }

    /**
     * Get the value stored under {@code ext}, failing if it was never computed.
     *
     * @param ext The ext.
     * @param <T> The value type.
     * @return The value.
     * @throws IllegalStateException If there is no value.
     */
    default <T> T getExtOrThrow(Ext<T> ext) {
        T nullable = getNullable(ext);
        if (nullable != null) return nullable;
        throw new IllegalStateException("Ext not present: " + ext.getName());
    }
}
