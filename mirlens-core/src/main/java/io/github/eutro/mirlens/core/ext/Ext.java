package io.github.eutro.mirlens.core.ext;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * A typed key under which an analysis fact can be stored in an {@link ExtContainer}.
 * <p>
 * Each ext gets a dense id on creation, which {@link ExtHolder} uses as a slot index.
 *
 * @param <T> The type of the value stored under this key.
 */
public final class Ext<T> {
    private static final AtomicInteger ID_COUNTER = new AtomicInteger(0);

    private final Class<?> type;
    private final int id = ID_COUNTER.getAndIncrement();
    private final String name;

    private Ext(Class<?> type, String name) {
        this.type = type;
        this.name = name;
    }

    /**
     * Create a new ext.
     * <p>
     * The class may be a raw supertype of {@code R}, since generic types have no class
     * literal; it is only used for debugging.
     *
     * @param type The most specific class of the value type.
     * @param name The name of the ext, for debugging.
     * @param <T>  The class type.
     * @param <R>  The value type.
     * @return The new ext.
     */
    public static <T, R extends T> Ext<R> create(Class<T> type, String name) {
        return new Ext<>(type, name);
    }

    /**
     * Get the name of this ext.
     *
     * @return The name.
     */
    public String getName() {
        return name;
    }

    int getId() {
        return id;
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public boolean equals(Object obj) {
        return this == obj;
    }

    @Override
    public String toString() {
        return name + ": " + type.getName();
    }
}
