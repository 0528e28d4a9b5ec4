package io.github.eutro.mirlens.core.index;

/**
 * A row of the type table.
 */
public final class TypeEntry {
    public final long id;
    public final TypeKind kind;
    /**
     * The rendered name of the type. Ignored for {@link TypeKind#VOID}.
     */
    public final String name;

    public TypeEntry(long id, TypeKind kind, String name) {
        this.id = id;
        this.kind = kind;
        this.name = name;
    }
}
