package io.github.eutro.mirlens.core.index;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Map;

/**
 * Resolves type ids to names.
 */
public final class TypeIndex {
    private static final Logger logger = LogManager.getLogger(TypeIndex.class);

    private final Map<Long, TypeEntry> byId = new HashMap<>();

    public TypeIndex(Iterable<TypeEntry> types) {
        for (TypeEntry type : types) {
            byId.put(type.id, type);
        }
    }

    /**
     * Get the fallback label of a type id.
     *
     * @param id The type id.
     * @return {@code ty<N>}.
     */
    public static String label(long id) {
        return "ty" + id;
    }

    public @Nullable TypeEntry get(long id) {
        return byId.get(id);
    }

    /**
     * Get the name of a type, falling back to its label if it is unknown.
     *
     * @param id The type id.
     * @return The name.
     */
    public String getName(long id) {
        TypeEntry entry = byId.get(id);
        if (entry == null) {
            logger.trace("unknown type {}", id);
            return label(id);
        }
        return entry.kind == TypeKind.VOID ? "()" : entry.name;
    }

    /**
     * Get whether a type is known to be a function type.
     *
     * @param id The type id.
     * @return Whether it is a function.
     */
    public boolean isFunction(long id) {
        TypeEntry entry = byId.get(id);
        return entry != null && entry.kind == TypeKind.FUNCTION;
    }

    public int size() {
        return byId.size();
    }
}
