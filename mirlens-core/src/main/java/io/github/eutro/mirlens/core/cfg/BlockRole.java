package io.github.eutro.mirlens.core.cfg;

/**
 * The structural role of a block in its function's control flow graph.
 * <p>
 * Every block has exactly one role. When several apply, the earlier constant wins,
 * except that {@link #RETURN}, {@link #PANIC} and {@link #BRANCH} are decided by
 * the terminator shape and cannot overlap with each other in practice.
 */
public enum BlockRole {
    ENTRY("entry", "entry"),
    CLEANUP("cleanup", "cleanup / unwind"),
    LOOP("loop", "loop"),
    RETURN("return", "return / success"),
    PANIC("panic", "panic path"),
    BRANCH("branch", "branch point"),
    MERGE("merge", "merge point"),
    NORMAL("normal", ""),
    ;

    private final String id;
    private final String title;

    BlockRole(String id, String title) {
        this.id = id;
        this.title = title;
    }

    /**
     * Get the stable lowercase identifier of this role, as used in serialized output.
     *
     * @return The id.
     */
    public String getId() {
        return id;
    }

    /**
     * Get the human-readable title of this role. Empty for {@link #NORMAL}.
     *
     * @return The title.
     */
    public String getTitle() {
        return title;
    }

    public static BlockRole fromId(String id) {
        for (BlockRole role : values()) {
            if (role.id.equals(id)) return role;
        }
        throw new IllegalArgumentException("unknown block role: " + id);
    }
}
