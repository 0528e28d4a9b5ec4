package io.github.eutro.mirlens.core.ir;

/**
 * The kind of an outgoing {@link Edge}.
 */
public enum EdgeKind {
    /**
     * Ordinary control transfer.
     */
    NORMAL("normal"),
    /**
     * Transfer to an unwind/cleanup block.
     */
    CLEANUP("cleanup"),
    /**
     * The fallthrough of a switch, taken when no value matches.
     */
    OTHERWISE("otherwise"),
    /**
     * A switch arm taken on a specific value.
     */
    BRANCH("branch"),
    ;

    private final String id;

    EdgeKind(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }
}
