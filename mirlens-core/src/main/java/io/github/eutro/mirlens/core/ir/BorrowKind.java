package io.github.eutro.mirlens.core.ir;

/**
 * The kind of a reference-creating operation.
 */
public enum BorrowKind {
    /**
     * {@code &T}.
     */
    SHARED("shared"),
    /**
     * {@code &mut T}.
     */
    MUTABLE("mutable"),
    /**
     * A fake borrow, used by match guards.
     */
    SHALLOW("shallow"),
    ;

    private final String id;

    BorrowKind(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }
}
