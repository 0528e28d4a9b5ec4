package io.github.eutro.mirlens.core.index;

/**
 * A row of the function symbol table.
 */
public final class FunctionSymbol {
    public enum Kind {
        NORMAL,
        NO_OP,
        INTRINSIC,
    }

    public final FunctionKey key;
    public final Kind kind;
    public final String name;

    public FunctionSymbol(FunctionKey key, Kind kind, String name) {
        this.key = key;
        this.kind = kind;
        this.name = name;
    }

    /**
     * Get the display name of this symbol.
     *
     * @return The name, prefixed with {@code NoOp: } or {@code Intr: } for those kinds.
     */
    public String displayName() {
        switch (kind) {
            case NO_OP:
                return "NoOp: " + name;
            case INTRINSIC:
                return "Intr: " + name;
            default:
                return name;
        }
    }
}
