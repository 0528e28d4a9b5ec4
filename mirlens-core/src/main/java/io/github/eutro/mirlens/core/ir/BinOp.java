package io.github.eutro.mirlens.core.ir;

/**
 * Binary operators, with their source symbol and a descriptive name.
 */
public enum BinOp {
    ADD("+", "Add"),
    ADD_UNCHECKED("+", "Add"),
    SUB("-", "Subtract"),
    SUB_UNCHECKED("-", "Subtract"),
    MUL("*", "Multiply"),
    MUL_UNCHECKED("*", "Multiply"),
    DIV("/", "Divide"),
    REM("%", "Remainder"),
    BIT_XOR("^", "Binary"),
    BIT_AND("&", "Binary"),
    BIT_OR("|", "Binary"),
    SHL("<<", "Binary"),
    SHL_UNCHECKED("<<", "Binary"),
    SHR(">>", "Binary"),
    SHR_UNCHECKED(">>", "Binary"),
    EQ("==", "Equality"),
    LT("<", "Comparison"),
    LE("<=", "Comparison"),
    NE("!=", "Inequality"),
    GE(">=", "Comparison"),
    GT(">", "Comparison"),
    CMP("<=>", "Comparison"),
    OFFSET("offset", "Binary"),
    ;

    private final String symbol;
    private final String description;

    BinOp(String symbol, String description) {
        this.symbol = symbol;
        this.description = description;
    }

    public String getSymbol() {
        return symbol;
    }

    public String getDescription() {
        return description;
    }

    /**
     * The name as the compiler prints it, e.g. {@code AddUnchecked}.
     *
     * @return The name.
     */
    public String debugName() {
        StringBuilder sb = new StringBuilder();
        for (String part : name().split("_")) {
            sb.append(part.charAt(0)).append(part.substring(1).toLowerCase());
        }
        return sb.toString();
    }
}
