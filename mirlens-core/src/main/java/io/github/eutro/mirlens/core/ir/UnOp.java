package io.github.eutro.mirlens.core.ir;

public enum UnOp {
    NOT("!", "Not"),
    NEG("-", "Neg"),
    PTR_METADATA("metadata", "PtrMetadata"),
    ;

    private final String symbol;
    private final String debugName;

    UnOp(String symbol, String debugName) {
        this.symbol = symbol;
        this.debugName = debugName;
    }

    public String getSymbol() {
        return symbol;
    }

    public String debugName() {
        return debugName;
    }
}
