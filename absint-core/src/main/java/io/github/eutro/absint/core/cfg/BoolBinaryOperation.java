package io.github.eutro.absint.core.cfg;

/**
 * Operators of a {@link BoolBinaryOp}.
 */
public enum BoolBinaryOperation {
    AND("&"),
    OR("|"),
    XOR("^");

    private final String symbol;

    BoolBinaryOperation(String symbol) {
        this.symbol = symbol;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
