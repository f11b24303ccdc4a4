package io.github.eutro.absint.core.cfg;

/**
 * Operators of a {@link BinaryOp}.
 */
public enum BinaryOperation {
    ADD("+"),
    SUB("-"),
    MUL("*"),
    SDIV("/"),
    UDIV("/_u"),
    SREM("%"),
    UREM("%_u"),
    AND("&"),
    OR("|"),
    XOR("^"),
    SHL("<<"),
    LSHR(">>_l"),
    ASHR(">>_r");

    private final String symbol;

    BinaryOperation(String symbol) {
        this.symbol = symbol;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
