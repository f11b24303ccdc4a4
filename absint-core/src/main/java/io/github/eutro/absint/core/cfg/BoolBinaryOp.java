package io.github.eutro.absint.core.cfg;

import io.github.eutro.absint.core.vars.Var;

import java.util.Objects;

/**
 * {@code lhs = left op right} over booleans.
 */
public final class BoolBinaryOp extends Statement {
    private final Var lhs;
    private final BoolBinaryOperation op;
    private final Var left;
    private final Var right;

    public BoolBinaryOp(Var lhs, BoolBinaryOperation op, Var left, Var right, DebugInfo debugInfo) {
        super(StatementCode.BOOL_BIN_OP, debugInfo);
        this.lhs = Objects.requireNonNull(lhs);
        this.op = Objects.requireNonNull(op);
        this.left = Objects.requireNonNull(left);
        this.right = Objects.requireNonNull(right);
        live.addDef(lhs);
        live.addUse(left);
        live.addUse(right);
    }

    public BoolBinaryOp(Var lhs, BoolBinaryOperation op, Var left, Var right) {
        this(lhs, op, left, right, DebugInfo.NONE);
    }

    public Var lhs() {
        return lhs;
    }

    public BoolBinaryOperation op() {
        return op;
    }

    public Var left() {
        return left;
    }

    public Var right() {
        return right;
    }

    @Override
    public BoolBinaryOp copy() {
        return new BoolBinaryOp(lhs, op, left, right, debugInfo());
    }

    @Override
    public void accept(StatementVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public String toString() {
        return lhs + " = " + left + op + right;
    }
}
