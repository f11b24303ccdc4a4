package io.github.eutro.absint.core.cfg;

import io.github.eutro.absint.core.vars.LinearExpression;
import io.github.eutro.absint.core.vars.Var;

import java.util.Objects;

/**
 * {@code lhs = left op right}.
 */
public final class BinaryOp extends Statement {
    private final Var lhs;
    private final BinaryOperation op;
    private final LinearExpression left;
    private final LinearExpression right;

    public BinaryOp(Var lhs, BinaryOperation op, LinearExpression left, LinearExpression right, DebugInfo debugInfo) {
        super(StatementCode.BIN_OP, debugInfo);
        this.lhs = Objects.requireNonNull(lhs);
        this.op = Objects.requireNonNull(op);
        this.left = Objects.requireNonNull(left);
        this.right = Objects.requireNonNull(right);
        live.addDef(lhs);
        live.addUses(left.variables());
        live.addUses(right.variables());
    }

    public BinaryOp(Var lhs, BinaryOperation op, LinearExpression left, LinearExpression right) {
        this(lhs, op, left, right, DebugInfo.NONE);
    }

    public Var lhs() {
        return lhs;
    }

    public BinaryOperation op() {
        return op;
    }

    public LinearExpression left() {
        return left;
    }

    public LinearExpression right() {
        return right;
    }

    @Override
    public BinaryOp copy() {
        return new BinaryOp(lhs, op, left, right, debugInfo());
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
