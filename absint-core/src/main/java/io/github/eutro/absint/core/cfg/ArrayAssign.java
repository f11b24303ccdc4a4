package io.github.eutro.absint.core.cfg;

import io.github.eutro.absint.core.vars.Var;

import java.util.Objects;

/**
 * {@code lhs = rhs} for two arrays of the same type.
 */
public final class ArrayAssign extends Statement {
    private final Var lhs;
    private final Var rhs;

    public ArrayAssign(Var lhs, Var rhs) {
        super(StatementCode.ARR_ASSIGN, DebugInfo.NONE);
        this.lhs = Objects.requireNonNull(lhs);
        this.rhs = Objects.requireNonNull(rhs);
        requireArray("array_assign", lhs);
        if (lhs.type() != rhs.type()) {
            throw new IllegalArgumentException(String.format(
                    "array_assign operands must have the same type" +
                            "\n  lhs: %s:%s" +
                            "\n  rhs: %s:%s",
                    lhs, lhs.type(),
                    rhs, rhs.type()));
        }
        live.addDef(lhs);
        live.addUse(rhs);
    }

    public Var lhs() {
        return lhs;
    }

    public Var rhs() {
        return rhs;
    }

    @Override
    public ArrayAssign copy() {
        return new ArrayAssign(lhs, rhs);
    }

    @Override
    public void accept(StatementVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public String toString() {
        return lhs + " = " + rhs;
    }
}
