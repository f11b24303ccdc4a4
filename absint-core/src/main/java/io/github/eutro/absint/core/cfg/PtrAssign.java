package io.github.eutro.absint.core.cfg;

import io.github.eutro.absint.core.vars.LinearExpression;
import io.github.eutro.absint.core.vars.Var;

import java.util.Objects;

/**
 * {@code lhs = &rhs + offset}, pointer arithmetic.
 */
public final class PtrAssign extends Statement {
    private final Var lhs;
    private final Var rhs;
    private final LinearExpression offset;

    public PtrAssign(Var lhs, Var rhs, LinearExpression offset) {
        super(StatementCode.PTR_ASSIGN, DebugInfo.NONE);
        this.lhs = Objects.requireNonNull(lhs);
        this.rhs = Objects.requireNonNull(rhs);
        this.offset = Objects.requireNonNull(offset);
        live.addDef(lhs);
        live.addUse(rhs);
        live.addUses(offset.variables());
    }

    public Var lhs() {
        return lhs;
    }

    public Var rhs() {
        return rhs;
    }

    public LinearExpression offset() {
        return offset;
    }

    @Override
    public PtrAssign copy() {
        return new PtrAssign(lhs, rhs, offset);
    }

    @Override
    public void accept(StatementVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public String toString() {
        return lhs + " = &(" + rhs + ") + " + offset;
    }
}
