package io.github.eutro.absint.core.cfg;

import io.github.eutro.absint.core.vars.LinearConstraint;
import io.github.eutro.absint.core.vars.Var;

import java.util.Objects;

/**
 * {@code lhs = (rhs)}, reifying a linear constraint into a boolean.
 */
public final class BoolAssignCst extends Statement {
    private final Var lhs;
    private final LinearConstraint rhs;

    public BoolAssignCst(Var lhs, LinearConstraint rhs) {
        super(StatementCode.BOOL_ASSIGN_CST, DebugInfo.NONE);
        this.lhs = Objects.requireNonNull(lhs);
        this.rhs = Objects.requireNonNull(rhs);
        live.addDef(lhs);
        live.addUses(rhs.variables());
    }

    public Var lhs() {
        return lhs;
    }

    public LinearConstraint rhs() {
        return rhs;
    }

    @Override
    public BoolAssignCst copy() {
        return new BoolAssignCst(lhs, rhs);
    }

    @Override
    public void accept(StatementVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public String toString() {
        if (rhs.isTautology()) return lhs + " = true";
        if (rhs.isContradiction()) return lhs + " = false";
        return lhs + " = (" + rhs + ")";
    }
}
