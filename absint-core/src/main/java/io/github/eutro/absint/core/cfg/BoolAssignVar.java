package io.github.eutro.absint.core.cfg;

import io.github.eutro.absint.core.vars.Var;

import java.util.Objects;

/**
 * {@code lhs = rhs} or {@code lhs = not(rhs)}.
 */
public final class BoolAssignVar extends Statement {
    private final Var lhs;
    private final Var rhs;
    private final boolean negated;

    public BoolAssignVar(Var lhs, Var rhs, boolean negated) {
        super(StatementCode.BOOL_ASSIGN_VAR, DebugInfo.NONE);
        this.lhs = Objects.requireNonNull(lhs);
        this.rhs = Objects.requireNonNull(rhs);
        this.negated = negated;
        live.addDef(lhs);
        live.addUse(rhs);
    }

    public Var lhs() {
        return lhs;
    }

    public Var rhs() {
        return rhs;
    }

    public boolean isRhsNegated() {
        return negated;
    }

    @Override
    public BoolAssignVar copy() {
        return new BoolAssignVar(lhs, rhs, negated);
    }

    @Override
    public void accept(StatementVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public String toString() {
        return lhs + " = " + (negated ? "not(" + rhs + ")" : rhs.toString());
    }
}
