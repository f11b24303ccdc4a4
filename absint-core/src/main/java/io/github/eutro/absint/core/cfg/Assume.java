package io.github.eutro.absint.core.cfg;

import io.github.eutro.absint.core.vars.LinearConstraint;

import java.util.Objects;

/**
 * Restrict execution to states satisfying a linear constraint.
 */
public final class Assume extends Statement {
    private final LinearConstraint constraint;

    public Assume(LinearConstraint constraint) {
        super(StatementCode.ASSUME, DebugInfo.NONE);
        this.constraint = Objects.requireNonNull(constraint);
        live.addUses(constraint.variables());
    }

    public LinearConstraint constraint() {
        return constraint;
    }

    @Override
    public Assume copy() {
        return new Assume(constraint);
    }

    @Override
    public void accept(StatementVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public String toString() {
        return "assume (" + constraint + ")";
    }
}
