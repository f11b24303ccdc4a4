package io.github.eutro.absint.core.cfg;

import io.github.eutro.absint.core.vars.LinearConstraint;

import java.util.Objects;

/**
 * A linear constraint that should hold, to be checked by an analysis.
 */
public final class Assert extends Statement {
    private final LinearConstraint constraint;

    public Assert(LinearConstraint constraint, DebugInfo debugInfo) {
        super(StatementCode.ASSERT, debugInfo);
        this.constraint = Objects.requireNonNull(constraint);
        live.addUses(constraint.variables());
    }

    public Assert(LinearConstraint constraint) {
        this(constraint, DebugInfo.NONE);
    }

    public LinearConstraint constraint() {
        return constraint;
    }

    @Override
    public Assert copy() {
        return new Assert(constraint, debugInfo());
    }

    @Override
    public void accept(StatementVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public String toString() {
        return "assert (" + constraint + ")";
    }
}
