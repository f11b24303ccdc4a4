package io.github.eutro.absint.core.cfg;

import io.github.eutro.absint.core.vars.PointerConstraint;

import java.util.Objects;

/**
 * Restrict execution to states satisfying a pointer constraint.
 */
public final class PtrAssume extends Statement {
    private final PointerConstraint constraint;

    public PtrAssume(PointerConstraint constraint) {
        super(StatementCode.PTR_ASSUME, DebugInfo.NONE);
        this.constraint = Objects.requireNonNull(constraint);
        addConstraintUses(live, constraint);
    }

    public PointerConstraint constraint() {
        return constraint;
    }

    static void addConstraintUses(Live live, PointerConstraint constraint) {
        if (constraint.isTautology() || constraint.isContradiction()) return;
        live.addUse(constraint.lhs());
        if (!constraint.isUnary()) {
            live.addUse(constraint.rhs());
        }
    }

    @Override
    public PtrAssume copy() {
        return new PtrAssume(constraint);
    }

    @Override
    public void accept(StatementVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public String toString() {
        return "assume_ptr(" + constraint + ")";
    }
}
