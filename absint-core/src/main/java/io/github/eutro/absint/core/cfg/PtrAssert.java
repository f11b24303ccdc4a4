package io.github.eutro.absint.core.cfg;

import io.github.eutro.absint.core.vars.PointerConstraint;

import java.util.Objects;

/**
 * A pointer constraint that should hold, to be checked by an analysis.
 */
public final class PtrAssert extends Statement {
    private final PointerConstraint constraint;

    public PtrAssert(PointerConstraint constraint, DebugInfo debugInfo) {
        super(StatementCode.PTR_ASSERT, debugInfo);
        this.constraint = Objects.requireNonNull(constraint);
        PtrAssume.addConstraintUses(live, constraint);
    }

    public PtrAssert(PointerConstraint constraint) {
        this(constraint, DebugInfo.NONE);
    }

    public PointerConstraint constraint() {
        return constraint;
    }

    @Override
    public PtrAssert copy() {
        return new PtrAssert(constraint, debugInfo());
    }

    @Override
    public void accept(StatementVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public String toString() {
        return "assert_ptr(" + constraint + ")";
    }
}
