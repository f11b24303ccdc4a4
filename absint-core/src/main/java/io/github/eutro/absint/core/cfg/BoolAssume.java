package io.github.eutro.absint.core.cfg;

import io.github.eutro.absint.core.vars.Var;

import java.util.Objects;

/**
 * Restrict execution to states where a boolean (or its negation) holds.
 */
public final class BoolAssume extends Statement {
    private final Var cond;
    private final boolean negated;

    public BoolAssume(Var cond, boolean negated) {
        super(StatementCode.BOOL_ASSUME, DebugInfo.NONE);
        this.cond = Objects.requireNonNull(cond);
        this.negated = negated;
        live.addUse(cond);
    }

    public Var cond() {
        return cond;
    }

    public boolean isNegated() {
        return negated;
    }

    @Override
    public BoolAssume copy() {
        return new BoolAssume(cond, negated);
    }

    @Override
    public void accept(StatementVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public String toString() {
        return negated ? "assume (not(" + cond + "))" : "assume (" + cond + ")";
    }
}
