package io.github.eutro.absint.core.cfg;

import io.github.eutro.absint.core.vars.Var;

import java.util.Objects;

/**
 * A boolean that should hold, to be checked by an analysis.
 */
public final class BoolAssert extends Statement {
    private final Var cond;

    public BoolAssert(Var cond, DebugInfo debugInfo) {
        super(StatementCode.BOOL_ASSERT, debugInfo);
        this.cond = Objects.requireNonNull(cond);
        live.addUse(cond);
    }

    public BoolAssert(Var cond) {
        this(cond, DebugInfo.NONE);
    }

    public Var cond() {
        return cond;
    }

    @Override
    public BoolAssert copy() {
        return new BoolAssert(cond, debugInfo());
    }

    @Override
    public void accept(StatementVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public String toString() {
        return "assert (" + cond + ")";
    }
}
