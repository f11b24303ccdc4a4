package io.github.eutro.absint.core.cfg;

import io.github.eutro.absint.core.vars.Var;

import java.util.Objects;

/**
 * {@code lhs = *rhs}.
 */
public final class PtrLoad extends Statement {
    private final Var lhs;
    private final Var rhs;

    public PtrLoad(Var lhs, Var rhs, DebugInfo debugInfo) {
        super(StatementCode.PTR_LOAD, debugInfo);
        this.lhs = Objects.requireNonNull(lhs);
        this.rhs = Objects.requireNonNull(rhs);
        live.addDef(lhs);
        live.addUse(rhs);
    }

    public PtrLoad(Var lhs, Var rhs) {
        this(lhs, rhs, DebugInfo.NONE);
    }

    public Var lhs() {
        return lhs;
    }

    public Var rhs() {
        return rhs;
    }

    @Override
    public PtrLoad copy() {
        return new PtrLoad(lhs, rhs, debugInfo());
    }

    @Override
    public void accept(StatementVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public String toString() {
        return lhs + " = *(" + rhs + ")";
    }
}
