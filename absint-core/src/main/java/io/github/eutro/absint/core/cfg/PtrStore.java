package io.github.eutro.absint.core.cfg;

import io.github.eutro.absint.core.vars.Var;

import java.util.Objects;

/**
 * {@code *lhs = rhs}.
 * <p>
 * Both operands are uses; nothing is defined.
 */
public final class PtrStore extends Statement {
    private final Var lhs;
    private final Var rhs;

    public PtrStore(Var lhs, Var rhs, DebugInfo debugInfo) {
        super(StatementCode.PTR_STORE, debugInfo);
        this.lhs = Objects.requireNonNull(lhs);
        this.rhs = Objects.requireNonNull(rhs);
        live.addUse(lhs);
        live.addUse(rhs);
    }

    public PtrStore(Var lhs, Var rhs) {
        this(lhs, rhs, DebugInfo.NONE);
    }

    public Var lhs() {
        return lhs;
    }

    public Var rhs() {
        return rhs;
    }

    @Override
    public PtrStore copy() {
        return new PtrStore(lhs, rhs, debugInfo());
    }

    @Override
    public void accept(StatementVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public String toString() {
        return "*(" + lhs + ") = " + rhs;
    }
}
