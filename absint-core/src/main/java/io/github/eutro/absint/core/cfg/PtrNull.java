package io.github.eutro.absint.core.cfg;

import io.github.eutro.absint.core.vars.Var;

import java.util.Objects;

/**
 * {@code lhs = NULL}.
 */
public final class PtrNull extends Statement {
    private final Var lhs;

    public PtrNull(Var lhs) {
        super(StatementCode.PTR_NULL, DebugInfo.NONE);
        this.lhs = Objects.requireNonNull(lhs);
        live.addDef(lhs);
    }

    public Var lhs() {
        return lhs;
    }

    @Override
    public PtrNull copy() {
        return new PtrNull(lhs);
    }

    @Override
    public void accept(StatementVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public String toString() {
        return lhs + " = NULL";
    }
}
