package io.github.eutro.absint.core.cfg;

import io.github.eutro.absint.core.vars.Var;

import java.util.Objects;

/**
 * Forget everything known about a variable.
 */
public final class Havoc extends Statement {
    private final Var lhs;

    public Havoc(Var lhs) {
        super(StatementCode.HAVOC, DebugInfo.NONE);
        this.lhs = Objects.requireNonNull(lhs);
        live.addDef(lhs);
    }

    public Var lhs() {
        return lhs;
    }

    @Override
    public Havoc copy() {
        return new Havoc(lhs);
    }

    @Override
    public void accept(StatementVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public String toString() {
        return lhs + " =*";
    }
}
