package io.github.eutro.absint.core.cfg;

import io.github.eutro.absint.core.vars.Var;
import io.github.eutro.absint.core.vars.VarName;

import java.util.Objects;

/**
 * {@code lhs = &function}. Function names are assumed unique.
 */
public final class PtrFunction extends Statement {
    private final Var lhs;
    private final VarName function;

    public PtrFunction(Var lhs, VarName function) {
        super(StatementCode.PTR_FUNCTION, DebugInfo.NONE);
        this.lhs = Objects.requireNonNull(lhs);
        this.function = Objects.requireNonNull(function);
        live.addDef(lhs);
    }

    public Var lhs() {
        return lhs;
    }

    public VarName function() {
        return function;
    }

    @Override
    public PtrFunction copy() {
        return new PtrFunction(lhs, function);
    }

    @Override
    public void accept(StatementVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public String toString() {
        return lhs + " = &(" + function + ")";
    }
}
