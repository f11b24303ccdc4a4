package io.github.eutro.absint.core.cfg;

import io.github.eutro.absint.core.vars.Var;

import java.util.Objects;

/**
 * {@code lhs = &object}, where {@code object} is an abstract allocation site.
 */
public final class PtrObject extends Statement {
    private final Var lhs;
    private final long address;

    public PtrObject(Var lhs, long address) {
        super(StatementCode.PTR_OBJECT, DebugInfo.NONE);
        this.lhs = Objects.requireNonNull(lhs);
        this.address = address;
        live.addDef(lhs);
    }

    public Var lhs() {
        return lhs;
    }

    public long address() {
        return address;
    }

    @Override
    public PtrObject copy() {
        return new PtrObject(lhs, address);
    }

    @Override
    public void accept(StatementVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public String toString() {
        return lhs + " = &(" + address + ")";
    }
}
