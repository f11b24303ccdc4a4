package io.github.eutro.absint.core.cfg;

/**
 * Marks a point that no execution reaches.
 */
public final class Unreachable extends Statement {
    public Unreachable() {
        super(StatementCode.UNREACH, DebugInfo.NONE);
    }

    @Override
    public Unreachable copy() {
        return new Unreachable();
    }

    @Override
    public void accept(StatementVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public String toString() {
        return "unreachable";
    }
}
