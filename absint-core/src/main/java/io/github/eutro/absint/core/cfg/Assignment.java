package io.github.eutro.absint.core.cfg;

import io.github.eutro.absint.core.vars.LinearExpression;
import io.github.eutro.absint.core.vars.Var;

import java.util.Objects;

/**
 * {@code lhs = rhs}, for a linear expression {@code rhs}.
 */
public final class Assignment extends Statement {
    private final Var lhs;
    private final LinearExpression rhs;

    public Assignment(Var lhs, LinearExpression rhs, DebugInfo debugInfo) {
        super(StatementCode.ASSIGN, debugInfo);
        this.lhs = Objects.requireNonNull(lhs);
        this.rhs = Objects.requireNonNull(rhs);
        live.addDef(lhs);
        live.addUses(rhs.variables());
    }

    public Assignment(Var lhs, LinearExpression rhs) {
        this(lhs, rhs, DebugInfo.NONE);
    }

    public Var lhs() {
        return lhs;
    }

    public LinearExpression rhs() {
        return rhs;
    }

    @Override
    public Assignment copy() {
        return new Assignment(lhs, rhs, debugInfo());
    }

    @Override
    public void accept(StatementVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public String toString() {
        return lhs + " = " + rhs;
    }
}
