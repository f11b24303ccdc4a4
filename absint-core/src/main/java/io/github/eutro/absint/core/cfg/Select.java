package io.github.eutro.absint.core.cfg;

import io.github.eutro.absint.core.vars.LinearConstraint;
import io.github.eutro.absint.core.vars.LinearExpression;
import io.github.eutro.absint.core.vars.Var;

import java.util.Objects;

/**
 * {@code lhs = cond ? ifTrue : ifFalse}.
 */
public final class Select extends Statement {
    private final Var lhs;
    private final LinearConstraint cond;
    private final LinearExpression ifTrue;
    private final LinearExpression ifFalse;

    public Select(Var lhs, LinearConstraint cond, LinearExpression ifTrue, LinearExpression ifFalse) {
        super(StatementCode.SELECT, DebugInfo.NONE);
        this.lhs = Objects.requireNonNull(lhs);
        this.cond = Objects.requireNonNull(cond);
        this.ifTrue = Objects.requireNonNull(ifTrue);
        this.ifFalse = Objects.requireNonNull(ifFalse);
        live.addDef(lhs);
        live.addUses(cond.variables());
        live.addUses(ifTrue.variables());
        live.addUses(ifFalse.variables());
    }

    public Var lhs() {
        return lhs;
    }

    public LinearConstraint cond() {
        return cond;
    }

    public LinearExpression ifTrue() {
        return ifTrue;
    }

    public LinearExpression ifFalse() {
        return ifFalse;
    }

    @Override
    public Select copy() {
        return new Select(lhs, cond, ifTrue, ifFalse);
    }

    @Override
    public void accept(StatementVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public String toString() {
        return lhs + " = ite(" + cond + "," + ifTrue + "," + ifFalse + ")";
    }
}
