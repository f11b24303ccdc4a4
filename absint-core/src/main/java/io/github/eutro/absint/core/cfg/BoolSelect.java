package io.github.eutro.absint.core.cfg;

import io.github.eutro.absint.core.vars.Var;

import java.util.Objects;

/**
 * {@code lhs = cond ? ifTrue : ifFalse} over booleans.
 */
public final class BoolSelect extends Statement {
    private final Var lhs;
    private final Var cond;
    private final Var ifTrue;
    private final Var ifFalse;

    public BoolSelect(Var lhs, Var cond, Var ifTrue, Var ifFalse) {
        super(StatementCode.BOOL_SELECT, DebugInfo.NONE);
        this.lhs = Objects.requireNonNull(lhs);
        this.cond = Objects.requireNonNull(cond);
        this.ifTrue = Objects.requireNonNull(ifTrue);
        this.ifFalse = Objects.requireNonNull(ifFalse);
        live.addDef(lhs);
        live.addUse(cond);
        live.addUse(ifTrue);
        live.addUse(ifFalse);
    }

    public Var lhs() {
        return lhs;
    }

    public Var cond() {
        return cond;
    }

    public Var ifTrue() {
        return ifTrue;
    }

    public Var ifFalse() {
        return ifFalse;
    }

    @Override
    public BoolSelect copy() {
        return new BoolSelect(lhs, cond, ifTrue, ifFalse);
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
