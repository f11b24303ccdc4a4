package io.github.eutro.absint.core.cfg;

import io.github.eutro.absint.core.vars.LinearExpression;
import io.github.eutro.absint.core.vars.Var;

import java.util.Objects;

/**
 * {@code lhs = array[index]}.
 */
public final class ArrayLoad extends Statement {
    private final Var lhs;
    private final Var array;
    private final LinearExpression index;
    private final long elemSize;

    public ArrayLoad(Var lhs, Var array, LinearExpression index, long elemSize) {
        super(StatementCode.ARR_LOAD, DebugInfo.NONE);
        this.lhs = Objects.requireNonNull(lhs);
        this.array = Objects.requireNonNull(array);
        this.index = Objects.requireNonNull(index);
        this.elemSize = elemSize;
        requireArray("array_load", array);
        live.addDef(lhs);
        live.addUse(array);
        live.addUses(index.variables());
    }

    public Var lhs() {
        return lhs;
    }

    public Var array() {
        return array;
    }

    public LinearExpression index() {
        return index;
    }

    public long elemSize() {
        return elemSize;
    }

    @Override
    public ArrayLoad copy() {
        return new ArrayLoad(lhs, array, index, elemSize);
    }

    @Override
    public void accept(StatementVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public String toString() {
        return lhs + " = array_load(" + array + "," + index + ")";
    }
}
