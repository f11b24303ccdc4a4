package io.github.eutro.absint.core.cfg;

import io.github.eutro.absint.core.vars.LinearExpression;
import io.github.eutro.absint.core.vars.Var;

import java.util.Objects;

/**
 * Assume every cell of {@code array} between {@code lb} and {@code ub}, in steps of {@code elemSize},
 * holds {@code value}.
 * <p>
 * The bounds and the value must each be a constant or a single variable.
 */
public final class ArrayAssume extends Statement {
    private final Var array;
    private final long elemSize;
    private final LinearExpression lb;
    private final LinearExpression ub;
    private final LinearExpression value;

    public ArrayAssume(Var array, long elemSize, LinearExpression lb, LinearExpression ub, LinearExpression value) {
        super(StatementCode.ARR_ASSUME, DebugInfo.NONE);
        this.array = Objects.requireNonNull(array);
        this.elemSize = elemSize;
        this.lb = Objects.requireNonNull(lb);
        this.ub = Objects.requireNonNull(ub);
        this.value = Objects.requireNonNull(value);
        requireArray("array_assume", array);
        requireConstantOrVariable("array_assume lower bound", lb);
        requireConstantOrVariable("array_assume upper bound", ub);
        requireConstantOrVariable("array_assume value", value);
        live.addUse(array);
        live.addUses(lb.variables());
        live.addUses(ub.variables());
        live.addUses(value.variables());
    }

    public Var array() {
        return array;
    }

    public long elemSize() {
        return elemSize;
    }

    public LinearExpression lb() {
        return lb;
    }

    public LinearExpression ub() {
        return ub;
    }

    public LinearExpression value() {
        return value;
    }

    @Override
    public ArrayAssume copy() {
        return new ArrayAssume(array, elemSize, lb, ub, value);
    }

    @Override
    public void accept(StatementVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public String toString() {
        return "assume (forall l in [" + lb + "," + ub + "] % " + elemSize + " :: " + array + "[l]=" + value + ")";
    }
}
