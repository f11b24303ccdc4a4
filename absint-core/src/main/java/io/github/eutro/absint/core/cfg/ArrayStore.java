package io.github.eutro.absint.core.cfg;

import io.github.eutro.absint.core.vars.LinearExpression;
import io.github.eutro.absint.core.vars.Var;

import java.util.Objects;

/**
 * {@code array[index] = value}, where {@code value} is a constant or a single variable.
 */
public final class ArrayStore extends Statement {
    private final Var array;
    private final LinearExpression index;
    private final LinearExpression value;
    private final long elemSize;
    private final boolean singleton;

    /**
     * Construct an array store.
     *
     * @param array     The array, which must have an array type.
     * @param index     The index written.
     * @param value     The value written.
     * @param elemSize  The size of an element, in bytes.
     * @param singleton Whether the store is known to write a single cell; false if unknown.
     */
    public ArrayStore(Var array, LinearExpression index, LinearExpression value, long elemSize, boolean singleton) {
        super(StatementCode.ARR_STORE, DebugInfo.NONE);
        this.array = Objects.requireNonNull(array);
        this.index = Objects.requireNonNull(index);
        this.value = Objects.requireNonNull(value);
        this.elemSize = elemSize;
        this.singleton = singleton;
        requireArray("array_store", array);
        requireConstantOrVariable("array_store value", value);
        live.addUse(array);
        live.addUses(index.variables());
        live.addUses(value.variables());
    }

    public Var array() {
        return array;
    }

    public LinearExpression index() {
        return index;
    }

    public LinearExpression value() {
        return value;
    }

    public long elemSize() {
        return elemSize;
    }

    public boolean isSingleton() {
        return singleton;
    }

    @Override
    public ArrayStore copy() {
        return new ArrayStore(array, index, value, elemSize, singleton);
    }

    @Override
    public void accept(StatementVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public String toString() {
        return "array_store(" + array + "," + index + "," + value + ")";
    }
}
