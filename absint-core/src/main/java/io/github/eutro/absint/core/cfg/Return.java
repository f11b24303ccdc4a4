package io.github.eutro.absint.core.cfg;

import io.github.eutro.absint.core.vars.Var;

import java.util.Collections;
import java.util.List;
import java.util.StringJoiner;

/**
 * Return some values from the function.
 */
public final class Return extends Statement {
    private final List<Var> values;

    public Return(List<Var> values) {
        super(StatementCode.RETURN, DebugInfo.NONE);
        this.values = FunctionDecl.copyVars("returned values", values);
        live.addUses(this.values);
    }

    public Return(Var value) {
        this(Collections.singletonList(value));
    }

    public List<Var> values() {
        return values;
    }

    @Override
    public Return copy() {
        return new Return(values);
    }

    @Override
    public void accept(StatementVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public String toString() {
        if (values.size() == 1) {
            return "return " + values.get(0);
        }
        StringJoiner sj = new StringJoiner(",", "return (", ")");
        for (Var v : values) {
            sj.add(v.toString());
        }
        return sj.toString();
    }
}
