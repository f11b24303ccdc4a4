package io.github.eutro.absint.core.cfg;

import io.github.eutro.absint.core.vars.Var;
import io.github.eutro.absint.core.vars.VarType;

import java.util.*;

/**
 * The signature of the function a {@link Cfg} represents: a name, ordered inputs and ordered outputs.
 * <p>
 * No variable may be both an input and an output.
 */
public final class FunctionDecl {
    private final String name;
    private final List<Var> inputs;
    private final List<Var> outputs;

    public FunctionDecl(String name, List<Var> inputs, List<Var> outputs) {
        this.name = Objects.requireNonNull(name, "name");
        this.inputs = copyVars("function inputs", inputs);
        this.outputs = copyVars("function outputs", outputs);

        Set<Var> shared = new LinkedHashSet<>(this.inputs);
        shared.retainAll(this.outputs);
        if (!shared.isEmpty()) {
            throw new IllegalArgumentException(String.format(
                    "inputs and outputs of a function must be disjoint" +
                            "\n  function: %s" +
                            "\n  shared: %s",
                    name,
                    shared));
        }
    }

    static List<Var> copyVars(String what, List<Var> vars) {
        Objects.requireNonNull(vars, what);
        List<Var> copy = new ArrayList<>(vars.size());
        for (Var v : vars) {
            if (v == null) {
                throw new IllegalArgumentException(String.format(
                        "%s must not contain null" +
                                "\n  got: %s",
                        what,
                        vars));
            }
            copy.add(v);
        }
        return Collections.unmodifiableList(copy);
    }

    public String name() {
        return name;
    }

    public List<Var> inputs() {
        return inputs;
    }

    public List<Var> outputs() {
        return outputs;
    }

    public int numInputs() {
        return inputs.size();
    }

    public int numOutputs() {
        return outputs.size();
    }

    /**
     * Get an input by position.
     *
     * @param idx The index.
     * @return The input.
     * @throws IndexOutOfBoundsException If there is no such input.
     */
    public Var getInput(int idx) {
        Objects.checkIndex(idx, inputs.size());
        return inputs.get(idx);
    }

    public Var getOutput(int idx) {
        Objects.checkIndex(idx, outputs.size());
        return outputs.get(idx);
    }

    public VarType getInputType(int idx) {
        return getInput(idx).type();
    }

    public VarType getOutputType(int idx) {
        return getOutput(idx).type();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FunctionDecl)) return false;
        FunctionDecl that = (FunctionDecl) o;
        return name.equals(that.name)
                && inputs.equals(that.inputs)
                && outputs.equals(that.outputs)
                && CfgHasher.types(inputs).equals(CfgHasher.types(that.inputs))
                && CfgHasher.types(outputs).equals(CfgHasher.types(that.outputs));
    }

    @Override
    public int hashCode() {
        return CfgHasher.hash(this);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (outputs.size() == 1) {
            sb.append(typed(outputs.get(0))).append(' ');
        } else if (!outputs.isEmpty()) {
            StringJoiner sj = new StringJoiner(",", "(", ") ");
            for (Var v : outputs) {
                sj.add(typed(v));
            }
            sb.append(sj);
        }
        sb.append("declare ").append(name);
        StringJoiner sj = new StringJoiner(",", "(", ")");
        for (Var v : inputs) {
            sj.add(typed(v));
        }
        return sb.append(sj).toString();
    }

    private static String typed(Var v) {
        return v + ":" + v.type();
    }
}
