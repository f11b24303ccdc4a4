package io.github.eutro.absint.core.vars;

import java.util.Objects;

/**
 * A typed program variable: a name, a {@link VarType type} and a bit width.
 * <p>
 * Identity is the name alone; the type and width are attributes that the
 * {@link io.github.eutro.absint.core.passes.meta.TypeCheck type checker} validates.
 */
public final class Var {
    private final VarName name;
    private final VarType type;
    private final int bitwidth;

    /**
     * Construct a variable.
     *
     * @param name     The interned name.
     * @param type     The type.
     * @param bitwidth The bit width, which must be positive.
     */
    public Var(VarName name, VarType type, int bitwidth) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        if (bitwidth <= 0) {
            throw new IllegalArgumentException(String.format(
                    "variable must have a positive bitwidth" +
                            "\n  variable: %s" +
                            "\n  bitwidth: %d",
                    name,
                    bitwidth));
        }
        this.bitwidth = bitwidth;
    }

    /**
     * Construct a variable whose type has no meaningful width, such as a pointer or array.
     *
     * @param name The interned name.
     * @param type The type.
     */
    public Var(VarName name, VarType type) {
        this(name, type, 1);
    }

    public VarName name() {
        return name;
    }

    public VarType type() {
        return type;
    }

    public int bitwidth() {
        return bitwidth;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Var)) return false;
        return name.equals(((Var) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name.toString();
    }
}
