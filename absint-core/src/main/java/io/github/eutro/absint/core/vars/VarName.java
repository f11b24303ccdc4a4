package io.github.eutro.absint.core.vars;

import org.jetbrains.annotations.NotNull;

/**
 * An interned variable name, as handed out by a {@link VariableFactory}.
 * <p>
 * Names are compared by their index alone, so two names from different factories
 * may compare equal. Do not mix factories within one CFG.
 */
public final class VarName implements Comparable<VarName> {
    private final String name;
    private final long index;

    VarName(String name, long index) {
        this.name = name;
        this.index = index;
    }

    /**
     * Get the string this name was interned from.
     *
     * @return The string.
     */
    public String str() {
        return name;
    }

    /**
     * Get the dense index of this name.
     *
     * @return The index.
     */
    public long index() {
        return index;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VarName)) return false;
        return index == ((VarName) o).index;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(index);
    }

    @Override
    public int compareTo(@NotNull VarName o) {
        return Long.compare(index, o.index);
    }

    @Override
    public String toString() {
        return name;
    }
}
