package io.github.eutro.absint.core.cfg;

import io.github.eutro.absint.core.vars.Var;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The variables a statement reads (uses) and writes (defs).
 * <p>
 * Both sets keep the order variables were first recorded in and never contain duplicates.
 * They are filled in while the owning statement is constructed, and read-only afterwards.
 */
public final class Live {
    private final Set<Var> uses = new LinkedHashSet<>();
    private final Set<Var> defs = new LinkedHashSet<>();

    Live() {
    }

    void addUse(Var var) {
        uses.add(var);
    }

    void addUses(Iterable<Var> vars) {
        for (Var var : vars) {
            uses.add(var);
        }
    }

    void addDef(Var var) {
        defs.add(var);
    }

    public Set<Var> uses() {
        return Collections.unmodifiableSet(uses);
    }

    public Set<Var> defs() {
        return Collections.unmodifiableSet(defs);
    }

    /**
     * Get every variable mentioned, uses first, then defs not already used.
     *
     * @return The variables.
     */
    public Set<Var> vars() {
        Set<Var> all = new LinkedHashSet<>(uses);
        all.addAll(defs);
        return all;
    }

    @Override
    public String toString() {
        return "uses=" + uses + " defs=" + defs;
    }
}
