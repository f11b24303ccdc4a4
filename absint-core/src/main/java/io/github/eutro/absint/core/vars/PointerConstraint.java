package io.github.eutro.absint.core.vars;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A constraint between pointer variables, or between a pointer variable and null.
 */
public final class PointerConstraint {
    public enum Kind {
        TAUTOLOGY,
        CONTRADICTION,
        EQ_NULL,
        NEQ_NULL,
        EQ,
        NEQ
    }

    private final Kind kind;
    private final @Nullable Var lhs;
    private final @Nullable Var rhs;

    private PointerConstraint(Kind kind, @Nullable Var lhs, @Nullable Var rhs) {
        this.kind = kind;
        this.lhs = lhs;
        this.rhs = rhs;
    }

    public static PointerConstraint tautology() {
        return new PointerConstraint(Kind.TAUTOLOGY, null, null);
    }

    public static PointerConstraint contradiction() {
        return new PointerConstraint(Kind.CONTRADICTION, null, null);
    }

    public static PointerConstraint eqNull(Var p) {
        return new PointerConstraint(Kind.EQ_NULL, Objects.requireNonNull(p), null);
    }

    public static PointerConstraint neqNull(Var p) {
        return new PointerConstraint(Kind.NEQ_NULL, Objects.requireNonNull(p), null);
    }

    public static PointerConstraint eq(Var p, Var q) {
        return new PointerConstraint(Kind.EQ, Objects.requireNonNull(p), Objects.requireNonNull(q));
    }

    public static PointerConstraint neq(Var p, Var q) {
        return new PointerConstraint(Kind.NEQ, Objects.requireNonNull(p), Objects.requireNonNull(q));
    }

    public Kind kind() {
        return kind;
    }

    public boolean isTautology() {
        return kind == Kind.TAUTOLOGY;
    }

    public boolean isContradiction() {
        return kind == Kind.CONTRADICTION;
    }

    /**
     * Get whether this constraint mentions exactly one variable.
     *
     * @return Whether this is a comparison against null.
     */
    public boolean isUnary() {
        return kind == Kind.EQ_NULL || kind == Kind.NEQ_NULL;
    }

    /**
     * Get the left operand.
     *
     * @return The left operand.
     * @throws IllegalStateException If this is a tautology or a contradiction.
     */
    public Var lhs() {
        if (lhs == null) throw new IllegalStateException("pointer constraint " + this + " has no operands");
        return lhs;
    }

    /**
     * Get the right operand.
     *
     * @return The right operand.
     * @throws IllegalStateException If this constraint is not binary.
     */
    public Var rhs() {
        if (rhs == null) throw new IllegalStateException("pointer constraint " + this + " is not binary");
        return rhs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PointerConstraint)) return false;
        PointerConstraint that = (PointerConstraint) o;
        return kind == that.kind && Objects.equals(lhs, that.lhs) && Objects.equals(rhs, that.rhs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, lhs, rhs);
    }

    @Override
    public String toString() {
        switch (kind) {
            case TAUTOLOGY:
                return "true";
            case CONTRADICTION:
                return "false";
            case EQ_NULL:
                return lhs + " == NULL";
            case NEQ_NULL:
                return lhs + " != NULL";
            case EQ:
                return lhs + " == " + rhs;
            case NEQ:
                return lhs + " != " + rhs;
            default:
                throw new IllegalStateException();
        }
    }
}
