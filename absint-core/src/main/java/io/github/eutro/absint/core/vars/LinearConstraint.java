package io.github.eutro.absint.core.vars;

import java.util.Objects;
import java.util.Set;

/**
 * An immutable linear constraint {@code e ⋈ 0}, where {@code ⋈} is one of
 * {@code =}, {@code !=}, {@code <=} or {@code <}.
 */
public final class LinearConstraint {
    /**
     * The relation between the expression and zero.
     */
    public enum Kind {
        EQUALITY("="),
        DISEQUATION("!="),
        INEQUALITY("<="),
        STRICT_INEQUALITY("<");

        private final String symbol;

        Kind(String symbol) {
            this.symbol = symbol;
        }

        @Override
        public String toString() {
            return symbol;
        }
    }

    private final LinearExpression expression;
    private final Kind kind;

    public LinearConstraint(LinearExpression expression, Kind kind) {
        this.expression = Objects.requireNonNull(expression);
        this.kind = Objects.requireNonNull(kind);
    }

    public static LinearConstraint eq(LinearExpression lhs, LinearExpression rhs) {
        return new LinearConstraint(lhs.minus(rhs), Kind.EQUALITY);
    }

    public static LinearConstraint neq(LinearExpression lhs, LinearExpression rhs) {
        return new LinearConstraint(lhs.minus(rhs), Kind.DISEQUATION);
    }

    public static LinearConstraint leq(LinearExpression lhs, LinearExpression rhs) {
        return new LinearConstraint(lhs.minus(rhs), Kind.INEQUALITY);
    }

    public static LinearConstraint geq(LinearExpression lhs, LinearExpression rhs) {
        return leq(rhs, lhs);
    }

    public static LinearConstraint lt(LinearExpression lhs, LinearExpression rhs) {
        return new LinearConstraint(lhs.minus(rhs), Kind.STRICT_INEQUALITY);
    }

    public static LinearConstraint gt(LinearExpression lhs, LinearExpression rhs) {
        return lt(rhs, lhs);
    }

    /**
     * The constraint {@code 0 = 0}.
     *
     * @return The constraint.
     */
    public static LinearConstraint tautology() {
        return new LinearConstraint(LinearExpression.of(0), Kind.EQUALITY);
    }

    /**
     * The constraint {@code 0 != 0}.
     *
     * @return The constraint.
     */
    public static LinearConstraint contradiction() {
        return new LinearConstraint(LinearExpression.of(0), Kind.DISEQUATION);
    }

    public LinearExpression expression() {
        return expression;
    }

    public Kind kind() {
        return kind;
    }

    public Set<Var> variables() {
        return expression.variables();
    }

    public boolean isTautology() {
        return expression.isConstant() && holds(expression.constant().signum());
    }

    public boolean isContradiction() {
        return expression.isConstant() && !holds(expression.constant().signum());
    }

    private boolean holds(int sign) {
        switch (kind) {
            case EQUALITY:
                return sign == 0;
            case DISEQUATION:
                return sign != 0;
            case INEQUALITY:
                return sign <= 0;
            case STRICT_INEQUALITY:
                return sign < 0;
            default:
                throw new IllegalStateException();
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LinearConstraint)) return false;
        LinearConstraint that = (LinearConstraint) o;
        return kind == that.kind && expression.equals(that.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, kind);
    }

    @Override
    public String toString() {
        if (isTautology()) return "true";
        if (isContradiction()) return "false";
        // move the constant to the right hand side
        LinearExpression lhs = expression.minus(LinearExpression.of(expression.constant()));
        return lhs + " " + kind + " " + expression.constant().negate();
    }
}
