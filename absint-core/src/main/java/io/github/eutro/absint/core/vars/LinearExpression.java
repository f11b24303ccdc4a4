package io.github.eutro.absint.core.vars;

import java.math.BigInteger;
import java.util.*;

/**
 * An immutable affine combination of variables, {@code c1*v1 + ... + cn*vn + k},
 * with integer coefficients.
 * <p>
 * Terms with a zero coefficient are never stored.
 */
public final class LinearExpression {
    private final Map<Var, BigInteger> terms; // insertion ordered
    private final BigInteger constant;

    private LinearExpression(Map<Var, BigInteger> terms, BigInteger constant) {
        this.terms = Collections.unmodifiableMap(terms);
        this.constant = constant;
    }

    /**
     * Create an expression consisting of a single variable.
     *
     * @param var The variable.
     * @return The expression {@code var}.
     */
    public static LinearExpression of(Var var) {
        Map<Var, BigInteger> terms = new LinkedHashMap<>();
        terms.put(Objects.requireNonNull(var), BigInteger.ONE);
        return new LinearExpression(terms, BigInteger.ZERO);
    }

    /**
     * Create a constant expression.
     *
     * @param constant The constant.
     * @return The expression.
     */
    public static LinearExpression of(BigInteger constant) {
        return new LinearExpression(new LinkedHashMap<>(), Objects.requireNonNull(constant));
    }

    /**
     * Create a constant expression.
     *
     * @param constant The constant.
     * @return The expression.
     */
    public static LinearExpression of(long constant) {
        return of(BigInteger.valueOf(constant));
    }

    /**
     * Create the expression {@code coefficient * var}.
     *
     * @param coefficient The coefficient.
     * @param var         The variable.
     * @return The expression.
     */
    public static LinearExpression term(long coefficient, Var var) {
        return of(var).times(coefficient);
    }

    public LinearExpression plus(LinearExpression other) {
        Map<Var, BigInteger> sum = new LinkedHashMap<>(terms);
        for (Map.Entry<Var, BigInteger> e : other.terms.entrySet()) {
            BigInteger c = sum.getOrDefault(e.getKey(), BigInteger.ZERO).add(e.getValue());
            if (c.signum() == 0) {
                sum.remove(e.getKey());
            } else {
                sum.put(e.getKey(), c);
            }
        }
        return new LinearExpression(sum, constant.add(other.constant));
    }

    public LinearExpression plus(Var var) {
        return plus(of(var));
    }

    public LinearExpression plus(long k) {
        return plus(of(k));
    }

    public LinearExpression minus(LinearExpression other) {
        return plus(other.negate());
    }

    public LinearExpression minus(Var var) {
        return minus(of(var));
    }

    public LinearExpression minus(long k) {
        return plus(of(BigInteger.valueOf(k).negate()));
    }

    public LinearExpression times(BigInteger k) {
        if (k.signum() == 0) return of(BigInteger.ZERO);
        Map<Var, BigInteger> scaled = new LinkedHashMap<>();
        for (Map.Entry<Var, BigInteger> e : terms.entrySet()) {
            scaled.put(e.getKey(), e.getValue().multiply(k));
        }
        return new LinearExpression(scaled, constant.multiply(k));
    }

    public LinearExpression times(long k) {
        return times(BigInteger.valueOf(k));
    }

    public LinearExpression negate() {
        return times(BigInteger.ONE.negate());
    }

    /**
     * Get the set of variables with a non-zero coefficient, in the order they were first added.
     *
     * @return The variables.
     */
    public Set<Var> variables() {
        return Collections.unmodifiableSet(terms.keySet());
    }

    /**
     * Get the coefficient of a variable, zero if it does not occur.
     *
     * @param var The variable.
     * @return The coefficient.
     */
    public BigInteger coefficient(Var var) {
        return terms.getOrDefault(var, BigInteger.ZERO);
    }

    public BigInteger constant() {
        return constant;
    }

    public boolean isConstant() {
        return terms.isEmpty();
    }

    /**
     * Get the variable this expression consists of, if it is exactly a single variable
     * with coefficient one and no constant.
     *
     * @return The variable, or empty.
     */
    public Optional<Var> getVariable() {
        if (terms.size() != 1 || constant.signum() != 0) return Optional.empty();
        Map.Entry<Var, BigInteger> only = terms.entrySet().iterator().next();
        return only.getValue().equals(BigInteger.ONE) ? Optional.of(only.getKey()) : Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LinearExpression)) return false;
        LinearExpression that = (LinearExpression) o;
        return terms.equals(that.terms) && constant.equals(that.constant);
    }

    @Override
    public int hashCode() {
        return Objects.hash(terms, constant);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<Var, BigInteger> e : terms.entrySet()) {
            BigInteger c = e.getValue();
            if (sb.length() == 0) {
                if (c.signum() < 0) sb.append('-');
            } else {
                sb.append(c.signum() < 0 ? " - " : " + ");
            }
            BigInteger abs = c.abs();
            if (!abs.equals(BigInteger.ONE)) {
                sb.append(abs).append('*');
            }
            sb.append(e.getKey());
        }
        if (sb.length() == 0) {
            sb.append(constant);
        } else if (constant.signum() != 0) {
            sb.append(constant.signum() < 0 ? " - " : " + ").append(constant.abs());
        }
        return sb.toString();
    }
}
