package io.github.eutro.absint.core.cfg;

/**
 * Which families of statements a {@link Cfg} keeps.
 * <p>
 * Each level tracks everything the levels before it do.
 */
public enum TrackedPrecision {
    /**
     * Only numeric and boolean statements.
     */
    NUM,
    /**
     * Numeric statements and pointers.
     */
    PTR,
    /**
     * Numeric statements, pointers and arrays.
     */
    ARR;

    /**
     * Get whether statements requiring the given precision are kept at this precision.
     *
     * @param required The precision the statement requires.
     * @return Whether it is kept.
     */
    public boolean tracks(TrackedPrecision required) {
        return compareTo(required) >= 0;
    }
}
