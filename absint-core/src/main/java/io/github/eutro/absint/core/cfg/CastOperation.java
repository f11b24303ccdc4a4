package io.github.eutro.absint.core.cfg;

/**
 * Integer casts, see {@link IntCast}.
 */
public enum CastOperation {
    TRUNC("trunc"),
    SEXT("sext"),
    ZEXT("zext");

    private final String name;

    CastOperation(String name) {
        this.name = name;
    }

    @Override
    public String toString() {
        return name;
    }
}
