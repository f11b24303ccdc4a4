package io.github.eutro.absint.core.vars;

/**
 * The flat lattice of variable types.
 * <p>
 * There is no sub-typing: two types are compatible iff they are equal.
 */
public enum VarType {
    BOOL("bool"),
    INT("int"),
    REAL("real"),
    PTR("ptr"),
    REF("ref"),
    ARR_BOOL("arr_bool"),
    ARR_INT("arr_int"),
    ARR_REAL("arr_real"),
    ARR_PTR("arr_ptr");

    private final String display;

    VarType(String display) {
        this.display = display;
    }

    /**
     * Get whether this is one of the array types.
     *
     * @return Whether this is an array type.
     */
    public boolean isArray() {
        return this == ARR_BOOL || this == ARR_INT || this == ARR_REAL || this == ARR_PTR;
    }

    /**
     * Get whether this is a numeric scalar type, i.e. {@link #INT} or {@link #REAL}.
     *
     * @return Whether this is numeric.
     */
    public boolean isNumeric() {
        return this == INT || this == REAL;
    }

    @Override
    public String toString() {
        return display;
    }
}
