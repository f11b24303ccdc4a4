package io.github.eutro.absint.core.cfg;

/**
 * The tag identifying each kind of {@link Statement}.
 */
public enum StatementCode {
    BIN_OP,
    ASSIGN,
    ASSUME,
    UNREACH,
    HAVOC,
    SELECT,
    ASSERT,
    INT_CAST,
    ARR_ASSUME,
    ARR_STORE,
    ARR_LOAD,
    ARR_ASSIGN,
    PTR_LOAD,
    PTR_STORE,
    PTR_ASSIGN,
    PTR_OBJECT,
    PTR_FUNCTION,
    PTR_NULL,
    PTR_ASSUME,
    PTR_ASSERT,
    CALLSITE,
    RETURN,
    BOOL_ASSIGN_CST,
    BOOL_ASSIGN_VAR,
    BOOL_BIN_OP,
    BOOL_ASSUME,
    BOOL_SELECT,
    BOOL_ASSERT
}
