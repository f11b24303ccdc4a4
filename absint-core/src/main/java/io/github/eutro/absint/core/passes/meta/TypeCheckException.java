package io.github.eutro.absint.core.passes.meta;

import io.github.eutro.absint.core.cfg.Statement;
import org.jetbrains.annotations.Nullable;

/**
 * Thrown by {@link TypeCheck} when a CFG is ill-typed.
 */
public class TypeCheckException extends RuntimeException {
    private final @Nullable Statement statement;
    private final String reason;

    public TypeCheckException(String reason, @Nullable Statement statement) {
        super(statement == null
                ? "(type checking) " + reason
                : "(type checking) " + reason + " in " + statement);
        this.reason = reason;
        this.statement = statement;
    }

    public TypeCheckException(String reason) {
        this(reason, null);
    }

    /**
     * Get the offending statement, if the failure concerns a single statement.
     *
     * @return The statement, or null.
     */
    public @Nullable Statement getStatement() {
        return statement;
    }

    public String getReason() {
        return reason;
    }
}
