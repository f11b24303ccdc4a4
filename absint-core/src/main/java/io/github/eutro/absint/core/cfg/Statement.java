package io.github.eutro.absint.core.cfg;

import io.github.eutro.absint.core.vars.LinearExpression;
import io.github.eutro.absint.core.vars.Var;

import java.util.Objects;

/**
 * A single statement of a {@link BasicBlock}.
 * <p>
 * Statements are immutable. Each one has a fixed {@link StatementCode code}, a {@link Live live set}
 * computed when it is constructed, and a {@link DebugInfo source location}.
 * <p>
 * The set of subclasses is closed; see {@link StatementVisitor} for the full list.
 */
public abstract class Statement {
    private final StatementCode code;
    private final DebugInfo debugInfo;
    final Live live = new Live();

    Statement(StatementCode code, DebugInfo debugInfo) {
        this.code = code;
        this.debugInfo = Objects.requireNonNull(debugInfo, "debugInfo");
    }

    public final StatementCode code() {
        return code;
    }

    /**
     * Get the variables read and written by this statement.
     *
     * @return The live set.
     */
    public final Live live() {
        return live;
    }

    public final DebugInfo debugInfo() {
        return debugInfo;
    }

    /**
     * Create a copy of this statement, with the same operands and debug info.
     *
     * @return The copy.
     */
    public abstract Statement copy();

    /**
     * Call the {@link StatementVisitor#visit visit} overload of the visitor for this statement.
     *
     * @param visitor The visitor.
     */
    public abstract void accept(StatementVisitor visitor);

    @Override
    public abstract String toString();

    static boolean isConstantOrVariable(LinearExpression e) {
        return e.isConstant() || e.getVariable().isPresent();
    }

    static void requireArray(String what, Var array) {
        if (!array.type().isArray()) {
            throw new IllegalArgumentException(String.format(
                    "%s must have array type" +
                            "\n  variable: %s" +
                            "\n  type: %s",
                    what,
                    array,
                    array.type()));
        }
    }

    static void requireConstantOrVariable(String what, LinearExpression e) {
        if (!isConstantOrVariable(e)) {
            throw new IllegalArgumentException(String.format(
                    "%s can only be a number or a variable" +
                            "\n  got: %s",
                    what,
                    e));
        }
    }
}
