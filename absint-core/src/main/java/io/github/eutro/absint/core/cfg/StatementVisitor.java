package io.github.eutro.absint.core.cfg;

/**
 * A visitor over {@link Statement statements}, with one overload per kind of statement.
 * <p>
 * Every overload does nothing by default, so implementations only override the kinds they care about.
 */
public interface StatementVisitor {
    // numeric
    default void visit(BinaryOp stmt) {
    }

    default void visit(Assignment stmt) {
    }

    default void visit(Assume stmt) {
    }

    default void visit(Assert stmt) {
    }

    default void visit(Select stmt) {
    }

    default void visit(IntCast stmt) {
    }

    default void visit(Unreachable stmt) {
    }

    default void visit(Havoc stmt) {
    }

    // arrays
    default void visit(ArrayAssume stmt) {
    }

    default void visit(ArrayStore stmt) {
    }

    default void visit(ArrayLoad stmt) {
    }

    default void visit(ArrayAssign stmt) {
    }

    // pointers
    default void visit(PtrLoad stmt) {
    }

    default void visit(PtrStore stmt) {
    }

    default void visit(PtrAssign stmt) {
    }

    default void visit(PtrObject stmt) {
    }

    default void visit(PtrFunction stmt) {
    }

    default void visit(PtrNull stmt) {
    }

    default void visit(PtrAssume stmt) {
    }

    default void visit(PtrAssert stmt) {
    }

    // functions
    default void visit(CallSite stmt) {
    }

    default void visit(Return stmt) {
    }

    // booleans
    default void visit(BoolAssignCst stmt) {
    }

    default void visit(BoolAssignVar stmt) {
    }

    default void visit(BoolBinaryOp stmt) {
    }

    default void visit(BoolAssume stmt) {
    }

    default void visit(BoolSelect stmt) {
    }

    default void visit(BoolAssert stmt) {
    }

    /**
     * Visit every statement of a block, in the block's iteration order.
     *
     * @param block The block.
     */
    default void visit(BlockView<?> block) {
        for (Statement stmt : block.getStatements()) {
            stmt.accept(this);
        }
    }
}
