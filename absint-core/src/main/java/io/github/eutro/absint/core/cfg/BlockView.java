package io.github.eutro.absint.core.cfg;

import io.github.eutro.absint.core.vars.Var;

import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * A read-only view of a basic block, as seen by analyses.
 *
 * @param <L> The type of block labels.
 * @see BasicBlock
 * @see BasicBlockRev
 */
public interface BlockView<L> extends Iterable<Statement> {
    /**
     * Get the label of this block.
     *
     * @return The label.
     */
    L label();

    /**
     * Get the statements of this block, in the order an analysis should process them.
     *
     * @return The statements.
     */
    List<Statement> getStatements();

    List<L> getPreds();

    List<L> getSuccs();

    /**
     * Get the variables used or defined by any statement of this block.
     *
     * @return The live set.
     */
    Set<Var> live();

    default int size() {
        return getStatements().size();
    }

    @Override
    default Iterator<Statement> iterator() {
        return getStatements().iterator();
    }

    /**
     * Visit every statement of this block.
     *
     * @param visitor The visitor.
     */
    default void accept(StatementVisitor visitor) {
        visitor.visit(this);
    }
}
