package io.github.eutro.absint.core.cfg;

import io.github.eutro.absint.core.vars.Var;

import java.util.*;

/**
 * A control flow graph, as seen by a fixpoint engine.
 *
 * @param <L> The type of block labels.
 * @see Cfg
 * @see CfgRef
 * @see CfgRev
 */
public interface CfgView<L> {
    /**
     * Get the label of the block execution starts at.
     *
     * @return The entry label.
     */
    L entry();

    boolean hasExit();

    /**
     * Get the label of the block execution ends at.
     *
     * @return The exit label.
     * @throws IllegalStateException If there is no exit.
     */
    L exit();

    /**
     * Get the successors of a block.
     *
     * @param label The label of the block.
     * @return The labels of its successors.
     * @throws NoSuchElementException If there is no such block.
     */
    default List<L> nextNodes(L label) {
        return getNode(label).getSuccs();
    }

    /**
     * Get the predecessors of a block.
     *
     * @param label The label of the block.
     * @return The labels of its predecessors.
     * @throws NoSuchElementException If there is no such block.
     */
    default List<L> prevNodes(L label) {
        return getNode(label).getPreds();
    }

    /**
     * Get a block by its label.
     *
     * @param label The label.
     * @return The block.
     * @throws NoSuchElementException If there is no such block.
     */
    BlockView<L> getNode(L label);

    Collection<? extends BlockView<L>> blocks();

    Set<L> labels();

    int size();

    Optional<FunctionDecl> getFuncDecl();

    /**
     * Simplify the graph, if this view can be rewritten.
     */
    void simplify();

    /**
     * Get every variable used or defined in any block.
     *
     * @return The variables.
     */
    default Set<Var> getVars() {
        Set<Var> vars = new LinkedHashSet<>();
        for (BlockView<L> block : blocks()) {
            vars.addAll(block.live());
        }
        return vars;
    }
}
