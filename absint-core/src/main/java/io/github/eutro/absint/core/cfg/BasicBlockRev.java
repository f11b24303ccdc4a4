package io.github.eutro.absint.core.cfg;

import io.github.eutro.absint.core.vars.Var;

import java.util.List;
import java.util.Set;

/**
 * A {@link BasicBlock} seen backwards: statements last first, predecessors and successors swapped.
 *
 * @param <L> The type of block labels.
 * @see CfgRev
 */
public final class BasicBlockRev<L> implements BlockView<L> {
    private final BasicBlock<L> block;

    public BasicBlockRev(BasicBlock<L> block) {
        this.block = block;
    }

    /**
     * Get the block this is a view of.
     *
     * @return The underlying block.
     */
    public BasicBlock<L> getBlock() {
        return block;
    }

    @Override
    public L label() {
        return block.label();
    }

    @Override
    public List<Statement> getStatements() {
        return block.reversedStatements();
    }

    @Override
    public List<L> getPreds() {
        return block.getSuccs();
    }

    @Override
    public List<L> getSuccs() {
        return block.getPreds();
    }

    @Override
    public Set<Var> live() {
        return block.live();
    }

    @Override
    public int size() {
        return block.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(label()).append(":\n");
        for (Statement stmt : this) {
            sb.append("  ").append(stmt).append(";\n");
        }
        if (!getSuccs().isEmpty()) {
            sb.append("  --> ").append(getSuccs()).append(";\n");
        }
        return sb.toString();
    }
}
