package io.github.eutro.absint.core.cfg;

import io.github.eutro.absint.core.util.GraphWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * A {@link Cfg} seen backwards, for backward analyses.
 * <p>
 * The entry of this view is the exit of the graph and vice versa, edges are reversed,
 * and blocks list their statements last first. The view cannot be simplified;
 * simplify the underlying graph instead, then create a new view.
 * <p>
 * The set of blocks is fixed when the view is created.
 *
 * @param <L> The type of block labels.
 */
public final class CfgRev<L> implements CfgView<L> {
    private static final Logger LOGGER = LoggerFactory.getLogger(CfgRev.class);

    private final CfgRef<L> cfg;
    private final Map<L, BasicBlockRev<L>> blocks = new LinkedHashMap<>();

    /**
     * Create a reversed view.
     *
     * @param cfg The graph to reverse, which must have an exit.
     * @throws IllegalStateException If the graph has no exit.
     */
    public CfgRev(CfgRef<L> cfg) {
        if (!cfg.hasExit()) {
            throw new IllegalStateException("cannot reverse a cfg without an exit block");
        }
        this.cfg = cfg;
        for (BasicBlock<L> block : cfg.blocks()) {
            blocks.put(block.label(), new BasicBlockRev<>(block));
        }
    }

    @Override
    public L entry() {
        return cfg.exit();
    }

    @Override
    public boolean hasExit() {
        return true;
    }

    @Override
    public L exit() {
        return cfg.entry();
    }

    @Override
    public List<L> nextNodes(L label) {
        return cfg.prevNodes(label);
    }

    @Override
    public List<L> prevNodes(L label) {
        return cfg.nextNodes(label);
    }

    @Override
    public BasicBlockRev<L> getNode(L label) {
        BasicBlockRev<L> block = blocks.get(label);
        if (block == null) {
            throw new NoSuchElementException(String.format(
                    "no block with label %s in reversed cfg" +
                            "\n  labels: %s",
                    label,
                    blocks.keySet()));
        }
        return block;
    }

    @Override
    public Collection<BasicBlockRev<L>> blocks() {
        return Collections.unmodifiableCollection(blocks.values());
    }

    @Override
    public Set<L> labels() {
        return Collections.unmodifiableSet(blocks.keySet());
    }

    @Override
    public int size() {
        return blocks.size();
    }

    @Override
    public Optional<FunctionDecl> getFuncDecl() {
        return cfg.getFuncDecl();
    }

    @Override
    public void simplify() {
        LOGGER.debug("ignoring simplify() on a reversed cfg");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CfgRev)) return false;
        return cfg.equals(((CfgRev<?>) o).cfg);
    }

    @Override
    public int hashCode() {
        return cfg.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (L label : GraphWalker.labelWalker(this).preOrder()) {
            sb.append(getNode(label));
        }
        return sb.toString();
    }
}
