package io.github.eutro.absint.core.cfg;

import io.github.eutro.absint.core.passes.Passes;
import io.github.eutro.absint.core.util.GraphWalker;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * A control flow graph: a set of {@link BasicBlock basic blocks} keyed by label,
 * with an entry block, an optional exit block and an optional {@link FunctionDecl signature}.
 * <p>
 * The entry block is created with the graph. The exit block, if any, must be
 * {@link #insert(Object) inserted} by the client like any other block.
 * <p>
 * Blocks are iterated in the order they were inserted.
 *
 * @param <L> The type of block labels.
 */
public final class Cfg<L> implements CfgView<L> {
    private static final Logger LOGGER = LoggerFactory.getLogger(Cfg.class);

    private final Map<L, BasicBlock<L>> blocks = new LinkedHashMap<>();
    private final L entry;
    private @Nullable L exit;
    private @Nullable FunctionDecl decl;
    private final TrackedPrecision precision;

    public Cfg(@NotNull L entry, @Nullable L exit, @Nullable FunctionDecl decl, @NotNull TrackedPrecision precision) {
        this.entry = Objects.requireNonNull(entry, "entry");
        this.exit = exit;
        this.decl = decl;
        this.precision = Objects.requireNonNull(precision, "precision");
        insert(entry);
    }

    public Cfg(@NotNull L entry, @Nullable L exit, @NotNull TrackedPrecision precision) {
        this(entry, exit, null, precision);
    }

    public Cfg(@NotNull L entry, @NotNull TrackedPrecision precision) {
        this(entry, null, null, precision);
    }

    public Cfg(@NotNull L entry) {
        this(entry, TrackedPrecision.NUM);
    }

    /**
     * Get the block with the given label, creating an empty one if there is none.
     *
     * @param label The label.
     * @return The block.
     */
    public BasicBlock<L> insert(@NotNull L label) {
        return blocks.computeIfAbsent(Objects.requireNonNull(label, "label"),
                l -> new BasicBlock<>(l, precision));
    }

    /**
     * Remove a block, and every edge to or from it.
     * <p>
     * If the block was the exit, this graph no longer has an exit.
     *
     * @param label The label of the block.
     * @throws NoSuchElementException   If there is no such block.
     * @throws IllegalArgumentException If the block is the entry.
     */
    public void remove(@NotNull L label) {
        BasicBlock<L> block = getNode(label);
        if (label.equals(entry)) {
            throw new IllegalArgumentException(String.format(
                    "cannot remove the entry block" +
                            "\n  label: %s",
                    label));
        }
        for (L pred : new ArrayList<>(block.getPreds())) {
            getNode(pred).removeEdge(block);
        }
        for (L succ : new ArrayList<>(block.getSuccs())) {
            block.removeEdge(getNode(succ));
        }
        blocks.remove(label);
        if (label.equals(exit)) {
            LOGGER.debug("removed exit block {}", label);
            exit = null;
        }
    }

    public boolean contains(@NotNull L label) {
        return blocks.containsKey(label);
    }

    @Override
    public BasicBlock<L> getNode(@NotNull L label) {
        BasicBlock<L> block = blocks.get(label);
        if (block == null) {
            throw new NoSuchElementException(String.format(
                    "no block with label %s" +
                            "\n  labels: %s",
                    label,
                    blocks.keySet()));
        }
        return block;
    }

    public void addEdge(@NotNull L from, @NotNull L to) {
        getNode(from).addEdge(getNode(to));
    }

    public void removeEdge(@NotNull L from, @NotNull L to) {
        getNode(from).removeEdge(getNode(to));
    }

    @Override
    public L entry() {
        return entry;
    }

    @Override
    public boolean hasExit() {
        return exit != null;
    }

    @Override
    public L exit() {
        if (exit == null) {
            throw new IllegalStateException("cfg does not have an exit block");
        }
        return exit;
    }

    public void setExit(@NotNull L exit) {
        this.exit = Objects.requireNonNull(exit, "exit");
    }

    @Override
    public Optional<FunctionDecl> getFuncDecl() {
        return Optional.ofNullable(decl);
    }

    public void setFuncDecl(@Nullable FunctionDecl decl) {
        this.decl = decl;
    }

    public TrackedPrecision getTrackedPrecision() {
        return precision;
    }

    @Override
    public int size() {
        return blocks.size();
    }

    @Override
    public Collection<BasicBlock<L>> blocks() {
        return Collections.unmodifiableCollection(blocks.values());
    }

    @Override
    public Set<L> labels() {
        return Collections.unmodifiableSet(blocks.keySet());
    }

    /**
     * Create an independent copy of this graph, copying every block.
     *
     * @return The copy.
     */
    public Cfg<L> copy() {
        Cfg<L> copy = new Cfg<>(entry, exit, decl, precision);
        copy.blocks.clear();
        for (BasicBlock<L> block : blocks.values()) {
            copy.blocks.put(block.label(), block.copy());
        }
        return copy;
    }

    /**
     * Run {@link Passes#SIMPLIFY} on this graph. Call this once construction is complete.
     */
    @Override
    public void simplify() {
        Passes.SIMPLIFY.run(this);
    }

    /**
     * Two graphs are equal if they are the same object, or if both have
     * signatures with the same {@link CfgHasher#hash(FunctionDecl) hash}.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Cfg)) return false;
        Cfg<?> that = (Cfg<?>) o;
        if (decl == null || that.decl == null) return false;
        return CfgHasher.hash(decl) == CfgHasher.hash(that.decl);
    }

    @Override
    public int hashCode() {
        return decl == null ? System.identityHashCode(this) : CfgHasher.hash(decl);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (decl != null) {
            sb.append(decl).append('\n');
        }
        for (L label : GraphWalker.labelWalker(this).preOrder()) {
            sb.append(getNode(label));
        }
        return sb.toString();
    }
}
