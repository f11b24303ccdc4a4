package io.github.eutro.absint.core.cfg;

import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A non-owning handle to a {@link Cfg}, which forwards everything to it.
 * <p>
 * Handles are equal iff the graphs they refer to are.
 *
 * @param <L> The type of block labels.
 */
public final class CfgRef<L> implements CfgView<L> {
    private final Cfg<L> cfg;

    public CfgRef(Cfg<L> cfg) {
        this.cfg = Objects.requireNonNull(cfg);
    }

    public Cfg<L> get() {
        return cfg;
    }

    @Override
    public L entry() {
        return cfg.entry();
    }

    @Override
    public boolean hasExit() {
        return cfg.hasExit();
    }

    @Override
    public L exit() {
        return cfg.exit();
    }

    @Override
    public BasicBlock<L> getNode(L label) {
        return cfg.getNode(label);
    }

    public BasicBlock<L> insert(L label) {
        return cfg.insert(label);
    }

    public void remove(L label) {
        cfg.remove(label);
    }

    public TrackedPrecision getTrackedPrecision() {
        return cfg.getTrackedPrecision();
    }

    @Override
    public Collection<BasicBlock<L>> blocks() {
        return cfg.blocks();
    }

    @Override
    public Set<L> labels() {
        return cfg.labels();
    }

    @Override
    public int size() {
        return cfg.size();
    }

    @Override
    public Optional<FunctionDecl> getFuncDecl() {
        return cfg.getFuncDecl();
    }

    @Override
    public void simplify() {
        cfg.simplify();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CfgRef)) return false;
        return cfg.equals(((CfgRef<?>) o).cfg);
    }

    @Override
    public int hashCode() {
        return cfg.hashCode();
    }

    @Override
    public String toString() {
        return cfg.toString();
    }
}
