package io.github.eutro.absint.core.passes.meta;

import io.github.eutro.absint.core.cfg.BasicBlock;
import io.github.eutro.absint.core.cfg.Cfg;
import io.github.eutro.absint.core.passes.InPlaceIRPass;

import java.util.HashSet;
import java.util.List;

/**
 * A pass that checks that the edges of a CFG are consistent, throwing an
 * {@link IllegalStateException} otherwise.
 * <p>
 * Every edge must join two blocks of the graph and be recorded at both ends, no edge may be
 * recorded twice, and the entry block and the exit block, if any, must exist.
 */
public class VerifyIntegrity implements InPlaceIRPass<Cfg<?>> {
    /**
     * A singleton instance of this pass.
     */
    public static final VerifyIntegrity INSTANCE = new VerifyIntegrity();

    @Override
    public void runInPlace(Cfg<?> cfg) {
        verify(cfg);
    }

    private static <L> void verify(Cfg<L> cfg) {
        if (!cfg.contains(cfg.entry())) {
            throw new IllegalStateException(String.format(
                    "entry block does not exist\n  entry: %s",
                    cfg.entry()));
        }
        if (cfg.hasExit() && !cfg.contains(cfg.exit())) {
            throw new IllegalStateException(String.format(
                    "exit block does not exist\n  exit: %s",
                    cfg.exit()));
        }
        for (BasicBlock<L> block : cfg.blocks()) {
            checkUnique(block, "successors", block.getSuccs());
            checkUnique(block, "predecessors", block.getPreds());
            for (L succ : block.getSuccs()) {
                if (!cfg.contains(succ)) {
                    throwDangling(block, succ);
                }
                if (!cfg.getNode(succ).getPreds().contains(block.label())) {
                    throwAsymmetric(block.label(), succ);
                }
            }
            for (L pred : block.getPreds()) {
                if (!cfg.contains(pred)) {
                    throwDangling(block, pred);
                }
                if (!cfg.getNode(pred).getSuccs().contains(block.label())) {
                    throwAsymmetric(pred, block.label());
                }
            }
        }
    }

    private static <L> void checkUnique(BasicBlock<L> block, String what, List<L> labels) {
        if (new HashSet<>(labels).size() != labels.size()) {
            throw new IllegalStateException(String.format(
                    "block has duplicate %s\n  in block: %s\n  %s: %s",
                    what,
                    block.label(),
                    what,
                    labels));
        }
    }

    private static void throwDangling(BasicBlock<?> block, Object label) {
        throw new IllegalStateException(String.format(
                "block references a block that does not exist\n  in block: %s\n  referenced: %s",
                block.label(),
                label));
    }

    private static void throwAsymmetric(Object from, Object to) {
        throw new IllegalStateException(String.format(
                "edge is only recorded at one end\n  from: %s\n  to: %s",
                from,
                to));
    }
}
