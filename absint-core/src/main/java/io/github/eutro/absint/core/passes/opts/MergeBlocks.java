package io.github.eutro.absint.core.passes.opts;

import io.github.eutro.absint.core.cfg.BasicBlock;
import io.github.eutro.absint.core.cfg.Cfg;
import io.github.eutro.absint.core.cfg.Statement;
import io.github.eutro.absint.core.cfg.StatementCode;
import io.github.eutro.absint.core.passes.InPlaceIRPass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * An optimisation pass that fuses straight-line chains of blocks.
 * <p>
 * A block {@code B} other than the entry is appended to its predecessor {@code P} if
 * {@code B} is the only successor of {@code P}, {@code P} is the only predecessor of {@code B},
 * and {@code B} contains no assume, boolean assume or array load. {@code P} takes over the
 * successors of {@code B}, and becomes the exit if {@code B} was.
 */
public class MergeBlocks implements InPlaceIRPass<Cfg<?>> {
    private static final Logger LOGGER = LoggerFactory.getLogger(MergeBlocks.class);

    /**
     * A singleton instance of this pass.
     */
    public static final MergeBlocks INSTANCE = new MergeBlocks();

    @Override
    public void runInPlace(Cfg<?> cfg) {
        run(cfg);
    }

    private static <L> void run(Cfg<L> cfg) {
        int fused = 0;
        Deque<L> stack = new ArrayDeque<>();
        Set<L> visited = new HashSet<>();
        stack.push(cfg.entry());
        while (!stack.isEmpty()) {
            L label = stack.pop();
            if (!cfg.contains(label) || !visited.add(label)) continue;
            BasicBlock<L> block = cfg.getNode(label);

            L next;
            while ((next = fusable(cfg, block)) != null) {
                fuse(cfg, block, cfg.getNode(next));
                fused++;
            }

            List<L> succs = block.getSuccs();
            for (int i = succs.size() - 1; i >= 0; i--) {
                stack.push(succs.get(i));
            }
        }
        if (fused != 0) {
            LOGGER.debug("fused {} blocks, {} remain", fused, cfg.size());
        }
    }

    private static <L> L fusable(Cfg<L> cfg, BasicBlock<L> pred) {
        if (pred.getSuccs().size() != 1) return null;
        L label = pred.getSuccs().get(0);
        if (label.equals(pred.label()) || label.equals(cfg.entry())) return null;
        BasicBlock<L> block = cfg.getNode(label);
        if (block.getPreds().size() != 1) return null;
        for (Statement stmt : block) {
            if (isGuarded(stmt.code())) return null;
        }
        return label;
    }

    private static boolean isGuarded(StatementCode code) {
        return code == StatementCode.ASSUME
                || code == StatementCode.BOOL_ASSUME
                || code == StatementCode.ARR_LOAD;
    }

    private static <L> void fuse(Cfg<L> cfg, BasicBlock<L> pred, BasicBlock<L> block) {
        L label = block.label();
        boolean wasExit = cfg.hasExit() && cfg.exit().equals(label);
        List<L> succs = new ArrayList<>(block.getSuccs());
        pred.mergeBack(block);
        cfg.remove(label);
        for (L succ : succs) {
            cfg.addEdge(pred.label(), succ);
        }
        if (wasExit) {
            cfg.setExit(pred.label());
        }
        LOGGER.debug("fused block {} into {}", label, pred.label());
    }
}
