package io.github.eutro.absint.core.passes.opts;

import io.github.eutro.absint.core.cfg.Cfg;
import io.github.eutro.absint.core.cfg.CfgRef;
import io.github.eutro.absint.core.cfg.CfgRev;
import io.github.eutro.absint.core.passes.InPlaceIRPass;
import io.github.eutro.absint.core.util.GraphWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * An optimisation pass that removes any blocks from which the exit block cannot be reached.
 * <p>
 * The entry block is never removed. Graphs without an exit block are left alone.
 */
public class EliminateUselessBlocks implements InPlaceIRPass<Cfg<?>> {
    private static final Logger LOGGER = LoggerFactory.getLogger(EliminateUselessBlocks.class);

    /**
     * A singleton instance of this pass.
     */
    public static final EliminateUselessBlocks INSTANCE = new EliminateUselessBlocks();

    @Override
    public void runInPlace(Cfg<?> cfg) {
        run(cfg);
    }

    private static <L> void run(Cfg<L> cfg) {
        if (!cfg.hasExit() || !cfg.contains(cfg.exit())) {
            LOGGER.debug("cfg has no exit block, skipping");
            return;
        }
        CfgRev<L> rev = new CfgRev<>(new CfgRef<>(cfg));
        Set<L> useful = new HashSet<>(GraphWalker.labelWalker(rev).preOrder().toList());
        if (!useful.contains(cfg.entry())) {
            LOGGER.warn("exit block {} is not reachable from entry block {}", cfg.exit(), cfg.entry());
        }
        List<L> useless = new ArrayList<>();
        for (L label : cfg.labels()) {
            if (!useful.contains(label) && !label.equals(cfg.entry())) useless.add(label);
        }
        for (L label : useless) {
            cfg.remove(label);
        }
        if (!useless.isEmpty()) {
            LOGGER.debug("removed blocks that cannot reach the exit {}", useless);
        }
    }
}
