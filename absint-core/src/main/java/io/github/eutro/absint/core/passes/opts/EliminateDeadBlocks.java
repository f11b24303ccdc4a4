package io.github.eutro.absint.core.passes.opts;

import io.github.eutro.absint.core.cfg.Cfg;
import io.github.eutro.absint.core.passes.InPlaceIRPass;
import io.github.eutro.absint.core.util.GraphWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * An optimisation pass that removes any blocks unreachable from the entry block.
 */
public class EliminateDeadBlocks implements InPlaceIRPass<Cfg<?>> {
    private static final Logger LOGGER = LoggerFactory.getLogger(EliminateDeadBlocks.class);

    /**
     * A singleton instance of this pass.
     */
    public static final EliminateDeadBlocks INSTANCE = new EliminateDeadBlocks();

    @Override
    public void runInPlace(Cfg<?> cfg) {
        run(cfg);
    }

    private static <L> void run(Cfg<L> cfg) {
        Set<L> reachable = new HashSet<>(GraphWalker.labelWalker(cfg).preOrder().toList());
        List<L> dead = new ArrayList<>();
        for (L label : cfg.labels()) {
            if (!reachable.contains(label)) dead.add(label);
        }
        for (L label : dead) {
            cfg.remove(label);
        }
        if (!dead.isEmpty()) {
            LOGGER.debug("removed unreachable blocks {}", dead);
        }
    }
}
