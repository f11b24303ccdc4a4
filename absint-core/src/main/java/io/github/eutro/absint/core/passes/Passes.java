package io.github.eutro.absint.core.passes;

import io.github.eutro.absint.core.cfg.Cfg;
import io.github.eutro.absint.core.passes.meta.VerifyIntegrity;
import io.github.eutro.absint.core.passes.opts.EliminateDeadBlocks;
import io.github.eutro.absint.core.passes.opts.EliminateUselessBlocks;
import io.github.eutro.absint.core.passes.opts.MergeBlocks;
import io.github.eutro.absint.core.util.CfgDisplay;

/**
 * Some pre-composed passes.
 */
public class Passes {
    /**
     * If set, {@link VerifyIntegrity} runs after every pass of {@link #SIMPLIFY}.
     */
    public static boolean VERIFY_PASSES = System.getenv("ABSINT_VERIFY_PASSES") != null;

    /**
     * Simplify a CFG once it has been built: fuse straight-line blocks, drop blocks
     * unreachable from the entry, drop blocks that cannot reach the exit, then fuse again.
     */
    public static final IRPass<Cfg<?>, Cfg<?>> SIMPLIFY =
            step("merge", MergeBlocks.INSTANCE)
                    .then(step("remove-unreachable", EliminateDeadBlocks.INSTANCE))
                    .then(step("remove-useless", EliminateUselessBlocks.INSTANCE))
                    .then(step("merge", MergeBlocks.INSTANCE))
                    .then(step("merge", MergeBlocks.INSTANCE));

    private static IRPass<Cfg<?>, Cfg<?>> step(String name, IRPass<Cfg<?>, Cfg<?>> pass) {
        IRPass<Cfg<?>, Cfg<?>> wrapped = CfgDisplay.debugDisplayOnError(name, pass);
        return VERIFY_PASSES ? wrapped.then(VerifyIntegrity.INSTANCE) : wrapped;
    }
}
