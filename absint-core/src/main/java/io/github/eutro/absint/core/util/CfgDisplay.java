package io.github.eutro.absint.core.util;

import io.github.eutro.absint.core.cfg.Cfg;
import io.github.eutro.absint.core.passes.IRPass;
import io.github.eutro.absint.core.passes.InPlaceIRPass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Debugging aids that render CFGs to the log.
 */
public class CfgDisplay {
    private static final Logger LOGGER = LoggerFactory.getLogger(CfgDisplay.class);

    /**
     * If set, {@link #debugDisplayOnError(String, IRPass)} logs the graph a pass failed on.
     */
    public static boolean DUMP_ON_ERROR = System.getenv("ABSINT_DUMP_ON_ERROR") != null;

    /**
     * Get a pass that logs the graph at debug level, then leaves it unchanged.
     *
     * @param prefix A name to log the graph under.
     * @return The pass.
     */
    public static InPlaceIRPass<Cfg<?>> debugDisplay(String prefix) {
        return cfg -> LOGGER.debug("{}:\n{}", prefix, cfg);
    }

    /**
     * Wrap a pass so that, when {@link #DUMP_ON_ERROR} is set, the graph it failed on is logged.
     * <p>
     * The graph is rendered before the pass runs, since a failing pass may leave it half rewritten.
     *
     * @param prefix A name for the pass.
     * @param pass   The pass.
     * @return The wrapped pass, or {@code pass} itself if {@link #DUMP_ON_ERROR} is not set.
     */
    public static IRPass<Cfg<?>, Cfg<?>> debugDisplayOnError(String prefix, IRPass<Cfg<?>, Cfg<?>> pass) {
        if (!DUMP_ON_ERROR) return pass;
        return new IRPass<Cfg<?>, Cfg<?>>() {
            @Override
            public boolean isInPlace() {
                return pass.isInPlace();
            }

            @Override
            public Cfg<?> run(Cfg<?> cfg) {
                String before = cfg.toString();
                try {
                    return pass.run(cfg);
                } catch (RuntimeException e) {
                    LOGGER.error("pass {} failed on cfg:\n{}", prefix, before);
                    e.addSuppressed(new RuntimeException("cfg logged before failing pass: " + prefix));
                    throw e;
                }
            }
        };
    }
}
