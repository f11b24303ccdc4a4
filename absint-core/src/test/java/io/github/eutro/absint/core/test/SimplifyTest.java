package io.github.eutro.absint.core.test;

import io.github.eutro.absint.core.cfg.*;
import io.github.eutro.absint.core.passes.meta.VerifyIntegrity;
import io.github.eutro.absint.core.passes.opts.EliminateDeadBlocks;
import io.github.eutro.absint.core.passes.opts.EliminateUselessBlocks;
import io.github.eutro.absint.core.passes.opts.MergeBlocks;
import io.github.eutro.absint.core.util.GraphWalker;
import io.github.eutro.absint.core.vars.LinearConstraint;
import io.github.eutro.absint.core.vars.LinearExpression;
import io.github.eutro.absint.core.vars.Var;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class SimplifyTest {
    final TestVars v = new TestVars();
    final Var x = v.i32("x");
    final Var y = v.i32("y");
    final Var z = v.i32("z");

    private static List<String> render(BlockView<?> block) {
        List<String> out = new ArrayList<>();
        for (Statement stmt : block) {
            out.add(stmt.toString());
        }
        return out;
    }

    private static <L> Set<L> reachable(Cfg<L> cfg) {
        return new HashSet<>(GraphWalker.labelWalker(cfg).preOrder().toList());
    }

    @Test
    void entryAndExitFuse() {
        Cfg<String> cfg = new Cfg<>("entry", "exit", TrackedPrecision.NUM);
        cfg.getNode("entry").add(y, x, 1);
        BasicBlock<String> exit = cfg.insert("exit");
        exit.add(z, y, 2);
        exit.ret(z);
        cfg.addEdge("entry", "exit");

        assertEquals(new HashSet<>(Arrays.asList(x, y, z)), cfg.getVars());
        cfg.simplify();

        assertEquals(1, cfg.size());
        assertEquals("entry", cfg.exit());
        assertEquals(Arrays.asList("y = x+1", "z = y+2", "return z"), render(cfg.getNode("entry")));
        assertTrue(cfg.nextNodes("entry").isEmpty());
        assertEquals(new HashSet<>(Arrays.asList(x, y, z)), cfg.getVars());
        VerifyIntegrity.INSTANCE.run(cfg);
    }

    @Test
    void chainsFuseInOrder() {
        Cfg<String> cfg = new Cfg<>("entry", "exit", TrackedPrecision.NUM);
        cfg.getNode("entry").havoc(x);
        cfg.insert("a").add(y, x, 1);
        cfg.insert("b").add(z, y, 1);
        cfg.insert("exit").ret(z);
        cfg.addEdge("entry", "a");
        cfg.addEdge("a", "b");
        cfg.addEdge("b", "exit");
        MergeBlocks.INSTANCE.run(cfg);
        assertEquals(Collections.singleton("entry"), cfg.labels());
        assertEquals(Arrays.asList("x =*", "y = x+1", "z = y+1", "return z"), render(cfg.getNode("entry")));
    }

    @Test
    void guardedBlocksAreNotFused() {
        Cfg<String> cfg = new Cfg<>("entry", "exit", TrackedPrecision.NUM);
        cfg.insert("guard").assume(LinearConstraint.leq(LinearExpression.of(x), LinearExpression.of(10)));
        cfg.insert("exit").ret(x);
        cfg.addEdge("entry", "guard");
        cfg.addEdge("guard", "exit");
        cfg.simplify();

        assertEquals(new HashSet<>(Arrays.asList("entry", "guard")), cfg.labels());
        assertEquals("guard", cfg.exit());
        assertEquals(Arrays.asList("assume (x <= 10)", "return x"), render(cfg.getNode("guard")));
        assertEquals(Collections.singletonList("guard"), cfg.nextNodes("entry"));
    }

    @Test
    void boolAssumeAndArrayLoadAreGuarded() {
        Var b = v.bool("b");
        Var arr = v.arr("arr");
        Cfg<String> cfg = new Cfg<>("entry", "exit", TrackedPrecision.ARR);
        cfg.insert("b").boolAssume(b);
        cfg.insert("exit").arrayLoad(x, arr, LinearExpression.of(0), 4);
        cfg.addEdge("entry", "b");
        cfg.addEdge("b", "exit");
        MergeBlocks.INSTANCE.run(cfg);
        assertEquals(3, cfg.size());
    }

    @Test
    void branchesAndLoopsAreKept() {
        Cfg<String> cfg = new Cfg<>("entry", "exit", TrackedPrecision.NUM);
        cfg.insert("head");
        cfg.insert("body").add(x, x, 1);
        cfg.insert("exit").ret(x);
        cfg.addEdge("entry", "head");
        cfg.addEdge("head", "body");
        cfg.addEdge("body", "head");
        cfg.addEdge("head", "exit");
        Set<String> before = reachable(cfg);
        cfg.simplify();
        assertEquals(before, reachable(cfg));
        assertEquals(4, cfg.size());
        assertEquals(Arrays.asList("body", "exit"), cfg.nextNodes("head"));
        VerifyIntegrity.INSTANCE.run(cfg);
    }

    @Test
    void selfLoopIsNotFused() {
        Cfg<String> cfg = new Cfg<>("entry", "loop", TrackedPrecision.NUM);
        cfg.insert("loop").havoc(x);
        cfg.addEdge("entry", "loop");
        cfg.addEdge("loop", "loop");
        MergeBlocks.INSTANCE.run(cfg);
        assertEquals(2, cfg.size());
        assertEquals(Arrays.asList("entry", "loop"), cfg.prevNodes("loop"));
    }

    @Test
    void unreachableBlocksAreRemoved() {
        Cfg<String> cfg = new Cfg<>("entry", "exit", TrackedPrecision.NUM);
        cfg.insert("exit");
        cfg.insert("dead").havoc(y);
        cfg.addEdge("entry", "exit");
        cfg.addEdge("dead", "exit");
        EliminateDeadBlocks.INSTANCE.run(cfg);
        assertFalse(cfg.contains("dead"));
        assertEquals(Collections.singletonList("entry"), cfg.prevNodes("exit"));
        assertFalse(cfg.getVars().contains(y));
    }

    @Test
    void uselessBlocksAreRemoved() {
        Cfg<String> cfg = new Cfg<>("entry", "exit", TrackedPrecision.NUM);
        cfg.insert("exit");
        cfg.insert("stuck").havoc(x);
        cfg.addEdge("entry", "exit");
        cfg.addEdge("entry", "stuck");
        cfg.addEdge("stuck", "stuck");
        EliminateUselessBlocks.INSTANCE.run(cfg);
        assertFalse(cfg.contains("stuck"));
        assertEquals(Collections.singletonList("exit"), cfg.nextNodes("entry"));
    }

    @Test
    void entryIsNeverRemoved() {
        Cfg<String> cfg = new Cfg<>("entry", "exit", TrackedPrecision.NUM);
        cfg.insert("exit");
        cfg.insert("a");
        cfg.addEdge("entry", "a");
        EliminateUselessBlocks.INSTANCE.run(cfg);
        assertTrue(cfg.contains("entry"));
        assertFalse(cfg.contains("a"));
        assertTrue(cfg.contains("exit"));
    }

    @Test
    void noExitMeansNoUselessBlocks() {
        Cfg<String> cfg = new Cfg<>("entry");
        cfg.insert("a");
        cfg.addEdge("entry", "a");
        cfg.simplify();
        assertEquals(1, cfg.size());
        assertFalse(cfg.hasExit());
    }
}
