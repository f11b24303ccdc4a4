package io.github.eutro.absint.core.test;

import io.github.eutro.absint.core.cfg.*;
import io.github.eutro.absint.core.vars.Var;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class CfgViewTest {
    final TestVars v = new TestVars();
    final Var x = v.i32("x");
    final Var y = v.i32("y");

    private Cfg<String> diamond() {
        Cfg<String> cfg = new Cfg<>("entry", "exit", TrackedPrecision.NUM);
        cfg.getNode("entry").havoc(x);
        cfg.getNode("entry").add(y, x, 1);
        cfg.insert("left");
        cfg.insert("right");
        cfg.insert("exit").ret(y);
        cfg.addEdge("entry", "left");
        cfg.addEdge("entry", "right");
        cfg.addEdge("left", "exit");
        cfg.addEdge("right", "exit");
        return cfg;
    }

    @Test
    void refForwards() {
        Cfg<String> cfg = diamond();
        CfgRef<String> ref = new CfgRef<>(cfg);
        assertSame(cfg, ref.get());
        assertEquals("entry", ref.entry());
        assertEquals("exit", ref.exit());
        assertEquals(Arrays.asList("left", "right"), ref.nextNodes("entry"));
        assertSame(cfg.getNode("left"), ref.getNode("left"));
        assertEquals(cfg.getVars(), ref.getVars());
        ref.insert("extra");
        assertTrue(cfg.contains("extra"));
        assertEquals(new CfgRef<>(cfg), ref);
        assertEquals(cfg.hashCode(), ref.hashCode());
    }

    @Test
    void revSwapsEverything() {
        Cfg<String> cfg = diamond();
        CfgRev<String> rev = new CfgRev<>(new CfgRef<>(cfg));
        assertEquals("exit", rev.entry());
        assertEquals("entry", rev.exit());
        assertTrue(rev.hasExit());
        assertEquals(cfg.size(), rev.size());
        assertEquals(Arrays.asList("left", "right"), rev.nextNodes("exit"));
        assertEquals(Arrays.asList("left", "right"), rev.prevNodes("entry"));
        assertEquals(cfg.getNode("entry").getSuccs(), rev.getNode("entry").getPreds());

        List<String> stmts = new ArrayList<>();
        for (Statement stmt : rev.getNode("entry")) {
            stmts.add(stmt.toString());
        }
        assertEquals(Arrays.asList("y = x+1", "x =*"), stmts);
        assertEquals("entry:\n  y = x+1;\n  x =*;\n", rev.getNode("entry").toString());
        assertEquals("exit:\n  return y;\n  --> [left, right];\n", rev.getNode("exit").toString());
        assertEquals(cfg.getVars(), rev.getVars());
        assertThrows(NoSuchElementException.class, () -> rev.getNode("nope"));
    }

    @Test
    void revIsNotSimplified() {
        Cfg<String> cfg = new Cfg<>("entry", "exit", TrackedPrecision.NUM);
        cfg.insert("exit");
        cfg.addEdge("entry", "exit");
        CfgRev<String> rev = new CfgRev<>(new CfgRef<>(cfg));
        rev.simplify();
        assertEquals(2, cfg.size());
        assertEquals(2, rev.size());
    }

    @Test
    void revNeedsExit() {
        Cfg<String> cfg = new Cfg<>("entry");
        assertThrows(IllegalStateException.class, () -> new CfgRev<>(new CfgRef<>(cfg)));
    }
}
