package io.github.eutro.absint.core.test;

import io.github.eutro.absint.core.cfg.Cfg;
import io.github.eutro.absint.core.cfg.TrackedPrecision;
import io.github.eutro.absint.core.passes.IRPass;
import io.github.eutro.absint.core.passes.InPlaceIRPass;
import io.github.eutro.absint.core.passes.misc.ChainedPass;
import io.github.eutro.absint.core.util.CfgDisplay;
import io.github.eutro.absint.core.util.GraphWalker;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class PassesTest {
    @Test
    void chainedPassesRunInOrder() {
        List<String> log = new ArrayList<>();
        InPlaceIRPass<List<String>> a = ls -> ls.add("a");
        InPlaceIRPass<List<String>> b = ls -> ls.add("b");
        IRPass<List<String>, Integer> size = List::size;
        IRPass<List<String>, Integer> chain = a.then(b).then(a).then(size);
        assertEquals(Integer.valueOf(3), chain.run(log));
        assertEquals(Arrays.asList("a", "b", "a"), log);
        assertEquals(4, ((ChainedPass<?, ?, ?>) chain).size());
        assertFalse(chain.isInPlace());
        assertTrue(a.then(b).isInPlace());
    }

    @Test
    void chainedPassReportsFailingIndex() {
        InPlaceIRPass<Object> ok = o -> {
        };
        InPlaceIRPass<Object> bad = o -> {
            throw new IllegalStateException("broken");
        };
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> ok.then(ok).then(bad).run(new Object()));
        assertEquals("broken", e.getMessage());
        assertEquals(1, e.getSuppressed().length);
        assertEquals("running pass 2 in chain", e.getSuppressed()[0].getMessage());
    }

    @Test
    void debugDisplayLeavesCfgAlone() {
        Cfg<String> cfg = new Cfg<>("entry", "exit", TrackedPrecision.NUM);
        cfg.insert("exit");
        cfg.addEdge("entry", "exit");
        assertSame(cfg, CfgDisplay.debugDisplay("test").run(cfg));
        assertEquals(2, cfg.size());
    }

    @Test
    void graphWalkerOrders() {
        Map<Integer, List<Integer>> graph = new HashMap<>();
        graph.put(1, Arrays.asList(2, 3));
        graph.put(2, Collections.singletonList(4));
        graph.put(3, Collections.singletonList(4));
        graph.put(4, Collections.singletonList(1));
        GraphWalker<Integer> walker = new GraphWalker<Integer>(1, graph::get);
        List<Integer> pre = walker.preOrder().toList();
        List<Integer> post = walker.postOrder().toList();
        assertEquals(Integer.valueOf(1), pre.get(0));
        assertEquals(Integer.valueOf(1), post.get(post.size() - 1));
        assertEquals(new HashSet<>(Arrays.asList(1, 2, 3, 4)), new HashSet<>(pre));
        assertEquals(4, post.size());
    }

    @Test
    void labelWalkerVisitsFirstSuccessorFirst() {
        Cfg<String> cfg = new Cfg<>("entry");
        cfg.insert("a");
        cfg.insert("b");
        cfg.insert("c");
        cfg.addEdge("entry", "a");
        cfg.addEdge("entry", "b");
        cfg.addEdge("a", "c");
        assertEquals(Arrays.asList("entry", "a", "c", "b"), GraphWalker.labelWalker(cfg).preOrder().toList());
    }
}
