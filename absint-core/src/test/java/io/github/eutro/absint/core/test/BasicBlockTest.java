package io.github.eutro.absint.core.test;

import io.github.eutro.absint.core.cfg.*;
import io.github.eutro.absint.core.vars.LinearExpression;
import io.github.eutro.absint.core.vars.PointerConstraint;
import io.github.eutro.absint.core.vars.Var;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class BasicBlockTest {
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

    @Test
    void edgesAreSymmetric() {
        Cfg<String> cfg = new Cfg<>("a");
        BasicBlock<String> a = cfg.getNode("a");
        BasicBlock<String> b = cfg.insert("b");
        a.addEdge(b);
        a.addEdge(b);
        assertEquals(Collections.singletonList("b"), a.getSuccs());
        assertEquals(Collections.singletonList("a"), b.getPreds());
        a.removeEdge(b);
        assertTrue(a.getSuccs().isEmpty());
        assertTrue(b.getPreds().isEmpty());
    }

    @Test
    void liveGrowsMonotonically() {
        Cfg<String> cfg = new Cfg<>("a");
        BasicBlock<String> a = cfg.getNode("a");
        Set<Var> before = new HashSet<>(a.live());
        a.add(y, x, 1);
        assertTrue(a.live().containsAll(before));
        assertEquals(new HashSet<>(Arrays.asList(x, y)), a.live());
        before = new HashSet<>(a.live());
        a.havoc(z);
        assertTrue(a.live().containsAll(before));
        assertTrue(a.live().contains(z));
    }

    @Test
    void insertAtFrontIsOneShot() {
        Cfg<String> cfg = new Cfg<>("a");
        BasicBlock<String> a = cfg.getNode("a");
        a.havoc(x);
        a.setInsertPointFront();
        a.havoc(y);
        a.havoc(z);
        assertEquals(Arrays.asList("y =*", "x =*", "z =*"), render(a));
        assertEquals(Arrays.asList("z =*", "x =*", "y =*"), stringsOf(a.reversedStatements()));
    }

    private static List<String> stringsOf(List<Statement> stmts) {
        List<String> out = new ArrayList<>();
        for (Statement stmt : stmts) {
            out.add(stmt.toString());
        }
        return out;
    }

    @Test
    void precisionGatesPointerAndArrayStatements() {
        Var p = v.ptr("p");
        Var arr = v.arr("arr");

        BasicBlock<String> num = new Cfg<>("n", TrackedPrecision.NUM).getNode("n");
        assertFalse(num.ptrNull(p));
        assertFalse(num.arrayStore(arr, LinearExpression.of(0), LinearExpression.of(1), 4));
        assertEquals(0, num.size());
        assertTrue(num.live().isEmpty());

        BasicBlock<String> ptr = new Cfg<>("p", TrackedPrecision.PTR).getNode("p");
        assertTrue(ptr.ptrAssume(PointerConstraint.neqNull(p)));
        assertFalse(ptr.arrayLoad(x, arr, LinearExpression.of(0), 4));
        assertEquals(1, ptr.size());

        BasicBlock<String> all = new Cfg<>("a", TrackedPrecision.ARR).getNode("a");
        assertTrue(all.ptrNull(p));
        assertTrue(all.arrayLoad(x, arr, LinearExpression.of(0), 4));
        assertEquals(2, all.size());
    }

    @Test
    void gatedBuildersSkipPreconditions() {
        BasicBlock<String> num = new Cfg<>("n").getNode("n");
        // x is not an array, but the statement is never built
        assertFalse(num.arrayAssign(x, y));
        BasicBlock<String> all = new Cfg<>("a", TrackedPrecision.ARR).getNode("a");
        assertThrows(IllegalArgumentException.class, () -> all.arrayAssign(x, y));
    }

    @Test
    void mergeJoinsStatementsAndLive() {
        Cfg<String> cfg = new Cfg<>("a");
        BasicBlock<String> a = cfg.getNode("a");
        BasicBlock<String> b = cfg.insert("b");
        BasicBlock<String> c = cfg.insert("c");
        a.assign(x, 1);
        b.assign(y, 2);
        c.assign(z, 3);
        a.mergeBack(b);
        a.mergeFront(c);
        assertEquals(Arrays.asList("z = 3", "x = 1", "y = 2"), render(a));
        assertEquals(new HashSet<>(Arrays.asList(x, y, z)), a.live());
    }

    @Test
    void copyIsIndependent() {
        Cfg<String> cfg = new Cfg<>("a");
        BasicBlock<String> a = cfg.getNode("a");
        BasicBlock<String> b = cfg.insert("b");
        a.add(y, x, 1);
        a.addEdge(b);
        BasicBlock<String> copy = a.copy();
        a.havoc(z);
        a.removeEdge(b);
        assertEquals(Collections.singletonList("y = x+1"), render(copy));
        assertNotSame(a.getStatements().get(0), copy.getStatements().get(0));
        assertEquals(Collections.singletonList("b"), copy.getSuccs());
        assertFalse(copy.live().contains(z));
    }

    @Test
    void rendering() {
        Cfg<String> cfg = new Cfg<>("a");
        BasicBlock<String> a = cfg.getNode("a");
        a.add(y, x, 1);
        a.ret(y);
        cfg.addEdge("a", cfg.insert("b").label());
        cfg.addEdge("a", cfg.insert("c").label());
        assertEquals("a:\n  y = x+1;\n  return y;\n  goto b,c;\n", a.toString());
    }

    @Test
    void visitsInBlockOrder() {
        Cfg<String> cfg = new Cfg<>("a");
        BasicBlock<String> a = cfg.getNode("a");
        a.havoc(x);
        a.havoc(y);
        List<Var> seen = new ArrayList<>();
        a.accept(new StatementVisitor() {
            @Override
            public void visit(Havoc stmt) {
                seen.add(stmt.lhs());
            }
        });
        assertEquals(Arrays.asList(x, y), seen);
    }
}
