package io.github.eutro.absint.core.test;

import io.github.eutro.absint.core.cfg.*;
import io.github.eutro.absint.core.vars.*;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class StatementTest {
    final TestVars v = new TestVars();
    final Var x = v.i32("x");
    final Var y = v.i32("y");
    final Var z = v.i32("z");

    private static Set<Var> setOf(Var... vars) {
        return new LinkedHashSet<>(Arrays.asList(vars));
    }

    @Test
    void binaryOpLive() {
        BinaryOp op = new BinaryOp(z, BinaryOperation.ADD, LinearExpression.of(x), LinearExpression.of(y));
        assertEquals(StatementCode.BIN_OP, op.code());
        assertEquals(setOf(x, y), op.live().uses());
        assertEquals(setOf(z), op.live().defs());
        assertEquals("z = x+y", op.toString());
    }

    @Test
    void liveSetsHaveNoDuplicates() {
        Assignment a = new Assignment(x, LinearExpression.of(y).plus(y).plus(z));
        assertEquals(Arrays.asList(y, z), new ArrayList<>(a.live().uses()));
        assertEquals("x = 2*y + z", a.toString());
    }

    @Test
    void pointerLive() {
        Var p = v.ptr("p");
        Var q = v.ptr("q");
        PtrLoad load = new PtrLoad(p, q);
        assertEquals(setOf(q), load.live().uses());
        assertEquals(setOf(p), load.live().defs());
        assertEquals("p = *(q)", load.toString());

        PtrStore store = new PtrStore(p, q);
        assertEquals(setOf(p, q), store.live().uses());
        assertEquals("*(p) = q", store.toString());

        PtrAssign assign = new PtrAssign(p, q, LinearExpression.of(4));
        assertEquals(setOf(p), assign.live().defs());
        assertEquals(setOf(q), assign.live().uses());
        assertEquals("p = &(q) + 4", assign.toString());

        assertTrue(new PtrAssume(PointerConstraint.tautology()).live().uses().isEmpty());
        assertEquals(setOf(p), new PtrAssert(PointerConstraint.neqNull(p)).live().uses());
        assertEquals("assume_ptr(p == q)", new PtrAssume(PointerConstraint.eq(p, q)).toString());
        assertEquals("p = NULL", new PtrNull(p).toString());
    }

    @Test
    void arrayPreconditions() {
        Var a = v.arr("a");
        Var b = new Var(v.vf.get("b"), VarType.ARR_BOOL);
        assertThrows(IllegalArgumentException.class,
                () -> new ArrayStore(x, LinearExpression.of(0), LinearExpression.of(1), 4, false));
        assertThrows(IllegalArgumentException.class,
                () -> new ArrayStore(a, LinearExpression.of(0), LinearExpression.of(x).plus(1), 4, false));
        assertThrows(IllegalArgumentException.class,
                () -> new ArrayLoad(y, x, LinearExpression.of(0), 4));
        assertThrows(IllegalArgumentException.class, () -> new ArrayAssign(a, b));
        assertThrows(IllegalArgumentException.class,
                () -> new ArrayAssume(a, 4, LinearExpression.of(x).plus(y), LinearExpression.of(8), LinearExpression.of(0)));

        ArrayStore store = new ArrayStore(a, LinearExpression.of(x), LinearExpression.of(y), 4, true);
        assertEquals(setOf(a, x, y), store.live().uses());
        assertEquals("array_store(a,x,y)", store.toString());
        ArrayAssume assume = new ArrayAssume(a, 4, LinearExpression.of(0), LinearExpression.of(x), LinearExpression.of(7));
        assertEquals("assume (forall l in [0,x] % 4 :: a[l]=7)", assume.toString());
    }

    @Test
    void callsAndReturns() {
        CallSite call = new CallSite("f", Arrays.asList(y, z), Collections.singletonList(x));
        assertEquals("(y,z)= call f(x:int)", call.toString());
        assertEquals(setOf(x), call.live().uses());
        assertEquals(setOf(y, z), call.live().defs());
        assertSame(x, call.getArg(0));
        assertThrows(IndexOutOfBoundsException.class, () -> call.getArg(1));
        assertThrows(IllegalArgumentException.class,
                () -> new CallSite("f", Arrays.asList(x, null)));
        assertEquals("z = call g()", new CallSite("g", Collections.singletonList(z), Collections.emptyList()).toString());
        assertEquals("return x", new Return(x).toString());
        assertEquals("return (x,y)", new Return(Arrays.asList(x, y)).toString());
    }

    @Test
    void booleans() {
        Var b = v.bool("b");
        Var c = v.bool("c");
        assertEquals("b = true", new BoolAssignCst(b, LinearConstraint.tautology()).toString());
        assertEquals("b = not(c)", new BoolAssignVar(b, c, true).toString());
        assertEquals("assume (not(c))", new BoolAssume(c, true).toString());
        BoolSelect select = new BoolSelect(b, c, c, c);
        assertEquals(setOf(c), select.live().uses());
        assertEquals(setOf(b), select.live().defs());
    }

    @Test
    void miscRendering() {
        assertEquals("x =*", new Havoc(x).toString());
        assertEquals("unreachable", new Unreachable().toString());
        assertEquals("trunc x:32 to y:32", new IntCast(CastOperation.TRUNC, x, y).toString());
        assertEquals("assume (x <= 5)",
                new Assume(LinearConstraint.leq(LinearExpression.of(x), LinearExpression.of(5))).toString());
    }

    @Test
    void copyKeepsDebugInfo() {
        DebugInfo dbg = new DebugInfo("main.c", 3, 7);
        Assert a = new Assert(LinearConstraint.tautology(), dbg);
        Assert copy = a.copy();
        assertNotSame(a, copy);
        assertEquals(dbg, copy.debugInfo());
        assertTrue(copy.debugInfo().hasDebug());
        assertFalse(DebugInfo.NONE.hasDebug());
        assertEquals(a.toString(), copy.toString());
    }

    @Test
    void visitorDispatch() {
        List<String> seen = new ArrayList<>();
        StatementVisitor visitor = new StatementVisitor() {
            @Override
            public void visit(Havoc stmt) {
                seen.add("havoc " + stmt.lhs());
            }

            @Override
            public void visit(Return stmt) {
                seen.add("return");
            }
        };
        new Havoc(x).accept(visitor);
        new Unreachable().accept(visitor);
        new Return(y).accept(visitor);
        assertEquals(Arrays.asList("havoc x", "return"), seen);
    }
}
