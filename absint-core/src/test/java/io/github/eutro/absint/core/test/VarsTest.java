package io.github.eutro.absint.core.test;

import io.github.eutro.absint.core.vars.*;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.NoSuchElementException;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class VarsTest {
    @Test
    void factoryInterns() {
        VariableFactory vf = new VariableFactory();
        VarName x = vf.get("x");
        assertSame(x, vf.get("x"));
        assertNotEquals(x, vf.get("y"));
        assertEquals(1, x.index());
        assertSame(x, vf.lookup(x.index()));
        assertEquals(2, vf.size());
        assertThrows(NoSuchElementException.class, () -> vf.lookup(42));
    }

    @Test
    void varIdentityIsName() {
        VariableFactory vf = new VariableFactory();
        Var a = new Var(vf.get("a"), VarType.INT, 32);
        Var b = new Var(vf.get("a"), VarType.INT, 8);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals("a", a.toString());
        assertThrows(IllegalArgumentException.class, () -> new Var(vf.get("c"), VarType.INT, 0));
    }

    @Test
    void linearExpressions() {
        TestVars v = new TestVars();
        Var x = v.i32("x");
        Var y = v.i32("y");
        LinearExpression e = LinearExpression.term(2, x).minus(y).plus(3);
        assertEquals("2*x - y + 3", e.toString());
        assertEquals(BigInteger.valueOf(2), e.coefficient(x));
        assertEquals(BigInteger.ZERO, e.coefficient(v.i32("z")));
        assertEquals(Arrays.asList(x, y), Arrays.asList(e.variables().toArray()));
        assertEquals(Optional.of(x), LinearExpression.of(x).getVariable());
        assertFalse(e.getVariable().isPresent());
        assertTrue(e.minus(e).isConstant());
        assertEquals("0", e.minus(e).toString());
        assertEquals("-x", LinearExpression.of(x).negate().toString());
        assertEquals(BigInteger.valueOf(Long.MAX_VALUE).add(BigInteger.ONE),
                LinearExpression.of(0).minus(Long.MIN_VALUE).constant());
    }

    @Test
    void linearConstraints() {
        TestVars v = new TestVars();
        Var x = v.i32("x");
        LinearConstraint c = LinearConstraint.leq(LinearExpression.of(x), LinearExpression.of(5));
        assertEquals("x <= 5", c.toString());
        assertTrue(LinearConstraint.tautology().isTautology());
        assertTrue(LinearConstraint.contradiction().isContradiction());
        assertTrue(LinearConstraint.lt(LinearExpression.of(1), LinearExpression.of(2)).isTautology());
        assertFalse(c.isTautology());
        assertFalse(c.isContradiction());
    }

    @Test
    void pointerConstraints() {
        TestVars v = new TestVars();
        Var p = v.ptr("p");
        Var q = v.ptr("q");
        assertTrue(PointerConstraint.eqNull(p).isUnary());
        assertFalse(PointerConstraint.neq(p, q).isUnary());
        assertEquals("p != q", PointerConstraint.neq(p, q).toString());
        assertThrows(IllegalStateException.class, () -> PointerConstraint.tautology().lhs());
        assertThrows(IllegalStateException.class, () -> PointerConstraint.eqNull(p).rhs());
    }
}
