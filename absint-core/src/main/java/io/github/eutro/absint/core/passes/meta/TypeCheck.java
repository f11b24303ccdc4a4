package io.github.eutro.absint.core.passes.meta;

import io.github.eutro.absint.core.cfg.*;
import io.github.eutro.absint.core.passes.InPlaceIRPass;
import io.github.eutro.absint.core.vars.LinearExpression;
import io.github.eutro.absint.core.vars.Var;
import io.github.eutro.absint.core.vars.VarType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * A pass that checks the types and bit widths of the operands of every numeric and boolean statement,
 * throwing a {@link TypeCheckException} at the first violation.
 * <p>
 * Integers must be wider than one bit, booleans exactly one bit wide. Pointer, array, call
 * and return statements are not checked.
 * <p>
 * The graph must also have an exit, and if it has only one block, that block must be both entry and exit.
 */
public class TypeCheck implements InPlaceIRPass<Cfg<?>> {
    private static final Logger LOGGER = LoggerFactory.getLogger(TypeCheck.class);

    /**
     * A singleton instance of this pass.
     */
    public static final TypeCheck INSTANCE = new TypeCheck();

    @Override
    public void runInPlace(Cfg<?> cfg) {
        check(cfg);
    }

    /**
     * Type check any view of a CFG.
     *
     * @param cfg The graph.
     * @throws TypeCheckException If the graph is ill-typed.
     */
    public void check(CfgView<?> cfg) {
        if (cfg.size() == 0) {
            throw new TypeCheckException("cfg must have at least one block");
        }
        if (!cfg.hasExit()) {
            throw new TypeCheckException("cfg must have an exit block");
        }
        if (cfg.size() == 1 && !cfg.entry().equals(cfg.exit())) {
            throw new TypeCheckException("cfg with only one block must have entry and exit blocks the same");
        }
        Checker checker = new Checker();
        for (BlockView<?> block : cfg.blocks()) {
            block.accept(checker);
        }
        LOGGER.debug("type checked {} blocks", cfg.size());
    }

    private static void checkNum(Var v, String msg, Statement s) {
        if (!v.type().isNumeric()) throw new TypeCheckException(msg, s);
    }

    private static void checkInt(Var v, String msg, Statement s) {
        if (v.type() != VarType.INT || v.bitwidth() <= 1) throw new TypeCheckException(msg, s);
    }

    private static void checkBool(Var v, String msg, Statement s) {
        if (v.type() != VarType.BOOL || v.bitwidth() != 1) throw new TypeCheckException(msg, s);
    }

    private static void checkIntOrBool(Var v, String msg, Statement s) {
        if (v.type() != VarType.INT && v.type() != VarType.BOOL) throw new TypeCheckException(msg, s);
        checkBitwidthIfInt(v, msg, s);
        checkBitwidthIfBool(v, msg, s);
    }

    private static void checkBitwidthIfInt(Var v, String msg, Statement s) {
        if (v.type() == VarType.INT && v.bitwidth() <= 1) throw new TypeCheckException(msg, s);
    }

    private static void checkBitwidthIfBool(Var v, String msg, Statement s) {
        if (v.type() == VarType.BOOL && v.bitwidth() != 1) throw new TypeCheckException(msg, s);
    }

    private static void checkSameType(Var v1, Var v2, String msg, Statement s) {
        if (v1.type() != v2.type()) throw new TypeCheckException(msg, s);
    }

    private static void checkSameBitwidth(Var v1, Var v2, String msg, Statement s) {
        // only meaningful for integers and booleans
        if ((v1.type() == VarType.INT || v1.type() == VarType.BOOL) && v1.bitwidth() != v2.bitwidth()) {
            throw new TypeCheckException(msg, s);
        }
    }

    private static void checkConsistent(Iterable<Var> vars, String what, Statement s) {
        Var first = null;
        for (Var v : vars) {
            checkNum(v, what + " variables must be integer or real", s);
            checkBitwidthIfInt(v, what + " integer variables must have bitwidth > 1", s);
            if (first == null) {
                first = v;
            } else {
                checkSameType(first, v, what + " variables must have the same type", s);
                checkSameBitwidth(first, v, what + " variables must have the same bitwidth", s);
            }
        }
    }

    private static void checkLike(Var lhs, LinearExpression e, String what, Statement s) {
        for (Var v : e.variables()) {
            checkNum(v, what + " variables must be integer or real", s);
            checkSameType(lhs, v, what + " variables cannot have different type from lhs", s);
            checkSameBitwidth(lhs, v, what + " variables cannot have different bitwidth from lhs", s);
        }
    }

    private static class Checker implements StatementVisitor {
        @Override
        public void visit(BinaryOp s) {
            Var lhs = s.lhs();
            checkNum(lhs, "lhs must be integer or real", s);
            checkBitwidthIfInt(lhs, "lhs must have bitwidth > 1", s);
            Optional<Var> left = s.left().getVariable();
            if (!left.isPresent()) {
                throw new TypeCheckException("first binary operand must be a variable", s);
            }
            checkSameType(lhs, left.get(), "first operand cannot have different type from lhs", s);
            checkSameBitwidth(lhs, left.get(), "first operand cannot have different bitwidth from lhs", s);
            Optional<Var> right = s.right().getVariable();
            if (right.isPresent()) {
                checkSameType(lhs, right.get(), "second operand cannot have different type from lhs", s);
                checkSameBitwidth(lhs, right.get(), "second operand cannot have different bitwidth from lhs", s);
            }
        }

        @Override
        public void visit(Assignment s) {
            Var lhs = s.lhs();
            checkNum(lhs, "lhs must be integer or real", s);
            checkBitwidthIfInt(lhs, "lhs must have bitwidth > 1", s);
            checkLike(lhs, s.rhs(), "rhs", s);
        }

        @Override
        public void visit(Assume s) {
            checkConsistent(s.constraint().variables(), "assume", s);
        }

        @Override
        public void visit(Assert s) {
            checkConsistent(s.constraint().variables(), "assert", s);
        }

        @Override
        public void visit(Select s) {
            Var lhs = s.lhs();
            checkNum(lhs, "lhs must be integer or real", s);
            checkBitwidthIfInt(lhs, "lhs must have bitwidth > 1", s);
            checkConsistent(s.cond().variables(), "condition", s);
            for (Var v : s.cond().variables()) {
                checkSameType(lhs, v, "condition variables cannot have different type from lhs", s);
            }
            checkLike(lhs, s.ifTrue(), "true value", s);
            checkLike(lhs, s.ifFalse(), "false value", s);
        }

        @Override
        public void visit(IntCast s) {
            Var src = s.src();
            Var dst = s.dst();
            switch (s.op()) {
                case TRUNC:
                    checkInt(src, "source operand must be integer", s);
                    checkIntOrBool(dst, "destination must be integer or bool", s);
                    if (src.bitwidth() <= dst.bitwidth()) {
                        throw new TypeCheckException("bitwidth of source operand must be greater than destination", s);
                    }
                    break;
                case SEXT:
                case ZEXT:
                    checkInt(dst, "destination operand must be integer", s);
                    checkIntOrBool(src, "source must be integer or bool", s);
                    if (dst.bitwidth() <= src.bitwidth()) {
                        throw new TypeCheckException("bitwidth of destination must be greater than source", s);
                    }
                    break;
                default:
                    throw new IllegalStateException();
            }
        }

        @Override
        public void visit(BoolAssignCst s) {
            checkBool(s.lhs(), "lhs must be boolean", s);
            checkConsistent(s.rhs().variables(), "rhs", s);
        }

        @Override
        public void visit(BoolAssignVar s) {
            checkBool(s.lhs(), "lhs must be boolean", s);
            checkBool(s.rhs(), "rhs must be boolean", s);
        }

        @Override
        public void visit(BoolBinaryOp s) {
            checkBool(s.lhs(), "lhs must be boolean", s);
            checkBool(s.left(), "first operand must be boolean", s);
            checkBool(s.right(), "second operand must be boolean", s);
        }

        @Override
        public void visit(BoolAssume s) {
            checkBool(s.cond(), "condition must be boolean", s);
        }

        @Override
        public void visit(BoolSelect s) {
            checkBool(s.lhs(), "lhs must be boolean", s);
            checkBool(s.cond(), "condition must be boolean", s);
            checkBool(s.ifTrue(), "first operand must be boolean", s);
            checkBool(s.ifFalse(), "second operand must be boolean", s);
        }

        @Override
        public void visit(BoolAssert s) {
            checkBool(s.cond(), "condition must be boolean", s);
        }
    }
}
