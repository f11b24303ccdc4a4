package io.github.eutro.absint.core.cfg;

import io.github.eutro.absint.core.vars.*;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * A basic block of a {@link Cfg}: an ordered list of {@link Statement statements},
 * the labels of its predecessors and successors, and the join of its statements' live sets.
 * <p>
 * Blocks are created by {@link Cfg#insert(Object)}, and take the CFG's {@link TrackedPrecision}.
 * Array statements are only kept at {@link TrackedPrecision#ARR}, and pointer statements at
 * {@link TrackedPrecision#PTR} or above; builders for those report whether the statement was kept.
 *
 * @param <L> The type of block labels.
 */
public final class BasicBlock<L> implements BlockView<L> {
    private static final Logger LOGGER = LoggerFactory.getLogger(BasicBlock.class);

    private final L label;
    private final TrackedPrecision precision;
    private final List<Statement> statements = new ArrayList<>();
    private final List<L> preds = new ArrayList<>();
    private final List<L> succs = new ArrayList<>();
    private final Set<Var> live = new LinkedHashSet<>();
    private boolean insertAtFront = false;

    BasicBlock(L label, TrackedPrecision precision) {
        this.label = Objects.requireNonNull(label, "label");
        this.precision = precision;
    }

    @Override
    public L label() {
        return label;
    }

    public TrackedPrecision getTrackedPrecision() {
        return precision;
    }

    @Override
    public List<Statement> getStatements() {
        return Collections.unmodifiableList(statements);
    }

    /**
     * Get the statements of this block, last first.
     *
     * @return The reversed statements.
     */
    public List<Statement> reversedStatements() {
        List<Statement> reversed = new ArrayList<>(statements);
        Collections.reverse(reversed);
        return Collections.unmodifiableList(reversed);
    }

    @Override
    public List<L> getPreds() {
        return Collections.unmodifiableList(preds);
    }

    @Override
    public List<L> getSuccs() {
        return Collections.unmodifiableList(succs);
    }

    @Override
    public Set<Var> live() {
        return Collections.unmodifiableSet(live);
    }

    @Override
    public int size() {
        return statements.size();
    }

    /**
     * Make the next inserted statement go at the front of this block, rather than the back.
     * <p>
     * Only the next insertion is affected.
     */
    public void setInsertPointFront() {
        insertAtFront = true;
    }

    private <S extends Statement> S insert(S stmt) {
        if (insertAtFront) {
            statements.add(0, stmt);
            insertAtFront = false;
        } else {
            statements.add(stmt);
        }
        live.addAll(stmt.live().vars());
        return stmt;
    }

    private boolean tracks(TrackedPrecision required, String what) {
        if (precision.tracks(required)) return true;
        LOGGER.debug("dropping {} in block {}: precision {} does not track {}",
                what, label, precision, required);
        return false;
    }

    // edges

    /**
     * Add an edge from this block to another, updating both blocks.
     * Adding an edge that already exists does nothing.
     *
     * @param to The successor.
     */
    public void addEdge(@NotNull BasicBlock<L> to) {
        if (!succs.contains(to.label)) succs.add(to.label);
        if (!to.preds.contains(label)) to.preds.add(label);
    }

    /**
     * Remove the edge from this block to another, updating both blocks.
     *
     * @param to The successor.
     */
    public void removeEdge(@NotNull BasicBlock<L> to) {
        succs.remove(to.label);
        to.preds.remove(label);
    }

    /**
     * Insert all the statements of another block before those of this one.
     * Edges are unaffected.
     *
     * @param other The other block.
     */
    public void mergeFront(@NotNull BasicBlock<L> other) {
        statements.addAll(0, other.statements);
        live.addAll(other.live);
    }

    /**
     * Insert all the statements of another block after those of this one.
     * Edges are unaffected.
     *
     * @param other The other block.
     */
    public void mergeBack(@NotNull BasicBlock<L> other) {
        statements.addAll(other.statements);
        live.addAll(other.live);
    }

    /**
     * Create a copy of this block, with copies of all its statements, and the same edges.
     *
     * @return The copy.
     */
    public BasicBlock<L> copy() {
        BasicBlock<L> copy = new BasicBlock<>(label, precision);
        for (Statement stmt : statements) {
            copy.statements.add(stmt.copy());
        }
        copy.preds.addAll(preds);
        copy.succs.addAll(succs);
        copy.live.addAll(live);
        copy.insertAtFront = insertAtFront;
        return copy;
    }

    // arithmetic

    public BinaryOp binOp(BinaryOperation op, Var lhs, LinearExpression op1, LinearExpression op2) {
        return insert(new BinaryOp(lhs, op, op1, op2));
    }

    public BinaryOp binOp(BinaryOperation op, Var lhs, Var op1, Var op2) {
        return binOp(op, lhs, LinearExpression.of(op1), LinearExpression.of(op2));
    }

    public BinaryOp binOp(BinaryOperation op, Var lhs, Var op1, long k) {
        return binOp(op, lhs, LinearExpression.of(op1), LinearExpression.of(k));
    }

    public BinaryOp add(Var lhs, Var op1, Var op2) {
        return binOp(BinaryOperation.ADD, lhs, op1, op2);
    }

    public BinaryOp add(Var lhs, Var op1, long k) {
        return binOp(BinaryOperation.ADD, lhs, op1, k);
    }

    public BinaryOp sub(Var lhs, Var op1, Var op2) {
        return binOp(BinaryOperation.SUB, lhs, op1, op2);
    }

    public BinaryOp sub(Var lhs, Var op1, long k) {
        return binOp(BinaryOperation.SUB, lhs, op1, k);
    }

    public BinaryOp mul(Var lhs, Var op1, Var op2) {
        return binOp(BinaryOperation.MUL, lhs, op1, op2);
    }

    public BinaryOp mul(Var lhs, Var op1, long k) {
        return binOp(BinaryOperation.MUL, lhs, op1, k);
    }

    public BinaryOp div(Var lhs, Var op1, Var op2) {
        return binOp(BinaryOperation.SDIV, lhs, op1, op2);
    }

    public BinaryOp div(Var lhs, Var op1, long k) {
        return binOp(BinaryOperation.SDIV, lhs, op1, k);
    }

    public BinaryOp udiv(Var lhs, Var op1, Var op2) {
        return binOp(BinaryOperation.UDIV, lhs, op1, op2);
    }

    public BinaryOp udiv(Var lhs, Var op1, long k) {
        return binOp(BinaryOperation.UDIV, lhs, op1, k);
    }

    public BinaryOp rem(Var lhs, Var op1, Var op2) {
        return binOp(BinaryOperation.SREM, lhs, op1, op2);
    }

    public BinaryOp rem(Var lhs, Var op1, long k) {
        return binOp(BinaryOperation.SREM, lhs, op1, k);
    }

    public BinaryOp urem(Var lhs, Var op1, Var op2) {
        return binOp(BinaryOperation.UREM, lhs, op1, op2);
    }

    public BinaryOp urem(Var lhs, Var op1, long k) {
        return binOp(BinaryOperation.UREM, lhs, op1, k);
    }

    public BinaryOp bitwiseAnd(Var lhs, Var op1, Var op2) {
        return binOp(BinaryOperation.AND, lhs, op1, op2);
    }

    public BinaryOp bitwiseAnd(Var lhs, Var op1, long k) {
        return binOp(BinaryOperation.AND, lhs, op1, k);
    }

    public BinaryOp bitwiseOr(Var lhs, Var op1, Var op2) {
        return binOp(BinaryOperation.OR, lhs, op1, op2);
    }

    public BinaryOp bitwiseOr(Var lhs, Var op1, long k) {
        return binOp(BinaryOperation.OR, lhs, op1, k);
    }

    public BinaryOp bitwiseXor(Var lhs, Var op1, Var op2) {
        return binOp(BinaryOperation.XOR, lhs, op1, op2);
    }

    public BinaryOp bitwiseXor(Var lhs, Var op1, long k) {
        return binOp(BinaryOperation.XOR, lhs, op1, k);
    }

    public BinaryOp shl(Var lhs, Var op1, Var op2) {
        return binOp(BinaryOperation.SHL, lhs, op1, op2);
    }

    public BinaryOp shl(Var lhs, Var op1, long k) {
        return binOp(BinaryOperation.SHL, lhs, op1, k);
    }

    public BinaryOp lshr(Var lhs, Var op1, Var op2) {
        return binOp(BinaryOperation.LSHR, lhs, op1, op2);
    }

    public BinaryOp lshr(Var lhs, Var op1, long k) {
        return binOp(BinaryOperation.LSHR, lhs, op1, k);
    }

    public BinaryOp ashr(Var lhs, Var op1, Var op2) {
        return binOp(BinaryOperation.ASHR, lhs, op1, op2);
    }

    public BinaryOp ashr(Var lhs, Var op1, long k) {
        return binOp(BinaryOperation.ASHR, lhs, op1, k);
    }

    public Assignment assign(Var lhs, LinearExpression rhs) {
        return insert(new Assignment(lhs, rhs));
    }

    public Assignment assign(Var lhs, Var rhs) {
        return assign(lhs, LinearExpression.of(rhs));
    }

    public Assignment assign(Var lhs, long k) {
        return assign(lhs, LinearExpression.of(k));
    }

    public Assume assume(LinearConstraint constraint) {
        return insert(new Assume(constraint));
    }

    public Havoc havoc(Var lhs) {
        return insert(new Havoc(lhs));
    }

    public Unreachable unreachable() {
        return insert(new Unreachable());
    }

    /**
     * Append {@code lhs = v ? ifTrue : ifFalse}, where {@code v} is taken to be true iff {@code v >= 1}.
     *
     * @param lhs     The variable to assign.
     * @param v       The condition.
     * @param ifTrue  The value if the condition holds.
     * @param ifFalse The value otherwise.
     * @return The statement.
     */
    public Select select(Var lhs, Var v, LinearExpression ifTrue, LinearExpression ifFalse) {
        return select(lhs, LinearConstraint.geq(LinearExpression.of(v), LinearExpression.of(1)), ifTrue, ifFalse);
    }

    public Select select(Var lhs, LinearConstraint cond, LinearExpression ifTrue, LinearExpression ifFalse) {
        return insert(new Select(lhs, cond, ifTrue, ifFalse));
    }

    public Assert assertion(LinearConstraint constraint) {
        return assertion(constraint, DebugInfo.NONE);
    }

    public Assert assertion(LinearConstraint constraint, DebugInfo debugInfo) {
        return insert(new Assert(constraint, debugInfo));
    }

    public IntCast truncate(Var src, Var dst) {
        return insert(new IntCast(CastOperation.TRUNC, src, dst));
    }

    public IntCast sext(Var src, Var dst) {
        return insert(new IntCast(CastOperation.SEXT, src, dst));
    }

    public IntCast zext(Var src, Var dst) {
        return insert(new IntCast(CastOperation.ZEXT, src, dst));
    }

    // functions

    public CallSite callsite(String name, List<Var> lhs, List<Var> args) {
        return insert(new CallSite(name, lhs, args));
    }

    public CallSite callsite(String name, List<Var> args) {
        return insert(new CallSite(name, args));
    }

    public Return ret(Var value) {
        return insert(new Return(value));
    }

    public Return ret(List<Var> values) {
        return insert(new Return(values));
    }

    // arrays

    /**
     * Append an {@link ArrayAssume}, if this block tracks arrays.
     *
     * @param array    The array.
     * @param elemSize The element size, in bytes.
     * @param lb       The lower bound.
     * @param ub       The upper bound.
     * @param value    The value of every cell in range.
     * @return Whether the statement was appended.
     */
    public boolean arrayAssume(Var array, long elemSize, LinearExpression lb, LinearExpression ub, LinearExpression value) {
        if (!tracks(TrackedPrecision.ARR, "array assume")) return false;
        insert(new ArrayAssume(array, elemSize, lb, ub, value));
        return true;
    }

    public boolean arrayStore(Var array, LinearExpression index, LinearExpression value, long elemSize, boolean singleton) {
        if (!tracks(TrackedPrecision.ARR, "array store")) return false;
        insert(new ArrayStore(array, index, value, elemSize, singleton));
        return true;
    }

    public boolean arrayStore(Var array, LinearExpression index, LinearExpression value, long elemSize) {
        return arrayStore(array, index, value, elemSize, false);
    }

    public boolean arrayLoad(Var lhs, Var array, LinearExpression index, long elemSize) {
        if (!tracks(TrackedPrecision.ARR, "array load")) return false;
        insert(new ArrayLoad(lhs, array, index, elemSize));
        return true;
    }

    public boolean arrayAssign(Var lhs, Var rhs) {
        if (!tracks(TrackedPrecision.ARR, "array assign")) return false;
        insert(new ArrayAssign(lhs, rhs));
        return true;
    }

    // pointers

    public boolean ptrLoad(Var lhs, Var rhs) {
        return ptrLoad(lhs, rhs, DebugInfo.NONE);
    }

    public boolean ptrLoad(Var lhs, Var rhs, DebugInfo debugInfo) {
        if (!tracks(TrackedPrecision.PTR, "pointer load")) return false;
        insert(new PtrLoad(lhs, rhs, debugInfo));
        return true;
    }

    public boolean ptrStore(Var lhs, Var rhs) {
        return ptrStore(lhs, rhs, DebugInfo.NONE);
    }

    public boolean ptrStore(Var lhs, Var rhs, DebugInfo debugInfo) {
        if (!tracks(TrackedPrecision.PTR, "pointer store")) return false;
        insert(new PtrStore(lhs, rhs, debugInfo));
        return true;
    }

    public boolean ptrAssign(Var lhs, Var rhs, LinearExpression offset) {
        if (!tracks(TrackedPrecision.PTR, "pointer assign")) return false;
        insert(new PtrAssign(lhs, rhs, offset));
        return true;
    }

    public boolean ptrObject(Var lhs, long address) {
        if (!tracks(TrackedPrecision.PTR, "pointer object")) return false;
        insert(new PtrObject(lhs, address));
        return true;
    }

    public boolean ptrFunction(Var lhs, VarName function) {
        if (!tracks(TrackedPrecision.PTR, "function pointer")) return false;
        insert(new PtrFunction(lhs, function));
        return true;
    }

    public boolean ptrNull(Var lhs) {
        if (!tracks(TrackedPrecision.PTR, "null pointer")) return false;
        insert(new PtrNull(lhs));
        return true;
    }

    public boolean ptrAssume(PointerConstraint constraint) {
        if (!tracks(TrackedPrecision.PTR, "pointer assume")) return false;
        insert(new PtrAssume(constraint));
        return true;
    }

    public boolean ptrAssert(PointerConstraint constraint) {
        return ptrAssert(constraint, DebugInfo.NONE);
    }

    public boolean ptrAssert(PointerConstraint constraint, DebugInfo debugInfo) {
        if (!tracks(TrackedPrecision.PTR, "pointer assert")) return false;
        insert(new PtrAssert(constraint, debugInfo));
        return true;
    }

    // booleans

    public BoolAssignCst boolAssign(Var lhs, LinearConstraint rhs) {
        return insert(new BoolAssignCst(lhs, rhs));
    }

    public BoolAssignVar boolAssign(Var lhs, Var rhs, boolean negated) {
        return insert(new BoolAssignVar(lhs, rhs, negated));
    }

    public BoolAssignVar boolAssign(Var lhs, Var rhs) {
        return boolAssign(lhs, rhs, false);
    }

    public BoolBinaryOp boolAnd(Var lhs, Var op1, Var op2) {
        return insert(new BoolBinaryOp(lhs, BoolBinaryOperation.AND, op1, op2));
    }

    public BoolBinaryOp boolOr(Var lhs, Var op1, Var op2) {
        return insert(new BoolBinaryOp(lhs, BoolBinaryOperation.OR, op1, op2));
    }

    public BoolBinaryOp boolXor(Var lhs, Var op1, Var op2) {
        return insert(new BoolBinaryOp(lhs, BoolBinaryOperation.XOR, op1, op2));
    }

    public BoolAssume boolAssume(Var cond) {
        return insert(new BoolAssume(cond, false));
    }

    public BoolAssume boolNotAssume(Var cond) {
        return insert(new BoolAssume(cond, true));
    }

    public BoolSelect boolSelect(Var lhs, Var cond, Var ifTrue, Var ifFalse) {
        return insert(new BoolSelect(lhs, cond, ifTrue, ifFalse));
    }

    public BoolAssert boolAssert(Var cond) {
        return boolAssert(cond, DebugInfo.NONE);
    }

    public BoolAssert boolAssert(Var cond, DebugInfo debugInfo) {
        return insert(new BoolAssert(cond, debugInfo));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(label).append(":\n");
        for (Statement stmt : statements) {
            sb.append("  ").append(stmt).append(";\n");
        }
        if (!succs.isEmpty()) {
            StringJoiner sj = new StringJoiner(",", "  goto ", ";\n");
            for (L succ : succs) {
                sj.add(String.valueOf(succ));
            }
            sb.append(sj);
        }
        return sb.toString();
    }
}
