package io.github.eutro.absint.core.cfg;

import io.github.eutro.absint.core.vars.Var;

import java.util.Objects;

/**
 * {@code dst = op(src)}, truncating or extending an integer to the width of {@code dst}.
 */
public final class IntCast extends Statement {
    private final CastOperation op;
    private final Var src;
    private final Var dst;

    public IntCast(CastOperation op, Var src, Var dst, DebugInfo debugInfo) {
        super(StatementCode.INT_CAST, debugInfo);
        this.op = Objects.requireNonNull(op);
        this.src = Objects.requireNonNull(src);
        this.dst = Objects.requireNonNull(dst);
        live.addUse(src);
        live.addDef(dst);
    }

    public IntCast(CastOperation op, Var src, Var dst) {
        this(op, src, dst, DebugInfo.NONE);
    }

    public CastOperation op() {
        return op;
    }

    public Var src() {
        return src;
    }

    public Var dst() {
        return dst;
    }

    @Override
    public IntCast copy() {
        return new IntCast(op, src, dst, debugInfo());
    }

    @Override
    public void accept(StatementVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public String toString() {
        return op + " " + src + ":" + src.bitwidth() + " to " + dst + ":" + dst.bitwidth();
    }
}
