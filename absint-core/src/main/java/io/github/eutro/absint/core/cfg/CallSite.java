package io.github.eutro.absint.core.cfg;

import io.github.eutro.absint.core.vars.Var;
import io.github.eutro.absint.core.vars.VarType;

import java.util.*;

/**
 * {@code (lhs...) = call name(args...)}.
 * <p>
 * Call sites are matched to callee {@link FunctionDecl declarations} by name and types,
 * see {@link CfgHasher}.
 */
public final class CallSite extends Statement {
    private final String name;
    private final List<Var> lhs;
    private final List<Var> args;

    public CallSite(String name, List<Var> lhs, List<Var> args) {
        super(StatementCode.CALLSITE, DebugInfo.NONE);
        this.name = Objects.requireNonNull(name, "name");
        this.lhs = FunctionDecl.copyVars("call site results", lhs);
        this.args = FunctionDecl.copyVars("call site arguments", args);
        live.addUses(this.args);
        for (Var v : this.lhs) {
            live.addDef(v);
        }
    }

    public CallSite(String name, List<Var> args) {
        this(name, Collections.emptyList(), args);
    }

    public String name() {
        return name;
    }

    public List<Var> lhs() {
        return lhs;
    }

    public List<Var> args() {
        return args;
    }

    public int numArgs() {
        return args.size();
    }

    /**
     * Get an argument by position.
     *
     * @param idx The index.
     * @return The argument.
     * @throws IndexOutOfBoundsException If there is no such argument.
     */
    public Var getArg(int idx) {
        Objects.checkIndex(idx, args.size());
        return args.get(idx);
    }

    public VarType getArgType(int idx) {
        return getArg(idx).type();
    }

    @Override
    public CallSite copy() {
        return new CallSite(name, lhs, args);
    }

    @Override
    public void accept(StatementVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (lhs.size() == 1) {
            sb.append(lhs.get(0)).append(" = ");
        } else if (!lhs.isEmpty()) {
            StringJoiner sj = new StringJoiner(",", "(", ")= ");
            for (Var v : lhs) {
                sj.add(v.toString());
            }
            sb.append(sj);
        }
        sb.append("call ").append(name);
        StringJoiner sj = new StringJoiner(",", "(", ")");
        for (Var arg : args) {
            sj.add(arg + ":" + arg.type());
        }
        return sb.append(sj).toString();
    }
}
