package io.github.eutro.absint.core.cfg;

import io.github.eutro.absint.core.vars.Var;
import io.github.eutro.absint.core.vars.VarType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Hashes function signatures so that a {@link CallSite} hashes the same as
 * the {@link FunctionDecl} of any function it may call.
 * <p>
 * A signature is its name, the types of its outputs and the types of its inputs.
 * Variable names play no part.
 */
public final class CfgHasher {
    private CfgHasher() {
    }

    public static int hash(FunctionDecl decl) {
        return hash(decl.name(), decl.outputs(), decl.inputs());
    }

    public static int hash(CallSite callSite) {
        return hash(callSite.name(), callSite.lhs(), callSite.args());
    }

    /**
     * Get the hash of the signature of a {@link Cfg}.
     *
     * @param cfg The CFG, which must have a {@link Cfg#getFuncDecl() declaration}.
     * @return The hash.
     * @throws IllegalStateException If the CFG has no declaration.
     */
    public static int hash(CfgView<?> cfg) {
        return hash(cfg.getFuncDecl()
                .orElseThrow(() -> new IllegalStateException("cannot hash a cfg without a function declaration")));
    }

    /**
     * Get whether a call site could call the function with the given declaration.
     *
     * @param callSite The call site.
     * @param decl     The declaration.
     * @return Whether the signatures match.
     */
    public static boolean matches(CallSite callSite, FunctionDecl decl) {
        return callSite.name().equals(decl.name())
                && types(callSite.lhs()).equals(types(decl.outputs()))
                && types(callSite.args()).equals(types(decl.inputs()));
    }

    private static int hash(String name, List<Var> outputs, List<Var> inputs) {
        return Objects.hash(name, types(outputs), types(inputs));
    }

    static List<VarType> types(List<Var> vars) {
        List<VarType> types = new ArrayList<>(vars.size());
        for (Var v : vars) {
            types.add(v.type());
        }
        return types;
    }
}
