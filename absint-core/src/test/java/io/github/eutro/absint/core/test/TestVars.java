package io.github.eutro.absint.core.test;

import io.github.eutro.absint.core.vars.Var;
import io.github.eutro.absint.core.vars.VarType;
import io.github.eutro.absint.core.vars.VariableFactory;

class TestVars {
    final VariableFactory vf = new VariableFactory();

    Var i32(String name) {
        return new Var(vf.get(name), VarType.INT, 32);
    }

    Var i8(String name) {
        return new Var(vf.get(name), VarType.INT, 8);
    }

    Var bool(String name) {
        return new Var(vf.get(name), VarType.BOOL, 1);
    }

    Var ptr(String name) {
        return new Var(vf.get(name), VarType.PTR);
    }

    Var arr(String name) {
        return new Var(vf.get(name), VarType.ARR_INT);
    }
}
