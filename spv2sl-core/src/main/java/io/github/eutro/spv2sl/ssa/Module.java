package io.github.eutro.spv2sl.ssa;

import io.github.eutro.spv2sl.ext.CommonExts;
import io.github.eutro.spv2sl.ext.ExtHolder;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A whole shader program: its functions and its global (non-function-scope) variables.
 */
public final class Module extends ExtHolder {
    public final List<Function> functions = new ArrayList<>();
    public final List<Variable> globals = new ArrayList<>();

    public Function addFunction(Function func) {
        func.attachExt(CommonExts.OWNING_MODULE, this);
        functions.add(func);
        return func;
    }

    public Variable addGlobal(Variable global) {
        globals.add(global);
        return global;
    }

    public @Nullable Function findFunction(String name) {
        for (Function function : functions) {
            if (function.name.equals(name)) return function;
        }
        return null;
    }
}
