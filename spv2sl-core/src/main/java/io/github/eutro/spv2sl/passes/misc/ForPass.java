package io.github.eutro.spv2sl.passes.misc;

import io.github.eutro.spv2sl.passes.IRPass;
import io.github.eutro.spv2sl.passes.InPlaceIRPass;
import io.github.eutro.spv2sl.ssa.Function;
import io.github.eutro.spv2sl.ssa.Module;

/**
 * Lifts passes which operate on smaller IR parts into ones that operate on bigger parts.
 */
public class ForPass {
    /**
     * Lift an in-place function pass to run over every function of a module.
     *
     * @param pass The function pass.
     * @return The module pass.
     */
    public static InPlaceIRPass<Module> liftFunctions(IRPass<Function, Function> pass) {
        if (!pass.isInPlace()) throw new IllegalArgumentException("pass " + pass + " is not in place");
        return module -> {
            for (Function function : module.functions) {
                try {
                    pass.run(function);
                } catch (RuntimeException e) {
                    e.addSuppressed(new RuntimeException("in function " + function.name));
                    throw e;
                }
            }
        };
    }
}
