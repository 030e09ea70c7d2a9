package io.github.eutro.spv2sl.compile;

import io.github.eutro.spv2sl.passes.InPlaceIRPass;
import io.github.eutro.spv2sl.passes.meta.PrepareMetadata;
import io.github.eutro.spv2sl.passes.misc.ForPass;
import io.github.eutro.spv2sl.ssa.Module;
import io.github.eutro.spv2sl.tracker.Decisions;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiles a module to structured source, emitting it again until the forwarding and loop shape
 * decisions stop changing.
 */
public class ShaderCompiler {
    private static final Logger LOGGER = LogManager.getLogger(ShaderCompiler.class);

    private static final InPlaceIRPass<Module> PREPARE = ForPass.liftFunctions(PrepareMetadata.INSTANCE);

    private final CompilerOptions options;

    public ShaderCompiler() {
        this(CompilerOptions.DEFAULT);
    }

    public ShaderCompiler(CompilerOptions options) {
        this.options = options;
    }

    public CompilerOptions getOptions() {
        return options;
    }

    public String compile(Module module) {
        return compileToResult(module).output;
    }

    /**
     * Compile a module, keeping the details of the final pass.
     *
     * @param module The module.
     * @return The result of the converged pass.
     * @throws ConvergenceFailureException If no pass converged within {@link CompilerOptions#maxRecompileIterations}.
     */
    public PassResult compileToResult(Module module) {
        PREPARE.run(module);
        CompilePass step = new CompilePass(options);
        Decisions decisions = Decisions.NONE;
        List<List<String>> history = new ArrayList<>();
        for (int pass = 1; pass <= options.maxRecompileIterations; pass++) {
            LOGGER.debug("starting pass {} with {} decisions", pass, decisions.size());
            PassResult result = step.run(module, decisions, pass);
            if (CompilerOptions.TRACE_PASSES) {
                LOGGER.info("output of pass {}:\n{}", pass, result.output);
            }
            history.add(result.log);
            if (result.converged) {
                LOGGER.debug("converged after {} passes", pass);
                return result;
            }
            for (String decision : result.log) {
                LOGGER.debug("pass {} needs a recompile: {}", pass, decision);
            }
            decisions = result.decisions;
        }
        throw new ConvergenceFailureException(options.maxRecompileIterations, history);
    }
}
