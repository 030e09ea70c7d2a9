package io.github.eutro.spv2sl.compile;

import io.github.eutro.spv2sl.emit.FunctionEmitter;
import io.github.eutro.spv2sl.emit.TextSink;
import io.github.eutro.spv2sl.ssa.Function;
import io.github.eutro.spv2sl.ssa.Module;
import io.github.eutro.spv2sl.tracker.Decisions;

/**
 * One complete emission of a module, from the decisions of the previous passes.
 * <p>
 * A pass only reads the IR, whose metadata must already be valid. Everything it learns goes into the
 * returned {@link PassResult}, so running it twice with the same decisions gives the same result.
 */
public class CompilePass {
    private final CompilerOptions options;

    public CompilePass(CompilerOptions options) {
        this.options = options;
    }

    public PassResult run(Module module, Decisions decisions, int pass) {
        TextSink sink = new TextSink();
        Decisions.Recorder recorder = decisions.recorder();
        FunctionEmitter emitter = new FunctionEmitter(options, decisions, recorder, sink);
        boolean first = true;
        for (Function func : module.functions) {
            if (!first) sink.emitStatement();
            first = false;
            emitter.emit(func);
        }
        boolean converged = recorder.isEmpty() && !sink.isRecompileRequested();
        return new PassResult(pass, sink.getText(), recorder.snapshot(), converged, recorder.getLog());
    }
}
