package io.github.eutro.spv2sl.compile;

import java.util.Collections;
import java.util.List;

/**
 * The recompile loop ran out of passes before the forwarding decisions settled.
 * <p>
 * This always indicates a bug in the decision logic. The history lists, per pass, the decisions that pass made.
 */
public class ConvergenceFailureException extends ShaderCompileException {
    private final List<List<String>> history;

    public ConvergenceFailureException(int passes, List<List<String>> history) {
        super("no fixed point after " + passes + " passes; decisions per pass: " + history, null);
        this.history = Collections.unmodifiableList(history);
    }

    public List<List<String>> getHistory() {
        return history;
    }
}
