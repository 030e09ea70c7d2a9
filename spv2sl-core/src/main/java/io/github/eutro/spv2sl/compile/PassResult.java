package io.github.eutro.spv2sl.compile;

import io.github.eutro.spv2sl.tracker.Decisions;

import java.util.Collections;
import java.util.List;

/**
 * The outcome of one emission pass.
 */
public final class PassResult {
    /**
     * The one-based number of the pass.
     */
    public final int pass;
    public final String output;
    /**
     * The decisions the pass started from, together with the ones it made.
     */
    public final Decisions decisions;
    /**
     * Whether the pass made no new decisions, so its output is final.
     */
    public final boolean converged;
    public final List<String> log;

    public PassResult(int pass, String output, Decisions decisions, boolean converged, List<String> log) {
        this.pass = pass;
        this.output = output;
        this.decisions = decisions;
        this.converged = converged;
        this.log = Collections.unmodifiableList(log);
    }

    @Override
    public String toString() {
        return "pass " + pass + (converged ? " (converged)" : " " + log);
    }
}
