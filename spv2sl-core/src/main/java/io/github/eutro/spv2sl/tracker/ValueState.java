package io.github.eutro.spv2sl.tracker;

import io.github.eutro.spv2sl.ssa.Var;
import io.github.eutro.spv2sl.ssa.Variable;

import java.util.Collections;
import java.util.Set;

/**
 * What the current pass knows about one value.
 */
public final class ValueState {
    public enum Kind {
        /**
         * The value is rendered as its defining expression.
         */
        FORWARDED,
        /**
         * The value is held in a temporary named after it.
         */
        TEMPORARY,
        /**
         * The value is held in the variable of a phi.
         */
        PHI,
    }

    public final Var value;
    public final Kind kind;
    final String text;
    final Set<Variable> dependencies;
    final boolean needsTranspose;
    final int depth;
    final boolean trivial;
    int readCount = 0;
    boolean invalidated = false;

    ValueState(Var value,
               Kind kind,
               String text,
               Set<Variable> dependencies,
               boolean needsTranspose,
               int depth,
               boolean trivial) {
        this.value = value;
        this.kind = kind;
        this.text = text;
        this.dependencies = dependencies;
        this.needsTranspose = needsTranspose;
        this.depth = depth;
        this.trivial = trivial;
    }

    /**
     * Get the text of the value, as stored. If {@link #needsTranspose()}, this is the transpose of the value.
     *
     * @return The text.
     */
    public String getText() {
        return text;
    }

    public boolean isForwarded() {
        return kind == Kind.FORWARDED;
    }

    /**
     * The variables whose writes make {@link #getText()} stale.
     *
     * @return The variables.
     */
    public Set<Variable> getDependencies() {
        return Collections.unmodifiableSet(dependencies);
    }

    public boolean needsTranspose() {
        return needsTranspose;
    }

    /**
     * How many forwarded expressions are nested in this one, counting itself. Temporaries have depth 0.
     *
     * @return The depth.
     */
    public int getDepth() {
        return depth;
    }

    @Override
    public String toString() {
        return value + " = " + kind + " " + text + (invalidated ? " (invalidated)" : "");
    }
}
