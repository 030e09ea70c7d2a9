package io.github.eutro.spv2sl.passes.cfg;

import io.github.eutro.spv2sl.ssa.BasicBlock;
import org.jetbrains.annotations.Nullable;

/**
 * How a structured loop is rendered.
 */
public final class LoopShape {
    public enum Kind {
        /**
         * {@code for (init; cond; increment) body}
         */
        FOR_LOOP,
        /**
         * {@code while (cond) body}
         */
        WHILE_LOOP,
        /**
         * {@code do body while (cond);}
         */
        DO_WHILE,
        /**
         * {@code for (;;) body}, leaving with explicit breaks.
         */
        COMPLEX,
    }

    public static final LoopShape COMPLEX = new LoopShape(Kind.COMPLEX, null, null, false);

    public final Kind kind;
    /**
     * The block whose conditional branch is the loop test. Absent for complex loops.
     */
    public final @Nullable BasicBlock testBlock;
    /**
     * Where the loop test continues when it passes. For do-while loops, the loop header.
     */
    public final @Nullable BasicBlock bodyTarget;
    /**
     * Whether the test branches to the merge block on true, so the condition must be negated.
     */
    public final boolean exitOnTrue;

    LoopShape(Kind kind, @Nullable BasicBlock testBlock, @Nullable BasicBlock bodyTarget, boolean exitOnTrue) {
        this.kind = kind;
        this.testBlock = testBlock;
        this.bodyTarget = bodyTarget;
        this.exitOnTrue = exitOnTrue;
    }

    public boolean isComplex() {
        return kind == Kind.COMPLEX;
    }

    /**
     * Whether the loop test is evaluated before the body, so the continue block runs as an increment.
     *
     * @return The above.
     */
    public boolean testsFirst() {
        return kind == Kind.FOR_LOOP || kind == Kind.WHILE_LOOP;
    }

    @Override
    public String toString() {
        if (testBlock == null) return kind.toString();
        return kind + "(test " + testBlock.toTargetString() + (exitOnTrue ? ", negated)" : ")");
    }
}
