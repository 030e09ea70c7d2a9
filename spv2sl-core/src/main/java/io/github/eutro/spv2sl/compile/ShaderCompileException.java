package io.github.eutro.spv2sl.compile;

import io.github.eutro.spv2sl.ssa.BasicBlock;
import org.jetbrains.annotations.Nullable;

/**
 * Base class of the errors that abort a compilation.
 */
public abstract class ShaderCompileException extends RuntimeException {
    private final @Nullable Object subject;

    protected ShaderCompileException(String message, @Nullable Object subject) {
        super(subject == null ? message : message + " (at " + describe(subject) + ")");
        this.subject = subject;
    }

    /**
     * Get the block, value or type the error is about, if known.
     *
     * @return The subject, or null.
     */
    public @Nullable Object getSubject() {
        return subject;
    }

    private static String describe(Object subject) {
        if (subject instanceof BasicBlock) {
            return ((BasicBlock) subject).toTargetString();
        }
        return String.valueOf(subject);
    }
}
