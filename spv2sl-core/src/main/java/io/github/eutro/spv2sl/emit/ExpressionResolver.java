package io.github.eutro.spv2sl.emit;

import io.github.eutro.spv2sl.ssa.Var;

/**
 * Answers what text a value is rendered as at the current point of emission.
 */
@FunctionalInterface
public interface ExpressionResolver {
    /**
     * Get the text of a value.
     *
     * @param value The value.
     * @return The text.
     * @throws IllegalStateException If the value has not been declared or forwarded yet.
     */
    String resolveExpressionText(Var value);
}
