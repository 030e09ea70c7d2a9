package io.github.eutro.spv2sl.layout;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * One index of an access chain: either a known constant, or the text of an expression computed at runtime.
 */
public final class ChainIndex {
    private final int constant;
    private final @Nullable String expression;

    private ChainIndex(int constant, @Nullable String expression) {
        this.constant = constant;
        this.expression = expression;
    }

    public static ChainIndex constant(int value) {
        return new ChainIndex(value, null);
    }

    public static ChainIndex dynamic(String expression) {
        return new ChainIndex(0, Objects.requireNonNull(expression));
    }

    public boolean isConstant() {
        return expression == null;
    }

    public int constant() {
        if (expression != null) throw new IllegalStateException("index " + expression + " is not constant");
        return constant;
    }

    public String expression() {
        return expression == null ? Integer.toString(constant) : expression;
    }

    @Override
    public String toString() {
        return expression();
    }
}
