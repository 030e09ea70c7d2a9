package io.github.eutro.spv2sl.passes;

/**
 * A transformation or analysis from IR of type {@code A} to IR of type {@code B}.
 *
 * @param <A> The input type.
 * @param <B> The output type.
 */
public interface IRPass<A, B> {
    B run(A a);

    /**
     * Whether this pass mutates and returns its input rather than producing new IR.
     *
     * @return Whether the pass is in-place.
     */
    default boolean isInPlace() {
        return false;
    }
}
