package io.github.eutro.pseudoc.passes;

import io.github.eutro.pseudoc.passes.misc.ChainedPass;

/**
 * A transformation or analysis over some part of the IR.
 *
 * @param <A> The input type.
 * @param <B> The output type.
 */
public interface IRPass<A, B> {
    B run(A a);

    /**
     * Whether this pass mutates its input and returns it, rather than building a new value.
     *
     * @return Whether the pass is in-place.
     */
    default boolean isInPlace() {
        return false;
    }

    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return new ChainedPass<>(this, next);
    }
}
