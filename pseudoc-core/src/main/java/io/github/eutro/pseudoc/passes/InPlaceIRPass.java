package io.github.eutro.pseudoc.passes;

import io.github.eutro.pseudoc.passes.misc.ChainedPass;

/**
 * A pass which mutates the graph, block or instruction it is given, rather than building a new one.
 * Graph passes and block passes are all of this kind.
 *
 * @param <T> The type of the IR.
 */
@FunctionalInterface
public interface InPlaceIRPass<T> extends IRPass<T, T> {
    void runInPlace(T t);

    @Override
    default T run(T t) {
        runInPlace(t);
        return t;
    }

    @Override
    default boolean isInPlace() {
        return true;
    }

    /**
     * Run this pass, and then another over the same IR.
     *
     * @param next The pass to run after this one.
     * @return The chained pass, also in-place.
     */
    default InPlaceIRPass<T> thenInPlace(InPlaceIRPass<T> next) {
        return new ChainedPass.InPlace<>(this, next);
    }
}
