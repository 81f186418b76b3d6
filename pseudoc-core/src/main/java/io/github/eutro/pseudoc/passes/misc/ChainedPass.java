package io.github.eutro.pseudoc.passes.misc;

import io.github.eutro.pseudoc.passes.IRPass;
import io.github.eutro.pseudoc.passes.InPlaceIRPass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A pass which runs one pass and then another on its result.
 * <p>
 * Nested chains are flattened when run, so a failure in any step is reported
 * with the step's position in the whole chain, and the step itself.
 *
 * @param <A> The input type.
 * @param <B> The intermediate type.
 * @param <C> The output type.
 */
public class ChainedPass<A, B, C> implements IRPass<A, C> {
    private final IRPass<A, B> first;
    private final IRPass<B, C> next;

    public ChainedPass(IRPass<A, B> first, IRPass<B, C> next) {
        this.first = first;
        this.next = next;
    }

    /**
     * Get the steps of this chain, in the order they run.
     *
     * @return The steps.
     */
    public List<IRPass<?, ?>> steps() {
        List<IRPass<?, ?>> steps = new ArrayList<>();
        IRPass<?, ?> pass = this;
        while (pass instanceof ChainedPass) {
            ChainedPass<?, ?, ?> chained = (ChainedPass<?, ?, ?>) pass;
            steps.add(chained.next);
            pass = chained.first;
        }
        steps.add(pass);
        Collections.reverse(steps);
        return steps;
    }

    @Override
    public boolean isInPlace() {
        return first.isInPlace() && next.isInPlace();
    }

    @SuppressWarnings("unchecked")
    @Override
    public C run(A a) {
        List<IRPass<?, ?>> steps = steps();
        Object acc = a;
        for (int i = 0; i < steps.size(); i++) {
            IRPass<Object, Object> step = (IRPass<Object, Object>) steps.get(i);
            try {
                acc = step.run(acc);
            } catch (Throwable t) {
                t.addSuppressed(new RuntimeException("running step " + i + " (" + step + ") of chain"));
                throw t;
            }
        }
        return (C) acc;
    }

    @Override
    public String toString() {
        return steps().toString();
    }

    /**
     * A chain of in-place passes over the same IR, itself in-place.
     *
     * @param <T> The type of the IR.
     */
    public static class InPlace<T> extends ChainedPass<T, T, T> implements InPlaceIRPass<T> {
        public InPlace(InPlaceIRPass<T> first, InPlaceIRPass<T> next) {
            super(first, next);
        }

        @Override
        public void runInPlace(T t) {
            run(t);
        }
    }
}
