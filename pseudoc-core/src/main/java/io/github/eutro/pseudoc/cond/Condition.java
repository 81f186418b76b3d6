package io.github.eutro.pseudoc.cond;

import io.github.eutro.pseudoc.ir.Operand;

import java.util.List;

/**
 * A boolean condition, guarding a graph edge or used as an instruction argument.
 * <p>
 * {@link #negate()} always returns a new condition. Simple conditions are immutable, but a
 * {@link CompoundCondition} can be extended in place with {@link CompoundCondition#append},
 * which changes its hash code.
 */
public abstract class Condition implements CondPart, Operand {
    /**
     * Get the condition which holds exactly when this one does not.
     * Negating twice gives a condition equal to the original.
     *
     * @return The negated condition.
     */
    @Override
    public abstract Condition negate();

    /**
     * Get this condition as an alternating sequence of conditions and connectives.
     *
     * @return The parts, a single element for a simple condition.
     */
    public abstract List<CondPart> flatten();

    @Override
    public abstract boolean equals(Object o);

    @Override
    public abstract int hashCode();
}
