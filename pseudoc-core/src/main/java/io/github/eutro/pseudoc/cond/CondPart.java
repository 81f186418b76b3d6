package io.github.eutro.pseudoc.cond;

/**
 * An element of a flattened condition: either a {@link Condition} or a {@link Connective}.
 */
public interface CondPart {
    /**
     * Negate this part. Conditions are negated, connectives are swapped.
     *
     * @return The negated part.
     */
    CondPart negate();
}
