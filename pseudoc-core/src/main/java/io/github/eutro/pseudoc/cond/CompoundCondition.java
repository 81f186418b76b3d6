package io.github.eutro.pseudoc.cond;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Conditions joined by connectives, such as {@code [c1, AND, c2, OR, c3]},
 * kept in source order without precedence grouping.
 */
public final class CompoundCondition extends Condition {
    private final List<CondPart> parts;

    /**
     * Construct a compound condition.
     *
     * @param parts Alternating conditions and connectives, starting and ending with a condition.
     * @throws IllegalArgumentException If the parts don't alternate.
     */
    public CompoundCondition(List<? extends CondPart> parts) {
        if (parts.size() % 2 == 0) {
            throw new IllegalArgumentException("Compound condition needs an odd number of parts, got " + parts.size());
        }
        for (int i = 0; i < parts.size(); i++) {
            CondPart part = parts.get(i);
            boolean ok = (i & 1) == 0 ? part instanceof Condition : part instanceof Connective;
            if (!ok) {
                throw new IllegalArgumentException("Unexpected " + part + " at position " + i + " of compound condition");
            }
        }
        this.parts = new ArrayList<>(parts);
    }

    public CompoundCondition(CondPart... parts) {
        this(Arrays.asList(parts));
    }

    /**
     * Extend this condition with another, joined by the given connective.
     * This mutates the condition, so it must not be held in a hashed collection meanwhile.
     *
     * @param connective The connective.
     * @param cond       The condition.
     */
    public void append(Connective connective, Condition cond) {
        parts.add(connective);
        parts.add(cond);
    }

    @Override
    public CompoundCondition negate() {
        List<CondPart> negated = new ArrayList<>(parts.size());
        for (CondPart part : parts) {
            negated.add(part.negate());
        }
        return new CompoundCondition(negated);
    }

    @Override
    public List<CondPart> flatten() {
        return Collections.unmodifiableList(parts);
    }

    @Override
    public String toString() {
        return parts.stream()
                .map(Object::toString)
                .collect(Collectors.joining(" ", "(", ")"));
    }

    @Override
    public String toDiagnosticString() {
        return "CCond" + this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return parts.equals(((CompoundCondition) o).parts);
    }

    @Override
    public int hashCode() {
        return parts.hashCode();
    }
}
