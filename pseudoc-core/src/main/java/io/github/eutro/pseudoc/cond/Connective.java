package io.github.eutro.pseudoc.cond;

/**
 * A logical connective between the conditions of a {@link CompoundCondition}.
 */
public enum Connective implements CondPart {
    AND("&&"),
    OR("||"),
    ;

    public final String symbol;

    Connective(String symbol) {
        this.symbol = symbol;
    }

    @Override
    public Connective negate() {
        return this == AND ? OR : AND;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
