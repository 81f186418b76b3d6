package io.github.eutro.pseudoc.cond;

/**
 * A comparison operator of a {@link SimpleCondition}.
 */
public enum CmpOp {
    EQ("=="),
    NE("!="),
    GT(">"),
    LT("<"),
    GE(">="),
    LE("<="),
    ;

    public final String symbol;

    CmpOp(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Get the operator that holds exactly when this one does not.
     *
     * @return The negated operator.
     */
    public CmpOp negate() {
        switch (this) {
            case EQ:
                return NE;
            case NE:
                return EQ;
            case GT:
                return LE;
            case LE:
                return GT;
            case LT:
                return GE;
            case GE:
                return LT;
            default:
                throw new AssertionError(this);
        }
    }

    /**
     * Look up an operator by its symbol.
     *
     * @param symbol The symbol, such as {@code ">="}.
     * @return The operator.
     * @throws IllegalArgumentException If there is no such operator.
     */
    public static CmpOp fromSymbol(String symbol) {
        for (CmpOp op : values()) {
            if (op.symbol.equals(symbol)) return op;
        }
        throw new IllegalArgumentException("Unknown comparison operator: " + symbol);
    }

    @Override
    public String toString() {
        return symbol;
    }
}
