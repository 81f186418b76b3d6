package io.github.eutro.pseudoc.cond;

import io.github.eutro.pseudoc.expr.Expr;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A single comparison, {@code (left op right)}.
 */
public final class SimpleCondition extends Condition {
    public final Expr left;
    public final CmpOp op;
    public final Expr right;

    public SimpleCondition(Expr left, CmpOp op, Expr right) {
        this.left = Objects.requireNonNull(left, "left");
        this.op = Objects.requireNonNull(op, "op");
        this.right = Objects.requireNonNull(right, "right");
    }

    public SimpleCondition(Expr left, String op, Expr right) {
        this(left, CmpOp.fromSymbol(op), right);
    }

    @Override
    public SimpleCondition negate() {
        return new SimpleCondition(left, op.negate(), right);
    }

    @Override
    public List<CondPart> flatten() {
        return Collections.singletonList(this);
    }

    @Override
    public String toString() {
        return "(" + left + " " + op + " " + right + ")";
    }

    @Override
    public String toDiagnosticString() {
        return "SCond" + this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SimpleCondition that = (SimpleCondition) o;
        return left.equals(that.left) && op == that.op && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, op, right);
    }
}
