package io.github.eutro.pseudoc.expr;

import io.github.eutro.pseudoc.ir.Operand;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A simple operand expression. Expressions are immutable values,
 * equal exactly when they are the same variant with equal fields.
 * <p>
 * Every expression carries a tag, empty by default, which passes use to mark where
 * it came from. The tag is prepended to both renderings and ignored by equality.
 * <p>
 * Only {@link Register}s and {@link MemoryRef}s are ordered. Comparing any other
 * expression throws {@link UnsupportedOperationException}.
 */
public abstract class Expr implements Operand, Comparable<Expr> {
    protected final String tag;

    protected Expr(String tag) {
        this.tag = Objects.requireNonNull(tag, "tag");
    }

    /**
     * Get the name of this variant, used for ordering between different variants.
     *
     * @return The variant name.
     */
    public abstract String kindName();

    public String getTag() {
        return tag;
    }

    /**
     * Copy this expression with a different tag.
     *
     * @param tag The new tag.
     * @return The tagged copy.
     */
    public abstract Expr withTag(String tag);

    /**
     * Get the register this expression reads or writes, if any.
     *
     * @return The register, or null.
     */
    public @Nullable Register reg() {
        return null;
    }

    protected abstract String render();

    protected abstract String renderDiagnostic();

    @Override
    public final String toString() {
        return tag + render();
    }

    @Override
    public final String toDiagnosticString() {
        return tag + renderDiagnostic();
    }

    @Override
    public int compareTo(@NotNull Expr o) {
        throw unordered(this, o);
    }

    static UnsupportedOperationException unordered(Expr a, Expr b) {
        return new UnsupportedOperationException("No order defined between "
                + a.kindName() + " and " + b.kindName());
    }

    static boolean isOrdered(Expr e) {
        return e instanceof Register || e instanceof MemoryRef;
    }

    /**
     * Order two ordered expressions of different variants by variant name.
     */
    static int compareKinds(Expr a, Expr b) {
        if (!isOrdered(a) || !isOrdered(b)) throw unordered(a, b);
        return a.kindName().compareTo(b.kindName());
    }

    @Override
    public abstract boolean equals(Object o);

    @Override
    public abstract int hashCode();
}
