package io.github.eutro.pseudoc.ir;

/**
 * Anything that may appear as an argument of an {@link Insn instruction}:
 * an {@link io.github.eutro.pseudoc.expr.Expr expression}, a
 * {@link io.github.eutro.pseudoc.cond.Condition condition}, or {@link RawText raw text}.
 * <p>
 * {@link #toString()} gives the canonical rendering.
 */
public interface Operand {
    /**
     * Render this operand in the diagnostic form, which spells out what kind of operand it is.
     *
     * @return The diagnostic rendering.
     */
    String toDiagnosticString();
}
