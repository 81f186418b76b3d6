package io.github.eutro.pseudoc.ops;

/**
 * How an {@link Op operation} behaves when rendered.
 */
public enum OpKind {
    /**
     * {@code return}, rendered bare.
     */
    RETURN,
    /**
     * {@code goto target}.
     */
    GOTO,
    /**
     * {@code call target}.
     */
    CALL,
    /**
     * {@code dest = src}.
     */
    ASSIGN,
    /**
     * Raw text from the input, rendered verbatim.
     */
    LIT,
    /**
     * A call to a {@link io.github.eutro.pseudoc.expr.SyntheticFunc synthetic function},
     * named by the first argument.
     */
    SFUNC,
    /**
     * A binary operator written between its operands, such as {@code +}.
     */
    INFIX,
    /**
     * Any other mnemonic, rendered like a function call.
     */
    GENERIC,
}
