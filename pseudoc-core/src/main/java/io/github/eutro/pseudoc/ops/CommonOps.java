package io.github.eutro.pseudoc.ops;

import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Map;

/**
 * The operations with dedicated rendering.
 */
public class CommonOps {
    private static final Map<String, Op> RESERVED = new HashMap<>();

    public static final Op RETURN = reserve("return", OpKind.RETURN);
    public static final Op GOTO = reserve("goto", OpKind.GOTO);
    public static final Op CALL = reserve("call", OpKind.CALL);
    public static final Op ASSIGN = reserve("ASSIGN", OpKind.ASSIGN);
    /**
     * Passthrough of input text that was not modelled, takes a single
     * {@link io.github.eutro.pseudoc.ir.RawText} argument and no destination.
     */
    public static final Op LIT = reserve("LIT", OpKind.LIT);
    public static final Op SFUNC = reserve("SFUNC", OpKind.SFUNC);

    private static Op reserve(String mnemonic, OpKind kind) {
        Op op = Op.reservedOp(mnemonic, kind);
        RESERVED.put(mnemonic, op);
        return op;
    }

    static @Nullable Op reserved(String mnemonic) {
        return RESERVED.get(mnemonic);
    }
}
