package io.github.eutro.pseudoc.ops;

import java.util.Objects;

/**
 * An operation, identified by its mnemonic.
 */
public final class Op {
    public final String mnemonic;
    public final OpKind kind;

    private Op(String mnemonic, OpKind kind) {
        this.mnemonic = mnemonic;
        this.kind = kind;
    }

    /**
     * Get the operation with the given mnemonic.
     * <p>
     * The reserved mnemonics of {@link CommonOps} get their own kinds,
     * mnemonics not starting with a letter are {@link OpKind#INFIX infix},
     * and everything else is {@link OpKind#GENERIC generic}.
     *
     * @param mnemonic The mnemonic.
     * @return The operation.
     */
    public static Op of(String mnemonic) {
        Op reserved = CommonOps.reserved(mnemonic);
        if (reserved != null) return reserved;
        return new Op(mnemonic, classify(mnemonic));
    }

    static Op reservedOp(String mnemonic, OpKind kind) {
        return new Op(mnemonic, kind);
    }

    private static OpKind classify(String mnemonic) {
        if (mnemonic.isEmpty()) {
            throw new IllegalArgumentException("Empty operation mnemonic");
        }
        return Character.isLetter(mnemonic.charAt(0)) ? OpKind.GENERIC : OpKind.INFIX;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return mnemonic.equals(((Op) o).mnemonic);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(mnemonic);
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
