package io.github.eutro.pseudoc.ir;

import java.util.Objects;

/**
 * Pre-rendered source text carried through unmodelled, the argument of a {@code LIT} instruction.
 */
public final class RawText implements Operand {
    public final String text;

    public RawText(String text) {
        this.text = Objects.requireNonNull(text, "text");
    }

    @Override
    public String toDiagnosticString() {
        return text;
    }

    @Override
    public String toString() {
        return text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return text.equals(((RawText) o).text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }
}
