package io.github.eutro.pseudoc.expr;

/**
 * An immediate constant.
 * <p>
 * The base only affects how the value is rendered, two values are equal if their
 * numeric values are.
 */
public final class Value extends Expr {
    public static final int HEX = 16;
    public static final int DEC = 10;

    public final long value;
    public final int base;

    public Value(long value) {
        this(value, HEX);
    }

    public Value(long value, int base) {
        this(value, base, "");
    }

    public Value(long value, int base, String tag) {
        super(tag);
        if (base != HEX && base != DEC) {
            throw new IllegalArgumentException("Unsupported display base " + base);
        }
        this.value = value;
        this.base = base;
    }

    @Override
    public String kindName() {
        return "VALUE";
    }

    @Override
    public Value withTag(String tag) {
        return new Value(value, base, tag);
    }

    static String hex(long value) {
        return value < 0
                ? "-0x" + Long.toHexString(-value)
                : "0x" + Long.toHexString(value);
    }

    @Override
    protected String render() {
        // single digits read the same in both bases
        if (base == DEC || (value >= 0 && value < 10)) {
            return Long.toString(value);
        }
        return hex(value);
    }

    @Override
    protected String renderDiagnostic() {
        return "VALUE(" + hex(value) + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return value == ((Value) o).value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }
}
