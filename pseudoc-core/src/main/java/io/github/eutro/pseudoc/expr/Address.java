package io.github.eutro.pseudoc.expr;

import java.util.Objects;

/**
 * A symbolic, unresolved location, such as a label or a global symbol.
 */
public final class Address extends Expr {
    public final String addr;

    public Address(String addr) {
        this(addr, "");
    }

    public Address(String addr, String tag) {
        super(tag);
        this.addr = Objects.requireNonNull(addr, "addr");
    }

    @Override
    public String kindName() {
        return "ADDR";
    }

    @Override
    public Address withTag(String tag) {
        return new Address(addr, tag);
    }

    @Override
    protected String render() {
        return addr;
    }

    @Override
    protected String renderDiagnostic() {
        return "ADDR(" + addr + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return addr.equals(((Address) o).addr);
    }

    @Override
    public int hashCode() {
        return addr.hashCode();
    }
}
