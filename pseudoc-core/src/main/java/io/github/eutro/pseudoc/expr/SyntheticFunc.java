package io.github.eutro.pseudoc.expr;

import java.util.Objects;

/**
 * The target of a call that a pass introduced, rather than one present in the input.
 */
public final class SyntheticFunc extends Expr {
    public final String name;

    public SyntheticFunc(String name) {
        this(name, "");
    }

    public SyntheticFunc(String name, String tag) {
        super(tag);
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public String kindName() {
        return "SFUNC";
    }

    @Override
    public SyntheticFunc withTag(String tag) {
        return new SyntheticFunc(name, tag);
    }

    @Override
    protected String render() {
        return name;
    }

    @Override
    protected String renderDiagnostic() {
        return "(SFUNC)" + name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return name.equals(((SyntheticFunc) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }
}
