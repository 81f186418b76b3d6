package io.github.eutro.pseudoc.expr;

import io.github.eutro.pseudoc.util.NaturalOrder;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A machine or virtual register.
 */
public final class Register extends Expr {
    public final String name;

    public Register(String name) {
        this(name, "");
    }

    public Register(String name, String tag) {
        super(tag);
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public String kindName() {
        return "REG";
    }

    @Override
    public Register withTag(String tag) {
        return new Register(name, tag);
    }

    @Override
    public Register reg() {
        return this;
    }

    @Override
    protected String render() {
        return name;
    }

    @Override
    protected String renderDiagnostic() {
        return "REG(" + name + ")";
    }

    @Override
    public int compareTo(@NotNull Expr o) {
        if (o instanceof Register) {
            return NaturalOrder.INSTANCE.compare(name, ((Register) o).name);
        }
        return compareKinds(this, o);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return name.equals(((Register) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }
}
