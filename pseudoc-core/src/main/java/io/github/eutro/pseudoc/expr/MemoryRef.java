package io.github.eutro.pseudoc.expr;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A dereference of {@code base + offset}, reading or writing an element of the given type.
 */
public final class MemoryRef extends Expr {
    /**
     * The element type, such as {@code u32}.
     */
    public final String type;
    public final Expr base;
    public final long offset;

    public MemoryRef(String type, Expr base) {
        this(type, base, 0);
    }

    public MemoryRef(String type, Expr base, long offset) {
        this(type, base, offset, "");
    }

    public MemoryRef(String type, Expr base, long offset, String tag) {
        super(tag);
        this.type = Objects.requireNonNull(type, "type");
        this.base = Objects.requireNonNull(base, "base");
        this.offset = offset;
    }

    @Override
    public String kindName() {
        return "MEM";
    }

    @Override
    public MemoryRef withTag(String tag) {
        return new MemoryRef(type, base, offset, tag);
    }

    @Override
    public @Nullable Register reg() {
        return base instanceof Register ? (Register) base : null;
    }

    @Override
    protected String render() {
        if (offset == 0) {
            return "*(" + type + "*)" + base;
        }
        return "*(" + type + "*)(" + base + " + " + Value.hex(offset) + ")";
    }

    @Override
    protected String renderDiagnostic() {
        return render();
    }

    @Override
    public int compareTo(@NotNull Expr o) {
        if (o instanceof MemoryRef) {
            MemoryRef other = (MemoryRef) o;
            int c = base.compareTo(other.base);
            if (c != 0) return c;
            return Long.compare(offset, other.offset);
        }
        return compareKinds(this, o);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MemoryRef that = (MemoryRef) o;
        return offset == that.offset && type.equals(that.type) && base.equals(that.base);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, base, offset);
    }
}
