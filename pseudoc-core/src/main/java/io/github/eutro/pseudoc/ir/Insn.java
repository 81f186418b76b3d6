package io.github.eutro.pseudoc.ir;

import io.github.eutro.pseudoc.ext.CommonExts;
import io.github.eutro.pseudoc.ext.Ext;
import io.github.eutro.pseudoc.ext.ExtHolder;
import io.github.eutro.pseudoc.expr.Expr;
import io.github.eutro.pseudoc.ops.CommonOps;
import io.github.eutro.pseudoc.ops.Op;
import io.github.eutro.pseudoc.ops.OpKind;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A single IR operation: an optional destination, an {@link Op operation}, and its arguments.
 * <p>
 * Two instructions are equal if their operations, destinations and arguments are;
 * the source address and any exts are provenance, and don't take part.
 * <p>
 * Instructions are mutable, and the hash code changes with them. A pass must not rewrite
 * an instruction while it is held in a hashed collection.
 */
public final class Insn extends ExtHolder {
    /**
     * Whether to record where each instruction is constructed. The trace is attached as the cause
     * when rendering a malformed instruction fails, to find the pass that built it.
     */
    public static boolean TRACK_INSN_CREATIONS = System.getenv("PSEUDOC_TRACK_INSN_CREATIONS") != null;

    public final @Nullable Throwable created = TRACK_INSN_CREATIONS ? new Throwable("constructed") : null;

    public @Nullable Expr dest;
    public Op op;
    private final List<Operand> args;
    /**
     * The address of the input this instruction came from, if known.
     */
    public @Nullable String addr;

    public Insn(@Nullable Expr dest, Op op, List<? extends Operand> args, @Nullable String addr) {
        this.dest = dest;
        this.op = Objects.requireNonNull(op, "op");
        this.args = new ArrayList<>(args);
        this.addr = addr;
        if (op.kind == OpKind.LIT) {
            if (dest != null || this.args.size() != 1 || !(this.args.get(0) instanceof RawText)) {
                throw new IllegalArgumentException("LIT takes exactly one raw text argument and no destination");
            }
        }
    }

    public Insn(@Nullable Expr dest, Op op, List<? extends Operand> args) {
        this(dest, op, args, null);
    }

    public Insn(@Nullable Expr dest, Op op, Operand... args) {
        this(dest, op, Arrays.asList(args));
    }

    public Insn(@Nullable Expr dest, String op, Operand... args) {
        this(dest, Op.of(op), args);
    }

    /**
     * Create a {@code LIT} instruction, passing the text through as is.
     *
     * @param text The pre-rendered text.
     * @return The instruction.
     */
    public static Insn lit(String text) {
        return new Insn(null, CommonOps.LIT, new RawText(text));
    }

    /**
     * Get the arguments of this instruction. The list is mutable, passes may rewrite it in place.
     *
     * @return The arguments.
     */
    public List<Operand> args() {
        return args;
    }

    public Operand arg(int index) {
        if (index >= args.size()) {
            throw malformed(op + " needs at least " + (index + 1) + " arguments, has " + args.size());
        }
        return args.get(index);
    }

    /**
     * Copy this instruction, without its exts.
     *
     * @return The copy.
     */
    public Insn copy() {
        return new Insn(dest, op, args, addr);
    }

    private IllegalStateException malformed(String message) {
        return new IllegalStateException(message, created);
    }

    private String provenancePrefix() {
        Insn original = getNullable(CommonExts.ORIGINAL_INSN);
        return original == null ? "" : "// " + original + "\n";
    }

    /**
     * Render this instruction in its canonical, source-like form.
     *
     * @return The rendering.
     * @throws IllegalStateException If an infix instruction doesn't have exactly two arguments.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(provenancePrefix());
        switch (op.kind) {
            case LIT:
                sb.append(arg(0));
                break;
            case RETURN:
                sb.append(op);
                break;
            case GOTO:
            case CALL:
                sb.append(op).append(' ').append(arg(0));
                break;
            case ASSIGN:
                sb.append(dest).append(" = ").append(arg(0));
                break;
            case INFIX:
                if (args.size() != 2) {
                    throw malformed("Infix operation " + op + " takes 2 arguments, got " + args.size());
                }
                if (Objects.equals(dest, args.get(0))) {
                    sb.append(dest).append(' ').append(op).append("= ").append(args.get(1));
                } else {
                    sb.append(dest).append(" = ")
                            .append(args.get(0)).append(' ').append(op).append(' ').append(args.get(1));
                }
                break;
            case SFUNC:
                appendCall(sb, arg(0).toString(), args.subList(1, args.size()));
                break;
            case GENERIC:
                appendCall(sb, op.mnemonic, args);
                break;
            default:
                throw new AssertionError(op.kind);
        }
        return sb.toString();
    }

    private void appendCall(StringBuilder sb, String name, List<Operand> callArgs) {
        if (dest != null) {
            sb.append(dest).append(" = ");
        }
        sb.append(name).append('(');
        sb.append(callArgs.stream().map(Object::toString).collect(Collectors.joining(", ")));
        sb.append(')');
    }

    /**
     * Render this instruction in the diagnostic form, which shows the structure
     * of the arguments, the source address, and any exts.
     *
     * @return The rendering.
     */
    public String toDiagnosticString() {
        StringBuilder sb = new StringBuilder(provenancePrefix());
        if (addr != null) {
            sb.append("/*").append(addr).append("*/ ");
        }
        if (op.kind == OpKind.LIT) {
            sb.append(arg(0));
        } else {
            if (dest != null) {
                sb.append(dest).append(" = ");
            }
            sb.append(op).append('(')
                    .append(args.stream()
                            .map(Operand::toDiagnosticString)
                            .collect(Collectors.joining(", ", "[", "]")))
                    .append(')');
        }
        String exts = toExtString(CommonExts.ORIGINAL_INSN);
        if (!exts.isEmpty()) {
            sb.append(" # ").append(exts);
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Insn insn = (Insn) o;
        return op.equals(insn.op) && Objects.equals(dest, insn.dest) && args.equals(insn.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(op, dest, args);
    }

    // exts
    private BasicBlock owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = (BasicBlock) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
