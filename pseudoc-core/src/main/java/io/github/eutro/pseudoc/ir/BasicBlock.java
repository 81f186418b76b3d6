package io.github.eutro.pseudoc.ir;

import io.github.eutro.pseudoc.display.InsnPrinter;
import io.github.eutro.pseudoc.ext.CommonExts;
import io.github.eutro.pseudoc.ext.ExtHolder;
import io.github.eutro.pseudoc.ext.TrackedList;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A straight-line sequence of instructions, keyed by the address of its first one.
 * Instructions execute in list order.
 */
public final class BasicBlock extends ExtHolder {
    public final String addr;

    private final List<Insn> insns = new TrackedList<Insn>(new ArrayList<>()) {
        @Override
        protected void onAdded(Insn elt) {
            elt.attachExt(CommonExts.OWNING_BLOCK, BasicBlock.this);
        }

        @Override
        protected void onRemoved(Insn elt) {
            elt.removeExt(CommonExts.OWNING_BLOCK);
        }
    };

    public BasicBlock(String addr) {
        this.addr = Objects.requireNonNull(addr, "addr");
    }

    /**
     * Get the instructions of this block. Changes to the list are reflected in the block.
     *
     * @return The instructions.
     */
    public List<Insn> getInsns() {
        return insns;
    }

    public void add(Insn insn) {
        insns.add(insn);
    }

    /**
     * Write each instruction of this block on its own line, as rendered by the printer.
     * Instructions the printer doesn't {@link InsnPrinter#includes(Insn) include} are skipped.
     *
     * @param out     The output.
     * @param indent  The indentation level, two spaces each.
     * @param printer The instruction printer.
     * @throws IOException If writing to the output fails.
     */
    public void dump(Appendable out, int indent, InsnPrinter printer) throws IOException {
        for (Insn insn : insns) {
            if (!printer.includes(insn)) continue;
            for (int i = 0; i < indent; i++) {
                out.append("  ");
            }
            out.append(printer.print(insn)).append('\n');
        }
    }

    @Override
    public String toString() {
        return "BasicBlock(" + addr + ")";
    }
}
