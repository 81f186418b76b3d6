package io.github.eutro.pseudoc.passes.opts;

import io.github.eutro.pseudoc.ir.BasicBlock;
import io.github.eutro.pseudoc.ir.Insn;
import io.github.eutro.pseudoc.ops.OpKind;
import io.github.eutro.pseudoc.passes.InPlaceIRPass;

import java.util.List;

/**
 * Removes a {@code goto} ending a block. The jump is already an edge of the graph.
 */
public class RemoveTrailingJumps implements InPlaceIRPass<BasicBlock> {
    public static final RemoveTrailingJumps INSTANCE = new RemoveTrailingJumps();

    @Override
    public void runInPlace(BasicBlock block) {
        List<Insn> insns = block.getInsns();
        if (!insns.isEmpty() && insns.get(insns.size() - 1).op.kind == OpKind.GOTO) {
            insns.remove(insns.size() - 1);
        }
    }
}
