package io.github.eutro.pseudoc.ir;

import io.github.eutro.pseudoc.cond.Condition;
import io.github.eutro.pseudoc.expr.Expr;
import io.github.eutro.pseudoc.ops.CommonOps;
import io.github.eutro.pseudoc.ops.Op;
import org.jetbrains.annotations.Nullable;

/**
 * An IR, or instruction, builder, which encapsulates a position in a graph
 * where instructions are being inserted.
 */
public class IRBuilder {
    /**
     * The graph being inserted into.
     */
    public final Cfg cfg;
    private BasicBlock bb;

    /**
     * Construct an instruction builder, inserting at the end of a block of the graph.
     *
     * @param cfg The graph.
     * @param bb  One of the graph's blocks.
     */
    public IRBuilder(Cfg cfg, BasicBlock bb) {
        this.cfg = cfg;
        this.bb = bb;
    }

    public BasicBlock getBlock() {
        return bb;
    }

    public void setBlock(BasicBlock bb) {
        this.bb = bb;
    }

    /**
     * Create a new block, add it to the graph, and continue inserting into it.
     *
     * @param addr The address of the new block.
     * @return The new block.
     */
    public BasicBlock newBlock(String addr) {
        BasicBlock block = new BasicBlock(addr);
        cfg.addNode(block);
        bb = block;
        return block;
    }

    public Insn insert(Insn insn) {
        bb.add(insn);
        return insn;
    }

    public Insn insert(@Nullable Expr dest, Op op, Expr... args) {
        return insert(new Insn(dest, op, args));
    }

    public Insn assign(Expr dest, Expr src) {
        return insert(dest, CommonOps.ASSIGN, src);
    }

    /**
     * Add an edge from the current block to another.
     *
     * @param target The target address.
     * @param cond   The condition of the edge, or null.
     * @return The edge.
     */
    public CfgEdge jumpTo(String target, @Nullable Condition cond) {
        return cfg.addEdge(bb.addr, target, cond);
    }
}
