package io.github.eutro.pseudoc.ext;

import io.github.eutro.pseudoc.cond.Condition;
import io.github.eutro.pseudoc.ir.BasicBlock;
import io.github.eutro.pseudoc.ir.Insn;

public class CommonExts {
    /**
     * On an instruction: the instruction it was rewritten from, kept for display.
     */
    public static final Ext<Insn> ORIGINAL_INSN = Ext.create(Insn.class, "org_inst");
    /**
     * On an instruction: whether a pass found it to be dead code.
     */
    public static final Ext<Boolean> DEAD = Ext.create(Boolean.class, "dead");

    public static final Ext<BasicBlock> OWNING_BLOCK = Ext.create(BasicBlock.class, "OWNING_BLOCK");

    /**
     * On a graph node: its depth-first preorder number.
     */
    public static final Ext<Integer> DFS_NUMBER = Ext.create(Integer.class, "dfsno");
    /**
     * On a graph edge: the condition under which it is taken.
     */
    public static final Ext<Condition> EDGE_COND = Ext.create(Condition.class, "cond");

    public static <T extends ExtContainer> T markDead(T t) {
        t.attachExt(DEAD, true);
        return t;
    }

    public static boolean isDead(ExtContainer ec) {
        return Boolean.TRUE.equals(ec.getNullable(DEAD));
    }
}
