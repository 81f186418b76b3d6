package io.github.eutro.pseudoc.ir;

import io.github.eutro.pseudoc.ext.ExtHolder;
import org.jetbrains.annotations.Nullable;

/**
 * A node of a {@link Cfg}, holding at most one block.
 */
public final class CfgNode extends ExtHolder {
    public final String addr;
    public @Nullable BasicBlock block;

    CfgNode(String addr, @Nullable BasicBlock block) {
        this.addr = addr;
        this.block = block;
    }

    @Override
    public String toString() {
        return "CfgNode(" + addr + ")";
    }
}
