package io.github.eutro.pseudoc.passes.misc;

import io.github.eutro.pseudoc.ir.BasicBlock;
import io.github.eutro.pseudoc.ir.Cfg;
import io.github.eutro.pseudoc.ir.Insn;
import io.github.eutro.pseudoc.passes.IRPass;
import io.github.eutro.pseudoc.passes.InPlaceIRPass;

import java.util.Iterator;
import java.util.ListIterator;

/**
 * Utilities for lifting passes over smaller parts of the IR to larger ones.
 */
public class ForPass {
    /**
     * Lift a basic block pass to operate on every block of a graph, in address order.
     * <p>
     * Block passes must be in-place, since a block's node is keyed by its address.
     *
     * @param pass The basic block pass.
     * @return The graph pass.
     */
    public static InPlaceIRPass<Cfg> liftBasicBlocks(IRPass<BasicBlock, BasicBlock> pass) {
        if (!pass.isInPlace()) {
            throw new IllegalArgumentException("Basic block passes must be in-place");
        }
        return new BasicBlocks(pass);
    }

    /**
     * Lift an instruction pass to operate on every instruction of a basic block.
     *
     * @param pass The instruction pass.
     * @return The basic block pass.
     */
    public static Insns liftInsns(IRPass<Insn, Insn> pass) {
        return new Insns(pass);
    }

    /**
     * A basic block pass lifted to operate on a full graph.
     */
    public static class BasicBlocks extends AbstractForPass<BasicBlock, Cfg> {
        private BasicBlocks(IRPass<BasicBlock, BasicBlock> pass) {
            super(pass);
        }

        @Override
        protected Iterator<BasicBlock> getIter(Cfg cfg) {
            return cfg.blocks().iterator();
        }

        @Override
        protected ListIterator<BasicBlock> getSetableIter(Cfg cfg) {
            throw new UnsupportedOperationException();
        }
    }

    /**
     * An instruction pass lifted to operate on a full basic block.
     */
    public static class Insns extends AbstractForPass<Insn, BasicBlock> {
        private Insns(IRPass<Insn, Insn> pass) {
            super(pass);
        }

        @Override
        protected ListIterator<Insn> getSetableIter(BasicBlock block) {
            return block.getInsns().listIterator();
        }

        /**
         * Lift this pass to operate on a full graph.
         *
         * @return The graph pass.
         */
        public InPlaceIRPass<Cfg> lift() {
            return liftBasicBlocks(this);
        }
    }

    private static abstract class AbstractForPass<T, Lifted> implements InPlaceIRPass<Lifted> {
        private final IRPass<T, T> pass;

        private AbstractForPass(IRPass<T, T> pass) {
            this.pass = pass;
        }

        protected Iterator<T> getIter(Lifted lifted) {
            return getSetableIter(lifted);
        }

        protected abstract ListIterator<T> getSetableIter(Lifted lifted);

        @Override
        public void runInPlace(Lifted lifted) {
            int i = 0;
            try {
                if (pass.isInPlace()) {
                    Iterator<T> iter = getIter(lifted);
                    while (iter.hasNext()) {
                        pass.run(iter.next());
                        i++;
                    }
                } else {
                    ListIterator<T> iter = getSetableIter(lifted);
                    while (iter.hasNext()) {
                        iter.set(pass.run(iter.next()));
                        i++;
                    }
                }
            } catch (Throwable t) {
                t.addSuppressed(new RuntimeException("in element " + i));
                throw t;
            }
        }
    }
}
