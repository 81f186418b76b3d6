package io.github.eutro.pseudoc.passes;

import io.github.eutro.pseudoc.ir.BasicBlock;
import io.github.eutro.pseudoc.ir.Cfg;
import io.github.eutro.pseudoc.passes.meta.ComputeDfsNumbers;
import io.github.eutro.pseudoc.passes.opts.RemoveTrailingJumps;

import java.util.HashMap;
import java.util.Map;

/**
 * Passes that a {@link PassScript} may refer to by name.
 * Graph passes and block passes have separate namespaces.
 */
public class PassRegistry {
    private final Map<String, InPlaceIRPass<Cfg>> graphPasses = new HashMap<>();
    private final Map<String, InPlaceIRPass<BasicBlock>> blockPasses = new HashMap<>();

    /**
     * Create a registry of the passes that ship with the IR.
     *
     * @return The registry.
     */
    public static PassRegistry defaults() {
        return new PassRegistry()
                .registerGraphPass("number_dfs", ComputeDfsNumbers.INSTANCE)
                .registerBlockPass("remove_trailing_jumps", RemoveTrailingJumps.INSTANCE);
    }

    public PassRegistry registerGraphPass(String name, InPlaceIRPass<Cfg> pass) {
        graphPasses.put(name, pass);
        return this;
    }

    public PassRegistry registerBlockPass(String name, InPlaceIRPass<BasicBlock> pass) {
        blockPasses.put(name, pass);
        return this;
    }

    /**
     * Look up a graph pass.
     *
     * @param name The name.
     * @return The pass.
     * @throws UnknownPassException If there is no graph pass with the name.
     */
    public InPlaceIRPass<Cfg> graphPass(String name) {
        InPlaceIRPass<Cfg> pass = graphPasses.get(name);
        if (pass == null) throw new UnknownPassException(name);
        return pass;
    }

    /**
     * Look up a block pass.
     *
     * @param name The name.
     * @return The pass.
     * @throws UnknownPassException If there is no block pass with the name.
     */
    public InPlaceIRPass<BasicBlock> blockPass(String name) {
        InPlaceIRPass<BasicBlock> pass = blockPasses.get(name);
        if (pass == null) throw new UnknownPassException(name);
        return pass;
    }
}
