package io.github.eutro.pseudoc.passes.meta;

import io.github.eutro.pseudoc.ext.CommonExts;
import io.github.eutro.pseudoc.ir.Cfg;
import io.github.eutro.pseudoc.passes.InPlaceIRPass;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * Computes {@link CommonExts#DFS_NUMBER} for each node reachable from the entry:
 * its position in a depth-first preorder walk, starting at 1, taking successors in graph order.
 * <p>
 * Unreachable nodes are left unnumbered.
 */
public class ComputeDfsNumbers implements InPlaceIRPass<Cfg> {
    private static final Logger LOGGER = LogManager.getLogger();

    /**
     * A singleton instance of this pass.
     */
    public static final ComputeDfsNumbers INSTANCE = new ComputeDfsNumbers();

    @Override
    public void runInPlace(Cfg cfg) {
        for (String addr : cfg.sortedAddrs()) {
            cfg.node(addr).removeExt(CommonExts.DFS_NUMBER);
        }
        String entry = cfg.getEntry();
        if (entry == null) return;

        Set<String> seen = new HashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(entry);
        int counter = 0;
        while (!stack.isEmpty()) {
            String addr = stack.pop();
            if (!seen.add(addr)) continue;
            cfg.node(addr).attachExt(CommonExts.DFS_NUMBER, ++counter);
            List<String> succs = cfg.succs(addr);
            ListIterator<String> it = succs.listIterator(succs.size());
            while (it.hasPrevious()) {
                String succ = it.previous();
                if (!seen.contains(succ)) stack.push(succ);
            }
        }
        LOGGER.debug("Numbered {} of {} nodes from {}", counter, cfg.size(), entry);
    }
}
