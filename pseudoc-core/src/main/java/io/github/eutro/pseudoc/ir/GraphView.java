package io.github.eutro.pseudoc.ir;

import io.github.eutro.pseudoc.cond.Condition;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.List;

/**
 * The queries a control flow graph container must answer for the IR to be dumped.
 * Nodes are keyed by address text.
 */
public interface GraphView {
    /**
     * Get the addresses of all nodes, in {@link io.github.eutro.pseudoc.util.NaturalOrder natural order}.
     *
     * @return The addresses.
     */
    List<String> sortedAddrs();

    Collection<String> preds(String addr);

    /**
     * Get the successors of a node, in the graph's own order.
     *
     * @param addr The node.
     * @return The successor addresses.
     */
    List<String> succs(String addr);

    /**
     * Get the condition on an edge.
     *
     * @param from The source node.
     * @param to   The target node.
     * @return The condition, or null if the edge is unconditional.
     */
    @Nullable Condition edgeCond(String from, String to);

    /**
     * Get the block held by a node.
     *
     * @param addr The node.
     * @return The block, or null if the node doesn't hold one.
     */
    @Nullable BasicBlock block(String addr);

    /**
     * Get the depth-first number of a node.
     *
     * @param addr The node.
     * @return The number, or null if the node hasn't been numbered.
     */
    @Nullable Integer dfsNumber(String addr);
}
