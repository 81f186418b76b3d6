package io.github.eutro.pseudoc.ir;

import io.github.eutro.pseudoc.cond.Condition;
import io.github.eutro.pseudoc.ext.CommonExts;
import io.github.eutro.pseudoc.ext.ExtHolder;
import io.github.eutro.pseudoc.util.NaturalOrder;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A control flow graph of {@link BasicBlock}s, keyed by address.
 * <p>
 * Successors keep the order their edges were added in, which is the order
 * the exits of a node are dumped in.
 */
public final class Cfg extends ExtHolder implements GraphView {
    private final Map<String, CfgNode> nodes = new LinkedHashMap<>();
    private final Map<String, Map<String, CfgEdge>> succs = new HashMap<>();
    private final Map<String, Set<String>> preds = new HashMap<>();
    private @Nullable String entry;

    /**
     * Add a node for a block, keyed by the block's address.
     *
     * @param block The block.
     * @return The node.
     */
    public CfgNode addNode(BasicBlock block) {
        return addNode(block.addr, block);
    }

    /**
     * Add a node. The first node added is the entry, unless {@link #setEntry(String) set} otherwise.
     *
     * @param addr  The address of the node.
     * @param block The block the node holds, or null.
     * @return The node.
     * @throws IllegalArgumentException If there already is a node with the address.
     */
    public CfgNode addNode(String addr, @Nullable BasicBlock block) {
        if (nodes.containsKey(addr)) {
            throw new IllegalArgumentException("Duplicate node " + addr);
        }
        CfgNode node = new CfgNode(addr, block);
        nodes.put(addr, node);
        succs.put(addr, new LinkedHashMap<>());
        preds.put(addr, new LinkedHashSet<>());
        if (entry == null) entry = addr;
        return node;
    }

    public CfgEdge addEdge(String from, String to) {
        return addEdge(from, to, null);
    }

    /**
     * Add an edge between two existing nodes.
     *
     * @param from The source address.
     * @param to   The target address.
     * @param cond The condition the edge is taken under, or null if unconditional.
     * @return The edge.
     * @throws IllegalArgumentException If either node doesn't exist, or the edge already does.
     */
    public CfgEdge addEdge(String from, String to, @Nullable Condition cond) {
        node(from);
        node(to);
        Map<String, CfgEdge> out = succs.get(from);
        if (out.containsKey(to)) {
            throw new IllegalArgumentException("Duplicate edge " + from + " -> " + to);
        }
        CfgEdge edge = new CfgEdge(from, to);
        if (cond != null) {
            edge.attachExt(CommonExts.EDGE_COND, cond);
        }
        out.put(to, edge);
        preds.get(to).add(from);
        return edge;
    }

    public void removeEdge(String from, String to) {
        if (succs.get(from) == null || succs.get(from).remove(to) == null) {
            throw new IllegalArgumentException("No edge " + from + " -> " + to);
        }
        preds.get(to).remove(from);
    }

    public boolean hasNode(String addr) {
        return nodes.containsKey(addr);
    }

    /**
     * Get a node.
     *
     * @param addr The address.
     * @return The node.
     * @throws IllegalArgumentException If there is no such node.
     */
    public CfgNode node(String addr) {
        CfgNode node = nodes.get(addr);
        if (node == null) {
            throw new IllegalArgumentException("No node " + addr);
        }
        return node;
    }

    public CfgEdge edge(String from, String to) {
        CfgEdge edge = succs.get(node(from).addr).get(to);
        if (edge == null) {
            throw new IllegalArgumentException("No edge " + from + " -> " + to);
        }
        return edge;
    }

    public @Nullable String getEntry() {
        return entry;
    }

    public void setEntry(String addr) {
        entry = node(addr).addr;
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Get the blocks of this graph, in address order. Nodes without blocks are left out.
     *
     * @return The blocks.
     */
    public List<BasicBlock> blocks() {
        List<BasicBlock> blocks = new ArrayList<>();
        for (String addr : sortedAddrs()) {
            BasicBlock block = nodes.get(addr).block;
            if (block != null) blocks.add(block);
        }
        return blocks;
    }

    @Override
    public List<String> sortedAddrs() {
        List<String> addrs = new ArrayList<>(nodes.keySet());
        addrs.sort(NaturalOrder.INSTANCE);
        return addrs;
    }

    @Override
    public Collection<String> preds(String addr) {
        return Collections.unmodifiableSet(preds.get(node(addr).addr));
    }

    @Override
    public List<String> succs(String addr) {
        return Collections.unmodifiableList(new ArrayList<>(succs.get(node(addr).addr).keySet()));
    }

    @Override
    public @Nullable Condition edgeCond(String from, String to) {
        return edge(from, to).getNullable(CommonExts.EDGE_COND);
    }

    @Override
    public @Nullable BasicBlock block(String addr) {
        return node(addr).block;
    }

    @Override
    public @Nullable Integer dfsNumber(String addr) {
        return node(addr).getNullable(CommonExts.DFS_NUMBER);
    }

    @Override
    public String toString() {
        return "Cfg(" + nodes.size() + " nodes)";
    }
}
