package io.github.eutro.pseudoc.display;

import io.github.eutro.pseudoc.cond.Condition;
import io.github.eutro.pseudoc.conf.DumpConfig;
import io.github.eutro.pseudoc.ir.BasicBlock;
import io.github.eutro.pseudoc.ir.GraphView;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.StringJoiner;

/**
 * Writes a text dump of a whole graph, for comparing the IR before and after passes.
 * <p>
 * Nodes are written in natural address order, each as:
 * <pre>
 * // Predecessors: ['blk1']
 * // DFS#: 2
 * blk2:
 * r1 = 0x10
 * Exits: [('(r1 == 0)', 'blk10'), (None, 'blk3')]
 * </pre>
 * with a blank line between nodes. The DFS line is only written for numbered nodes.
 * Exits are listed in the graph's own successor order.
 */
public class CfgDumper {
    private static final Logger LOGGER = LogManager.getLogger();

    private final InsnPrinter printer;

    public CfgDumper(InsnPrinter printer) {
        this.printer = printer;
    }

    public CfgDumper(DumpConfig config) {
        this(config.printer());
    }

    public CfgDumper() {
        this(InsnPrinter.CANONICAL);
    }

    public void dump(GraphView cfg, Appendable out) throws IOException {
        List<String> addrs = cfg.sortedAddrs();
        LOGGER.trace("Dumping {} nodes", addrs.size());
        boolean first = true;
        for (String addr : addrs) {
            if (!first) out.append('\n');
            first = false;

            List<String> preds = new ArrayList<>(cfg.preds(addr));
            Collections.sort(preds);
            out.append("// Predecessors: ").append(quotedList(preds)).append('\n');
            Integer dfsNo = cfg.dfsNumber(addr);
            if (dfsNo != null) {
                out.append("// DFS#: ").append(Integer.toString(dfsNo)).append('\n');
            }
            out.append(addr).append(":\n");
            BasicBlock block = cfg.block(addr);
            if (block != null) {
                block.dump(out, 0, printer);
            } else {
                out.append("    None\n");
            }

            StringJoiner exits = new StringJoiner(", ", "[", "]");
            for (String succ : cfg.succs(addr)) {
                Condition cond = cfg.edgeCond(addr, succ);
                exits.add("(" + (cond == null ? "None" : quote(cond.toString())) + ", " + quote(succ) + ")");
            }
            out.append("Exits: ").append(exits.toString()).append('\n');
        }
    }

    /**
     * Dump a graph to a string.
     *
     * @param cfg The graph.
     * @return The dump.
     */
    public String dumpToString(GraphView cfg) {
        StringBuilder sb = new StringBuilder();
        try {
            dump(cfg, sb);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return sb.toString();
    }

    private static String quotedList(List<String> items) {
        StringJoiner sj = new StringJoiner(", ", "[", "]");
        for (String item : items) {
            sj.add(quote(item));
        }
        return sj.toString();
    }

    /**
     * Quote a string for the dump: in single quotes, unless the string contains
     * a single quote and no double quote.
     */
    private static String quote(String s) {
        char q = s.indexOf('\'') >= 0 && s.indexOf('"') < 0 ? '"' : '\'';
        StringBuilder sb = new StringBuilder().append(q);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                default:
                    if (c == q) sb.append('\\');
                    sb.append(c);
            }
        }
        return sb.append(q).toString();
    }
}
