package io.github.eutro.pseudoc.passes;

import io.github.eutro.pseudoc.ir.Cfg;
import io.github.eutro.pseudoc.passes.misc.ForPass;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordered list of passes to apply to a graph, each named in a line like
 * {@code xform: number_dfs} (a graph pass) or {@code xform_bblock: remove_trailing_jumps}
 * (a block pass, run on every block).
 */
public class PassScript {
    private static final Logger LOGGER = LogManager.getLogger();

    public enum Kind {
        XFORM("xform:"),
        XFORM_BBLOCK("xform_bblock:"),
        ;

        public final String directive;

        Kind(String directive) {
            this.directive = directive;
        }

        static Kind fromDirective(String directive) {
            for (Kind kind : values()) {
                if (kind.directive.equals(directive)) return kind;
            }
            throw new IllegalArgumentException("Unknown script directive: " + directive);
        }
    }

    public static final class Entry {
        public final Kind kind;
        public final String name;

        public Entry(Kind kind, String name) {
            this.kind = kind;
            this.name = name;
        }

        @Override
        public String toString() {
            return kind.directive + " " + name;
        }
    }

    private final List<Entry> entries = new ArrayList<>();

    public PassScript add(Kind kind, String name) {
        entries.add(new Entry(kind, name));
        return this;
    }

    public List<Entry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    /**
     * Read a script, one entry per line. Blank lines are skipped.
     *
     * @param lines The lines.
     * @return The script.
     * @throws IllegalArgumentException If a line isn't a directive followed by a name.
     */
    public static PassScript parse(Iterable<String> lines) {
        PassScript script = new PassScript();
        for (String line : lines) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) continue;
            String[] parts = trimmed.split("\\s+");
            if (parts.length != 2) {
                throw new IllegalArgumentException("Malformed script line: " + line);
            }
            script.add(Kind.fromDirective(parts[0]), parts[1]);
        }
        return script;
    }

    /**
     * Apply the script to a graph.
     * <p>
     * Every name is resolved before any pass runs, so an unknown name leaves the graph untouched.
     *
     * @param cfg      The graph.
     * @param registry The passes to resolve names in.
     * @throws UnknownPassException If the script names a pass that isn't registered.
     */
    public void run(Cfg cfg, PassRegistry registry) {
        InPlaceIRPass<Cfg> chain = null;
        for (Entry entry : entries) {
            InPlaceIRPass<Cfg> step;
            try {
                step = new Step(entry, entry.kind == Kind.XFORM
                        ? registry.graphPass(entry.name)
                        : ForPass.liftBasicBlocks(registry.blockPass(entry.name)));
            } catch (UnknownPassException e) {
                LOGGER.error("Cannot resolve script entry \"{}\"", entry);
                throw e;
            }
            chain = chain == null ? step : chain.thenInPlace(step);
        }
        if (chain != null) {
            chain.runInPlace(cfg);
        }
    }

    private static final class Step implements InPlaceIRPass<Cfg> {
        private final Entry entry;
        private final InPlaceIRPass<Cfg> pass;

        Step(Entry entry, InPlaceIRPass<Cfg> pass) {
            this.entry = entry;
            this.pass = pass;
        }

        @Override
        public void runInPlace(Cfg cfg) {
            LOGGER.debug("Running {}", entry);
            pass.runInPlace(cfg);
        }

        @Override
        public String toString() {
            return entry.toString();
        }
    }
}
