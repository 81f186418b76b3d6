package io.github.eutro.pseudoc.display;

import io.github.eutro.pseudoc.ext.CommonExts;
import io.github.eutro.pseudoc.ir.Insn;

import java.util.function.Predicate;

/**
 * Renders one instruction to text, and decides which instructions are rendered at all.
 */
@FunctionalInterface
public interface InsnPrinter {
    InsnPrinter CANONICAL = Insn::toString;
    InsnPrinter DIAGNOSTIC = Insn::toDiagnosticString;

    String print(Insn insn);

    /**
     * Whether the instruction should be rendered.
     *
     * @param insn The instruction.
     * @return {@code true} unless the printer filters it out.
     */
    default boolean includes(Insn insn) {
        return true;
    }

    /**
     * Get a printer which renders like this one, but only the instructions matching the filter.
     *
     * @param filter The filter.
     * @return The filtering printer.
     */
    default InsnPrinter filtered(Predicate<Insn> filter) {
        InsnPrinter self = this;
        return new InsnPrinter() {
            @Override
            public String print(Insn insn) {
                return self.print(insn);
            }

            @Override
            public boolean includes(Insn insn) {
                return self.includes(insn) && filter.test(insn);
            }
        };
    }

    /**
     * Get a printer which leaves out instructions {@link CommonExts#DEAD marked dead}.
     *
     * @return The printer.
     */
    default InsnPrinter omittingDead() {
        return filtered(insn -> !CommonExts.isDead(insn));
    }
}
