package io.github.eutro.pseudoc.conf;

import io.github.eutro.pseudoc.display.InsnPrinter;

import java.util.function.Function;

/**
 * Options for dumping IR, see {@link io.github.eutro.pseudoc.display.CfgDumper}.
 */
public final class DumpConfig {
    /**
     * How each instruction is rendered.
     */
    public enum Style {
        CANONICAL,
        DIAGNOSTIC,
    }

    public static final DumpConfig DEFAULT = builder().build();

    public final Style style;
    public final boolean omitDead;

    private DumpConfig(Style style, boolean omitDead) {
        this.style = style;
        this.omitDead = omitDead;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Read the configuration from the environment: {@code PSEUDOC_DUMP_REPR} selects the
     * diagnostic style, {@code PSEUDOC_NO_DEAD} omits dead instructions.
     *
     * @return The configuration.
     */
    public static DumpConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    public static DumpConfig fromEnvironment(Function<String, String> env) {
        return builder()
                .setStyle(env.apply("PSEUDOC_DUMP_REPR") != null ? Style.DIAGNOSTIC : Style.CANONICAL)
                .setOmitDead(env.apply("PSEUDOC_NO_DEAD") != null)
                .build();
    }

    /**
     * Get the instruction printer for this configuration.
     *
     * @return The printer.
     */
    public InsnPrinter printer() {
        InsnPrinter printer = style == Style.DIAGNOSTIC ? InsnPrinter.DIAGNOSTIC : InsnPrinter.CANONICAL;
        return omitDead ? printer.omittingDead() : printer;
    }

    public Builder toBuilder() {
        return new Builder().setStyle(style).setOmitDead(omitDead);
    }

    public static class Builder {
        private Style style = Style.CANONICAL;
        private boolean omitDead = false;

        private Builder() {
        }

        public Builder setStyle(Style style) {
            this.style = style;
            return this;
        }

        public Builder setOmitDead(boolean omitDead) {
            this.omitDead = omitDead;
            return this;
        }

        public DumpConfig build() {
            return new DumpConfig(style, omitDead);
        }
    }
}
