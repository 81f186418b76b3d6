package io.github.eutro.pseudoc.passes;

/**
 * Thrown when a pass script names a pass that isn't registered.
 */
public class UnknownPassException extends RuntimeException {
    public final String passName;

    public UnknownPassException(String passName) {
        super("Unknown pass: " + passName);
        this.passName = passName;
    }
}
