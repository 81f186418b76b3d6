package io.github.eutro.pseudoc.ext;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * An ext, a typed annotation key that can be associated with a value (of type {@code T})
 * in an {@link ExtContainer}.
 * <p>
 * Exts are ordered by the order in which they were {@link #create(Class, String) create}d,
 * which is also the order they are rendered in by {@link ExtHolder#toExtString()}.
 *
 * @param <T> The type of the ext.
 */
public class Ext<T> implements Comparable<Ext<?>> {
    private static final AtomicInteger ID_COUNTER = new AtomicInteger(0);

    private final Class<T> type;
    private final int id = ID_COUNTER.getAndIncrement();
    private final String name;

    private Ext(Class<T> type, String name) {
        this.type = type;
        this.name = name;
    }

    /**
     * Creates a new ext, with the subtype of a given class, and the given name.
     * <p>
     * Classes are not generic, so the type variable {@code T} here cannot refer to a generic class.
     * The class given is only used for debugging.
     *
     * @param type The most specific superclass of the type of the ext.
     * @param name The name of the ext, used when it is rendered.
     * @param <T>  The type of the class.
     * @param <R>  The type of the ext.
     * @return The new ext.
     */
    @SuppressWarnings("unchecked")
    public static <T, R extends T> Ext<R> create(Class<T> type, String name) {
        return (Ext<R>) new Ext<>(type, name);
    }

    public String getName() {
        return name;
    }

    @Override
    public int compareTo(@NotNull Ext<?> o) {
        return Integer.compare(id, o.id);
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public String toString() {
        return name + ": " + type.getName();
    }
}
