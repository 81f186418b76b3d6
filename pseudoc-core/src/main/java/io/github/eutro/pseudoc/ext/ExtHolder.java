package io.github.eutro.pseudoc.ext;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * An implementation of {@link ExtContainer} using a {@link Map}.
 */
public class ExtHolder implements ExtContainer {
    @Nullable
    private Map<Ext<?>, Object> map = null; // most instructions never get annotated, so don't allocate it!

    @NotNull
    private Map<Ext<?>, Object> getMap() {
        if (map == null) {
            map = new TreeMap<>();
        }
        return map;
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        getMap().put(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (map == null) return;
        Map<Ext<?>, Object> map = this.map;
        map.remove(ext);
        if (map.isEmpty()) {
            this.map = null;
        }
    }

    @SuppressWarnings("unchecked")
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (map == null) return null;
        return (T) getMap().get(ext);
    }

    /**
     * Get a read-only view of the exts stored in this holder's map, in ext creation order.
     * <p>
     * Exts that subclasses store in dedicated fields are not included.
     *
     * @return The exts.
     */
    public Map<Ext<?>, Object> getExts() {
        if (map == null) return Collections.emptyMap();
        return Collections.unmodifiableMap(map);
    }

    /**
     * Render the exts stored in this holder's map, as {@code {NAME: value, ...}}.
     *
     * @param skip Exts to leave out.
     * @return The rendered exts, or the empty string if there are none to render.
     */
    public String toExtString(Ext<?>... skip) {
        StringJoiner sj = new StringJoiner(", ", "{", "}");
        sj.setEmptyValue("");
        outer:
        for (Map.Entry<Ext<?>, Object> entry : getExts().entrySet()) {
            for (Ext<?> skipped : skip) {
                if (entry.getKey() == skipped) continue outer;
            }
            sj.add(entry.getKey().getName() + ": " + entry.getValue());
        }
        return sj.toString();
    }
}
