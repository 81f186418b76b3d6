package io.github.eutro.pseudoc.ir;

import io.github.eutro.pseudoc.ext.ExtHolder;

/**
 * A directed edge of a {@link Cfg}. Its condition, if any, is the
 * {@link io.github.eutro.pseudoc.ext.CommonExts#EDGE_COND} ext.
 */
public final class CfgEdge extends ExtHolder {
    public final String from;
    public final String to;

    CfgEdge(String from, String to) {
        this.from = from;
        this.to = to;
    }

    @Override
    public String toString() {
        return from + " -> " + to;
    }
}
