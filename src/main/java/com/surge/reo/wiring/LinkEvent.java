package com.surge.reo.wiring;

import com.surge.reo.graph.Graph;

import java.nio.file.Path;
import java.util.List;

/**
 * Ring buffer slot carrying one compiled unit to the merging thread.
 *
 * Slots are allocated once with the ring buffer and reused; the handler
 * clears a slot after consuming it so the unit's graph can be collected.
 */
public final class LinkEvent {
    private int unit = -1;
    private Path source;
    private List<String> pkg;
    private Graph graph;
    private Throwable error;

    /** A successfully assembled unit. */
    public void setCompiled(int unit, Path source, List<String> pkg, Graph graph) {
        this.unit = unit;
        this.source = source;
        this.pkg = pkg;
        this.graph = graph;
        this.error = null;
    }

    /** A unit that failed to assemble or read. */
    public void setFailed(int unit, Path source, Throwable error) {
        this.unit = unit;
        this.source = source;
        this.pkg = null;
        this.graph = null;
        this.error = error;
    }

    public int unit() {
        return unit;
    }

    public Path source() {
        return source;
    }

    public List<String> pkg() {
        return pkg;
    }

    public Graph graph() {
        return graph;
    }

    public Throwable error() {
        return error;
    }

    public boolean isFailed() {
        return error != null;
    }

    public void clear() {
        unit = -1;
        source = null;
        pkg = null;
        graph = null;
        error = null;
    }
}
