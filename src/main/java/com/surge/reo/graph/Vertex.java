package com.surge.reo.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single vertex of the {@link Graph} arena.
 *
 * Holds the outgoing named edges (attribute name to target id, in insertion
 * order), an optional literal payload and the memoized dataization result
 * together with its evaluation status. Only {@link Graph} creates vertices.
 */
public final class Vertex {

    /** Evaluation status of a vertex. CACHED and FAILED are terminal. */
    public enum Status {
        UNVISITED,
        IN_PROGRESS,
        CACHED,
        FAILED
    }

    private final int id;
    private final Map<String, Integer> edges = new LinkedHashMap<>();
    private byte[] data;
    private byte[] cached;
    private Status status = Status.UNVISITED;

    Vertex(int id) {
        this.id = id;
    }

    public int id() {
        return id;
    }

    /** Read-only view of the outgoing edges. */
    public Map<String, Integer> edges() {
        return Collections.unmodifiableMap(edges);
    }

    public boolean has(String name) {
        return edges.containsKey(name);
    }

    public boolean hasData() {
        return data != null;
    }

    byte[] data() {
        return data;
    }

    void data(byte[] bytes) {
        this.data = bytes;
    }

    void edge(String name, int to) {
        edges.put(name, to);
    }

    Integer target(String name) {
        return edges.get(name);
    }

    /** The memoized dataization result, or null if not yet computed. */
    public byte[] cached() {
        return cached == null ? null : cached.clone();
    }

    /**
     * Stores the dataization result. This is the only write the evaluator does
     * on an existing vertex; writing the same value twice is harmless.
     */
    public void cache(byte[] bytes) {
        this.cached = bytes.clone();
        this.status = Status.CACHED;
    }

    public Status status() {
        return status;
    }

    public void status(Status next) {
        this.status = next;
    }
}
