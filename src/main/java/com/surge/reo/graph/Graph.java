package com.surge.reo.graph;

import com.surge.reo.api.Attr;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.TreeMap;

/**
 * The attributed graph container: a flat arena of {@link Vertex} objects
 * addressed by non-negative integer ids, with named directed edges stored as
 * id-to-id mappings.
 *
 * Vertex 0 is the root namespace and exists from construction. The graph only
 * grows: there is no operation that removes a vertex or an edge.
 *
 * Not thread-safe. One logical writer at a time (assembler, merger, or the
 * dataizer's cache write-back).
 */
public final class Graph {
    private static final Logger log = LogManager.getLogger(Graph.class);

    /** Id of the root namespace vertex. */
    public static final int ROOT = 0;

    private static final List<String> EXCLUSIVE = List.of(Attr.PI, Attr.LAMBDA, Attr.BETA, Attr.EPSILON);

    private final TreeMap<Integer, Vertex> vertices = new TreeMap<>();
    // target id -> first vertex binding it under a non-system name
    private final Map<Integer, Integer> holders = new HashMap<>();
    private int latest;
    private int edges;

    public Graph() {
        vertices.put(ROOT, new Vertex(ROOT));
    }

    /** A graph containing only the root vertex. */
    public static Graph empty() {
        return new Graph();
    }

    /**
     * Generates an id not used by any vertex of this graph.
     */
    public int nextId() {
        do {
            latest++;
        } while (vertices.containsKey(latest));
        return latest;
    }

    /**
     * Creates a fresh empty vertex.
     *
     * @throws GraphException DUPLICATE_VERTEX if the id is taken
     */
    public void add(int id) {
        if (id < 0)
            throw new IllegalArgumentException("Vertex id must be non-negative: " + id);
        if (vertices.containsKey(id))
            throw GraphException.duplicateVertex(id);
        vertices.put(id, new Vertex(id));
        log.trace("#add(ν{}): new vertex added", id);
    }

    /**
     * Creates the edge {@code name} from {@code from} to {@code to}.
     *
     * @throws GraphException UNKNOWN_VERTEX if either end is absent,
     *                        DUPLICATE_ATTRIBUTE if {@code name} is already bound
     *                        from {@code from}
     */
    public void bind(int from, int to, String name) {
        Vertex source = require(from);
        require(to);
        if (name == null || name.isEmpty())
            throw new IllegalArgumentException("Attribute name can't be empty");
        Integer existing = source.target(name);
        if (existing != null)
            throw GraphException.duplicateAttribute(from, name, existing);
        source.edge(name, to);
        edges++;
        if (from != to && !Attr.isSystem(name))
            holders.putIfAbsent(to, from);
        log.trace("#bind(ν{}, ν{}, '{}'): edge added", from, to, name);
    }

    /**
     * Attaches or replaces the literal payload of a vertex.
     *
     * @throws GraphException UNKNOWN_VERTEX if the vertex is absent
     */
    public void put(int id, byte[] bytes) {
        require(id).data(bytes.clone());
        log.trace("#put(ν{}): {} bytes", id, bytes.length);
    }

    /** The target of the edge {@code name} departing from {@code from}, if any. */
    public OptionalInt attr(int from, String name) {
        Vertex v = vertices.get(from);
        if (v == null)
            return OptionalInt.empty();
        Integer to = v.target(name);
        return to == null ? OptionalInt.empty() : OptionalInt.of(to);
    }

    /** The literal payload of a vertex, if any. */
    public Optional<byte[]> data(int id) {
        Vertex v = vertices.get(id);
        if (v == null || v.data() == null)
            return Optional.empty();
        return Optional.of(v.data().clone());
    }

    /** All outgoing edges of a vertex, in binding order. */
    public Map<String, Integer> kids(int id) {
        return require(id).edges();
    }

    /**
     * Returns the vertex record.
     *
     * @throws GraphException UNKNOWN_VERTEX if the vertex is absent
     */
    public Vertex vertex(int id) {
        return require(id);
    }

    public boolean contains(int id) {
        return vertices.containsKey(id);
    }

    /** Vertex ids in ascending order. */
    public NavigableSet<Integer> ids() {
        return Collections.unmodifiableNavigableSet(vertices.navigableKeySet());
    }

    public int size() {
        return vertices.size();
    }

    public int edgeCount() {
        return edges;
    }

    /** True if nothing but a bare root is present. */
    public boolean isEmpty() {
        return vertices.size() == 1 && edges == 0 && !vertices.get(ROOT).hasData();
    }

    /**
     * Finds the object holding a vertex: its {@code ρ} target if bound,
     * otherwise the vertex that first bound it under a non-system name.
     * Returns -1 for the root and for orphans.
     */
    public int holder(int id) {
        Vertex v = require(id);
        Integer rho = v.target(Attr.RHO);
        if (rho != null)
            return rho;
        if (id == ROOT)
            return -1;
        return holders.getOrDefault(id, -1);
    }

    /**
     * Structural problems the construction contract doesn't catch: a vertex
     * may carry at most one of {@code π}, {@code λ}, {@code β} and
     * {@code ε}. Empty for a consistent graph.
     */
    public List<String> inconsistencies() {
        List<String> errors = new ArrayList<>();
        for (Vertex v : vertices.values()) {
            List<String> found = new ArrayList<>(2);
            for (String name : EXCLUSIVE) {
                if (v.has(name))
                    found.add(name);
            }
            if (found.size() > 1)
                errors.add("ν" + v.id() + " has " + String.join(" and ", found) + " together");
        }
        return errors;
    }

    /** Names bound from the root, in binding order. */
    public List<String> rootNames() {
        return new ArrayList<>(vertices.get(ROOT).edges().keySet());
    }

    private Vertex require(int id) {
        Vertex v = vertices.get(id);
        if (v == null)
            throw GraphException.unknownVertex(id);
        return v;
    }

    @Override
    public String toString() {
        return "Graph[" + vertices.size() + " vertices, " + edges + " edges]";
    }
}
