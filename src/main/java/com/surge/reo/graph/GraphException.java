package com.surge.reo.graph;

import com.surge.reo.api.SodgException;

/**
 * Violation of the {@link Graph} construction contract.
 */
public final class GraphException extends SodgException {

    /** What went wrong. */
    public enum Kind {
        DUPLICATE_VERTEX,
        UNKNOWN_VERTEX,
        DUPLICATE_ATTRIBUTE
    }

    private final Kind kind;
    private final int vertex;
    private final String attribute;

    private GraphException(Kind kind, int vertex, String attribute, String message) {
        super(message);
        this.kind = kind;
        this.vertex = vertex;
        this.attribute = attribute;
    }

    static GraphException duplicateVertex(int v) {
        return new GraphException(Kind.DUPLICATE_VERTEX, v, null,
                "Vertex ν" + v + " already exists");
    }

    static GraphException unknownVertex(int v) {
        return new GraphException(Kind.UNKNOWN_VERTEX, v, null,
                "Can't find ν" + v);
    }

    static GraphException duplicateAttribute(int v, String name, int existing) {
        return new GraphException(Kind.DUPLICATE_ATTRIBUTE, v, name,
                "Attribute '" + name + "' already exists in ν" + v + ", arriving to ν" + existing);
    }

    public Kind kind() {
        return kind;
    }

    /** The offending vertex id. */
    public int vertex() {
        return vertex;
    }

    /** The offending attribute name, or null when the failure is about a vertex. */
    public String attribute() {
        return attribute;
    }

    @Override
    public int exitCode() {
        return 2;
    }
}
