package com.surge.reo.engine;

import com.surge.reo.api.SodgException;

/**
 * Two graphs can't be merged. Nothing is changed in the base graph when
 * this is thrown.
 */
public final class MergeException extends SodgException {

    /** What went wrong. */
    public enum Kind {
        NAME_COLLISION
    }

    private final Kind kind;
    private final int vertex;
    private final String attribute;

    private MergeException(Kind kind, int vertex, String attribute, String message) {
        super(message);
        this.kind = kind;
        this.vertex = vertex;
        this.attribute = attribute;
    }

    static MergeException collision(int mount, String name) {
        return new MergeException(Kind.NAME_COLLISION, mount, name,
                "Name '" + name + "' is already bound at ν" + mount);
    }

    public Kind kind() {
        return kind;
    }

    /** The vertex where the names collide. */
    public int vertex() {
        return vertex;
    }

    public String attribute() {
        return attribute;
    }

    @Override
    public int exitCode() {
        return 3;
    }
}
