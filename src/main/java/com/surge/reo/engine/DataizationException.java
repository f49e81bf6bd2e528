package com.surge.reo.engine;

import com.surge.reo.api.SodgException;

/**
 * Failure to compute the value of a vertex.
 */
public final class DataizationException extends SodgException {

    /** What went wrong. */
    public enum Kind {
        ATTRIBUTE_NOT_FOUND,
        CYCLIC_DATAIZATION,
        NATIVE_TYPE_MISMATCH,
        UNKNOWN_NATIVE,
        PREVIOUSLY_FAILED,
        TOO_DEEP
    }

    private final Kind kind;
    private final int vertex;
    private final String attribute;

    private DataizationException(Kind kind, int vertex, String attribute, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.vertex = vertex;
        this.attribute = attribute;
    }

    static DataizationException attributeNotFound(int v, String name) {
        return new DataizationException(Kind.ATTRIBUTE_NOT_FOUND, v, name,
                "Can't find attribute '" + name + "' at ν" + v, null);
    }

    static DataizationException badLocator(int v, String locator, Throwable cause) {
        return new DataizationException(Kind.ATTRIBUTE_NOT_FOUND, v, "β",
                "Malformed locator '" + locator + "' at ν" + v, cause);
    }

    static DataizationException cyclic(int v) {
        return new DataizationException(Kind.CYCLIC_DATAIZATION, v, null,
                "Cyclic dataization of ν" + v, null);
    }

    static DataizationException typeMismatch(int v, String name, Throwable cause) {
        return new DataizationException(Kind.NATIVE_TYPE_MISMATCH, v, name,
                "Native '" + name + "' rejected its arguments at ν" + v + ": " + cause.getMessage(), cause);
    }

    static DataizationException unknownNative(int v, String name) {
        return new DataizationException(Kind.UNKNOWN_NATIVE, v, name,
                "Unknown native function '" + name + "' at ν" + v, null);
    }

    static DataizationException previouslyFailed(int v) {
        return new DataizationException(Kind.PREVIOUSLY_FAILED, v, null,
                "Dataization of ν" + v + " failed before", null);
    }

    static DataizationException tooDeep(int v, Throwable cause) {
        return new DataizationException(Kind.TOO_DEEP, v, null,
                "Dataization of ν" + v + " is nested too deep for the thread stack", cause);
    }

    public Kind kind() {
        return kind;
    }

    /** The vertex being evaluated when the failure happened. */
    public int vertex() {
        return vertex;
    }

    /** Missing attribute or native name, when relevant; otherwise null. */
    public String attribute() {
        return attribute;
    }

    @Override
    public int exitCode() {
        return 4;
    }
}
