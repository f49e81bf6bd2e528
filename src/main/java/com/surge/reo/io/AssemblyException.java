package com.surge.reo.io;

import com.surge.reo.api.SodgException;
import com.surge.reo.graph.GraphException;

/**
 * Failure of a single SODG instruction. Assembly stops at the first one.
 */
public final class AssemblyException extends SodgException {

    /** What went wrong. */
    public enum Kind {
        DUPLICATE_VERTEX,
        UNKNOWN_VERTEX,
        DUPLICATE_ATTRIBUTE,
        MALFORMED_INSTRUCTION
    }

    private final Kind kind;
    private final int line;
    private final String instruction;

    AssemblyException(Kind kind, int line, String instruction, String message, Throwable cause) {
        super("Failure at line no." + line + " '" + instruction + "': " + message, cause);
        this.kind = kind;
        this.line = line;
        this.instruction = instruction;
    }

    static AssemblyException malformed(int line, String instruction, String why) {
        return new AssemblyException(Kind.MALFORMED_INSTRUCTION, line, instruction, why, null);
    }

    static AssemblyException of(int line, String instruction, GraphException cause) {
        Kind kind = switch (cause.kind()) {
            case DUPLICATE_VERTEX -> Kind.DUPLICATE_VERTEX;
            case UNKNOWN_VERTEX -> Kind.UNKNOWN_VERTEX;
            case DUPLICATE_ATTRIBUTE -> Kind.DUPLICATE_ATTRIBUTE;
        };
        return new AssemblyException(kind, line, instruction, cause.getMessage(), cause);
    }

    public Kind kind() {
        return kind;
    }

    /** 1-based line number of the failing instruction. */
    public int line() {
        return line;
    }

    public String instruction() {
        return instruction;
    }

    /** The vertex named by the underlying graph failure, or -1. */
    public int vertex() {
        return getCause() instanceof GraphException g ? g.vertex() : -1;
    }

    /** The attribute named by the underlying graph failure, or null. */
    public String attribute() {
        return getCause() instanceof GraphException g ? g.attribute() : null;
    }

    @Override
    public int exitCode() {
        return 2;
    }
}
