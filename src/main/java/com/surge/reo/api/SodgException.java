package com.surge.reo.api;

/**
 * Root of every failure raised by the assembler, the merger and the dataizer.
 *
 * Subclasses expose a {@code kind()} discriminator so that callers (the CLI in
 * particular) can tell failures apart without parsing messages.
 */
public abstract class SodgException extends RuntimeException {

    protected SodgException(String message) {
        super(message);
    }

    protected SodgException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Process exit status the command line front end reports for this family
     * of failures.
     */
    public abstract int exitCode();
}
