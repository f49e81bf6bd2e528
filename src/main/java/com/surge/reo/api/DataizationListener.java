package com.surge.reo.api;

/**
 * Callbacks from the dataizer while it evaluates a vertex.
 *
 * Called on the evaluating thread, while the dataizer's lock is held, so
 * implementations must not call back into the same dataizer.
 */
public interface DataizationListener {

    /**
     * Called before a top-level dataization begins.
     *
     * @param vertex the vertex requested by the caller
     */
    void onDataizationStart(int vertex);

    /**
     * Called when a vertex gets its value and the value is memoized.
     *
     * @param vertex the vertex
     * @param value  its value
     */
    void onVertexDataized(int vertex, byte[] value);

    /**
     * Called right before a native function runs.
     *
     * @param vertex the copy in whose context it runs
     * @param name   native name
     * @param args   number of arguments passed
     */
    void onNativeInvoked(int vertex, String name, int args);

    /** Called when a top-level dataization fails. */
    void onDataizationError(int vertex, Throwable error);

    /**
     * Called after a top-level dataization succeeds.
     *
     * @param vertex    the vertex requested by the caller
     * @param dataized  vertices memoized during this call
     */
    void onDataizationEnd(int vertex, int dataized);
}
