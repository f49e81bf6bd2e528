package com.surge.reo.util;

import com.surge.reo.api.DataizationListener;
import com.surge.reo.io.Hex;

import lombok.extern.log4j.Log4j2;

/**
 * Reports dataization progress to the log: vertex values and native calls at
 * trace, totals at debug, failures at warn. Also counts native calls.
 */
@Log4j2
public class LoggingDataizationListener implements DataizationListener {
    private long started;
    private int nativeCalls;

    @Override
    public void onDataizationStart(int vertex) {
        started = System.nanoTime();
        log.debug("Dataization of ν{} started", vertex);
    }

    @Override
    public void onVertexDataized(int vertex, byte[] value) {
        if (log.isTraceEnabled())
            log.trace("ν{} = {}", vertex, Hex.format(value));
    }

    @Override
    public void onNativeInvoked(int vertex, String name, int args) {
        nativeCalls++;
        log.trace("λ{}({} args) at ν{}", name, args, vertex);
    }

    @Override
    public void onDataizationError(int vertex, Throwable error) {
        log.warn("Dataization of ν{} failed: {}", vertex, error.getMessage());
    }

    @Override
    public void onDataizationEnd(int vertex, int dataized) {
        log.debug("ν{} done in {}us, {} vertices dataized, {} native calls so far",
                vertex, (System.nanoTime() - started) / 1_000, dataized, nativeCalls);
    }

    public int nativeCalls() {
        return nativeCalls;
    }
}
