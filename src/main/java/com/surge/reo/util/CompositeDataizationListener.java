package com.surge.reo.util;

import com.surge.reo.api.DataizationListener;
import java.util.Arrays;

/**
 * Fans callbacks out to several {@link DataizationListener} instances, in the
 * order they were added.
 */
public class CompositeDataizationListener implements DataizationListener {
    private DataizationListener[] listeners = new DataizationListener[0];

    public CompositeDataizationListener add(DataizationListener listener) {
        DataizationListener[] old = listeners;
        DataizationListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
        return this;
    }

    @Override
    public void onDataizationStart(int vertex) {
        for (DataizationListener l : listeners)
            l.onDataizationStart(vertex);
    }

    @Override
    public void onVertexDataized(int vertex, byte[] value) {
        for (DataizationListener l : listeners)
            l.onVertexDataized(vertex, value);
    }

    @Override
    public void onNativeInvoked(int vertex, String name, int args) {
        for (DataizationListener l : listeners)
            l.onNativeInvoked(vertex, name, args);
    }

    @Override
    public void onDataizationError(int vertex, Throwable error) {
        for (DataizationListener l : listeners)
            l.onDataizationError(vertex, error);
    }

    @Override
    public void onDataizationEnd(int vertex, int dataized) {
        for (DataizationListener l : listeners)
            l.onDataizationEnd(vertex, dataized);
    }
}
