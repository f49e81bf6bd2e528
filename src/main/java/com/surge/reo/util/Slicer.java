package com.surge.reo.util;

import com.surge.reo.api.Attr;
import com.surge.reo.api.Locator;
import com.surge.reo.graph.Graph;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Extracts the part of a graph reachable from one object.
 *
 * {@code ρ} edges are not followed, so a slice doesn't pull in the
 * enclosing objects. Vertex ids, payloads and memoized values are kept. When
 * the object is not the root, the slice's root binds it under the last
 * segment of the locator.
 */
public final class Slicer {
    private static final Logger log = LogManager.getLogger(Slicer.class);

    private Slicer() {
    }

    public static Graph slice(Graph graph, String locator) {
        int start = GraphInspector.find(graph, locator);
        TreeSet<Integer> reached = new TreeSet<>();
        Deque<Integer> todo = new ArrayDeque<>();
        todo.add(start);
        reached.add(start);
        while (!todo.isEmpty()) {
            int v = todo.poll();
            for (Map.Entry<String, Integer> e : graph.kids(v).entrySet()) {
                if (!Attr.RHO.equals(e.getKey()) && reached.add(e.getValue()))
                    todo.add(e.getValue());
            }
        }
        Graph slice = Graph.empty();
        for (int v : reached) {
            if (v != Graph.ROOT)
                slice.add(v);
            graph.data(v).ifPresent(d -> slice.put(v, d));
            byte[] cached = graph.vertex(v).cached();
            if (cached != null)
                slice.vertex(v).cache(cached);
        }
        for (int v : reached) {
            for (Map.Entry<String, Integer> e : graph.kids(v).entrySet()) {
                if (reached.contains(e.getValue()) && !Attr.RHO.equals(e.getKey()))
                    slice.bind(v, e.getValue(), e.getKey());
            }
        }
        if (start != Graph.ROOT) {
            List<String> segs = Locator.parse(locator).segments();
            String name = segs.get(segs.size() - 1);
            if (slice.attr(Graph.ROOT, name).isEmpty() && !Locator.isRoot(name))
                slice.bind(Graph.ROOT, start, name);
        }
        log.debug("Slice of {} has {} of {} vertices", locator, slice.size(), graph.size());
        return slice;
    }
}
