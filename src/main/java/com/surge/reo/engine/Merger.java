package com.surge.reo.engine;

import com.surge.reo.graph.Graph;
import com.surge.reo.graph.Vertex;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Combines independently assembled graphs into one.
 *
 * The incoming root is identified with a vertex of the base graph (its root,
 * or a package vertex). Every other incoming vertex gets a fresh id in the
 * base, so the ids used by separately compiled units never clash. Payloads
 * and memoized values come along; edges are copied with both ends renumbered.
 *
 * Names bound from the incoming root must be free at the mount point. All of
 * them are checked before anything is written, so a failed merge leaves the
 * base untouched. Concurrent merges into the same base are serialized on the
 * base graph.
 */
public final class Merger {
    private static final Logger log = LogManager.getLogger(Merger.class);

    private Merger() {
    }

    /**
     * Merges {@code incoming} into {@code base}, root onto root.
     *
     * @return incoming id to base id
     * @throws MergeException NAME_COLLISION if both roots bind a name
     */
    public static Map<Integer, Integer> merge(Graph base, Graph incoming) {
        return merge(base, incoming, Graph.ROOT);
    }

    /**
     * Merges {@code incoming} under the package {@code pkg} of {@code base},
     * creating the package vertices that are missing.
     */
    public static Map<Integer, Integer> merge(Graph base, Graph incoming, List<String> pkg) {
        synchronized (base) {
            return merge(base, incoming, mount(base, pkg));
        }
    }

    /**
     * Merges {@code incoming} with its root identified with vertex
     * {@code mount} of {@code base}.
     */
    public static Map<Integer, Integer> merge(Graph base, Graph incoming, int mount) {
        synchronized (base) {
            base.vertex(mount);
            for (String name : incoming.kids(Graph.ROOT).keySet()) {
                if (base.attr(mount, name).isPresent())
                    throw MergeException.collision(mount, name);
            }
            Map<Integer, Integer> ids = new HashMap<>(incoming.size() * 2);
            ids.put(Graph.ROOT, mount);
            for (int id : incoming.ids()) {
                if (id == Graph.ROOT)
                    continue;
                int fresh = base.nextId();
                base.add(fresh);
                ids.put(id, fresh);
            }
            for (int id : incoming.ids()) {
                int target = ids.get(id);
                Vertex v = incoming.vertex(id);
                if (id != Graph.ROOT || base.data(mount).isEmpty())
                    incoming.data(id).ifPresent(d -> base.put(target, d));
                byte[] cached = v.cached();
                if (cached != null && id != Graph.ROOT)
                    base.vertex(target).cache(cached);
                for (Map.Entry<String, Integer> e : v.edges().entrySet())
                    base.bind(target, ids.get(e.getValue()), e.getKey());
            }
            log.debug("{} vertices merged at ν{}, now {}", incoming.size() - 1, mount, base);
            return Collections.unmodifiableMap(ids);
        }
    }

    /** Walks or creates the package vertices, returning the innermost one. */
    static int mount(Graph base, List<String> pkg) {
        int cur = Graph.ROOT;
        for (String name : pkg) {
            OptionalInt next = base.attr(cur, name);
            if (next.isPresent()) {
                cur = next.getAsInt();
                continue;
            }
            int fresh = base.nextId();
            base.add(fresh);
            base.bind(cur, fresh, name);
            log.trace("package '{}' is ν{}", name, fresh);
            cur = fresh;
        }
        return cur;
    }
}
