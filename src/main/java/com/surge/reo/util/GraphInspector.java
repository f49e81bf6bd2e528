package com.surge.reo.util;

import com.surge.reo.api.Attr;
import com.surge.reo.api.Data;
import com.surge.reo.api.Locator;
import com.surge.reo.graph.Graph;
import com.surge.reo.io.Hex;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Prints the attribute tree of an object without dataizing anything.
 *
 * <pre>
 * Φ.foo
 *   .Δ ➞ ν2 Δ00-00-00-00-00-00-00-2A
 *   .bar ➞ ν3 λinc
 * </pre>
 *
 * Each vertex is expanded once; {@code ρ} edges are listed but not followed.
 */
public final class GraphInspector {
    private final Graph graph;

    public GraphInspector(Graph graph) {
        this.graph = graph;
    }

    /**
     * Follows edges literally: {@code Φ} or {@code Q} is the root, {@code νN}
     * a vertex, anything else an edge name. Nothing is copied or resolved.
     *
     * @throws IllegalArgumentException if a step has no edge
     */
    public static int find(Graph graph, String locator) {
        int v = Graph.ROOT;
        for (String seg : Locator.parse(locator).segments()) {
            if (Locator.isRoot(seg)) {
                v = Graph.ROOT;
                continue;
            }
            int direct = Locator.vertex(seg);
            if (direct >= 0 && graph.contains(direct)) {
                v = direct;
                continue;
            }
            OptionalInt to = graph.attr(v, seg);
            if (to.isEmpty())
                throw new IllegalArgumentException("Can't find '" + seg + "' from ν" + v);
            v = to.getAsInt();
        }
        return v;
    }

    public String inspect(String locator) {
        int v = find(graph, locator);
        Set<Integer> seen = new HashSet<>();
        List<String> lines = new ArrayList<>();
        lines.add(locator);
        tree(v, seen, lines, "");
        return String.join("\n", lines);
    }

    private void tree(int v, Set<Integer> seen, List<String> lines, String indent) {
        seen.add(v);
        for (Map.Entry<String, Integer> e : graph.kids(v).entrySet()) {
            int to = e.getValue();
            lines.add(indent + "  ." + e.getKey() + " ➞ ν" + to + marks(to));
            if (!Attr.RHO.equals(e.getKey()) && seen.add(to))
                tree(to, seen, lines, indent + "  ");
        }
    }

    private String marks(int v) {
        StringBuilder sb = new StringBuilder();
        OptionalInt lambda = graph.attr(v, Attr.LAMBDA);
        if (lambda.isPresent())
            sb.append(" λ").append(Data.toString(graph.data(lambda.getAsInt()).orElse(new byte[0])));
        graph.data(v).ifPresent(d -> sb.append(" Δ").append(Hex.format(d)));
        return sb.toString();
    }
}
