package com.surge.reo.util;

import com.surge.reo.api.Attr;
import com.surge.reo.graph.Graph;
import com.surge.reo.io.Hex;

import java.util.Map;

/**
 * Renders a graph in Graphviz DOT.
 *
 * Vertices with a payload show it in hex (truncated), {@code ρ} edges are
 * dashed and {@code π} edges are dotted.
 */
public final class DotPrinter {
    private static final int MAX_HEX = 23;

    private DotPrinter() {
    }

    public static String print(Graph graph) {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph sodg {\n");
        sb.append("  node [fontname=\"Arial\", shape=circle];\n");
        sb.append("  edge [fontname=\"Arial\"];\n");
        for (int id : graph.ids()) {
            sb.append("  v").append(id).append(" [label=\"ν").append(id);
            graph.data(id).ifPresent(d -> sb.append("\\n").append(shorten(Hex.format(d))));
            sb.append('"');
            if (id == Graph.ROOT)
                sb.append(", shape=doublecircle");
            sb.append("];\n");
        }
        for (int id : graph.ids()) {
            for (Map.Entry<String, Integer> e : graph.kids(id).entrySet()) {
                sb.append("  v").append(id).append(" -> v").append(e.getValue())
                        .append(" [label=\"").append(escape(e.getKey())).append('"');
                if (Attr.RHO.equals(e.getKey()))
                    sb.append(", style=dashed");
                else if (Attr.PI.equals(e.getKey()))
                    sb.append(", style=dotted");
                sb.append("];\n");
            }
        }
        sb.append("}\n");
        return sb.toString();
    }

    private static String shorten(String hex) {
        return hex.length() <= MAX_HEX ? hex : hex.substring(0, MAX_HEX) + "…";
    }

    private static String escape(String label) {
        return label.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
