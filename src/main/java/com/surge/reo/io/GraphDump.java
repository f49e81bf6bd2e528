package com.surge.reo.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.surge.reo.graph.Graph;
import com.surge.reo.graph.Vertex;

import lombok.Data;

/**
 * JSON view of a graph: every vertex with its edges, payload and memoized
 * value in hex. Readable back into a {@link Graph}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GraphDump {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private int edges;
    private List<VertexDef> vertices = new ArrayList<>();

    /** One vertex of the dump. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class VertexDef {
        private int id;
        private String data, cached;
        private Map<String, Integer> edges = new LinkedHashMap<>();
    }

    public static GraphDump of(Graph graph) {
        GraphDump dump = new GraphDump();
        dump.setEdges(graph.edgeCount());
        for (int id : graph.ids()) {
            Vertex v = graph.vertex(id);
            VertexDef def = new VertexDef();
            def.setId(id);
            graph.data(id).ifPresent(d -> def.setData(Hex.format(d)));
            byte[] cached = v.cached();
            if (cached != null)
                def.setCached(Hex.format(cached));
            def.setEdges(new LinkedHashMap<>(v.edges()));
            dump.getVertices().add(def);
        }
        return dump;
    }

    public String toJson() throws IOException {
        return MAPPER.writeValueAsString(this);
    }

    public void save(Path file) throws IOException {
        Files.writeString(file, toJson(), StandardCharsets.UTF_8);
    }

    public static GraphDump fromJson(String json) throws IOException {
        return MAPPER.readValue(json, GraphDump.class);
    }

    /** Rebuilds the graph; vertices first, then edges in listed order. */
    public Graph toGraph() {
        Graph g = Graph.empty();
        for (VertexDef def : vertices) {
            if (def.getId() != Graph.ROOT)
                g.add(def.getId());
            if (def.getData() != null)
                g.put(def.getId(), Hex.parse(def.getData()));
            if (def.getCached() != null)
                g.vertex(def.getId()).cache(Hex.parse(def.getCached()));
        }
        for (VertexDef def : vertices) {
            for (Map.Entry<String, Integer> e : def.getEdges().entrySet())
                g.bind(def.getId(), e.getValue(), e.getKey());
        }
        return g;
    }
}
