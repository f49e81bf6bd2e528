package com.surge.reo.io;

import com.surge.reo.graph.Graph;
import com.surge.reo.graph.Vertex;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Binary form of a {@link Graph}.
 *
 * Layout, all integers big-endian:
 *
 * <pre>
 *   "SODG" u8:version i32:vertices
 *   per vertex: i32:id u8:flags [i32:len bytes]:data? [i32:len bytes]:cache?
 *               i32:edges, per edge: utf:name i32:target
 * </pre>
 *
 * Flag bit 0 marks a payload, bit 1 a memoized dataization result. Aliases
 * never reach this form; ids are stored as assigned. I/O failures are
 * propagated as they are.
 */
public final class GraphCodec {
    private static final Logger log = LogManager.getLogger(GraphCodec.class);

    private static final byte[] MAGIC = { 'S', 'O', 'D', 'G' };
    private static final int VERSION = 1;
    private static final int HAS_DATA = 1;
    private static final int HAS_CACHE = 2;

    private GraphCodec() {
    }

    public static void save(Graph graph, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null)
            Files.createDirectories(parent);
        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(file))) {
            write(graph, out);
        }
        log.debug("{} saved to {} ({} bytes)", graph, file, Files.size(file));
    }

    public static Graph load(Path file) throws IOException {
        try (InputStream in = new BufferedInputStream(Files.newInputStream(file))) {
            Graph g = read(in);
            log.debug("{} loaded from {}", g, file);
            return g;
        }
    }

    public static void write(Graph graph, OutputStream stream) throws IOException {
        DataOutputStream out = new DataOutputStream(stream);
        out.write(MAGIC);
        out.writeByte(VERSION);
        out.writeInt(graph.size());
        for (int id : graph.ids()) {
            Vertex v = graph.vertex(id);
            Optional<byte[]> data = graph.data(id);
            byte[] cache = v.cached();
            out.writeInt(id);
            out.writeByte((data.isPresent() ? HAS_DATA : 0) | (cache != null ? HAS_CACHE : 0));
            if (data.isPresent())
                blob(out, data.get());
            if (cache != null)
                blob(out, cache);
            Map<String, Integer> edges = v.edges();
            out.writeInt(edges.size());
            for (Map.Entry<String, Integer> e : edges.entrySet()) {
                out.writeUTF(e.getKey());
                out.writeInt(e.getValue());
            }
        }
        out.flush();
    }

    /**
     * @throws IOException if the stream is truncated or not in this format
     */
    public static Graph read(InputStream stream) throws IOException {
        DataInputStream in = new DataInputStream(stream);
        byte[] magic = new byte[MAGIC.length];
        in.readFully(magic);
        for (int i = 0; i < MAGIC.length; i++) {
            if (magic[i] != MAGIC[i])
                throw new IOException("Not a SODG binary graph");
        }
        int version = in.readUnsignedByte();
        if (version != VERSION)
            throw new IOException("Unsupported binary graph version " + version);
        int count = in.readInt();
        if (count < 1)
            throw new IOException("Corrupted binary graph: " + count + " vertices");
        Graph g = Graph.empty();
        // edges may point forward, so bind once every vertex exists
        List<int[]> pending = new ArrayList<>();
        List<String> names = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            int id = in.readInt();
            if (id != Graph.ROOT) {
                if (id < 0 || g.contains(id))
                    throw new IOException("Corrupted binary graph: bad vertex id " + id);
                g.add(id);
            }
            int flags = in.readUnsignedByte();
            if ((flags & HAS_DATA) != 0)
                g.put(id, blob(in));
            if ((flags & HAS_CACHE) != 0)
                g.vertex(id).cache(blob(in));
            int edges = in.readInt();
            for (int k = 0; k < edges; k++) {
                names.add(in.readUTF());
                pending.add(new int[] { id, in.readInt() });
            }
        }
        for (int k = 0; k < pending.size(); k++) {
            int[] e = pending.get(k);
            if (!g.contains(e[1]))
                throw new IOException("Corrupted binary graph: edge to missing ν" + e[1]);
            g.bind(e[0], e[1], names.get(k));
        }
        return g;
    }

    private static void blob(DataOutputStream out, byte[] bytes) throws IOException {
        out.writeInt(bytes.length);
        out.write(bytes);
    }

    private static byte[] blob(DataInputStream in) throws IOException {
        int len = in.readInt();
        if (len < 0)
            throw new IOException("Corrupted binary graph: negative blob length");
        byte[] bytes = new byte[len];
        in.readFully(bytes);
        return bytes;
    }
}
