package com.surge.reo.io;

import com.surge.reo.Programs;
import com.surge.reo.api.Data;
import com.surge.reo.engine.Dataizer;
import com.surge.reo.graph.Graph;
import com.surge.reo.graph.Vertex;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.Assert.*;

public class GraphCodecTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    @Test
    public void testRoundTripKeepsShape() throws IOException {
        Graph g = Assembler.assemble(Programs.TIMES);
        Path file = tmp.getRoot().toPath().resolve("times.reo");
        GraphCodec.save(g, file);
        Graph back = GraphCodec.load(file);

        assertEquals(g.size(), back.size());
        assertEquals(g.edgeCount(), back.edgeCount());
        assertEquals(g.ids(), back.ids());
        assertEquals(GraphDump.of(g).toJson(), GraphDump.of(back).toJson());
    }

    @Test
    public void testRoundTripKeepsDataizationResults() throws IOException {
        for (String program : Arrays.asList(Programs.INC, Programs.TIMES, Programs.LITERAL)) {
            Graph g = Assembler.assemble(program);
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            GraphCodec.write(g, out);
            Graph back = GraphCodec.read(new ByteArrayInputStream(out.toByteArray()));
            assertArrayEquals(new Dataizer(g).dataize("foo"), new Dataizer(back).dataize("foo"));
        }
    }

    @Test
    public void testMemoizedValuesSurvive() throws IOException {
        Graph g = Assembler.assemble(Programs.INC);
        byte[] value = new Dataizer(g).dataize("foo");
        assertEquals(42L, Data.toLong(value));

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        GraphCodec.write(g, out);
        Graph back = GraphCodec.read(new ByteArrayInputStream(out.toByteArray()));
        long cached = back.ids().stream()
                .filter(id -> back.vertex(id).status() == Vertex.Status.CACHED)
                .count();
        assertTrue(cached > 0);
        assertArrayEquals(value, new Dataizer(back).dataize("foo"));
    }

    @Test
    public void testEmptyGraph() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        GraphCodec.write(Graph.empty(), out);
        Graph back = GraphCodec.read(new ByteArrayInputStream(out.toByteArray()));
        assertTrue(back.isEmpty());
    }

    @Test(expected = IOException.class)
    public void testRejectsForeignBytes() throws IOException {
        GraphCodec.read(new ByteArrayInputStream("not a graph".getBytes()));
    }

    @Test(expected = IOException.class)
    public void testRejectsTruncatedFile() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        GraphCodec.write(Assembler.assemble(Programs.INC), out);
        byte[] bytes = out.toByteArray();
        GraphCodec.read(new ByteArrayInputStream(Arrays.copyOf(bytes, bytes.length / 2)));
    }

    @Test(expected = IOException.class)
    public void testMissingFile() throws IOException {
        GraphCodec.load(tmp.getRoot().toPath().resolve("absent.reo"));
    }

    @Test
    public void testSaveCreatesParentDirectories() throws IOException {
        Path file = tmp.getRoot().toPath().resolve("a/b/c.reo");
        GraphCodec.save(Graph.empty(), file);
        assertTrue(Files.exists(file));
    }
}
