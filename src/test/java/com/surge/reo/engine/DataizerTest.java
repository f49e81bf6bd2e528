package com.surge.reo.engine;

import com.surge.reo.Programs;
import com.surge.reo.api.Data;
import com.surge.reo.api.DataizationListener;
import com.surge.reo.fn.NativeRegistry;
import com.surge.reo.graph.Graph;
import com.surge.reo.graph.Vertex;
import com.surge.reo.io.Assembler;
import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class DataizerTest {

    private static DataizationException expectFailure(Dataizer dataizer, String locator) {
        try {
            dataizer.dataize(locator);
        } catch (DataizationException e) {
            return e;
        }
        throw new AssertionError("Expected dataization of " + locator + " to fail");
    }

    @Test
    public void testDeltaLiteralReturnedUnchanged() {
        Dataizer dataizer = new Dataizer(Assembler.assemble(Programs.LITERAL));
        assertArrayEquals(new byte[] { 0, 0, 0, 0, 0, 0, 0, 42 }, dataizer.dataize("foo"));
    }

    @Test
    public void testPayloadOnTheVertexItself() {
        Graph g = Assembler.assemble("ADD($x);\nBIND(ν0, $x, foo);\nPUT($x, ff-ff);");
        assertArrayEquals(new byte[] { -1, -1 }, new Dataizer(g).dataize("foo"));
    }

    @Test
    public void testNativeCallThroughCopy() {
        Dataizer dataizer = new Dataizer(Assembler.assemble(Programs.INC));
        assertEquals(42L, Data.toLong(dataizer.dataize("foo")));
        assertEquals(42L, Data.toLong(dataizer.dataize("Φ.instance.inc")));
        assertEquals(41L, Data.toLong(dataizer.dataize("instance")));
    }

    @Test
    public void testApplicationWithArgument() {
        Dataizer dataizer = new Dataizer(Assembler.assemble(Programs.TIMES));
        assertEquals(42L, Data.toLong(dataizer.dataize("foo")));
    }

    @Test
    public void testDataizeByVertexId() {
        Graph g = Assembler.assemble(Programs.TIMES);
        int foo = g.attr(0, "foo").getAsInt();
        assertEquals(42L, Data.toLong(new Dataizer(g).dataize(foo)));
    }

    @Test
    public void testEachCopyKeepsItsOwnContext() {
        String program = Programs.INC + "\n" + String.join("\n",
                "ADD($j);",
                "BIND(ν0, $j, other);",
                "BIND($j, $int, π);",
                "ADD($e);",
                "BIND($j, $e, Δ);",
                "PUT($e, int/6);",
                "ADD($bar);",
                "BIND(ν0, $bar, bar);",
                "ADD($bb);",
                "BIND($bar, $bb, β);",
                "PUT($bb, string/Φ.other.inc);");
        Dataizer dataizer = new Dataizer(Assembler.assemble(program));
        assertEquals(42L, Data.toLong(dataizer.dataize("foo")));
        assertEquals(7L, Data.toLong(dataizer.dataize("bar")));
        // the first result was memoized on its own copy, not on the shared atom
        assertEquals(42L, Data.toLong(dataizer.dataize("foo")));
    }

    @Test
    public void testRelativeLocatorWalksOutwards() {
        Graph g = Assembler.assemble(String.join("\n",
                "ADD($box);",
                "BIND(ν0, $box, box);",
                "ADD($x);",
                "BIND($box, $x, x);",
                "PUT($x, int/5);",
                "ADD($y);",
                "BIND($box, $y, y);",
                "ADD($b);",
                "BIND($y, $b, β);",
                "PUT($b, string/x);",
                "ADD($z);",
                "BIND($box, $z, z);",
                "ADD($c);",
                "BIND($z, $c, β);",
                "PUT($c, string/ρ.x.Δ);"));
        Dataizer dataizer = new Dataizer(g);
        assertEquals(5L, Data.toLong(dataizer.dataize("box.y")));
        assertEquals(5L, Data.toLong(dataizer.dataize("Φ.box.z")));
    }

    @Test
    public void testCycleIsDetected() {
        DataizationException e = expectFailure(new Dataizer(Assembler.assemble(Programs.CYCLE)), "a");
        assertEquals(DataizationException.Kind.CYCLIC_DATAIZATION, e.kind());
        assertEquals(4, e.exitCode());
    }

    @Test
    public void testSelfReferenceThroughDelta() {
        Graph g = Assembler.assemble("ADD($a);\nBIND(ν0, $a, a);\nBIND($a, $a, Δ);");
        Dataizer dataizer = new Dataizer(g);
        assertEquals(DataizationException.Kind.CYCLIC_DATAIZATION, expectFailure(dataizer, "a").kind());
        // failure is terminal for the vertex
        assertEquals(DataizationException.Kind.PREVIOUSLY_FAILED, expectFailure(dataizer, "a").kind());
    }

    @Test
    public void testMissingAttribute() {
        Graph g = Assembler.assemble("ADD($x);\nBIND(ν0, $x, foo);\nADD($b);\nBIND($x, $b, β);\nPUT($b, string/Φ.nope);");
        DataizationException e = expectFailure(new Dataizer(g), "foo");
        assertEquals(DataizationException.Kind.ATTRIBUTE_NOT_FOUND, e.kind());
        assertEquals("nope", e.attribute());

        DataizationException top = expectFailure(new Dataizer(g), "bar");
        assertEquals(DataizationException.Kind.ATTRIBUTE_NOT_FOUND, top.kind());
        assertEquals("bar", top.attribute());
    }

    @Test
    public void testObjectWithoutValue() {
        Graph g = Assembler.assemble("ADD($x);\nBIND(ν0, $x, empty);");
        DataizationException e = expectFailure(new Dataizer(g), "empty");
        assertEquals(DataizationException.Kind.ATTRIBUTE_NOT_FOUND, e.kind());
        assertEquals("Δ", e.attribute());
    }

    @Test
    public void testUnknownNative() {
        Graph g = Assembler.assemble("ADD($x);\nBIND(ν0, $x, foo);\nADD($l);\nBIND($x, $l, λ);\nPUT($l, string/warp);");
        DataizationException e = expectFailure(new Dataizer(g), "foo");
        assertEquals(DataizationException.Kind.UNKNOWN_NATIVE, e.kind());
        assertEquals("warp", e.attribute());
    }

    @Test
    public void testNativeTypeMismatch() {
        String program = Programs.INC.replace("PUT($d, 00-00-00-00-00-00-00-29);", "PUT($d, 00-29);");
        DataizationException e = expectFailure(new Dataizer(Assembler.assemble(program)), "foo");
        assertEquals(DataizationException.Kind.NATIVE_TYPE_MISMATCH, e.kind());
        assertEquals("inc", e.attribute());
    }

    @Test
    public void testMissingArgument() {
        String program = Programs.TIMES
                .replace("BIND($foo, $arg, α0);", "BIND($foo, $arg, α1);");
        DataizationException e = expectFailure(new Dataizer(Assembler.assemble(program)), "foo");
        assertEquals(DataizationException.Kind.ATTRIBUTE_NOT_FOUND, e.kind());
        assertEquals("α0", e.attribute());
    }

    @Test
    public void testAttributeOfCopySeesCopyBindings() {
        // o has an abstract y and x = ξ.y; o2 copies o with y bound to 5
        Graph g = Assembler.assemble(String.join("\n",
                "ADD($o);",
                "BIND(ν0, $o, o);",
                "ADD($y);",
                "BIND($o, $y, y);",
                "ADD($x);",
                "BIND($o, $x, x);",
                "ADD($xb);",
                "BIND($x, $xb, β);",
                "PUT($xb, string/ξ.y);",
                "ADD($bare);",
                "BIND($o, $bare, bare);",
                "ADD($bb);",
                "BIND($bare, $bb, β);",
                "PUT($bb, string/y);",
                "ADD($up);",
                "BIND($o, $up, up);",
                "ADD($ub);",
                "BIND($up, $ub, β);",
                "PUT($ub, string/ρ.y);",
                "ADD($o2);",
                "BIND(ν0, $o2, o2);",
                "BIND($o2, $o, π);",
                "ADD($v);",
                "BIND($o2, $v, y);",
                "ADD($vd);",
                "BIND($v, $vd, Δ);",
                "PUT($vd, int/5);"));
        Dataizer dataizer = new Dataizer(g);
        assertEquals(5L, Data.toLong(dataizer.dataize("o2.x")));
        assertEquals(5L, Data.toLong(dataizer.dataize("o2.bare")));
        assertEquals(5L, Data.toLong(dataizer.dataize("Φ.o2.up")));
        // the original still has y unbound
        DataizationException e = expectFailure(dataizer, "o.x");
        assertEquals(DataizationException.Kind.ATTRIBUTE_NOT_FOUND, e.kind());
        assertEquals("Δ", e.attribute());
    }

    @Test
    public void testInheritedDeltaIsEvaluatedPerCopy() {
        // f has Δ = ρ.k; a and b are copies of f with different k
        Graph g = Assembler.assemble(String.join("\n",
                "ADD($f);",
                "BIND(ν0, $f, f);",
                "ADD($fd);",
                "BIND($f, $fd, Δ);",
                "ADD($fb);",
                "BIND($fd, $fb, β);",
                "PUT($fb, string/ρ.k);",
                "ADD($a);",
                "BIND(ν0, $a, a);",
                "BIND($a, $f, π);",
                "ADD($ka);",
                "BIND($a, $ka, k);",
                "PUT($ka, int/1);",
                "ADD($b);",
                "BIND(ν0, $b, b);",
                "BIND($b, $f, π);",
                "ADD($kb);",
                "BIND($b, $kb, k);",
                "PUT($kb, int/2);"));
        Dataizer dataizer = new Dataizer(g);
        assertEquals(1L, Data.toLong(dataizer.dataize("a")));
        assertEquals(2L, Data.toLong(dataizer.dataize("b")));
        assertEquals(1L, Data.toLong(dataizer.dataize("a")));
        int fd = g.attr(g.attr(0, "f").getAsInt(), "Δ").getAsInt();
        assertNotEquals(Vertex.Status.CACHED, g.vertex(fd).status());
    }

    @Test
    public void testInheritedDeltaFailureStaysOnItsCopy() {
        Graph g = Assembler.assemble(String.join("\n",
                "ADD($f);",
                "BIND(ν0, $f, f);",
                "ADD($fd);",
                "BIND($f, $fd, Δ);",
                "ADD($fb);",
                "BIND($fd, $fb, β);",
                "PUT($fb, string/ρ.k);",
                "ADD($a);",
                "BIND(ν0, $a, a);",
                "BIND($a, $f, π);",
                "ADD($b);",
                "BIND(ν0, $b, b);",
                "BIND($b, $f, π);",
                "ADD($kb);",
                "BIND($b, $kb, k);",
                "PUT($kb, int/2);"));
        Dataizer dataizer = new Dataizer(g);
        assertEquals("k", expectFailure(dataizer, "a").attribute());
        assertEquals(2L, Data.toLong(dataizer.dataize("b")));
    }

    @Test
    public void testAnonymousCopiesAsReceiverAndArgument() {
        // foo = int(6).times(int(6).inc), both int(6) are unnamed applications
        Graph g = Assembler.assemble(String.join("\n",
                "ADD($int);",
                "BIND(ν0, $int, int);",
                "ADD($id);",
                "BIND($int, $id, Δ);",
                "ADD($idb);",
                "BIND($id, $idb, β);",
                "PUT($idb, string/ρ.α0);",
                "ADD($inc);",
                "BIND($int, $inc, inc);",
                "ADD($l1);",
                "BIND($inc, $l1, λ);",
                "PUT($l1, string/inc);",
                "ADD($times);",
                "BIND($int, $times, times);",
                "ADD($l2);",
                "BIND($times, $l2, λ);",
                "PUT($l2, string/times);",
                "ADD(ν100);",
                "ADD($c1);",
                "BIND(ν100, $c1, ε);",
                "ADD($c1b);",
                "BIND($c1, $c1b, β);",
                "PUT($c1b, string/Φ.int);",
                "ADD($six1);",
                "BIND(ν100, $six1, α0);",
                "PUT($six1, int/6);",
                "ADD(ν200);",
                "ADD($c2);",
                "BIND(ν200, $c2, ε);",
                "ADD($c2b);",
                "BIND($c2, $c2b, β);",
                "PUT($c2b, string/Φ.int);",
                "ADD($six2);",
                "BIND(ν200, $six2, α0);",
                "PUT($six2, int/6);",
                "ADD($foo);",
                "BIND(ν0, $foo, foo);",
                "ADD($callee);",
                "BIND($foo, $callee, ε);",
                "ADD($cb);",
                "BIND($callee, $cb, β);",
                "PUT($cb, string/ν100.times);",
                "ADD($arg);",
                "BIND($foo, $arg, α0);",
                "ADD($ab);",
                "BIND($arg, $ab, β);",
                "PUT($ab, string/ν200.inc);"));
        Dataizer dataizer = new Dataizer(g);
        assertEquals(42L, Data.toLong(dataizer.dataize("foo")));
        assertEquals(6L, Data.toLong(dataizer.dataize("ν100")));
        assertEquals(7L, Data.toLong(dataizer.dataize("ν200.inc")));
    }

    @Test
    public void testChainDeeperThanStackFailsCleanly() {
        int depth = 100_000;
        Graph g = Graph.empty();
        for (int i = 1; i <= depth; i++) {
            g.add(i);
            g.bind(Graph.ROOT, i, "o" + i);
        }
        for (int i = 1; i < depth; i++) {
            int beta = depth + i;
            g.add(beta);
            g.bind(i, beta, "β");
            g.put(beta, Data.fromString("Φ.o" + (i + 1)));
        }
        g.put(depth, Data.fromLong(5));
        Dataizer dataizer = new Dataizer(g);
        assertEquals(DataizationException.Kind.TOO_DEEP, expectFailure(dataizer, "o1").kind());
        // nothing was left half done, so the same request fails the same way
        assertEquals(DataizationException.Kind.TOO_DEEP, expectFailure(dataizer, "o1").kind());
        for (int id : g.ids())
            assertNotEquals(Vertex.Status.IN_PROGRESS, g.vertex(id).status());
        assertEquals(5L, Data.toLong(dataizer.dataize("o" + (depth - 3))));
    }

    @Test
    public void testSideEffectHappensOnce() {
        ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        NativeRegistry natives = NativeRegistry.standard(new PrintStream(stdout, true, StandardCharsets.UTF_8));
        Dataizer dataizer = new Dataizer(Assembler.assemble(Programs.HELLO), natives);
        assertEquals("hello", Data.toString(dataizer.dataize("say")));
        assertEquals("hello", Data.toString(dataizer.dataize("say")));
        assertEquals("hello", stdout.toString(StandardCharsets.UTF_8));
    }

    @Test
    public void testCustomNative() {
        NativeRegistry natives = NativeRegistry.builder()
                .register("inc", true, 0, args -> Data.fromLong(Data.toLong(args.get(0)) + 100))
                .build();
        Dataizer dataizer = new Dataizer(Assembler.assemble(Programs.INC), natives);
        assertEquals(141L, Data.toLong(dataizer.dataize("foo")));
    }

    @Test
    public void testListenerSeesProgress() {
        List<String> events = new ArrayList<>();
        Dataizer dataizer = new Dataizer(Assembler.assemble(Programs.INC));
        dataizer.setListener(new DataizationListener() {
            @Override
            public void onDataizationStart(int vertex) {
                events.add("start");
            }

            @Override
            public void onVertexDataized(int vertex, byte[] value) {
                events.add("vertex");
            }

            @Override
            public void onNativeInvoked(int vertex, String name, int args) {
                events.add("λ" + name + "/" + args);
            }

            @Override
            public void onDataizationError(int vertex, Throwable error) {
                events.add("error");
            }

            @Override
            public void onDataizationEnd(int vertex, int dataized) {
                events.add("end:" + dataized);
            }
        });
        dataizer.dataize("foo");
        assertEquals("start", events.get(0));
        assertTrue(events.contains("λinc/1"));
        assertTrue(events.get(events.size() - 1).startsWith("end:"));
        assertFalse(events.contains("error"));
        assertTrue(dataizer.dataizedCount() >= 3);

        events.clear();
        expectFailure(dataizer, "missing");
        assertEquals(List.of("start", "error"), events);
    }
}
