package com.surge.reo.io;

import com.surge.reo.graph.Graph;
import com.surge.reo.graph.GraphException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Deploys textual SODG instructions into a {@link Graph}.
 *
 * The input is a sequence of lines, each either blank, a {@code #} comment,
 * or one of:
 *
 * <pre>
 *   ADD(v);             create vertex v
 *   BIND(v1, v2, name); edge 'name' from v1 to v2
 *   PUT(v, literal);    attach a payload (see {@link DataLiteral})
 * </pre>
 *
 * Vertex references are either concrete ({@code ν7}, {@code v7}, {@code 7})
 * or symbolic ({@code $x}). A symbolic reference gets a fresh id of the target
 * graph the first time it is mentioned, so a unit can be deployed into a graph
 * that already holds other units. Ids written as concrete references
 * anywhere in the program are never given to an alias. Reference {@code ν0}
 * means the unit's root, which is vertex 0 unless remapped with
 * {@link #withRoot(int)}.
 *
 * Instructions are applied in order and assembly stops at the first failure.
 * Instructions already applied stay in the graph.
 */
public final class Assembler {
    private static final Logger log = LogManager.getLogger(Assembler.class);

    private final Graph graph;
    private final Map<String, Integer> aliases = new HashMap<>();
    // concrete ids the program mentions, kept away from aliases
    private final Set<Integer> reserved = new HashSet<>();
    private int root = Graph.ROOT;

    public Assembler(Graph graph) {
        this.graph = graph;
    }

    /** Assembles a program into a fresh graph. */
    public static Graph assemble(String program) {
        Graph g = Graph.empty();
        new Assembler(g).deploy(program);
        return g;
    }

    /** Assembles a UTF-8 source file into a fresh graph. */
    public static Graph assemble(Path source) throws IOException {
        return assemble(Files.readString(source, StandardCharsets.UTF_8));
    }

    /**
     * Maps the unit's root reference onto an existing vertex of the target
     * graph, so every {@code BIND(ν0, ...)} lands there instead.
     */
    public Assembler withRoot(int vertex) {
        graph.vertex(vertex);
        this.root = vertex;
        return this;
    }

    /**
     * Applies all instructions of the program.
     *
     * @return the number of instructions applied
     * @throws AssemblyException on the first failing instruction
     */
    public int deploy(String program) {
        String[] lines = program.split("\\R", -1);
        List<Instruction> parsed = new ArrayList<>(lines.length);
        AssemblyException malformed = null;
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty() || line.startsWith("#"))
                continue;
            try {
                parsed.add(Instruction.parse(line, i + 1));
            } catch (AssemblyException e) {
                // the lines before it are still applied, then this is thrown
                malformed = e;
                break;
            }
        }
        for (Instruction ins : parsed)
            reserve(ins);
        int applied = 0;
        for (Instruction ins : parsed) {
            apply(ins);
            applied++;
        }
        if (malformed != null)
            throw malformed;
        log.debug("{} instructions deployed, {}", applied, graph);
        return applied;
    }

    private void reserve(Instruction ins) {
        int refs = ins.op() == Instruction.Op.BIND ? 2 : 1;
        for (int pos = 0; pos < refs; pos++) {
            int id = concrete(ins.args().get(pos));
            if (id > Graph.ROOT)
                reserved.add(id);
        }
    }

    /** Symbolic references allocated so far, by name without the {@code $}. */
    public Map<String, Integer> aliases() {
        return Map.copyOf(aliases);
    }

    private void apply(Instruction ins) {
        try {
            switch (ins.op()) {
                case ADD -> {
                    int v = vertex(ins, 0);
                    // the root pre-exists; re-adding it is tolerated
                    if (v == root && isRootRef(ins.args().get(0)))
                        break;
                    graph.add(v);
                }
                case BIND -> {
                    String name = ins.args().get(2);
                    if (name.chars().anyMatch(Character::isWhitespace))
                        throw AssemblyException.malformed(ins.line(), ins.text(),
                                "attribute name '" + name + "' contains whitespace");
                    graph.bind(vertex(ins, 0), vertex(ins, 1), name);
                }
                case PUT -> graph.put(vertex(ins, 0), literal(ins));
            }
            log.trace("#{}: {}", ins.line(), ins.text());
        } catch (GraphException e) {
            throw AssemblyException.of(ins.line(), ins.text(), e);
        }
    }

    private byte[] literal(Instruction ins) {
        try {
            return DataLiteral.parse(ins.args().get(1));
        } catch (IllegalArgumentException e) {
            throw AssemblyException.malformed(ins.line(), ins.text(), e.getMessage());
        }
    }

    private int vertex(Instruction ins, int pos) {
        String ref = ins.args().get(pos);
        if (ref.startsWith("$")) {
            String name = ref.substring(1);
            if (name.isEmpty())
                throw AssemblyException.malformed(ins.line(), ins.text(), "empty alias");
            Integer known = aliases.get(name);
            if (known != null)
                return known;
            int id = graph.nextId();
            while (reserved.contains(id))
                id = graph.nextId();
            aliases.put(name, id);
            log.trace("${} is ν{}", name, id);
            return id;
        }
        int id = concrete(ref);
        if (id < 0)
            throw AssemblyException.malformed(ins.line(), ins.text(), "bad vertex reference '" + ref + "'");
        return id == Graph.ROOT ? root : id;
    }

    private static boolean isRootRef(String ref) {
        return concrete(ref) == Graph.ROOT;
    }

    private static int concrete(String ref) {
        String digits = ref;
        if (ref.startsWith("ν") || ref.startsWith("v"))
            digits = ref.substring(1);
        if (digits.isEmpty() || !digits.chars().allMatch(c -> c >= '0' && c <= '9'))
            return -1;
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
