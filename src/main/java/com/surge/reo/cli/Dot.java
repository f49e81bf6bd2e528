package com.surge.reo.cli;

import com.surge.reo.graph.Graph;
import com.surge.reo.io.GraphCodec;
import com.surge.reo.util.DotPrinter;

import lombok.extern.log4j.Log4j2;
import org.apache.commons.cli.CommandLine;

import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;

/**
 * {@code dot <binary> <out.dot>}: renders the graph for Graphviz.
 */
@Log4j2
public class Dot implements ReoCommand {

    @Override
    public String usage() {
        return "dot <binary> <out.dot>";
    }

    @Override
    public int execute(CommandLine command, PrintStream out) throws Exception {
        List<String> args = positional(parse(command), 2);
        Graph graph = GraphCodec.load(Paths.get(args.get(0)));
        Files.writeString(Paths.get(args.get(1)), DotPrinter.print(graph), StandardCharsets.UTF_8);
        log.info("{} rendered to '{}'", graph, args.get(1));
        return ReoCli.OK;
    }
}
