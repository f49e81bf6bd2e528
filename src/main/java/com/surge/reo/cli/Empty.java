package com.surge.reo.cli;

import com.surge.reo.graph.Graph;
import com.surge.reo.io.GraphCodec;

import lombok.extern.log4j.Log4j2;
import org.apache.commons.cli.CommandLine;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * {@code empty <binary>}: writes a graph with the root vertex only.
 */
@Log4j2
public class Empty implements ReoCommand {

    @Override
    public String usage() {
        return "empty <binary>";
    }

    @Override
    public int execute(CommandLine command, PrintStream out) throws Exception {
        Path binary = Paths.get(positional(parse(command), 1).get(0));
        GraphCodec.save(Graph.empty(), binary);
        log.info("Empty graph saved to '{}'", binary);
        return ReoCli.OK;
    }
}
