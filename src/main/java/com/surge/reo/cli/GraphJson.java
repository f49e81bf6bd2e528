package com.surge.reo.cli;

import com.surge.reo.io.GraphCodec;
import com.surge.reo.io.GraphDump;

import org.apache.commons.cli.CommandLine;

import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.List;

/**
 * {@code graph <binary> <out.json>}: writes vertices, edges and payloads as
 * JSON.
 */
public class GraphJson implements ReoCommand {

    @Override
    public String usage() {
        return "graph <binary> <out.json>";
    }

    @Override
    public int execute(CommandLine command, PrintStream out) throws Exception {
        List<String> args = positional(parse(command), 2);
        GraphDump.of(GraphCodec.load(Paths.get(args.get(0)))).save(Paths.get(args.get(1)));
        return ReoCli.OK;
    }
}
