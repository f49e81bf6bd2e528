package com.surge.reo.cli;

import com.surge.reo.io.GraphCodec;
import com.surge.reo.util.GraphInspector;

import org.apache.commons.cli.CommandLine;

import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.List;

/**
 * {@code inspect <binary> <locator>}: prints the attribute tree of an
 * object.
 */
public class Inspect implements ReoCommand {

    @Override
    public String usage() {
        return "inspect <binary> <locator>";
    }

    @Override
    public int execute(CommandLine command, PrintStream out) throws Exception {
        List<String> args = positional(parse(command), 2);
        GraphInspector inspector = new GraphInspector(GraphCodec.load(Paths.get(args.get(0))));
        out.println(inspector.inspect(args.get(1)));
        return ReoCli.OK;
    }
}
