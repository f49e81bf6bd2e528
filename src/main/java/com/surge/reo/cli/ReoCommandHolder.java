package com.surge.reo.cli;

import org.apache.commons.cli.CommandLine;

import java.io.PrintStream;

/**
 * Sub-commands by name.
 */
public enum ReoCommandHolder {
    compile(new Compile()),
    merge(new Merge()),
    link(new Merge()),
    empty(new Empty()),
    dataize(new Dataize()),
    inspect(new Inspect()),
    dot(new Dot()),
    graph(new GraphJson());

    private final ReoCommand command;

    ReoCommandHolder(ReoCommand command) {
        this.command = command;
    }

    public ReoCommand command() {
        return command;
    }

    public int execute(CommandLine line, PrintStream out) throws Exception {
        return command.execute(line, out);
    }
}
