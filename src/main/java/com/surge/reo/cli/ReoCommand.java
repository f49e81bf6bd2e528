package com.surge.reo.cli;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;

/**
 * A sub-command of the command line tool.
 */
public interface ReoCommand {

    /**
     * Runs the command. {@code command.getArgs()[0]} is the command name.
     *
     * @param out where results go; logs never go there
     * @return process exit status
     */
    int execute(CommandLine command, PrintStream out) throws Exception;

    /** Options of this command, beyond the global ones. */
    default Options options() {
        return new Options();
    }

    /** One-line usage, e.g. {@code "compile [--force] <source> <binary>"}. */
    String usage();

    /**
     * Parses the command's own options out of the arguments left after the
     * global ones.
     */
    default CommandLine parse(CommandLine command) throws ParseException {
        return new DefaultParser().parse(options(), command.getArgs(), false);
    }

    /**
     * Positional arguments after the command name.
     *
     * @throws ParseException if there are fewer than {@code min}
     */
    default List<String> positional(CommandLine local, int min) throws ParseException {
        String[] args = local.getArgs();
        List<String> rest = args.length == 0 ? List.of() : Arrays.asList(args).subList(1, args.length);
        if (rest.size() < min)
            throw new ParseException("Usage: " + usage());
        return rest;
    }
}
