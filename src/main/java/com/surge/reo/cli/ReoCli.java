package com.surge.reo.cli;

import com.surge.reo.api.SodgException;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;

import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;

/**
 * Command line entry point: {@code reo [--verbose|--trace] <command> ...}.
 *
 * Exit status: 0 success, 1 usage, 2 assembly, 3 merge, 4 dataization,
 * 5 I/O.
 */
public class ReoCli {
    private static final Logger LOG = LogManager.getLogger(ReoCli.class);
    private static final Options options = new Options();

    public static final int OK = 0;
    public static final int USAGE = 1;
    public static final int IO = 5;

    static {
        options.addOption("v", "verbose", false, "Print info messages to stderr");
        options.addOption("t", "trace", false, "Print everything to stderr");
    }

    public static void main(String[] args) {
        System.exit(execute(args, System.out));
    }

    public static int execute(String[] args) {
        return execute(args, System.out);
    }

    public static int execute(String[] args, PrintStream out) {
        final CommandLineParser cliParser = new DefaultParser();
        String commandStr = "reo";
        try {
            final CommandLine parse = cliParser.parse(options, args, true);
            if (parse.hasOption('t'))
                Configurator.setRootLevel(Level.TRACE);
            else if (parse.hasOption('v'))
                Configurator.setRootLevel(Level.INFO);
            LOG.debug("Going to execute: {}", String.join(" ", args));
            if (parse.getArgs().length == 0) {
                usage(out);
                return USAGE;
            }
            commandStr = parse.getArgs()[0];
            final ReoCommandHolder command;
            try {
                command = ReoCommandHolder.valueOf(commandStr);
            } catch (IllegalArgumentException e) {
                LOG.error("Unknown command '{}'", commandStr);
                usage(out);
                return USAGE;
            }
            return command.execute(parse, out);
        } catch (ParseException e) {
            LOG.error("{}: {}", commandStr, e.getMessage());
            return USAGE;
        } catch (SodgException e) {
            LOG.error("{} failed: {}", commandStr, e.getMessage());
            return e.exitCode();
        } catch (IOException e) {
            LOG.error("{} failed, I/O error: {}", commandStr, e.getMessage());
            return IO;
        } catch (IllegalArgumentException e) {
            LOG.error("{}: {}", commandStr, e.getMessage());
            return USAGE;
        } catch (Exception e) {
            LOG.error("Error while executing: " + String.join(" ", args), e);
            return USAGE;
        }
    }

    private static void usage(PrintStream out) {
        PrintWriter pw = new PrintWriter(out);
        HelpFormatter cliHelp = new HelpFormatter();
        StringBuilder commands = new StringBuilder("\nCommands:");
        for (ReoCommandHolder c : ReoCommandHolder.values())
            commands.append("\n  ").append(c.command().usage());
        cliHelp.printHelp(pw, HelpFormatter.DEFAULT_WIDTH, "reo [options] <command> ...", null,
                options, HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, commands.toString());
        pw.flush();
    }
}
