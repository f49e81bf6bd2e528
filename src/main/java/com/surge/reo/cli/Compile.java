package com.surge.reo.cli;

import com.surge.reo.graph.Graph;
import com.surge.reo.io.Assembler;
import com.surge.reo.io.GraphCodec;
import com.surge.reo.io.SourceTree;
import com.surge.reo.wiring.LinkPipeline;

import lombok.extern.log4j.Log4j2;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * {@code compile [--force] [--parallelism N] <source> <binary>}: assembles a
 * {@code .sodg} file, or every such file under a directory, and saves the
 * binary graph. Does nothing when the binary is newer than the sources.
 */
@Log4j2
public class Compile implements ReoCommand {

    @Override
    public Options options() {
        Options options = new Options();
        options.addOption("f", "force", false, "Compile even if the binary is up to date");
        options.addOption("p", "parallelism", true, "Number of assembling threads for a directory");
        return options;
    }

    @Override
    public String usage() {
        return "compile [--force] [--parallelism N] <source> <binary>";
    }

    @Override
    public int execute(CommandLine command, PrintStream out) throws Exception {
        CommandLine local = parse(command);
        List<String> args = positional(local, 2);
        Path source = Paths.get(args.get(0));
        Path binary = Paths.get(args.get(1));
        boolean directory = Files.isDirectory(source);
        if (!directory && !Files.isRegularFile(source))
            throw new NoSuchFileException(source.toString());
        long recent = directory
                ? new SourceTree(source).lastModified()
                : Files.getLastModifiedTime(source).toMillis();
        if (!local.hasOption('f') && Files.exists(binary)
                && Files.getLastModifiedTime(binary).toMillis() > recent) {
            log.info("The binary '{}' is up to date ({} bytes), use --force to compile anyway",
                    binary, Files.size(binary));
            return ReoCli.OK;
        }
        long start = System.currentTimeMillis();
        Graph graph;
        if (directory) {
            graph = pipeline(local).compile(source);
        } else {
            graph = Assembler.assemble(source);
        }
        for (String problem : graph.inconsistencies())
            log.warn("{}: {}", source, problem);
        GraphCodec.save(graph, binary);
        log.info("{} compiled into '{}' ({} bytes) in {}ms",
                graph, binary, Files.size(binary), System.currentTimeMillis() - start);
        return ReoCli.OK;
    }

    private static LinkPipeline pipeline(CommandLine local) throws ParseException {
        if (!local.hasOption('p'))
            return new LinkPipeline();
        try {
            return new LinkPipeline(LinkPipeline.DEFAULT_RING_SIZE, Integer.parseInt(local.getOptionValue('p')));
        } catch (IllegalArgumentException e) {
            throw new ParseException("Bad --parallelism: " + local.getOptionValue('p'));
        }
    }
}
