package com.surge.reo.cli;

import com.surge.reo.api.Attr;
import com.surge.reo.api.Locator;
import com.surge.reo.engine.Dataizer;
import com.surge.reo.fn.NativeRegistry;
import com.surge.reo.graph.Graph;
import com.surge.reo.io.GraphCodec;
import com.surge.reo.io.Hex;
import com.surge.reo.util.LoggingDataizationListener;

import lombok.extern.log4j.Log4j2;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Options;

import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.List;

/**
 * {@code dataize [--dump <file>] <binary> <object>}: prints the value of a
 * root-level object (or any locator starting at {@code Φ}) in hex.
 */
@Log4j2
public class Dataize implements ReoCommand {

    @Override
    public Options options() {
        Options options = new Options();
        options.addOption("d", "dump", true, "Save the graph here after dataization, even if it fails");
        return options;
    }

    @Override
    public String usage() {
        return "dataize [--dump <file>] <binary> <object>";
    }

    @Override
    public int execute(CommandLine command, PrintStream out) throws Exception {
        CommandLine local = parse(command);
        List<String> args = positional(local, 2);
        Graph graph = GraphCodec.load(Paths.get(args.get(0)));
        String object = args.get(1);
        String locator = Locator.isRoot(Locator.parse(object).head()) ? object : Attr.PHI + "." + object;
        Dataizer dataizer = new Dataizer(graph, NativeRegistry.standard(out));
        dataizer.setListener(new LoggingDataizationListener());
        try {
            long start = System.nanoTime();
            byte[] value = dataizer.dataize(locator);
            String hex = Hex.format(value);
            log.info("Dataization result, in {}us, is: {}", (System.nanoTime() - start) / 1_000, hex);
            out.println(hex);
        } finally {
            if (local.hasOption('d')) {
                GraphCodec.save(graph, Paths.get(local.getOptionValue('d')));
                log.info("{} dumped to '{}'", graph, local.getOptionValue('d'));
            }
        }
        return ReoCli.OK;
    }
}
