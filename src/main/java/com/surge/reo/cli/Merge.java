package com.surge.reo.cli;

import com.surge.reo.engine.Merger;
import com.surge.reo.graph.Graph;
import com.surge.reo.io.GraphCodec;

import lombok.extern.log4j.Log4j2;
import org.apache.commons.cli.CommandLine;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * {@code merge <target> <binary>...}: merges binaries into the target, in
 * the given order, and saves the target. The target is written only when
 * every merge succeeds.
 */
@Log4j2
public class Merge implements ReoCommand {

    @Override
    public String usage() {
        return "merge <target> <binary>...";
    }

    @Override
    public int execute(CommandLine command, PrintStream out) throws Exception {
        List<String> args = positional(parse(command), 2);
        Path target = Paths.get(args.get(0));
        Graph base = GraphCodec.load(target);
        for (String other : args.subList(1, args.size())) {
            Graph incoming = GraphCodec.load(Paths.get(other));
            Merger.merge(base, incoming);
            log.info("'{}' merged into '{}'", other, target);
        }
        GraphCodec.save(base, target);
        log.info("{} saved to '{}'", base, target);
        return ReoCli.OK;
    }
}
