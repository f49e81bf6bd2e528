package com.surge.reo.wiring;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.surge.reo.engine.Merger;
import com.surge.reo.graph.Graph;
import com.surge.reo.io.Assembler;
import com.surge.reo.io.SourceTree;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Compiles many SODG units in parallel and links them into one graph.
 *
 * Each unit is assembled on a worker thread into its own private
 * {@link Graph}. Workers publish the result to a Disruptor ring buffer; a
 * single consumer thread merges units into the shared graph under their
 * packages, one at a time. Units are merged in completion order, so vertex
 * ids of the result may differ between runs while the names bound and the
 * values they dataize to don't.
 *
 * The first failure (assembly, I/O or name collision) wins: later units are
 * drained but not merged, and the failure is thrown once every unit has
 * been accounted for.
 */
public final class LinkPipeline {
    private static final Logger log = LogManager.getLogger(LinkPipeline.class);

    public static final int DEFAULT_RING_SIZE = 1024;

    private final int ringSize;
    private final int parallelism;

    /**
     * @param ringSize    ring buffer slots, a power of two
     * @param parallelism number of assembling threads
     */
    public LinkPipeline(int ringSize, int parallelism) {
        if (Integer.bitCount(ringSize) != 1)
            throw new IllegalArgumentException("Ring size must be a power of two: " + ringSize);
        if (parallelism < 1)
            throw new IllegalArgumentException("Parallelism must be positive: " + parallelism);
        this.ringSize = ringSize;
        this.parallelism = parallelism;
    }

    public LinkPipeline() {
        this(DEFAULT_RING_SIZE, Math.max(1, Runtime.getRuntime().availableProcessors()));
    }

    /** Compiles every {@code *.sodg} file under a directory. */
    public Graph compile(Path home) throws IOException {
        return link(new SourceTree(home).units());
    }

    /**
     * Assembles and merges the units.
     *
     * @throws IOException if a source can't be read
     * @throws com.surge.reo.io.AssemblyException  if a unit is malformed
     * @throws com.surge.reo.engine.MergeException if two units bind one name
     */
    public Graph link(List<SourceTree.Unit> units) throws IOException {
        Graph linked = Graph.empty();
        if (units.isEmpty())
            return linked;
        MergeHandler handler = new MergeHandler(linked, units.size());
        Disruptor<LinkEvent> disruptor = new Disruptor<>(
                LinkEvent::new,
                ringSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        disruptor.handleEventsWith(handler);
        RingBuffer<LinkEvent> ring = disruptor.start();
        ExecutorService workers = Executors.newFixedThreadPool(parallelism, DaemonThreadFactory.INSTANCE);
        try {
            for (int i = 0; i < units.size(); i++) {
                int index = i;
                SourceTree.Unit unit = units.get(i);
                workers.execute(() -> assemble(ring, index, unit));
            }
            handler.done.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while linking " + units.size() + " units");
        } finally {
            workers.shutdownNow();
            disruptor.shutdown();
        }
        Throwable error = handler.error;
        if (error instanceof IOException io)
            throw io;
        if (error instanceof RuntimeException re)
            throw re;
        if (error != null)
            throw new IllegalStateException("Linking failed", error);
        log.info("{} units linked into {}", units.size(), linked);
        return linked;
    }

    private static void assemble(RingBuffer<LinkEvent> ring, int index, SourceTree.Unit unit) {
        Graph graph;
        try {
            graph = Assembler.assemble(unit.file());
        } catch (IOException | RuntimeException e) {
            log.debug("{} failed: {}", unit.file(), e.getMessage());
            long seq = ring.next();
            try {
                ring.get(seq).setFailed(index, unit.file(), e);
            } finally {
                ring.publish(seq);
            }
            return;
        }
        log.debug("{} assembled: {}", unit.file(), graph);
        long seq = ring.next();
        try {
            ring.get(seq).setCompiled(index, unit.file(), unit.pkg(), graph);
        } finally {
            ring.publish(seq);
        }
    }

    /** The single consumer: merges units into the shared graph. */
    private static final class MergeHandler implements EventHandler<LinkEvent> {
        private final Graph target;
        private final CountDownLatch done;
        private volatile Throwable error;

        MergeHandler(Graph target, int units) {
            this.target = target;
            this.done = new CountDownLatch(units);
        }

        @Override
        public void onEvent(LinkEvent event, long sequence, boolean endOfBatch) {
            try {
                if (error != null)
                    return;
                if (event.isFailed()) {
                    error = event.error();
                    log.debug("Unit {} failed: {}", event.source(), error.getMessage());
                    return;
                }
                try {
                    Merger.merge(target, event.graph(), event.pkg());
                    log.trace("Unit #{} {} merged", event.unit(), event.source());
                } catch (RuntimeException e) {
                    error = e;
                    log.debug("Unit {} can't be merged: {}", event.source(), e.getMessage());
                }
            } finally {
                event.clear();
                done.countDown();
            }
        }
    }
}
