package com.ordoAetheris.handoff;

import com.ordoAetheris.handoff.buffer.SharedBuffer;
import com.ordoAetheris.handoff.container.Sink;
import com.ordoAetheris.handoff.container.Source;
import com.ordoAetheris.handoff.worker.Consumer;
import com.ordoAetheris.handoff.worker.EndOfStream;
import com.ordoAetheris.handoff.worker.PoisonPill;
import com.ordoAetheris.handoff.worker.Producer;
import com.ordoAetheris.handoff.worker.ProducerCountdown;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs P producers and C consumers over one {@link SharedBuffer} and waits for all of them.
 *
 * <p>Single use: one instance drives exactly one transfer.
 * <ul>
 *   <li>all workers finish within the join timeout: a {@link TransferResult}</li>
 *   <li>a worker throws: the others are interrupted and a {@link TransferException} carries the fault</li>
 *   <li>workers are still running at the deadline: a thread dump is logged, the workers are
 *       interrupted and a {@link TransferTimeoutException} is thrown</li>
 * </ul>
 */
public class TransferManager<T> {

    private static final Logger log = LoggerFactory.getLogger(TransferManager.class);

    private final TransferConfig config;
    private final AtomicBoolean started = new AtomicBoolean(false);

    private volatile SharedBuffer<T> buffer;

    public TransferManager(TransferConfig config) {
        if (config == null) throw new IllegalArgumentException("config must not be null");
        this.config = config;
    }

    public TransferResult transfer(Source<T> source, Sink<T> sink) throws TransferException, InterruptedException {
        if (source == null) throw new IllegalArgumentException("source must not be null");
        if (sink == null) throw new IllegalArgumentException("sink must not be null");
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("TransferManager is single-use, create a new instance for a new transfer");
        }

        SharedBuffer<T> buffer = new SharedBuffer<>(config.capacity());
        this.buffer = buffer;
        EndOfStream endOfStream = config.shutdownMode() == ShutdownMode.SYMMETRIC
                ? new PoisonPill<>(buffer)
                : new ProducerCountdown<>(buffer, config.producers());

        List<Producer<T>> producers = new ArrayList<>(config.producers());
        for (int i = 1; i <= config.producers(); i++) {
            producers.add(new Producer<>("producer-" + i, source, buffer, endOfStream, config.pacing()));
        }
        List<Consumer<T>> consumers = new ArrayList<>(config.consumers());
        for (int i = 1; i <= config.consumers(); i++) {
            consumers.add(new Consumer<>("consumer-" + i, buffer, sink, config.pacing()));
        }

        log.info("Starting transfer: {}", config);
        long t0 = System.nanoTime();
        ExecutorService pool = Executors.newFixedThreadPool(config.producers() + config.consumers(), workerThreads());
        try {
            CompletionService<Integer> done = new ExecutorCompletionService<>(pool);
            List<Future<Integer>> consumerFutures = new ArrayList<>();
            List<Future<Integer>> producerFutures = new ArrayList<>();
            // consumers first, ready to drain as soon as anything lands
            for (Consumer<T> c : consumers) consumerFutures.add(done.submit(c));
            for (Producer<T> p : producers) producerFutures.add(done.submit(p));

            long deadline = t0 + config.joinTimeout().toNanos();
            for (int finished = 0; finished < producers.size() + consumers.size(); finished++) {
                Future<Integer> f = done.poll(deadline - System.nanoTime(), TimeUnit.NANOSECONDS);
                if (f == null) throw timedOut(producers, consumers, buffer);
                try {
                    f.get();
                } catch (ExecutionException e) {
                    pool.shutdownNow();
                    throw new TransferException("worker failed: " + e.getCause(), e.getCause());
                }
            }

            TransferResult result = new TransferResult(sum(producerFutures), sum(consumerFutures),
                    Duration.ofNanos(System.nanoTime() - t0));
            log.info("Transfer complete: {}", result);
            return result;
        } finally {
            pool.shutdownNow();
        }
    }

    private TransferTimeoutException timedOut(List<Producer<T>> producers, List<Consumer<T>> consumers,
                                              SharedBuffer<T> buffer) {
        StringBuilder alive = new StringBuilder();
        for (Producer<T> p : producers) {
            if (p.state() != Producer.State.DONE) alive.append(' ').append(p.name()).append('=').append(p.state());
        }
        for (Consumer<T> c : consumers) {
            if (c.state() != Consumer.State.DONE) alive.append(' ').append(c.name()).append('=').append(c.state());
        }
        String message = String.format("workers still running after %dms (likely deadlock), buffer %d/%d, alive:%s",
                config.joinTimeout().toMillis(), buffer.size(), buffer.capacity(), alive);
        log.error("{}\n=== thread dump ===\n{}", message, ThreadDumps.dump());
        return new TransferTimeoutException(message);
    }

    private static int sum(List<Future<Integer>> futures) throws InterruptedException {
        int total = 0;
        for (Future<Integer> f : futures) {
            try {
                total += f.get();
            } catch (ExecutionException e) {
                throw new IllegalStateException("completed worker reported a failure late", e);
            }
        }
        return total;
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "handoff-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /** Items currently queued in the running transfer, or 0 before it starts. Diagnostics only. */
    public int inFlight() {
        SharedBuffer<T> b = buffer;
        return b == null ? 0 : b.size();
    }

    public TransferConfig config() {
        return config;
    }
}
