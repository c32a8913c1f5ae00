package com.ordoAetheris.handoff.worker;

import com.ordoAetheris.handoff.buffer.Item;
import com.ordoAetheris.handoff.buffer.SharedBuffer;
import com.ordoAetheris.handoff.container.Source;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Pulls items from a {@link Source} and puts them into the {@link SharedBuffer},
 * then signals end of stream exactly once.
 *
 * <p>The end-of-stream signal is also sent when the source or the buffer throws
 * (any unchecked exception or error),
 * before the fault is rethrown, so consumers are never left waiting on an empty buffer.
 * Returns the number of items enqueued.
 */
public class Producer<T> implements Callable<Integer> {

    public enum State { RUNNING, DRAINING_SOURCE, SENDING_SENTINEL, DONE }

    private static final Logger log = LoggerFactory.getLogger(Producer.class);

    private final String name;
    private final Source<T> source;
    private final SharedBuffer<T> buffer;
    private final EndOfStream endOfStream;
    private final Duration pacing;

    private volatile State state = State.RUNNING;
    private boolean signalled;

    public Producer(String name, Source<T> source, SharedBuffer<T> buffer, EndOfStream endOfStream, Duration pacing) {
        if (source == null) throw new IllegalArgumentException("source must not be null");
        if (buffer == null) throw new IllegalArgumentException("buffer must not be null");
        if (endOfStream == null) throw new IllegalArgumentException("endOfStream must not be null");
        this.name = name;
        this.source = source;
        this.buffer = buffer;
        this.endOfStream = endOfStream;
        this.pacing = Pacing.check(pacing);
    }

    /** Single producer feeding one consumer through a poison pill, no pacing. */
    public Producer(Source<T> source, SharedBuffer<T> buffer) {
        this("producer", source, buffer, new PoisonPill<>(buffer), Duration.ZERO);
    }

    @Override
    public Integer call() throws InterruptedException {
        log.info("{} started", name);
        int produced = 0;
        try {
            state = State.DRAINING_SOURCE;
            while (true) {
                Optional<T> next = source.next();
                if (next.isEmpty()) break;
                buffer.put(Item.of(next.get()));
                produced++;
                if (log.isDebugEnabled()) log.debug("{} PUT {} -> buffer {}", name, next.get(), buffer.snapshot());
                Pacing.pause(pacing);
            }
            state = State.SENDING_SENTINEL;
            log.debug("{} source exhausted, signalling end of stream", name);
            signalled = true;
            endOfStream.signal();
        } catch (InterruptedException e) {
            log.warn("{} interrupted after {} items", name, produced);
            throw e;
        } catch (RuntimeException | Error fault) {
            log.error("{} failed after {} items", name, produced, fault);
            if (!signalled) signalAfterFault(fault);
            throw fault;
        } finally {
            state = State.DONE;
        }
        log.info("{} finished, {} items enqueued", name, produced);
        return produced;
    }

    private void signalAfterFault(Throwable fault) {
        signalled = true;
        state = State.SENDING_SENTINEL;
        try {
            endOfStream.signal();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fault.addSuppressed(e);
        } catch (RuntimeException | Error e) {
            fault.addSuppressed(e);
        }
    }

    public State state() {
        return state;
    }

    public String name() {
        return name;
    }
}
