package com.ordoAetheris.handoff.worker;

import com.ordoAetheris.handoff.buffer.Item;
import com.ordoAetheris.handoff.buffer.SharedBuffer;
import com.ordoAetheris.handoff.container.Sink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Takes items from the {@link SharedBuffer} and stores them in a {@link Sink}
 * until it reads the stop sentinel, which is never forwarded.
 * Returns the number of items stored.
 */
public class Consumer<T> implements Callable<Integer> {

    public enum State { RUNNING, DONE }

    private static final Logger log = LoggerFactory.getLogger(Consumer.class);

    private final String name;
    private final SharedBuffer<T> buffer;
    private final Sink<T> sink;
    private final Duration pacing;

    private volatile State state = State.RUNNING;

    public Consumer(String name, SharedBuffer<T> buffer, Sink<T> sink, Duration pacing) {
        if (buffer == null) throw new IllegalArgumentException("buffer must not be null");
        if (sink == null) throw new IllegalArgumentException("sink must not be null");
        this.name = name;
        this.buffer = buffer;
        this.sink = sink;
        this.pacing = Pacing.check(pacing);
    }

    public Consumer(SharedBuffer<T> buffer, Sink<T> sink) {
        this("consumer", buffer, sink, Duration.ZERO);
    }

    @Override
    public Integer call() throws InterruptedException {
        log.info("{} started", name);
        int consumed = 0;
        try {
            while (true) {
                Item<T> item = buffer.get();
                if (item.isStop()) {
                    log.debug("{} received stop signal", name);
                    break;
                }
                sink.store(item.value());
                consumed++;
                if (log.isDebugEnabled()) log.debug("{} GOT {} -> buffer {}", name, item, buffer.snapshot());
                Pacing.pause(pacing);
            }
        } catch (InterruptedException e) {
            log.warn("{} interrupted after {} items", name, consumed);
            throw e;
        } catch (RuntimeException fault) {
            log.error("{} failed after {} items", name, consumed, fault);
            throw fault;
        } finally {
            state = State.DONE;
        }
        log.info("{} finished, {} items stored", name, consumed);
        return consumed;
    }

    public State state() {
        return state;
    }

    public String name() {
        return name;
    }
}
