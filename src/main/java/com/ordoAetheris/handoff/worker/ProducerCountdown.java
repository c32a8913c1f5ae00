package com.ordoAetheris.handoff.worker;

import com.ordoAetheris.handoff.buffer.SharedBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared by all producers of one buffer. The last producer to arrive closes the buffer,
 * and every consumer then reads the stop sentinel once the queue is drained,
 * whatever the consumer count.
 */
public class ProducerCountdown<T> implements EndOfStream {

    private static final Logger log = LoggerFactory.getLogger(ProducerCountdown.class);

    private final SharedBuffer<T> buffer;
    private final AtomicInteger remaining;

    public ProducerCountdown(SharedBuffer<T> buffer, int producers) {
        if (buffer == null) throw new IllegalArgumentException("buffer must not be null");
        if (producers <= 0) throw new IllegalArgumentException("producers must be > 0, got " + producers);
        this.buffer = buffer;
        this.remaining = new AtomicInteger(producers);
    }

    @Override
    public void signal() {
        int left = remaining.decrementAndGet();
        if (left < 0) throw new IllegalStateException("more end-of-stream signals than registered producers");
        if (left == 0) {
            log.debug("All producers finished, closing buffer");
            buffer.close();
        } else {
            log.debug("Producer finished, {} still running", left);
        }
    }

    public int remaining() {
        return Math.max(remaining.get(), 0);
    }
}
