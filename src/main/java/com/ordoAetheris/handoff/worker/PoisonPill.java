package com.ordoAetheris.handoff.worker;

import com.ordoAetheris.handoff.buffer.Item;
import com.ordoAetheris.handoff.buffer.SharedBuffer;

/**
 * Enqueues one stop sentinel per signal. Each sentinel retires exactly one consumer,
 * so producers and consumers must be paired one to one.
 */
public class PoisonPill<T> implements EndOfStream {

    private final SharedBuffer<T> buffer;

    public PoisonPill(SharedBuffer<T> buffer) {
        if (buffer == null) throw new IllegalArgumentException("buffer must not be null");
        this.buffer = buffer;
    }

    @Override
    public void signal() throws InterruptedException {
        buffer.put(Item.stop());
    }
}
