package com.ordoAetheris.handoff.worker;

/**
 * What a producer does, exactly once, when it stops feeding the buffer
 * (its source ran dry or it failed).
 */
@FunctionalInterface
public interface EndOfStream {

    void signal() throws InterruptedException;
}
