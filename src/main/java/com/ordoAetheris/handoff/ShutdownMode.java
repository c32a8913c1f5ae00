package com.ordoAetheris.handoff;

/**
 * How consumers learn that the stream has ended.
 */
public enum ShutdownMode {

    /**
     * Every producer enqueues its own stop sentinel and every consumer retires on the first
     * one it reads. Only valid when producers == consumers.
     */
    SYMMETRIC,

    /**
     * Producers count down a shared latch; the last one closes the buffer and every consumer
     * sees end of stream once the queue is drained. Works for any producer/consumer counts.
     */
    BROADCAST
}
