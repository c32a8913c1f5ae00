package com.ordoAetheris.handoff.container;

/**
 * Append-only destination for consumers. Must tolerate concurrent calls when shared.
 */
@FunctionalInterface
public interface Sink<T> {

    void store(T item);
}
