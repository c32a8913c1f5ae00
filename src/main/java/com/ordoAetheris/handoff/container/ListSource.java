package com.ordoAetheris.handoff.container;

import java.util.ArrayDeque;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Finite FIFO source over a copy of the given items.
 *
 * The cursor is guarded by a private lock, so any number of producers may drain it.
 */
public class ListSource<T> implements Source<T> {

    private final ArrayDeque<T> items;
    private final ReentrantLock lock = new ReentrantLock();

    public ListSource(Iterable<? extends T> items) {
        if (items == null) throw new IllegalArgumentException("source items must not be null");
        this.items = new ArrayDeque<>();
        for (T item : items) {
            if (item == null) throw new IllegalArgumentException("source items must not contain null");
            this.items.addLast(item);
        }
    }

    @Override
    public Optional<T> next() {
        lock.lock();
        try {
            return Optional.ofNullable(items.pollFirst());
        } finally {
            lock.unlock();
        }
    }

    public int remaining() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }
}
