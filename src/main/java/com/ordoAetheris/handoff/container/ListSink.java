package com.ordoAetheris.handoff.container;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only list sink. Each writer's items keep their insertion order.
 */
public class ListSink<T> implements Sink<T> {

    private final List<T> items = new ArrayList<>();
    private final ReentrantLock lock = new ReentrantLock();

    @Override
    public void store(T item) {
        if (item == null) throw new IllegalArgumentException("item must not be null");
        lock.lock();
        try {
            items.add(item);
        } finally {
            lock.unlock();
        }
    }

    /** Immutable copy of everything stored so far. */
    public List<T> items() {
        lock.lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(items));
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }
}
