package com.ordoAetheris.handoff.buffer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 Bounded Buffer: fixed-capacity FIFO hand-off between producers and consumers.

 One lock, two conditions. Storage is a plain ArrayDeque touched only under the lock.

 Methods
 void put(Item<T> item) throws InterruptedException
   item == null -> IllegalArgumentException
   closed -> IllegalStateException
   full and not closed -> waits for space
   after enqueue -> wakes threads waiting in get()

 Item<T> get() throws InterruptedException
   empty and not closed -> waits
   empty and closed -> Item.stop() (every caller, every time)
   otherwise removes the head and wakes threads waiting in put()

 void close()
   idempotent, wakes everyone waiting in put() and get()
   items already queued are still delivered

 Invariants
   no lost items, no duplicates
   0 <= size <= capacity
   stop sentinels travel through the queue like any other item
 */
public class SharedBuffer<T> {

    private final Queue<Item<T>> queue;
    private final int capacity;
    private boolean closed = false;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();

    public SharedBuffer(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0, got " + capacity);
        this.queue = new ArrayDeque<>(capacity);
        this.capacity = capacity;
    }

    public void put(Item<T> item) throws InterruptedException {
        if (item == null) throw new IllegalArgumentException("item must not be null");
        lock.lockInterruptibly();
        try {
            while (!closed && queue.size() >= capacity) notFull.await();
            if (closed) throw new IllegalStateException("buffer is closed");
            queue.offer(item);
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    public Item<T> get() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (!closed && queue.isEmpty()) notEmpty.await();
            if (queue.isEmpty()) return Item.stop();
            Item<T> head = queue.poll();
            notFull.signal();
            return head;
        } finally {
            lock.unlock();
        }
    }

    public void close() {
        lock.lock();
        try {
            closed = true;
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /** Diagnostics only: the value may be stale by the time the caller looks at it. */
    public int size() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    /** Copy of the queued items, head first. Diagnostics only. */
    public List<Item<T>> snapshot() {
        lock.lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(queue));
        } finally {
            lock.unlock();
        }
    }
}
