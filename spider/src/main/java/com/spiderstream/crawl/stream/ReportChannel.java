package com.spiderstream.crawl.stream;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded queue with an end-of-stream marker. Any number of producers may {@link #send} concurrently; one
 * consumer reads until {@link #take} returns {@code null}.
 */
public class ReportChannel<T> {
    private final int capacity;
    private final Deque<T> buffer = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();
    private boolean closed;

    public ReportChannel(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Blocks while the channel is full.
     *
     * @return false when the channel was closed and the item dropped
     */
    public boolean send(T item) throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (buffer.size() >= capacity && !closed) {
                notFull.await();
            }
            if (closed) {
                return false;
            }
            buffer.addLast(item);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Next item, waiting as long as needed; {@code null} once the channel is closed and empty.
     */
    public T take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (buffer.isEmpty() && !closed) {
                notEmpty.await();
            }
            return next();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Next item, or {@code null} when none arrived within {@code timeout} or the channel is drained.
     */
    public T poll(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (buffer.isEmpty() && !closed) {
                if (remaining <= 0) {
                    return null;
                }
                remaining = notEmpty.awaitNanos(remaining);
            }
            return next();
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

    /**
     * Closed and nothing left to read.
     */
    public boolean isDrained() {
        lock.lock();
        try {
            return closed && buffer.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    private T next() {
        T item = buffer.pollFirst();
        if (item != null) {
            notFull.signal();
        }
        return item;
    }
}
