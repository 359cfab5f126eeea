package io.confluent.lanepool.internal;

/*-
 * Copyright (C) 2020-2025 Confluent, Inc.
 */

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Unbounded FIFO queue with a single consumer, which can be closed.
 * <p>
 * Once closed, {@link #put} fails with {@link LaneClosedException} instead of queueing, and {@link #take} hands out
 * whatever is still queued before reporting the close - so no thread is left blocked forever on a dead lane.
 * <p>
 * Capacity is unbounded - back pressure is applied upstream, based on queue depth.
 *
 * @param <E> element type
 */
@Slf4j
public class LaneQueue<E> {

    private final ReentrantLock lock = new ReentrantLock();

    private final Condition notEmptyOrClosed = lock.newCondition();

    private final Deque<E> items = new ArrayDeque<>();

    private boolean closed = false;

    /**
     * @throws LaneClosedException if the queue has been closed
     */
    public void put(E item) {
        lock.lock();
        try {
            if (closed) {
                throw new LaneClosedException("Lane is closed, can't accept more work");
            }
            items.addLast(item);
            notEmptyOrClosed.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until there's an item, or the queue is closed and drained.
     *
     * @return the next item in FIFO order, or empty once the queue is closed and has nothing left
     */
    public Optional<E> take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (items.isEmpty() && !closed) {
                notEmptyOrClosed.await();
            }
            return Optional.ofNullable(items.pollFirst());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes everything queued, without blocking.
     *
     * @return the removed items, in queue order
     */
    public List<E> drain() {
        lock.lock();
        try {
            var drained = new ArrayList<>(items);
            items.clear();
            return drained;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Rejects further puts and wakes the consumer. Idempotent.
     */
    public void close() {
        lock.lock();
        try {
            closed = true;
            notEmptyOrClosed.signalAll();
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

    public int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }

}
