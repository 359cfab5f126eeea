package io.confluent.lanepool.internal;

/*-
 * Copyright (C) 2020-2025 Confluent, Inc.
 */

import io.confluent.lanepool.ResultProcessor;
import io.confluent.lanepool.WorkItem;
import io.confluent.lanepool.state.OffsetLedger;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.concurrent.ThreadFactory;

import static java.util.concurrent.TimeUnit.NANOSECONDS;

/**
 * One ordered lane - a FIFO queue, serviced by exactly one worker thread.
 * <p>
 * Every dequeued item has its offset completed in the {@link OffsetLedger} once the processing function returns,
 * whether it succeeded or not.
 *
 * @param <T> the decoded payload type
 * @author Antony Stubbs
 */
@Slf4j
public class Lane<T> implements Runnable {

    public static final String MDC_LANE_POOL_ID = "lanepool.id";

    @Getter
    private final int index;

    private final String identifier;

    @Getter
    private final LaneQueue<WorkItem<T>> queue = new LaneQueue<>();

    private final ResultProcessor<T> processor;

    private final OffsetLedger ledger;

    private final Timer processingTimer;

    private final Counter failedCounter;

    private final Thread thread;

    private volatile boolean stopRequested = false;

    public Lane(int index,
                String identifier,
                ResultProcessor<T> processor,
                OffsetLedger ledger,
                Timer processingTimer,
                Counter failedCounter,
                ThreadFactory threadFactory) {
        this.index = index;
        this.identifier = identifier;
        this.processor = processor;
        this.ledger = ledger;
        this.processingTimer = processingTimer;
        this.failedCounter = failedCounter;
        this.thread = threadFactory.newThread(this);
    }

    public void start() {
        thread.start();
    }

    public void enqueue(WorkItem<T> item) {
        queue.put(item);
    }

    @Override
    public void run() {
        MDC.put(MDC_LANE_POOL_ID, identifier);
        log.trace("Lane {} worker start", index);
        try {
            while (!stopRequested) {
                var next = queue.take();
                if (next.isEmpty()) {
                    log.debug("Lane {} closed and drained", index);
                    break;
                }
                process(next.get());
            }
        } catch (InterruptedException e) {
            log.debug("Lane {} worker interrupted", index, e);
            Thread.currentThread().interrupt();
        } finally {
            MDC.remove(MDC_LANE_POOL_ID);
            log.trace("Lane {} worker finished", index);
        }
    }

    private void process(WorkItem<T> item) {
        long start = System.nanoTime();
        try {
            processor.process(identifier, item.getPayload());
        } catch (Exception e) {
            failedCounter.increment();
            log.error("Unexpected error in lane {} worker processing offset {} of {}", index, item.getOffset(), item.getPartition(), e);
        } finally {
            processingTimer.record(System.nanoTime() - start, NANOSECONDS);
            ledger.completeOffset(item.getPartition(), item.getOffset());
        }
    }

    /**
     * Worker stops after its current item, and the queue stops accepting work.
     */
    public void requestStop() {
        stopRequested = true;
        queue.close();
    }

    /**
     * @return true if the worker thread finished within the timeout
     */
    public boolean join(Duration timeout) throws InterruptedException {
        // join(0) would wait forever
        thread.join(Math.max(1, timeout.toMillis()));
        return !thread.isAlive();
    }

    public boolean isAlive() {
        return thread.isAlive();
    }

    public int depth() {
        return queue.size();
    }

}
