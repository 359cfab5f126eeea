package io.confluent.lanepool.internal;

/*-
 * Copyright (C) 2020-2025 Confluent, Inc.
 */

import io.confluent.lanepool.OffsetCommitFunction;
import io.confluent.lanepool.state.CommittableOffsets;
import io.confluent.lanepool.state.OffsetLedger;
import io.micrometer.core.instrument.Counter;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicReference;

import static io.confluent.lanepool.internal.Lane.MDC_LANE_POOL_ID;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * Background loop which periodically hands the offsets that are safe to commit to the registered
 * {@link OffsetCommitFunction}, independently of the processing lanes.
 * <p>
 * A failure in one cycle is logged, and the next cycle carries on as normal. There is no final commit when stopped -
 * the last commit is at most one interval old.
 *
 * @author Antony Stubbs
 */
@Slf4j
public class CheckpointDriver implements Runnable {

    private final OffsetLedger ledger;

    private final Duration interval;

    private final String identifier;

    private final Counter committedCounter;

    private final AtomicReference<OffsetCommitFunction> commitFunction = new AtomicReference<>();

    private final CountDownLatch stopSignal = new CountDownLatch(1);

    private final Thread thread;

    public CheckpointDriver(OffsetLedger ledger, Duration interval, String identifier, Counter committedCounter, ThreadFactory threadFactory) {
        this.ledger = ledger;
        this.interval = interval;
        this.identifier = identifier;
        this.committedCounter = committedCounter;
        this.thread = threadFactory.newThread(this);
    }

    public void start() {
        thread.start();
    }

    /**
     * Swap the function used for subsequent commits. A commit already in progress finishes with the previous one.
     */
    public void setCommitFunction(OffsetCommitFunction function) {
        commitFunction.set(function);
    }

    public Optional<OffsetCommitFunction> getCommitFunction() {
        return Optional.ofNullable(commitFunction.get());
    }

    @Override
    public void run() {
        MDC.put(MDC_LANE_POOL_ID, identifier);
        log.trace("Checkpoint loop start, interval {}", interval);
        try {
            while (!awaitStop()) {
                try {
                    checkpoint();
                } catch (Exception e) {
                    log.error("Error in commit loop", e);
                }
            }
        } catch (InterruptedException e) {
            log.debug("Checkpoint loop interrupted", e);
            Thread.currentThread().interrupt();
        } finally {
            MDC.remove(MDC_LANE_POOL_ID);
            log.debug("Checkpoint loop finished");
        }
    }

    /**
     * @return true if stop was signalled during the wait
     */
    private boolean awaitStop() throws InterruptedException {
        return stopSignal.await(interval.toMillis(), MILLISECONDS);
    }

    /**
     * Runs a single checkpoint cycle.
     *
     * @return true if offsets were handed to the commit function
     */
    boolean checkpoint() {
        var function = commitFunction.get();
        if (function == null) {
            log.trace("No commit function registered yet");
            return false;
        }

        CommittableOffsets committable = ledger.snapshotCommittable();
        if (committable.isEmpty()) {
            log.trace("No offsets ready");
            return false;
        }

        log.debug("Will commit offsets for {} partition(s): {}", committable.getOffsets().size(), committable.getOffsets());
        function.commit(committable.getOffsets());
        committedCounter.increment(committable.getOffsets().size());

        boolean recorded = ledger.markCommitted(committable);
        if (!recorded) {
            log.debug("Commit succeeded, but assignment changed in the meantime - not recording against the new assignment");
        }
        return true;
    }

    /**
     * Signal the loop to stop, and wait for it to finish.
     *
     * @return true if the loop finished within the timeout
     */
    public boolean stop(Duration timeout) throws InterruptedException {
        stopSignal.countDown();
        // join(0) would wait forever
        thread.join(Math.max(1, timeout.toMillis()));
        return !thread.isAlive();
    }

    public boolean isRunning() {
        return thread.isAlive();
    }

}
