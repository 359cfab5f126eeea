package io.confluent.lanepool;

/*-
 * Copyright (C) 2020-2025 Confluent, Inc.
 */

import io.confluent.csid.utils.ThreadUtils;
import io.confluent.lanepool.internal.CheckpointDriver;
import io.confluent.lanepool.internal.InternalRuntimeException;
import io.confluent.lanepool.internal.Lane;
import io.confluent.lanepool.metrics.LanePoolMetrics;
import io.confluent.lanepool.state.OffsetLedger;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Tag;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.common.TopicPartition;

import java.io.Closeable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import static io.confluent.lanepool.metrics.LanePoolMetricsDef.*;

/**
 * Fixed pool of ordered lanes, which guarantees processing order within a group.
 * <p>
 * Key properties:
 * <ul>
 * <li>Each group key is always routed to the same lane, by a pure function of the key and the lane count
 * <li>Each lane has exactly one worker thread, and processes in FIFO order
 * <li>No dynamic reassignment of groups to lanes, which could break ordering
 * <li>Offset completion is tracked in the {@link OffsetLedger}, and checkpointed periodically by a background loop,
 * never past work which hasn't finished
 * </ul>
 * Completion is fail-open: a record whose processing throws is still checkpointed past - it is logged, not retried. So
 * a record which persistently fails will not block progress of its partition.
 *
 * @param <T> the decoded payload type
 * @author Antony Stubbs
 * @see LanePoolOptions
 */
@Slf4j
public class LanePool<T> implements Closeable {

    @Getter
    private final LanePoolOptions options;

    @Getter
    private final OffsetLedger ledger = new OffsetLedger();

    private final List<Lane<T>> lanes;

    private final CheckpointDriver checkpointDriver;

    @Getter
    private final LanePoolMetrics metrics;

    private final Counter unassignedCounter;

    private final Counter flushTimeoutCounter;

    private final Counter discardedCounter;

    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public LanePool(ResultProcessor<T> processor, LanePoolOptions options) {
        options.validate();
        this.options = options;
        String identifier = options.getIdentifier();
        this.metrics = new LanePoolMetrics(options.getMeterRegistry(), identifier);

        this.unassignedCounter = metrics.counter(UNASSIGNED_PARTITION);
        this.flushTimeoutCounter = metrics.counter(FLUSH_TIMEOUT);
        this.discardedCounter = metrics.counter(FLUSH_DISCARDED);

        this.checkpointDriver = new CheckpointDriver(ledger,
                options.getCheckpointInterval(),
                identifier,
                metrics.counter(OFFSETS_COMMITTED),
                ThreadUtils.namedThreadFactory(options.getManagedThreadFactory(), "lp-" + identifier + "-checkpoint"));
        checkpointDriver.start();

        var laneThreads = ThreadUtils.namedThreadFactory(options.getManagedThreadFactory(), "lp-" + identifier + "-lane");
        var processingTimer = metrics.timer(PROCESSING_TIME);
        var failedCounter = metrics.counter(PROCESSING_FAILED);
        List<Lane<T>> created = new ArrayList<>(options.getLaneCount());
        for (int i = 0; i < options.getLaneCount(); i++) {
            var lane = new Lane<>(i, identifier, processor, ledger, processingTimer, failedCounter, laneThreads);
            metrics.gauge(QUEUE_DEPTH, lane, Lane::depth, Tag.of(LANE_TAG, String.valueOf(i)));
            lane.start();
            created.add(lane);
        }
        this.lanes = Collections.unmodifiableList(created);
        metrics.gauge(QUEUE_TOTAL, this, pool -> pool.getStats().getTotalItems());

        log.info("Started lane pool {} with {} lanes, checkpointing every {}", identifier, lanes.size(), options.getCheckpointInterval());
    }

    public LanePool(ResultProcessor<T> processor, String identifier) {
        this(processor, LanePoolOptions.builder().identifier(identifier).build());
    }

    public String getIdentifier() {
        return options.getIdentifier();
    }

    public int getLaneCount() {
        return lanes.size();
    }

    /**
     * @return the lane this group key is always routed to
     */
    public int getLaneForGroup(String groupKey) {
        int index = options.getLaneSelector().laneFor(groupKey, lanes.size());
        if (index < 0 || index >= lanes.size()) {
            throw InternalRuntimeException.msg("Lane selector returned lane {} for key {}, outside of [0, {})", index, groupKey, lanes.size());
        }
        return index;
    }

    /**
     * Admit the item's offset, and queue the item on its group's lane.
     * <p>
     * If the item's partition isn't assigned (the assignment changed concurrently), the item is dropped - nothing has
     * been promised for it yet.
     *
     * @throws io.confluent.lanepool.internal.LaneClosedException if the pool has been shut down
     */
    public void submit(String groupKey, WorkItem<T> item) {
        try {
            ledger.addOffset(item.getPartition(), item.getOffset());
        } catch (UnassignedPartitionException e) {
            unassignedCounter.increment();
            log.warn("Received message for unassigned partition, skipping. Partition: {}, offset: {}, pool: {}",
                    item.getPartition(), item.getOffset(), getIdentifier(), e);
            return;
        }

        lanes.get(getLaneForGroup(groupKey)).enqueue(item);
    }

    public LanePoolStats getStats() {
        return LanePoolStats.of(lanes.stream()
                .map(Lane::depth)
                .collect(Collectors.toList()));
    }

    /**
     * Wait until all lane queues are empty. Note that the last item taken from each lane may still be processing.
     *
     * @return true if the lanes emptied, false on timeout
     */
    public boolean waitUntilEmpty(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        long pollMs = options.getEmptyPollInterval().toMillis();
        while (true) {
            if (getStats().isEmpty()) {
                return true;
            }
            if (System.nanoTime() - deadline >= 0) {
                return false;
            }
            try {
                Thread.sleep(pollMs);
            } catch (InterruptedException e) {
                log.debug("Interrupted waiting for lanes to empty", e);
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }

    /**
     * Best efforts drain of the lanes.
     * <p>
     * If the lanes don't empty within the timeout, everything still queued is discarded, without being processed. In
     * all cases, all offset tracking is then cleared - so discarded offsets are never checkpointed under the current
     * assignment. A new assignment must be registered before submitting more work.
     *
     * @param timeout how long to wait for the lanes to empty - null means don't wait at all
     * @return true if the lanes emptied within the timeout
     */
    public boolean flush(Duration timeout) {
        boolean success = timeout != null && waitUntilEmpty(timeout);
        if (!success) {
            flushTimeoutCounter.increment();
            int cleared = 0;
            for (var lane : lanes) {
                try {
                    cleared += lane.getQueue().drain().size();
                } catch (RuntimeException e) {
                    log.error("Error clearing lane {}", lane.getIndex(), e);
                }
            }
            if (cleared > 0) {
                discardedCounter.increment(cleared);
                log.warn("Lanes didn't empty within {}, discarded {} queued records from pool {}", timeout == null ? Duration.ZERO : timeout, cleared, getIdentifier());
            }
        }

        ledger.clear();
        return success;
    }

    /**
     * Replace the partition assignment, resetting all offset tracking, and swap the commit function.
     * <p>
     * A commit already in flight may still complete with the previous function, and its result is not recorded against
     * the new assignment.
     */
    public void updateAssignments(Collection<TopicPartition> partitions, OffsetCommitFunction commitFunction) {
        ledger.updateAssignments(partitions);
        checkpointDriver.setCommitFunction(commitFunction);

        log.info("Updated partition assignments for pool {}: {} partition(s)", getIdentifier(), partitions.size());
    }

    /**
     * Stop all workers after their current item, close the lanes, and stop checkpointing. Waits for each thread up to
     * the configured shutdown timeout. Idempotent.
     */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            log.debug("Already shut down");
            return;
        }
        log.debug("Shutting down lane pool {}", getIdentifier());

        for (var lane : lanes) {
            try {
                lane.requestStop();
            } catch (RuntimeException e) {
                log.error("Error shutting down lane {}", lane.getIndex(), e);
            }
        }

        Duration timeout = options.getShutdownTimeout();
        boolean interrupted = false;
        for (var lane : lanes) {
            try {
                if (!lane.join(timeout)) {
                    log.warn("Lane {} worker didn't finish within {}", lane.getIndex(), timeout);
                }
            } catch (InterruptedException e) {
                log.warn("Interrupted waiting for lane {} worker of pool {}", lane.getIndex(), getIdentifier(), e);
                interrupted = true;
            }
        }

        try {
            if (!checkpointDriver.stop(timeout)) {
                log.warn("Checkpoint loop didn't finish within {}", timeout);
            }
        } catch (InterruptedException e) {
            log.warn("Interrupted waiting for checkpoint loop of pool {}", getIdentifier(), e);
            interrupted = true;
        }

        metrics.close();
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        log.info("Lane pool {} shut down", getIdentifier());
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    @Override
    public void close() {
        shutdown();
    }

}
