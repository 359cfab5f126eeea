package io.confluent.lanepool.state;

/*-
 * Copyright (C) 2020-2025 Confluent, Inc.
 */

import lombok.Getter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.common.TopicPartition;

import java.util.HashSet;
import java.util.NavigableSet;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Offset bookkeeping for a single assigned partition.
 * <p>
 * Every method takes this partition's own lock, so partitions never contend with each other. The lock is only ever
 * held for a map mutation or a scan over this partition's own tracked offsets.
 * <p>
 * <h2>How does this handle gaps in the offsets in the source partitions?:</h2>
 * <p>
 * Only offsets we've actually been given are tracked - we make no assumptions about which offsets exist. A gap between
 * admitted offsets stops the committable run there. A gap below the lowest admitted offset is skipped: offsets are
 * admitted in increasing order, so a missing offset below it (a transaction marker, or a compacted record) will never
 * arrive.
 *
 * @see OffsetLedger
 */
@Slf4j
@ToString(onlyExplicitlyIncluded = true)
class PartitionOffsets {

    /**
     * Symbolic value for no checkpoint yet. Kafka offsets are never negative, so this is fine.
     */
    static final long NO_CHECKPOINT = -1L;

    @Getter
    @ToString.Include
    private final TopicPartition tp;

    private final ReentrantLock lock = new ReentrantLock();

    /**
     * Offsets admitted and not yet checkpointed. Sorted so the committable scan walks upwards from the checkpoint.
     */
    private final NavigableSet<Long> admitted = new TreeSet<>();

    /**
     * Subset of {@link #admitted} still being worked on.
     */
    private final Set<Long> outstanding = new HashSet<>();

    /**
     * Highest offset ever handed to the commit function. Never decreases.
     */
    private long lastCheckpoint = NO_CHECKPOINT;

    PartitionOffsets(TopicPartition tp) {
        this.tp = tp;
    }

    void add(long offset) {
        lock.lock();
        try {
            admitted.add(offset);
            outstanding.add(offset);
        } finally {
            lock.unlock();
        }
    }

    void complete(long offset) {
        lock.lock();
        try {
            outstanding.remove(offset);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Walks the admitted offsets upwards, for as long as they are contiguous and completed.
     * <p>
     * The run starts at the lowest admitted offset above the last checkpoint, i.e.
     * {@code max(lastCheckpoint + 1, lowestAdmitted)}.
     *
     * @return the highest offset of the completed run, if it's beyond the last checkpoint
     */
    OptionalLong highestCommittable() {
        lock.lock();
        try {
            if (admitted.isEmpty()) {
                return OptionalLong.empty();
            }

            long expected = Math.max(lastCheckpoint + 1, admitted.first());

            long highest = lastCheckpoint;
            for (Long offset : admitted.tailSet(expected, true)) {
                if (offset != expected || outstanding.contains(offset)) {
                    break;
                }
                highest = offset;
                expected++;
            }

            return highest > lastCheckpoint
                    ? OptionalLong.of(highest)
                    : OptionalLong.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records the checkpoint, and truncates the tracked offsets below it, as we don't need to track them anymore.
     */
    void markCommitted(long offset) {
        lock.lock();
        try {
            if (offset < lastCheckpoint) {
                log.warn("Ignoring checkpoint {} for {} which is below the last checkpoint {}", offset, tp, lastCheckpoint);
                return;
            }
            lastCheckpoint = offset;
            var truncated = admitted.headSet(offset, true);
            outstanding.removeAll(truncated);
            truncated.clear();
        } finally {
            lock.unlock();
        }
    }

    OptionalLong getLastCheckpoint() {
        lock.lock();
        try {
            return lastCheckpoint == NO_CHECKPOINT
                    ? OptionalLong.empty()
                    : OptionalLong.of(lastCheckpoint);
        } finally {
            lock.unlock();
        }
    }

    int getAdmittedCount() {
        lock.lock();
        try {
            return admitted.size();
        } finally {
            lock.unlock();
        }
    }

    int getOutstandingCount() {
        lock.lock();
        try {
            return outstanding.size();
        } finally {
            lock.unlock();
        }
    }

}
