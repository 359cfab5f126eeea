package io.confluent.lanepool.state;

/*-
 * Copyright (C) 2020-2025 Confluent, Inc.
 */

import io.confluent.lanepool.UnassignedPartitionException;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.common.TopicPartition;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import static io.confluent.csid.utils.StringUtils.msg;

/**
 * Tracks which offsets have been admitted and which are still outstanding, and from that, which offsets are safe to
 * checkpoint - even though work completes out of order across lanes.
 * <p>
 * State is held in a {@link PartitionRegistry} which is replaced wholesale on every assignment change, so operations
 * racing with a rebalance act on the generation they started with. Each partition has its own lock, so operations on
 * different partitions never block each other.
 *
 * @author Antony Stubbs
 */
@Slf4j
public class OffsetLedger {

    private volatile PartitionRegistry registry = PartitionRegistry.EMPTY;

    private final AtomicLong epochs = new AtomicLong();

    /**
     * Record that an offset has been admitted for processing.
     *
     * @throws UnassignedPartitionException if the partition isn't in the current assignment - callers must skip the
     *                                      record
     */
    public void addOffset(TopicPartition tp, long offset) {
        var partition = registry.get(tp)
                .orElseThrow(() -> new UnassignedPartitionException(msg("Partition {} is not assigned to this consumer", tp)));
        partition.add(offset);
    }

    /**
     * Mark an offset as completed, whether processing succeeded or not.
     * <p>
     * No-op if the partition is no longer assigned - the work was queued under a previous assignment, and its
     * completion is no longer relevant.
     */
    public void completeOffset(TopicPartition tp, long offset) {
        registry.get(tp).ifPresentOrElse(
                partition -> partition.complete(offset),
                () -> log.trace("Ignoring completion of {} for no longer assigned partition {}", offset, tp));
    }

    /**
     * @return per partition, the highest offset which is safe to checkpoint, only for partitions which have progressed
     *         since their last checkpoint
     * @see #snapshotCommittable()
     */
    public Map<TopicPartition, Long> getCommittableOffsets() {
        return snapshotCommittable().getOffsets();
    }

    /**
     * Calculates the committable offsets, tagged with the assignment epoch they were calculated from.
     * <p>
     * Each partition is locked and released independently - this is a snapshot per partition, not a global one. A stale
     * partition snapshot can only delay a checkpoint, never produce an unsafe one.
     */
    public CommittableOffsets snapshotCommittable() {
        var current = registry;
        Map<TopicPartition, Long> committable = new HashMap<>();
        for (var partition : current.all()) {
            OptionalLong highest = partition.highestCommittable();
            highest.ifPresent(offset -> committable.put(partition.getTp(), offset));
        }
        return new CommittableOffsets(current.getEpoch(), Collections.unmodifiableMap(committable));
    }

    /**
     * Record a successful checkpoint, and truncate tracked offsets at or below it.
     * <p>
     * The checkpoint never goes backwards - a lower offset is ignored.
     */
    public void markCommitted(TopicPartition tp, long offset) {
        registry.get(tp).ifPresentOrElse(
                partition -> partition.markCommitted(offset),
                () -> log.debug("Ignoring checkpoint {} for no longer assigned partition {}", offset, tp));
    }

    /**
     * Record a checkpoint only if the assignment hasn't changed since it was calculated.
     *
     * @return false if the checkpoint was fenced off by a newer assignment
     */
    public boolean markCommitted(CommittableOffsets committed) {
        var current = registry;
        if (current.getEpoch() != committed.getEpoch()) {
            log.debug("Assignment changed since checkpoint was calculated (epoch {} now {}), not recording {}",
                    committed.getEpoch(), current.getEpoch(), committed.getOffsets());
            return false;
        }
        committed.getOffsets().forEach((tp, offset) ->
                current.get(tp).ifPresent(partition -> partition.markCommitted(offset)));
        return true;
    }

    /**
     * Replace the assignment, discarding all tracking state - including for partitions which remain assigned.
     */
    public void updateAssignments(Collection<TopicPartition> partitions) {
        registry = new PartitionRegistry(epochs.incrementAndGet(), partitions);
        log.debug("New partition assignment epoch {}: {}", registry.getEpoch(), partitions);
    }

    /**
     * Drop all tracked state, and all assignments.
     */
    public void clear() {
        registry = new PartitionRegistry(epochs.incrementAndGet(), Set.of());
    }

    public boolean isAssigned(TopicPartition tp) {
        return registry.contains(tp);
    }

    public Set<TopicPartition> getAssignedPartitions() {
        return registry.getAssigned();
    }

    public long getAssignmentEpoch() {
        return registry.getEpoch();
    }

    public OptionalLong getLastCheckpoint(TopicPartition tp) {
        return registry.get(tp)
                .map(PartitionOffsets::getLastCheckpoint)
                .orElse(OptionalLong.empty());
    }

    public int getOutstandingCount(TopicPartition tp) {
        return registry.get(tp).map(PartitionOffsets::getOutstandingCount).orElse(0);
    }

    public int getAdmittedCount(TopicPartition tp) {
        return registry.get(tp).map(PartitionOffsets::getAdmittedCount).orElse(0);
    }

}
