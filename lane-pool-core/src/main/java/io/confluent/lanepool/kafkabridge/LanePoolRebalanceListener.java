package io.confluent.lanepool.kafkabridge;

/*-
 * Copyright (C) 2020-2025 Confluent, Inc.
 */

import io.confluent.lanepool.LanePool;
import io.confluent.lanepool.OffsetCommitFunction;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.TopicPartition;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Keeps a {@link LanePool}'s partition assignment in step with a Kafka consumer group.
 * <p>
 * Any change of assignment resets all of the pool's offset tracking - including for partitions this consumer keeps,
 * which is the norm with incremental (cooperative) rebalancing. So after every reset, each kept partition is rewound to
 * its last committed offset (or its beginning, if it has never been committed). Work for it which was queued, in
 * flight or discarded is then delivered again, and tracked again from the start - processing is at least once.
 * <p>
 * Must be registered on the consumer's own poll thread, as with any {@link ConsumerRebalanceListener}.
 */
@Slf4j
public class LanePoolRebalanceListener implements ConsumerRebalanceListener {

    private final Consumer<?, ?> consumer;

    private final LanePool<?> pool;

    private final OffsetCommitFunction commitFunction;

    /**
     * How long to let queued work finish before revoked partitions are released.
     */
    private final Duration revokeDrainTimeout;

    public LanePoolRebalanceListener(Consumer<?, ?> consumer, LanePool<?> pool, OffsetCommitFunction commitFunction, Duration revokeDrainTimeout) {
        this.consumer = consumer;
        this.pool = pool;
        this.commitFunction = commitFunction;
        this.revokeDrainTimeout = revokeDrainTimeout;
    }

    /**
     * With eager rebalancing, {@code partitions} is the whole assignment, so nothing is kept.
     */
    @Override
    public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
        log.info("Assigned {} new partition(s) {}", partitions.size(), partitions);
        Set<TopicPartition> assignment = new HashSet<>(consumer.assignment());
        pool.updateAssignments(assignment, commitFunction);

        assignment.removeAll(partitions);
        rewind(assignment);
    }

    @Override
    public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
        if (partitions.isEmpty()) {
            log.debug("Nothing revoked");
            return;
        }
        log.info("Partitions revoked: {}", partitions);
        pool.flush(revokeDrainTimeout);
        reassignWithout(partitions);
    }

    /**
     * Lost partitions can't be committed to, so there's no point waiting for their work to finish.
     */
    @Override
    public void onPartitionsLost(Collection<TopicPartition> partitions) {
        log.warn("Partitions lost: {}", partitions);
        pool.flush(null);
        reassignWithout(partitions);
    }

    private void reassignWithout(Collection<TopicPartition> removed) {
        Set<TopicPartition> kept = new HashSet<>(consumer.assignment());
        kept.removeAll(removed);
        pool.updateAssignments(kept, commitFunction);
        rewind(kept);
    }

    /**
     * Seek kept partitions back to their committed position, as their tracking was reset.
     */
    private void rewind(Set<TopicPartition> kept) {
        if (kept.isEmpty()) {
            return;
        }
        Map<TopicPartition, OffsetAndMetadata> committed = consumer.committed(kept);
        List<TopicPartition> neverCommitted = new ArrayList<>();
        for (var tp : kept) {
            OffsetAndMetadata offset = committed.get(tp);
            if (offset == null) {
                neverCommitted.add(tp);
            } else {
                log.debug("Rewinding kept partition {} to committed offset {}", tp, offset.offset());
                consumer.seek(tp, offset);
            }
        }
        if (!neverCommitted.isEmpty()) {
            log.debug("Rewinding never committed kept partitions {} to the beginning", neverCommitted);
            consumer.seekToBeginning(neverCommitted);
        }
    }

}
