package io.confluent.lanepool.state;

/*-
 * Copyright (C) 2020-2025 Confluent, Inc.
 */

import lombok.Value;
import org.apache.kafka.common.TopicPartition;

import java.util.Map;

/**
 * Offsets ready to be checkpointed, along with the assignment epoch they were calculated against.
 *
 * @see OffsetLedger#snapshotCommittable()
 */
@Value
public class CommittableOffsets {

    long epoch;

    /**
     * Highest completed offset of the gap free run, per partition
     */
    Map<TopicPartition, Long> offsets;

    public boolean isEmpty() {
        return offsets.isEmpty();
    }

}
