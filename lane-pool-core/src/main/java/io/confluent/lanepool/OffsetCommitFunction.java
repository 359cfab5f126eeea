package io.confluent.lanepool;

/*-
 * Copyright (C) 2020-2025 Confluent, Inc.
 */

import org.apache.kafka.common.TopicPartition;

import java.util.Map;

/**
 * Acknowledges progress with the upstream source.
 * <p>
 * Must be idempotent - it may be called again with the same offsets, for example by an in flight checkpoint using a
 * function which has since been replaced by a rebalance.
 */
@FunctionalInterface
public interface OffsetCommitFunction {

    /**
     * @param offsets per partition, the highest offset whose processing has completed, along with all before it.
     *                Strictly increasing per partition across calls.
     */
    void commit(Map<TopicPartition, Long> offsets);

}
