package io.confluent.lanepool;

/*-
 * Copyright (C) 2020-2025 Confluent, Inc.
 */

import lombok.NonNull;
import lombok.Value;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.TopicPartition;

/**
 * A decoded record queued on a lane, along with where it came from for offset tracking.
 *
 * @param <T> the decoded payload type
 */
@Value
public class WorkItem<T> {

    @NonNull
    TopicPartition partition;

    long offset;

    @NonNull
    T payload;

    /**
     * The original record, kept for diagnostics only. Nullable.
     */
    ConsumerRecord<?, ?> source;

    public static <T> WorkItem<T> of(ConsumerRecord<?, ?> rec, T payload) {
        return new WorkItem<>(new TopicPartition(rec.topic(), rec.partition()), rec.offset(), payload, rec);
    }

}
