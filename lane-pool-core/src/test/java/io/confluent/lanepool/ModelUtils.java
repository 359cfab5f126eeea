package io.confluent.lanepool;

/*-
 * Copyright (C) 2020-2025 Confluent, Inc.
 */

import lombok.Value;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.TopicPartition;

/**
 * Test model builders.
 */
public class ModelUtils {

    public static final String TOPIC = "input";

    public static TopicPartition tp(int partition) {
        return new TopicPartition(TOPIC, partition);
    }

    public static ConsumerRecord<String, String> record(TopicPartition tp, long offset, String key, String value) {
        return new ConsumerRecord<>(tp.topic(), tp.partition(), offset, key, value);
    }

    public static <T> WorkItem<T> workItem(TopicPartition tp, long offset, T payload) {
        return new WorkItem<>(tp, offset, payload, null);
    }

    /**
     * A decoded payload, remembering where it came from.
     */
    @Value
    public static class Event {
        String group;
        TopicPartition tp;
        long offset;
    }

}
