package io.confluent.lanepool;

/*-
 * Copyright (C) 2020-2025 Confluent, Inc.
 */

import org.apache.kafka.clients.consumer.ConsumerRecord;

import java.util.Optional;

/**
 * Turns a raw record into a payload to process.
 * <p>
 * Must not have side effects on the lane pool. An empty result means skip the record - it still counts towards offset
 * progress.
 *
 * @param <K> record key type
 * @param <V> record value type
 * @param <T> decoded payload type
 */
@FunctionalInterface
public interface RecordDecoder<K, V, T> {

    Optional<T> decode(ConsumerRecord<K, V> rec);

}
