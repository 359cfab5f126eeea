package io.confluent.lanepool;

/*-
 * Copyright (C) 2020-2025 Confluent, Inc.
 */

import org.apache.kafka.clients.consumer.ConsumerRecord;

import java.time.Duration;

/**
 * The contract a stream consumer loop drives - records are submitted one at a time, with periodic polls, and a close
 * sequence on shutdown or rebalance.
 *
 * @param <K> record key type
 * @param <V> record value type
 */
public interface RecordProcessingStrategy<K, V> {

    /**
     * Accept a record for processing. Must not block beyond queueing.
     *
     * @throws MessageRejectedException if the record can't be accepted right now - back off and submit it again
     */
    void submit(ConsumerRecord<K, V> rec);

    /**
     * Periodic housekeeping hook, called from the consumer loop.
     */
    void poll();

    /**
     * Stop accepting new records.
     */
    void close();

    /**
     * Stop accepting new records, and abandon any queued ones immediately.
     */
    void terminate();

    /**
     * Wait for queued records to finish processing, for up to the timeout, then abandon what's left.
     *
     * @param timeout null means don't wait
     */
    void join(Duration timeout);

}
