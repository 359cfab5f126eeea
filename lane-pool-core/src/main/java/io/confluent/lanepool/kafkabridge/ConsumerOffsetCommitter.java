package io.confluent.lanepool.kafkabridge;

/*-
 * Copyright (C) 2020-2025 Confluent, Inc.
 */

import io.confluent.lanepool.OffsetCommitFunction;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.TopicPartition;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Commits checkpoints through a Kafka {@link Consumer}, either synchronously or asynchronously.
 * <p>
 * The lane pool checkpoints the highest <em>processed</em> offset, whereas Kafka expects the offset of the next record
 * to read - so each offset is committed as {@code offset + 1}.
 * <p>
 * The {@link org.apache.kafka.clients.consumer.KafkaConsumer} may only be used from the thread which polls it. The
 * committer belongs to the thread which constructs it, or the last to {@link #claim() claim} it. Commits requested from
 * any other thread (i.e. the checkpoint loop) are parked, and sent the next time the owning thread calls
 * {@link #maybeDoCommit()} - so the poll loop must call it once per poll.
 *
 * @see CommitMode
 */
@Slf4j
public class ConsumerOffsetCommitter<K, V> implements OffsetCommitFunction {

    public enum CommitMode {
        /**
         * Blocks the committing thread until the broker responds, or the commit timeout passes.
         */
        CONSUMER_SYNC,
        /**
         * Fire and forget - failures are logged from the consumer's callback.
         */
        CONSUMER_ASYNCHRONOUS
    }

    private final Consumer<K, V> consumer;

    @Getter
    private final CommitMode commitMode;

    private final Duration commitTimeout;

    /**
     * Parked commits waiting for the owning thread, merged keeping the highest offset per partition.
     */
    private final Map<TopicPartition, Long> pending = new ConcurrentHashMap<>();

    private volatile Thread owningThread;

    public ConsumerOffsetCommitter(Consumer<K, V> consumer, CommitMode commitMode, Duration commitTimeout) {
        this.consumer = consumer;
        this.commitMode = commitMode;
        this.commitTimeout = commitTimeout;
        this.owningThread = Thread.currentThread();
    }

    public ConsumerOffsetCommitter(Consumer<K, V> consumer) {
        this(consumer, CommitMode.CONSUMER_SYNC, Duration.ofSeconds(10));
    }

    /**
     * Make the current thread the only one allowed to use the consumer, if it isn't the constructing thread.
     */
    public void claim() {
        owningThread = Thread.currentThread();
    }

    @Override
    public void commit(Map<TopicPartition, Long> offsets) {
        if (offsets.isEmpty()) {
            log.trace("Nothing to commit");
            return;
        }

        if (isCurrentThreadOwner()) {
            commitOffsets(offsets);
        } else {
            log.debug("Parking commit for owning thread: {}", offsets);
            offsets.forEach((tp, offset) -> pending.merge(tp, offset, Math::max));
        }
    }

    /**
     * Send any commits parked by other threads. Must be called from the owning thread, usually once per poll loop.
     *
     * @return true if a commit was sent
     */
    public boolean maybeDoCommit() {
        if (pending.isEmpty()) {
            return false;
        }
        if (!isCurrentThreadOwner()) {
            log.warn("Parked commits can only be sent by the owning thread {}, not {}", owningThread.getName(), Thread.currentThread().getName());
            return false;
        }
        Map<TopicPartition, Long> toCommit = new HashMap<>();
        for (var tp : pending.keySet()) {
            Long offset = pending.remove(tp);
            if (offset != null) {
                toCommit.put(tp, offset);
            }
        }
        commitOffsets(toCommit);
        return true;
    }

    private void commitOffsets(Map<TopicPartition, Long> offsets) {
        Map<TopicPartition, OffsetAndMetadata> offsetsToSend = toKafkaOffsets(offsets);
        switch (commitMode) {
            case CONSUMER_SYNC -> {
                log.debug("Committing offsets Sync: {}", offsetsToSend);
                consumer.commitSync(offsetsToSend, commitTimeout);
            }
            case CONSUMER_ASYNCHRONOUS -> {
                log.debug("Committing offsets Async: {}", offsetsToSend);
                consumer.commitAsync(offsetsToSend, (committed, exception) -> {
                    if (exception != null) {
                        log.error("Error committing offsets {}", committed, exception);
                    }
                });
            }
        }
    }

    static Map<TopicPartition, OffsetAndMetadata> toKafkaOffsets(Map<TopicPartition, Long> processed) {
        Map<TopicPartition, OffsetAndMetadata> offsets = new HashMap<>();
        processed.forEach((tp, offset) -> offsets.put(tp, new OffsetAndMetadata(offset + 1)));
        return offsets;
    }

    private boolean isCurrentThreadOwner() {
        return Thread.currentThread().equals(owningThread);
    }

}
