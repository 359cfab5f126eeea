package io.confluent.lanepool;

/*-
 * Copyright (C) 2020-2025 Confluent, Inc.
 */

import io.confluent.lanepool.state.OffsetLedger;
import io.micrometer.core.instrument.Counter;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.TopicPartition;

import java.time.Duration;
import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import static io.confluent.lanepool.metrics.LanePoolMetricsDef.DECODE_FAILED;

/**
 * Processing strategy which decodes records, and distributes them across a {@link LanePool} by group key.
 * <p>
 * Guarantees:
 * <ul>
 * <li>Records of the same group are processed in submission order
 * <li>Offsets are only checkpointed once every record up to them has finished processing
 * <li>Back pressure is signalled with {@link MessageRejectedException} while shutting down
 * </ul>
 * Records which can't be decoded or grouped are logged and counted as complete, so a poison record never blocks
 * checkpoint progress. They are not retried.
 *
 * @param <K> record key type
 * @param <V> record value type
 * @param <T> decoded payload type
 * @author Antony Stubbs
 */
@Slf4j
public class LanePoolStrategy<K, V, T> implements RecordProcessingStrategy<K, V> {

    @Getter
    private final LanePool<T> pool;

    private final RecordDecoder<K, V, T> decoder;

    private final GroupingFunction<T> groupingFunction;

    private final Counter decodeFailedCounter;

    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    /**
     * Registers the initial assignment and commit function with the pool.
     */
    public LanePoolStrategy(LanePool<T> pool,
                            RecordDecoder<K, V, T> decoder,
                            GroupingFunction<T> groupingFunction,
                            OffsetCommitFunction commitFunction,
                            Collection<TopicPartition> partitions) {
        this.pool = pool;
        this.decoder = decoder;
        this.groupingFunction = groupingFunction;
        this.decodeFailedCounter = pool.getMetrics().counter(DECODE_FAILED);
        this.pool.updateAssignments(partitions, commitFunction);
    }

    @Override
    public void submit(ConsumerRecord<K, V> rec) {
        if (shuttingDown.get()) {
            throw new MessageRejectedException("Strategy is shutting down");
        }

        try {
            Optional<T> decoded = decoder.decode(rec);
            if (decoded.isEmpty()) {
                log.trace("Decoder skipped offset {} of {}-{}", rec.offset(), rec.topic(), rec.partition());
                markSkipped(rec);
                return;
            }

            T payload = decoded.get();
            String groupKey = groupingFunction.groupKey(payload);
            pool.submit(groupKey, WorkItem.of(rec, payload));
        } catch (Exception e) {
            decodeFailedCounter.increment();
            log.error("Error submitting message to queue, offset {} of {}-{} will be skipped", rec.offset(), rec.topic(), rec.partition(), e);
            markSkipped(rec);
        }
    }

    /**
     * Count the offset as done, so it still progresses the checkpoint.
     */
    private void markSkipped(ConsumerRecord<K, V> rec) {
        OffsetLedger ledger = pool.getLedger();
        var tp = new TopicPartition(rec.topic(), rec.partition());
        try {
            ledger.addOffset(tp, rec.offset());
            ledger.completeOffset(tp, rec.offset());
        } catch (UnassignedPartitionException e) {
            log.debug("Skipped record's partition {} is no longer assigned", tp, e);
        }
    }

    /**
     * Queue depth is published by the pool's {@code lanepool.queue.total} gauge, this only logs it.
     */
    @Override
    public void poll() {
        if (log.isTraceEnabled()) {
            log.trace("Total queued in pool {}: {}", pool.getIdentifier(), pool.getStats().getTotalItems());
        }
    }

    @Override
    public void close() {
        shuttingDown.set(true);
    }

    @Override
    public void terminate() {
        shuttingDown.set(true);
        pool.flush(Duration.ZERO);
    }

    @Override
    public void join(Duration timeout) {
        pool.flush(timeout == null ? Duration.ZERO : timeout);
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

}
