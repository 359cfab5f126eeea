package io.confluent.lanepool;

/*-
 * Copyright (C) 2020-2025 Confluent, Inc.
 */

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import pl.tlinkowski.unij.api.UniLists;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static com.google.common.truth.Truth.assertThat;
import static io.confluent.lanepool.ModelUtils.record;
import static io.confluent.lanepool.ModelUtils.tp;
import static java.time.Duration.ofMillis;
import static java.time.Duration.ofSeconds;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * @see LanePoolStrategy
 */
class LanePoolStrategyTest {

    static final String SKIP = "skip";

    static final String POISON = "poison";

    static final String UNGROUPABLE = "ungroupable";

    final TopicPartition tp0 = tp(0);

    final TopicPartition tp1 = tp(1);

    final SimpleMeterRegistry registry = new SimpleMeterRegistry();

    final ConcurrentLinkedQueue<String> processed = new ConcurrentLinkedQueue<>();

    final AtomicReference<Map<TopicPartition, Long>> lastCommit = new AtomicReference<>(Map.of());

    /**
     * Blocks processing of every record until released
     */
    CountDownLatch gate = new CountDownLatch(0);

    LanePool<String> pool;

    LanePoolStrategy<String, String, String> strategy;

    /**
     * Values are "group:n". {@link #SKIP} decodes to nothing, {@link #POISON} fails decoding.
     */
    static Optional<String> decode(ConsumerRecord<String, String> rec) {
        if (rec.value().equals(POISON)) {
            throw new IllegalArgumentException("Can't decode " + rec.value());
        }
        return rec.value().equals(SKIP) ? Optional.empty() : Optional.of(rec.value());
    }

    static String group(String payload) {
        if (payload.equals(UNGROUPABLE)) {
            throw new IllegalStateException("No group for " + payload);
        }
        return payload.substring(0, payload.indexOf(':'));
    }

    void setup() {
        var options = LanePoolOptions.builder()
                .identifier("strategy-test")
                .laneCount(4)
                .checkpointInterval(ofMillis(20))
                .shutdownTimeout(ofMillis(500))
                .meterRegistry(registry)
                .build();
        pool = new LanePool<>((identifier, payload) -> {
            gate.await(10, TimeUnit.SECONDS);
            processed.add(payload);
        }, options);
        strategy = new LanePoolStrategy<>(pool,
                LanePoolStrategyTest::decode,
                LanePoolStrategyTest::group,
                offsets -> lastCommit.set(Map.copyOf(offsets)),
                UniLists.of(tp0));
    }

    @AfterEach
    void close() {
        gate.countDown();
        if (pool != null) {
            pool.shutdown();
        }
    }

    @Test
    void constructionRegistersTheAssignment() {
        setup();

        assertThat(pool.getLedger().getAssignedPartitions()).containsExactly(tp0);
        assertThat(strategy.isShuttingDown()).isFalse();
    }

    @Test
    void decodedRecordsAreProcessedInGroupOrder() {
        setup();

        strategy.submit(record(tp0, 0, "k", "a:1"));
        strategy.submit(record(tp0, 1, "k", "b:1"));
        strategy.submit(record(tp0, 2, "k", "a:2"));
        strategy.submit(record(tp0, 3, "k", "a:3"));

        await().untilAsserted(() -> assertThat(processed).hasSize(4));
        assertThat(processed.stream().filter(p -> p.startsWith("a:"))).containsExactly("a:1", "a:2", "a:3").inOrder();
        await().untilAsserted(() -> assertThat(lastCommit.get()).containsExactly(tp0, 3L));
    }

    @Test
    void skippedRecordsAreCompletedWithoutProcessing() {
        setup();

        strategy.submit(record(tp0, 0, "k", "a:1"));
        strategy.submit(record(tp0, 1, "k", SKIP));
        strategy.submit(record(tp0, 2, "k", SKIP));

        await().untilAsserted(() -> assertThat(lastCommit.get()).containsExactly(tp0, 2L));
        assertThat(processed).containsExactly("a:1");
        assertThat(registry.get("lanepool.decode.failed").counter().count()).isEqualTo(0.0);
    }

    @Test
    void poisonRecordDoesNotBlockCheckpointing() {
        setup();

        strategy.submit(record(tp0, 0, "k", "a:1"));
        assertThatCode(() -> strategy.submit(record(tp0, 1, "k", POISON))).doesNotThrowAnyException();
        strategy.submit(record(tp0, 2, "k", "a:2"));

        await().untilAsserted(() -> assertThat(lastCommit.get()).containsExactly(tp0, 2L));
        assertThat(processed).containsExactly("a:1", "a:2").inOrder();
        assertThat(registry.get("lanepool.decode.failed").counter().count()).isEqualTo(1.0);
    }

    @Test
    void groupingFailureIsSkipped() {
        setup();

        assertThatCode(() -> strategy.submit(record(tp0, 0, "k", UNGROUPABLE))).doesNotThrowAnyException();

        await().untilAsserted(() -> assertThat(lastCommit.get()).containsExactly(tp0, 0L));
        assertThat(processed).isEmpty();
        assertThat(registry.get("lanepool.decode.failed").counter().count()).isEqualTo(1.0);
    }

    @Test
    void skipOfUnassignedPartitionIsIgnored() {
        setup();

        assertThatCode(() -> strategy.submit(record(tp1, 0, "k", SKIP))).doesNotThrowAnyException();
        assertThatCode(() -> strategy.submit(record(tp1, 1, "k", POISON))).doesNotThrowAnyException();

        assertThat(pool.getLedger().isAssigned(tp1)).isFalse();
    }

    @Test
    void closedStrategyRejectsRecords() {
        setup();
        strategy.close();

        assertThat(strategy.isShuttingDown()).isTrue();
        assertThatThrownBy(() -> strategy.submit(record(tp0, 0, "k", "a:1")))
                .isInstanceOf(MessageRejectedException.class)
                .isInstanceOf(LanePoolException.class);
        assertThat(pool.getLedger().getAdmittedCount(tp0)).isEqualTo(0);
    }

    @Test
    void submitToShutDownPoolIsSkipped() {
        setup();
        pool.shutdown();

        assertThatCode(() -> strategy.submit(record(tp0, 0, "k", "a:1"))).doesNotThrowAnyException();

        assertThat(pool.getLedger().getAdmittedCount(tp0)).isEqualTo(1);
        assertThat(pool.getLedger().getOutstandingCount(tp0)).isEqualTo(0);
    }

    @Test
    void terminateDiscardsQueuedWork() {
        gate = new CountDownLatch(1);
        setup();
        for (int i = 0; i < 5; i++) {
            strategy.submit(record(tp0, i, "k", "a:" + i));
        }

        strategy.terminate();

        assertThat(strategy.isShuttingDown()).isTrue();
        assertThat(pool.getStats().isEmpty()).isTrue();
        assertThat(pool.getLedger().getAssignedPartitions()).isEmpty();
        assertThatThrownBy(() -> strategy.submit(record(tp0, 5, "k", "a:5")))
                .isInstanceOf(MessageRejectedException.class);
    }

    @Test
    void joinWaitsForQueuedWork() {
        setup();
        for (int i = 0; i < 20; i++) {
            strategy.submit(record(tp0, i, "k", "g" + (i % 3) + ":" + i));
        }

        strategy.close();
        strategy.join(ofSeconds(10));

        assertThat(pool.getStats().isEmpty()).isTrue();
        assertThat(pool.getLedger().getAssignedPartitions()).isEmpty();
        await().untilAsserted(() -> assertThat(processed).hasSize(20));
    }

    @Test
    void joinWithoutTimeoutDoesNotWait() {
        gate = new CountDownLatch(1);
        setup();
        strategy.submit(record(tp0, 0, "k", "a:0"));
        strategy.submit(record(tp0, 1, "k", "a:1"));

        strategy.join(null);

        assertThat(pool.getStats().isEmpty()).isTrue();
        assertThat(pool.getLedger().getAssignedPartitions()).isEmpty();
    }

    @Test
    void pollHasNoEffect() {
        setup();
        strategy.submit(record(tp0, 0, "k", "a:0"));

        strategy.poll();

        await().untilAsserted(() -> assertThat(lastCommit.get()).containsExactly(tp0, 0L));
    }

    @Test
    void queueDepthIsPublishedWithoutPolling() {
        gate = new CountDownLatch(1);
        setup();
        for (int i = 0; i < 3; i++) {
            strategy.submit(record(tp0, i, "k", "a:" + i));
        }

        // one taken by the lane, blocked on the gate
        await().untilAsserted(() -> assertThat(registry.get("lanepool.queue.total").gauge().value()).isEqualTo(2.0));
        strategy.poll();
        assertThat(registry.get("lanepool.queue.total").gauge().value()).isEqualTo(2.0);
    }

}
