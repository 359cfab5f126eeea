package io.confluent.lanepool.kafkabridge;

/*-
 * Copyright (C) 2020-2025 Confluent, Inc.
 */

import io.confluent.lanepool.kafkabridge.ConsumerOffsetCommitter.CommitMode;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.clients.consumer.OffsetCommitCallback;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.RebalanceInProgressException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import pl.tlinkowski.unij.api.UniLists;
import pl.tlinkowski.unij.api.UniMaps;
import pl.tlinkowski.unij.api.UniSets;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static com.google.common.truth.Truth.assertThat;
import static io.confluent.lanepool.ModelUtils.tp;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * @see ConsumerOffsetCommitter
 */
class ConsumerOffsetCommitterTest {

    final TopicPartition tp0 = tp(0);

    final TopicPartition tp1 = tp(1);

    MockConsumer<String, String> consumer;

    @BeforeEach
    void setup() {
        consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
        consumer.assign(UniLists.of(tp0, tp1));
    }

    Map<TopicPartition, OffsetAndMetadata> committed() {
        return consumer.committed(UniSets.of(tp0, tp1));
    }

    @Test
    void commitsTheNextOffsetToRead() {
        var translated = ConsumerOffsetCommitter.toKafkaOffsets(UniMaps.of(tp0, 0L, tp1, 41L));

        assertThat(translated).containsExactly(tp0, new OffsetAndMetadata(1), tp1, new OffsetAndMetadata(42));
    }

    @Test
    void syncCommit() {
        var committer = new ConsumerOffsetCommitter<>(consumer);
        assertThat(committer.getCommitMode()).isEqualTo(CommitMode.CONSUMER_SYNC);

        committer.commit(UniMaps.of(tp0, 5L, tp1, 9L));

        assertThat(committed()).containsExactly(tp0, new OffsetAndMetadata(6), tp1, new OffsetAndMetadata(10));
    }

    @Test
    void asyncCommit() {
        var committer = new ConsumerOffsetCommitter<>(consumer, CommitMode.CONSUMER_ASYNCHRONOUS, Duration.ofSeconds(1));

        committer.commit(UniMaps.of(tp0, 5L));

        assertThat(committed()).containsExactly(tp0, new OffsetAndMetadata(6));
    }

    @Test
    void asyncFailureIsOnlyLogged() {
        @SuppressWarnings("unchecked")
        Consumer<String, String> mockConsumer = mock(Consumer.class);
        var committer = new ConsumerOffsetCommitter<>(mockConsumer, CommitMode.CONSUMER_ASYNCHRONOUS, Duration.ofSeconds(1));

        committer.commit(UniMaps.of(tp0, 5L));

        var callback = ArgumentCaptor.forClass(OffsetCommitCallback.class);
        verify(mockConsumer).commitAsync(anyMap(), callback.capture());
        assertThatCode(() -> callback.getValue().onComplete(UniMaps.of(tp0, new OffsetAndMetadata(6)), new RebalanceInProgressException("Fake rebalance")))
                .doesNotThrowAnyException();
    }

    @Test
    void emptyCommitIsNotSent() {
        @SuppressWarnings("unchecked")
        Consumer<String, String> mockConsumer = mock(Consumer.class);
        var committer = new ConsumerOffsetCommitter<>(mockConsumer);

        committer.commit(Map.of());

        verifyNoInteractions(mockConsumer);
    }

    @Test
    void commitsFromOtherThreadsWaitForTheOwner() {
        var committer = new ConsumerOffsetCommitter<>(consumer);
        committer.claim();
        assertThat(committer.maybeDoCommit()).isFalse();

        CompletableFuture.runAsync(() -> {
            committer.commit(UniMaps.of(tp0, 5L));
            committer.commit(UniMaps.of(tp0, 3L, tp1, 7L));
        }).join();

        assertThat(committed()).isEmpty();

        assertThat(committer.maybeDoCommit()).isTrue();

        // parked offsets merge, keeping the highest
        assertThat(committed()).containsExactly(tp0, new OffsetAndMetadata(6), tp1, new OffsetAndMetadata(8));
        assertThat(committer.maybeDoCommit()).isFalse();
    }

    @Test
    void constructingThreadOwnsTheConsumer() {
        var committer = new ConsumerOffsetCommitter<>(consumer);

        // as the checkpoint loop would
        CompletableFuture.runAsync(() -> committer.commit(UniMaps.of(tp0, 5L))).join();
        assertThat(committed()).isEmpty();

        // other threads can't send the parked commit either
        assertThat(CompletableFuture.supplyAsync(committer::maybeDoCommit).join()).isFalse();
        assertThat(committed()).isEmpty();

        assertThat(committer.maybeDoCommit()).isTrue();
        assertThat(committed()).containsExactly(tp0, new OffsetAndMetadata(6));
    }

    @Test
    void ownerCommitsDirectly() {
        @SuppressWarnings("unchecked")
        Consumer<String, String> mockConsumer = mock(Consumer.class);
        var committer = new ConsumerOffsetCommitter<>(mockConsumer, CommitMode.CONSUMER_SYNC, Duration.ofSeconds(3));
        committer.claim();

        committer.commit(UniMaps.of(tp0, 5L));

        verify(mockConsumer).commitSync(UniMaps.of(tp0, new OffsetAndMetadata(6)), Duration.ofSeconds(3));
        assertThat(committer.maybeDoCommit()).isFalse();
    }

}
