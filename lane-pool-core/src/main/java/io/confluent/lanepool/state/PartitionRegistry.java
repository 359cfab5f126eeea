package io.confluent.lanepool.state;

/*-
 * Copyright (C) 2020-2025 Confluent, Inc.
 */

import lombok.Getter;
import lombok.ToString;
import org.apache.kafka.common.TopicPartition;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * One generation of partition assignment, and the tracking state (including the locks) of each partition in it.
 * <p>
 * Never mutated after construction - a new assignment builds a new registry, and the old one is dropped along with its
 * locks. Work still in flight from the old generation can only ever touch the old registry's state.
 */
@ToString
class PartitionRegistry {

    static final PartitionRegistry EMPTY = new PartitionRegistry(0, Set.of());

    /**
     * The epoch of this generation of partition assignment, for fencing off stale checkpoints.
     */
    @Getter
    private final long epoch;

    private final Map<TopicPartition, PartitionOffsets> partitions;

    PartitionRegistry(long epoch, Collection<TopicPartition> assigned) {
        this.epoch = epoch;
        this.partitions = assigned.stream()
                .distinct()
                .collect(Collectors.toUnmodifiableMap(Function.identity(), PartitionOffsets::new));
    }

    Optional<PartitionOffsets> get(TopicPartition tp) {
        return Optional.ofNullable(partitions.get(tp));
    }

    boolean contains(TopicPartition tp) {
        return partitions.containsKey(tp);
    }

    Set<TopicPartition> getAssigned() {
        return partitions.keySet();
    }

    Collection<PartitionOffsets> all() {
        return partitions.values();
    }

}
