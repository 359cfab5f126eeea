package io.confluent.lanepool;

/*-
 * Copyright (C) 2020-2025 Confluent, Inc.
 */

import io.micrometer.core.instrument.MeterRegistry;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.util.Objects;

import static io.confluent.csid.utils.StringUtils.isBlank;
import static io.confluent.csid.utils.StringUtils.msg;

/**
 * The options for the {@link LanePool} system.
 * <p>
 * The important options to look at are {@link #laneCount} and {@link #checkpointInterval}. All options have sensible
 * defaults, and none can be changed once the pool is running - changing the lane count means restarting the pool.
 *
 * @see #builder()
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class LanePoolOptions {

    public static final int DEFAULT_LANE_COUNT = 20;

    /**
     * Smallest interval or timeout accepted.
     */
    public static final Duration MIN_DURATION = Duration.ofMillis(1);

    /**
     * Name of the pool, used in thread names, log context and metrics tags. Also passed to the user's
     * {@link ResultProcessor}.
     */
    @Builder.Default
    private final String identifier = "lane-pool";

    /**
     * Number of lanes, each with exactly one worker thread. Concurrency is at most this number, or the number of
     * distinct group keys, whichever is lower.
     */
    @Builder.Default
    private final int laneCount = DEFAULT_LANE_COUNT;

    /**
     * How often the checkpoint driver looks for completed offsets to commit.
     */
    @Builder.Default
    private final Duration checkpointInterval = Duration.ofSeconds(1);

    /**
     * How long shutdown waits to join each worker thread, and the checkpoint thread.
     */
    @Builder.Default
    private final Duration shutdownTimeout = Duration.ofSeconds(1);

    /**
     * How often {@link LanePool#waitUntilEmpty} re-checks the lane queues.
     */
    @Builder.Default
    private final Duration emptyPollInterval = Duration.ofMillis(10);

    /**
     * Maps group keys to lanes.
     */
    @Builder.Default
    private final LaneSelector laneSelector = LaneSelector.HASH_MODULO;

    /**
     * Where to register meters. If not set, meters are kept in a no-op registry.
     */
    private final MeterRegistry meterRegistry;

    /**
     * Path to Managed thread factory for Java EE
     */
    @Builder.Default
    private final String managedThreadFactory = "java:comp/DefaultManagedThreadFactory";

    public void validate() {
        if (isBlank(identifier)) {
            throw new IllegalArgumentException("Identifier must be set");
        }
        if (laneCount < 1) {
            throw new IllegalArgumentException(msg("Lane count must be at least one, was {}", laneCount));
        }
        Objects.requireNonNull(laneSelector, "Lane selector must be set");
        checkAtLeastOneMilli(checkpointInterval, "checkpointInterval");
        checkAtLeastOneMilli(shutdownTimeout, "shutdownTimeout");
        checkAtLeastOneMilli(emptyPollInterval, "emptyPollInterval");
    }

    /**
     * Waits and joins are in milliseconds, where zero means forever.
     */
    private static void checkAtLeastOneMilli(Duration duration, String name) {
        if (duration == null || duration.compareTo(MIN_DURATION) < 0) {
            throw new IllegalArgumentException(msg("{} must be at least {}, was {}", name, MIN_DURATION, duration));
        }
    }

}
