package io.confluent.lanepool.metrics;

/*-
 * Copyright (C) 2020-2025 Confluent, Inc.
 */

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import static io.confluent.lanepool.metrics.LanePoolMetricsDef.MeterType.*;

/**
 * This enum defines the metrics that are collected by the lane pool.
 */
@Getter
@RequiredArgsConstructor
public enum LanePoolMetricsDef {

    UNASSIGNED_PARTITION("submit.unassigned.partition", "Records dropped as their partition is no longer assigned", COUNTER),
    FLUSH_TIMEOUT("flush.timeout", "Flushes which timed out before the lanes emptied", COUNTER),
    FLUSH_DISCARDED("flush.discarded", "Queued records discarded, without processing, by a timed out flush", COUNTER),
    OFFSETS_COMMITTED("offsets.committed", "Partition checkpoints handed to the commit function", COUNTER),
    PROCESSING_FAILED("processing.failed", "Records whose processing function threw", COUNTER),
    DECODE_FAILED("decode.failed", "Records which failed decoding or grouping, and were skipped", COUNTER),
    PROCESSING_TIME("processing.time", "Processing function time", TIMER),
    QUEUE_DEPTH("queue.depth", "Records waiting on a lane", GAUGE),
    QUEUE_TOTAL("queue.total", "Records waiting across all lanes", GAUGE);

    public static final String IDENTIFIER_TAG = "identifier";

    public static final String LANE_TAG = "lane";

    private static final String METER_PREFIX = "lanepool.";

    private final String shortName;

    private final String description;

    private final MeterType type;

    public String getName() {
        return METER_PREFIX + shortName;
    }

    public enum MeterType {
        COUNTER, GAUGE, TIMER
    }

}
