package io.confluent.lanepool;

/*-
 * Copyright (C) 2020-2025 Confluent, Inc.
 */

import io.confluent.lanepool.state.OffsetLedger;
import lombok.experimental.StandardException;

/**
 * Thrown by the {@link OffsetLedger} when offsets are tracked for a partition which isn't in the current assignment.
 * <p>
 * Always recovered from locally - the assignment changed concurrently, so the record is dropped rather than processed.
 */
@StandardException
public class UnassignedPartitionException extends LanePoolException {
}
