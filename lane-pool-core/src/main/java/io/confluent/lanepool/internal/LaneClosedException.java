package io.confluent.lanepool.internal;

/*-
 * Copyright (C) 2020-2025 Confluent, Inc.
 */

import io.confluent.lanepool.LanePoolException;
import lombok.experimental.StandardException;

/**
 * A lane's queue has been closed by shutdown, and won't accept any more work.
 */
@StandardException
public class LaneClosedException extends LanePoolException {
}
