package io.confluent.lanepool;

/*-
 * Copyright (C) 2020-2025 Confluent, Inc.
 */

import lombok.experimental.StandardException;

/**
 * Back pressure signal - the strategy can't accept the record right now.
 * <p>
 * This is an expected, transient condition and not a bug. Callers should back off and submit the same record again.
 */
@StandardException
public class MessageRejectedException extends LanePoolException {
}
