package io.confluent.lanepool;

/*-
 * Copyright (C) 2020-2025 Confluent, Inc.
 */

import lombok.experimental.StandardException;

/**
 * Generic Lane Pool {@link RuntimeException} parent.
 *
 * @author Antony Stubbs
 */
@StandardException
public class LanePoolException extends RuntimeException {
}
