package io.confluent.lanepool.internal;

/*-
 * Copyright (C) 2020-2025 Confluent, Inc.
 */

import io.confluent.csid.utils.StringUtils;
import lombok.experimental.StandardException;

/**
 * Internal {@link RuntimeException}
 *
 * @author Antony Stubbs
 */
@StandardException
public class InternalRuntimeException extends RuntimeException {

    /**
     * @see StringUtils#msg(String, Object...)
     */
    public static InternalRuntimeException msg(String message, Object... vars) {
        return new InternalRuntimeException(StringUtils.msg(message, vars));
    }

}
