package io.confluent.lanepool;

/*-
 * Copyright (C) 2020-2025 Confluent, Inc.
 */

/**
 * The user's processing function, run on a lane's worker thread.
 * <p>
 * May throw - the failure is logged, and the record still counts as processed for checkpointing. Retrying, if wanted,
 * is the function's own responsibility.
 *
 * @param <T> the decoded payload type
 */
@FunctionalInterface
public interface ResultProcessor<T> {

    void process(String identifier, T payload) throws Exception;

}
