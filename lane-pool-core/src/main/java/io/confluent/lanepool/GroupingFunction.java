package io.confluent.lanepool;

/*-
 * Copyright (C) 2020-2025 Confluent, Inc.
 */

/**
 * Derives the ordering group of a payload. Payloads with the same group key are processed in submission order.
 *
 * @param <T> decoded payload type
 */
@FunctionalInterface
public interface GroupingFunction<T> {

    String groupKey(T payload);

}
