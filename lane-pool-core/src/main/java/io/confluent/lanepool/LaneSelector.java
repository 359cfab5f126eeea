package io.confluent.lanepool;

/*-
 * Copyright (C) 2020-2025 Confluent, Inc.
 */

/**
 * Chooses the lane for a group key.
 * <p>
 * Must be a pure function of its inputs - a group must always land on the same lane for the life of the pool, as that
 * is the entire ordering guarantee.
 */
@FunctionalInterface
public interface LaneSelector {

    /**
     * Default selector - {@link String#hashCode()} is specified by the JLS, so is stable within and across JVMs.
     */
    LaneSelector HASH_MODULO = (groupKey, laneCount) -> Math.floorMod(groupKey.hashCode(), laneCount);

    /**
     * @return lane index, in the range {@code [0, laneCount)}
     */
    int laneFor(String groupKey, int laneCount);

}
