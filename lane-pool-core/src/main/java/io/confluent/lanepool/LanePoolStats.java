package io.confluent.lanepool;

/*-
 * Copyright (C) 2020-2025 Confluent, Inc.
 */

import lombok.Value;

import java.util.List;

/**
 * Point in time view of the lane queue depths. Not transactionally consistent across lanes.
 */
@Value
public class LanePoolStats {

    /**
     * Items waiting (not yet started) on each lane, indexed by lane
     */
    List<Integer> queueDepths;

    int totalItems;

    public static LanePoolStats of(List<Integer> queueDepths) {
        int total = queueDepths.stream().mapToInt(Integer::intValue).sum();
        return new LanePoolStats(List.copyOf(queueDepths), total);
    }

    public boolean isEmpty() {
        return totalItems == 0;
    }

}
