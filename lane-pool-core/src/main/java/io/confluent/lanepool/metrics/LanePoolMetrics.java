package io.confluent.lanepool.metrics;

/*-
 * Copyright (C) 2020-2025 Confluent, Inc.
 */

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * Meter registration for a single lane pool, all tagged with the pool's identifier.
 */
@Slf4j
public class LanePoolMetrics {

    /**
     * If none was configured, a composite registry with no children - which is a no-op.
     */
    @Getter
    private final MeterRegistry meterRegistry;

    private final Tags commonTags;

    /**
     * Tracking of registered meters for removal from registry on shutdown.
     */
    private final List<Meter.Id> registeredMeters = new ArrayList<>();

    public LanePoolMetrics(MeterRegistry meterRegistry, String identifier) {
        this.meterRegistry = meterRegistry == null ? new CompositeMeterRegistry() : meterRegistry;
        this.commonTags = Tags.of(LanePoolMetricsDef.IDENTIFIER_TAG, identifier);
    }

    public synchronized Counter counter(LanePoolMetricsDef def, Tag... additionalTags) {
        Counter counter = Counter.builder(def.getName())
                .description(def.getDescription())
                .tags(commonTags)
                .tags(List.of(additionalTags))
                .register(meterRegistry);
        registeredMeters.add(counter.getId());
        return counter;
    }

    public synchronized Timer timer(LanePoolMetricsDef def, Tag... additionalTags) {
        Timer timer = Timer.builder(def.getName())
                .description(def.getDescription())
                .tags(commonTags)
                .tags(List.of(additionalTags))
                .register(meterRegistry);
        registeredMeters.add(timer.getId());
        return timer;
    }

    /**
     * Note: holds a strong reference to the state object, so the gauge doesn't go NaN when the caller drops theirs.
     */
    public synchronized <T> Gauge gauge(LanePoolMetricsDef def, T stateObject, ToDoubleFunction<T> valueFunction, Tag... additionalTags) {
        Gauge gauge = Gauge.builder(def.getName(), stateObject, valueFunction)
                .description(def.getDescription())
                .tags(commonTags)
                .tags(List.of(additionalTags))
                .strongReference(true)
                .register(meterRegistry);
        registeredMeters.add(gauge.getId());
        return gauge;
    }

    /**
     * Removes this pool's meters from the registry.
     */
    public synchronized void close() {
        log.debug("Removing {} meters", registeredMeters.size());
        registeredMeters.forEach(meterRegistry::remove);
        registeredMeters.clear();
    }

}
