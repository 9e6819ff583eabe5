package dev.mars.pgevents.db.metrics;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer metrics of the event store and the projection daemon.
 *
 * <p>Recording methods are no-ops until {@link #bindTo(MeterRegistry)} is called,
 * so components can be used with metrics disabled.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class EventStoreMetrics implements MeterBinder {
    private static final Logger logger = LoggerFactory.getLogger(EventStoreMetrics.class);

    private final String instanceId;
    private MeterRegistry registry;

    private Counter eventsAppended;
    private Counter streamsStarted;
    private Counter concurrencyConflicts;
    private Counter streamLockContentions;
    private Counter eventsApplied;
    private Counter deadLetters;
    private Counter skippedSequenceGaps;

    private final AtomicLong highWaterMark = new AtomicLong(0);

    public EventStoreMetrics(String instanceId) {
        this.instanceId = instanceId;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;

        eventsAppended = Counter.builder("pgevents.events.appended")
            .description("Total number of events committed to streams")
            .tag("instance", instanceId)
            .register(registry);

        streamsStarted = Counter.builder("pgevents.streams.started")
            .description("Total number of streams started")
            .tag("instance", instanceId)
            .register(registry);

        concurrencyConflicts = Counter.builder("pgevents.streams.concurrency_conflicts")
            .description("Optimistic concurrency conflicts detected on stream writes")
            .tag("instance", instanceId)
            .register(registry);

        streamLockContentions = Counter.builder("pgevents.streams.lock_contentions")
            .description("Exclusive fetches rejected because another session held the stream lock")
            .tag("instance", instanceId)
            .register(registry);

        eventsApplied = Counter.builder("pgevents.projections.events.applied")
            .description("Events applied by projection shards")
            .tag("instance", instanceId)
            .register(registry);

        deadLetters = Counter.builder("pgevents.projections.dead_letters")
            .description("Events set aside as dead letters by projection shards")
            .tag("instance", instanceId)
            .register(registry);

        skippedSequenceGaps = Counter.builder("pgevents.daemon.skipped_gaps")
            .description("Sequence gaps skipped after the stale sequence threshold")
            .tag("instance", instanceId)
            .register(registry);

        Gauge.builder("pgevents.daemon.high_water_mark", highWaterMark::get)
            .description("Highest sequence with no gaps below it")
            .tag("instance", instanceId)
            .register(registry);

        logger.info("PgEvents metrics registered for instance: {}", instanceId);
    }

    public void recordEventsAppended(int count) {
        if (eventsAppended != null) {
            eventsAppended.increment(count);
        }
    }

    public void recordStreamStarted() {
        if (streamsStarted != null) {
            streamsStarted.increment();
        }
    }

    public void recordConcurrencyConflicts(int count) {
        if (concurrencyConflicts != null) {
            concurrencyConflicts.increment(count);
        }
    }

    public void recordStreamLockContention() {
        if (streamLockContentions != null) {
            streamLockContentions.increment();
        }
    }

    public void recordEventsApplied(String shardName, int count) {
        if (eventsApplied != null) {
            eventsApplied.increment(count);
        }
        if (registry != null) {
            Counter.builder("pgevents.projections.events.applied.by.shard")
                .tag("instance", instanceId)
                .tag("shard", shardName)
                .register(registry)
                .increment(count);
        }
    }

    public void recordDeadLetter(String projectionName) {
        if (deadLetters != null) {
            deadLetters.increment();
        }
        if (registry != null) {
            Counter.builder("pgevents.projections.dead_letters.by.projection")
                .tag("instance", instanceId)
                .tag("projection", projectionName)
                .register(registry)
                .increment();
        }
    }

    public void recordSkippedGap() {
        if (skippedSequenceGaps != null) {
            skippedSequenceGaps.increment();
        }
    }

    public void recordHighWaterMark(long mark) {
        highWaterMark.set(mark);
    }

    public String getInstanceId() {
        return instanceId;
    }
}
