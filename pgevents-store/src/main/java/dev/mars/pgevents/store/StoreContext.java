package dev.mars.pgevents.store;

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

import dev.mars.pgevents.api.StreamIdentity;
import dev.mars.pgevents.api.TenancyStyle;
import dev.mars.pgevents.db.metrics.EventStoreMetrics;
import dev.mars.pgevents.store.aggregation.Aggregator;
import dev.mars.pgevents.store.append.StreamWriter;
import dev.mars.pgevents.store.events.EventRowMapper;
import dev.mars.pgevents.store.events.EventSerializer;
import dev.mars.pgevents.store.events.EventTypeRegistry;
import dev.mars.pgevents.store.fetch.StreamFetcher;
import dev.mars.pgevents.store.progress.ProjectionProgressStore;
import dev.mars.pgevents.store.projection.ProjectionContext;
import dev.mars.pgevents.store.projection.ProjectionRegistry;
import dev.mars.pgevents.store.projection.SnapshotProjection;
import dev.mars.pgevents.store.schema.EventStoreSchema;
import dev.mars.pgevents.store.snapshot.SnapshotStore;
import io.vertx.sqlclient.Pool;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable wiring shared by an event store, its sessions and the projection daemon.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
public final class StoreContext {

    private final Pool pool;
    private final EventStoreSchema schema;
    private final int lockClassId;
    private final EventTypeRegistry eventTypes;
    private final EventSerializer serializer;
    private final ProjectionRegistry projections;
    private final Map<Class<?>, Aggregator<?>> aggregators;
    private final EventStoreMetrics metrics;
    private final String databaseIdentifier;

    private final EventRowMapper rowMapper;
    private final SnapshotStore snapshots;
    private final ProjectionProgressStore progress;
    private final StreamWriter writer;
    private final StreamFetcher fetcher;
    private final ProjectionContext projectionContext;

    StoreContext(Pool pool, EventStoreSchema schema, int lockClassId, EventTypeRegistry eventTypes,
                 EventSerializer serializer, ProjectionRegistry projections, Map<Class<?>, Aggregator<?>> aggregators,
                 EventStoreMetrics metrics, String databaseIdentifier) {
        this.pool = pool;
        this.schema = schema;
        this.lockClassId = lockClassId;
        this.eventTypes = eventTypes;
        this.serializer = serializer;
        this.projections = projections;
        this.metrics = metrics;
        this.databaseIdentifier = databaseIdentifier;

        Map<Class<?>, Aggregator<?>> allAggregators = new LinkedHashMap<>(aggregators);
        projections.all().forEach(source -> {
            if (source instanceof SnapshotProjection<?> snapshot) {
                allAggregators.putIfAbsent(snapshot.getAggregateType(), snapshot.getAggregator());
            }
        });
        this.aggregators = Collections.unmodifiableMap(allAggregators);

        this.rowMapper = new EventRowMapper(schema.getStreamIdentity(), eventTypes, serializer);
        this.snapshots = new SnapshotStore(schema, serializer);
        this.progress = new ProjectionProgressStore(schema);
        this.writer = new StreamWriter(schema, serializer);
        this.projectionContext = new ProjectionContext(schema, snapshots);
        this.fetcher = new StreamFetcher(this);
    }

    public Pool getPool() {
        return pool;
    }

    public EventStoreSchema getSchema() {
        return schema;
    }

    public StreamIdentity getStreamIdentity() {
        return schema.getStreamIdentity();
    }

    public TenancyStyle getTenancy() {
        return schema.getTenancy();
    }

    public int getLockClassId() {
        return lockClassId;
    }

    public EventTypeRegistry getEventTypes() {
        return eventTypes;
    }

    public EventSerializer getSerializer() {
        return serializer;
    }

    public ProjectionRegistry getProjections() {
        return projections;
    }

    @SuppressWarnings("unchecked")
    public <T> Optional<Aggregator<T>> aggregatorFor(Class<T> aggregateType) {
        return Optional.ofNullable((Aggregator<T>) aggregators.get(aggregateType));
    }

    public EventStoreMetrics getMetrics() {
        return metrics;
    }

    public String getDatabaseIdentifier() {
        return databaseIdentifier;
    }

    public EventRowMapper getRowMapper() {
        return rowMapper;
    }

    public SnapshotStore getSnapshots() {
        return snapshots;
    }

    public ProjectionProgressStore getProgress() {
        return progress;
    }

    public StreamWriter getWriter() {
        return writer;
    }

    public StreamFetcher getFetcher() {
        return fetcher;
    }

    public ProjectionContext getProjectionContext() {
        return projectionContext;
    }
}
