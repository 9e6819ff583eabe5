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

import dev.mars.pgevents.api.EventStoreStatistics;
import dev.mars.pgevents.api.StreamIdentity;
import dev.mars.pgevents.api.StreamState;
import dev.mars.pgevents.api.TenancyStyle;
import dev.mars.pgevents.api.projection.ShardName;
import dev.mars.pgevents.api.projection.ShardProgress;
import dev.mars.pgevents.db.PgEventsManager;
import dev.mars.pgevents.db.config.PgEventsConfiguration;
import dev.mars.pgevents.store.aggregation.Aggregator;
import dev.mars.pgevents.store.events.EventSerializer;
import dev.mars.pgevents.store.events.EventTypeRegistry;
import dev.mars.pgevents.store.events.JacksonEventSerializer;
import dev.mars.pgevents.store.projection.ProjectionRegistry;
import dev.mars.pgevents.store.projection.ProjectionSource;
import dev.mars.pgevents.store.schema.EventStoreSchema;
import dev.mars.pgevents.store.session.PgEventSession;
import io.vertx.core.Future;
import io.vertx.sqlclient.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point of the event store.
 *
 * <p>Built from a started {@link PgEventsManager}, which supplies the pool,
 * the Jackson mapper, the metrics and the configuration defaults:</p>
 *
 * <pre>{@code
 * PgEventStore store = PgEventStore.builder(manager)
 *     .eventType(TripStarted.class)
 *     .projection(SnapshotProjection.of(tripAggregator))
 *     .build();
 * store.ensureStorageExists().get();
 *
 * try (EventSession session = store.openSession()) {
 *     session.startStream(Trip.class, tripId, new TripStarted(...));
 *     session.saveChanges().get();
 * }
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
public class PgEventStore implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PgEventStore.class);

    private final StoreContext context;

    private PgEventStore(StoreContext context) {
        this.context = context;
    }

    public static Builder builder(PgEventsManager manager) {
        return new Builder(manager);
    }

    /**
     * Creates the schema, sequence and tables if missing. Safe to run concurrently from several nodes.
     */
    public CompletableFuture<Void> ensureStorageExists() {
        return context.getSchema().ensureStorageExists(context.getPool())
            .toCompletionStage().toCompletableFuture();
    }

    public EventSession openSession() {
        return openSession(TenancyStyle.DEFAULT_TENANT_ID);
    }

    public EventSession openSession(String tenantId) {
        Objects.requireNonNull(tenantId, "tenantId");
        if (!context.getSchema().isConjoined() && !TenancyStyle.DEFAULT_TENANT_ID.equals(tenantId)) {
            logger.debug("Tenant {} ignored by single tenancy store", tenantId);
        }
        return new PgEventSession(context, tenantId);
    }

    public CompletableFuture<EventStoreStatistics> fetchEventStoreStatistics() {
        String sql = "SELECT"
            + " (SELECT count(*) FROM " + context.getSchema().events() + ") AS event_count,"
            + " (SELECT count(*) FROM " + context.getSchema().streams() + ") AS stream_count,"
            + " (SELECT last_value FROM " + context.getSchema().sequence() + ") AS sequence_value";
        Future<EventStoreStatistics> statistics = context.getPool().query(sql).execute()
            .map(rows -> {
                Row row = rows.iterator().next();
                return new EventStoreStatistics(
                    row.getLong("event_count"),
                    row.getLong("stream_count"),
                    row.getLong("sequence_value"));
            });
        return statistics.toCompletionStage().toCompletableFuture();
    }

    public CompletableFuture<List<ShardProgress>> allProjectionProgress() {
        return context.getProgress().all(context.getPool()).toCompletionStage().toCompletableFuture();
    }

    public CompletableFuture<Optional<ShardProgress>> projectionProgressFor(ShardName shardName) {
        return context.getProgress().find(context.getPool(), shardName.getIdentity())
            .toCompletionStage().toCompletableFuture();
    }

    /**
     * Stream state read outside of any session.
     */
    public CompletableFuture<Optional<StreamState>> fetchStreamState(Object identity) {
        Object id = context.getStreamIdentity().validate(identity);
        return context.getFetcher().fetchState(context.getPool(), id, TenancyStyle.DEFAULT_TENANT_ID)
            .toCompletionStage().toCompletableFuture();
    }

    public StoreContext getContext() {
        return context;
    }

    /**
     * The pool belongs to the {@link PgEventsManager}; closing the store releases nothing else.
     */
    @Override
    public void close() {
        logger.debug("Event store for schema {} closed", context.getSchema().getSchema());
    }

    public static class Builder {
        private final PgEventsManager manager;
        private StreamIdentity streamIdentity;
        private TenancyStyle tenancy;
        private String schema;
        private Integer lockClassId;
        private EventSerializer serializer;
        private final EventTypeRegistry.Builder eventTypes = EventTypeRegistry.builder();
        private final Map<Class<?>, Aggregator<?>> aggregators = new LinkedHashMap<>();
        private final List<ProjectionSource> projections = new ArrayList<>();

        private Builder(PgEventsManager manager) {
            this.manager = Objects.requireNonNull(manager, "manager");
        }

        public Builder streamIdentity(StreamIdentity streamIdentity) {
            this.streamIdentity = streamIdentity;
            return this;
        }

        public Builder tenancy(TenancyStyle tenancy) {
            this.tenancy = tenancy;
            return this;
        }

        public Builder schema(String schema) {
            this.schema = schema;
            return this;
        }

        public Builder lockClassId(int lockClassId) {
            this.lockClassId = lockClassId;
            return this;
        }

        public Builder serializer(EventSerializer serializer) {
            this.serializer = serializer;
            return this;
        }

        public Builder eventType(Class<?> eventType) {
            eventTypes.register(eventType);
            return this;
        }

        public Builder eventType(Class<?> eventType, String alias) {
            eventTypes.register(eventType, alias);
            return this;
        }

        /**
         * Registers the aggregator used for live aggregation of an aggregate type.
         */
        public Builder aggregator(Aggregator<?> aggregator) {
            Objects.requireNonNull(aggregator, "aggregator");
            if (aggregators.putIfAbsent(aggregator.getAggregateType(), aggregator) != null) {
                throw new IllegalArgumentException("An aggregator for "
                    + aggregator.getAggregateType().getName() + " is already registered");
            }
            return this;
        }

        public Builder projection(ProjectionSource projection) {
            projections.add(Objects.requireNonNull(projection, "projection"));
            return this;
        }

        public PgEventStore build() {
            PgEventsConfiguration.EventStoreConfig defaults = manager.getConfiguration().getEventStoreConfig();
            EventStoreSchema storeSchema = new EventStoreSchema(
                schema != null ? schema : manager.getSchema(),
                streamIdentity != null ? streamIdentity : defaults.getStreamIdentity(),
                tenancy != null ? tenancy : defaults.getTenancy());

            StoreContext context = new StoreContext(
                manager.getPool(),
                storeSchema,
                lockClassId != null ? lockClassId : defaults.getLockClassId(),
                eventTypes.build(),
                serializer != null ? serializer : new JacksonEventSerializer(manager.getObjectMapper()),
                new ProjectionRegistry(projections),
                aggregators,
                manager.getMetrics(),
                manager.getDatabaseIdentifier());

            logger.info("Event store configured: schema={}, identity={}, tenancy={}, projections={}",
                storeSchema.getSchema(), storeSchema.getStreamIdentity(), storeSchema.getTenancy(),
                context.getProjections().all().size());
            return new PgEventStore(context);
        }
    }
}
