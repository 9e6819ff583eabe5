package dev.mars.pgevents.store.fetch;

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

import dev.mars.pgevents.api.StreamEvent;
import dev.mars.pgevents.api.StreamState;
import dev.mars.pgevents.api.projection.ShardName;
import dev.mars.pgevents.store.StoreContext;
import dev.mars.pgevents.store.aggregation.Aggregator;
import dev.mars.pgevents.store.events.EventRowMapper;
import dev.mars.pgevents.store.projection.SnapshotProjection;
import dev.mars.pgevents.store.snapshot.Snapshot;
import io.vertx.core.Future;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.SqlClient;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Reads stream state, stream events and aggregates.
 *
 * <p>When a {@link SnapshotProjection} maintains the requested aggregate type the
 * persisted snapshot is used as the starting point. If the projection has not yet
 * consumed the stream's latest event, the missing events are folded onto the
 * snapshot in memory; the stored snapshot is left untouched.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
public class StreamFetcher {
    private static final Logger logger = LoggerFactory.getLogger(StreamFetcher.class);

    private final StoreContext context;
    private final String selectStateSql;
    private final String selectEventsSql;
    private final String selectMaxSequenceSql;

    public StreamFetcher(StoreContext context) {
        this.context = context;
        boolean conjoined = context.getSchema().isConjoined();
        String streams = context.getSchema().streams();
        String events = context.getSchema().events();

        this.selectStateSql = "SELECT id, version, type, created, timestamp, is_archived, tenant_id FROM " + streams
            + " WHERE id = $1" + (conjoined ? " AND tenant_id = $2" : "");
        this.selectEventsSql = "SELECT " + EventRowMapper.COLUMNS + " FROM " + events
            + " WHERE stream_id = $1 AND version > $2 AND version <= $3" + (conjoined ? " AND tenant_id = $4" : "")
            + " ORDER BY version";
        this.selectMaxSequenceSql = "SELECT max(seq_id) AS max_seq FROM " + events
            + " WHERE stream_id = $1" + (conjoined ? " AND tenant_id = $2" : "");
    }

    public Future<Optional<StreamState>> fetchState(SqlClient client, Object identity, String tenantId) {
        return client.preparedQuery(selectStateSql).execute(withTenant(Tuple.of(identity), tenantId))
            .map(rows -> {
                if (rows.size() == 0) {
                    return Optional.<StreamState>empty();
                }
                return Optional.of(toState(rows.iterator().next()));
            });
    }

    /**
     * Events with {@code afterVersion < version <= upToVersion}, in version order.
     */
    public Future<List<StreamEvent<?>>> fetchEvents(SqlClient client, Object identity, String tenantId,
                                                    long afterVersion, long upToVersion) {
        Tuple params = withTenant(Tuple.of(identity, afterVersion, upToVersion), tenantId);
        return client.preparedQuery(selectEventsSql).execute(params)
            .map(rows -> context.getRowMapper().mapAll(rows));
    }

    public Future<List<StreamEvent<?>>> fetchStream(SqlClient client, Object identity, String tenantId) {
        return fetchEvents(client, identity, tenantId, 0, Long.MAX_VALUE);
    }

    /**
     * Live aggregation over every event of the stream.
     *
     * @return the aggregate, or null when the stream has no events
     */
    public <T> Future<T> aggregateStream(SqlClient client, Class<T> aggregateType, Object identity, String tenantId) {
        Aggregator<T> aggregator = requireAggregator(aggregateType);
        return fetchStream(client, identity, tenantId).map(aggregator::build);
    }

    /**
     * Reads the stream state and the aggregate at that state's version.
     */
    public <T> Future<FetchResult<T>> fetchForWriting(SqlClient client, Class<T> aggregateType, Object identity,
                                                      String tenantId) {
        return fetchState(client, identity, tenantId).compose(state -> {
            if (state.isEmpty()) {
                return Future.succeededFuture(new FetchResult<T>(null, null, 0));
            }
            long version = state.get().getVersion();
            return aggregateUpTo(client, aggregateType, identity, tenantId, version)
                .map(aggregate -> new FetchResult<>(state.get(), aggregate, version));
        });
    }

    private <T> Future<T> aggregateUpTo(SqlClient client, Class<T> aggregateType, Object identity, String tenantId,
                                        long version) {
        Optional<SnapshotProjection<T>> snapshotProjection = context.getProjections().snapshotFor(aggregateType);
        if (snapshotProjection.isEmpty()) {
            Aggregator<T> aggregator = requireAggregator(aggregateType);
            return fetchEvents(client, identity, tenantId, 0, version).map(aggregator::build);
        }

        SnapshotProjection<T> projection = snapshotProjection.get();
        ShardName shard = projection.shardFor(identity);
        return context.getSnapshots().load(client, aggregateType, identity, tenantId)
            .compose(snapshot -> context.getProgress().lastSequence(client, shard)
                .compose(progress -> maxSequence(client, identity, tenantId)
                    .compose(maxSequence -> {
                        if (snapshot.isPresent() && progress >= maxSequence) {
                            logger.debug("Snapshot of {} #{} is current at version {}",
                                aggregateType.getSimpleName(), identity, snapshot.get().version());
                            return Future.succeededFuture(snapshot.get().document());
                        }
                        T start = snapshot.map(Snapshot::document).orElse(null);
                        long from = snapshot.map(Snapshot::version).orElse(0L);
                        logger.debug("Catching up {} #{} from version {} (shard {} at {}, stream at #{})",
                            aggregateType.getSimpleName(), identity, from, shard, progress, maxSequence);
                        return fetchEvents(client, identity, tenantId, from, version)
                            .map(events -> projection.getAggregator().fold(start, events));
                    })));
    }

    private Future<Long> maxSequence(SqlClient client, Object identity, String tenantId) {
        return client.preparedQuery(selectMaxSequenceSql).execute(withTenant(Tuple.of(identity), tenantId))
            .map(rows -> {
                Long max = rows.iterator().next().getLong("max_seq");
                return max == null ? 0L : max;
            });
    }

    private <T> Aggregator<T> requireAggregator(Class<T> aggregateType) {
        return context.aggregatorFor(aggregateType).orElseThrow(() -> new IllegalArgumentException(
            "No aggregator registered for " + aggregateType.getName()
                + "; register one with PgEventStore.Builder#aggregator or a SnapshotProjection"));
    }

    private Tuple withTenant(Tuple params, String tenantId) {
        if (context.getSchema().isConjoined()) {
            params.addString(tenantId);
        }
        return params;
    }

    private StreamState toState(Row row) {
        OffsetDateTime created = row.getOffsetDateTime("created");
        OffsetDateTime timestamp = row.getOffsetDateTime("timestamp");
        return new StreamState(
            context.getRowMapper().readIdentity(row, "id"),
            row.getLong("version"),
            row.getString("type"),
            created == null ? null : created.toInstant(),
            timestamp == null ? null : timestamp.toInstant(),
            row.getBoolean("is_archived"),
            row.getString("tenant_id"));
    }
}
