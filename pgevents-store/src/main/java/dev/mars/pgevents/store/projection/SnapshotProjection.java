package dev.mars.pgevents.store.projection;

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
import dev.mars.pgevents.store.aggregation.Aggregator;
import dev.mars.pgevents.store.snapshot.Snapshot;
import dev.mars.pgevents.store.snapshot.SnapshotStore;
import io.vertx.core.Future;
import io.vertx.sqlclient.SqlConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Asynchronous projection keeping one snapshot document per stream in {@code pge_snapshots}.
 *
 * <p>For every stream touched by a page the stored snapshot is loaded, the new
 * events are folded onto it with the {@link Aggregator}, and an upsert is added to
 * the batch. Events at or below the snapshot's version are skipped, so replaying a
 * page is harmless.</p>
 *
 * @param <T> aggregate type
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
public final class SnapshotProjection<T> implements ProjectionSource {
    private static final Logger logger = LoggerFactory.getLogger(SnapshotProjection.class);

    private final String name;
    private final Aggregator<T> aggregator;
    private final int shardCount;

    private SnapshotProjection(String name, Aggregator<T> aggregator, int shardCount) {
        this.name = name;
        this.aggregator = aggregator;
        this.shardCount = shardCount;
    }

    /**
     * Snapshot projection named after the aggregate's simple class name.
     */
    public static <T> SnapshotProjection<T> of(Aggregator<T> aggregator) {
        Objects.requireNonNull(aggregator, "aggregator");
        return new SnapshotProjection<>(aggregator.getAggregateType().getSimpleName(), aggregator, 1);
    }

    public static <T> SnapshotProjection<T> of(String name, Aggregator<T> aggregator, int shardCount) {
        Objects.requireNonNull(aggregator, "aggregator");
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Projection name cannot be blank");
        }
        if (shardCount < 1) {
            throw new IllegalArgumentException("Shard count must be at least 1");
        }
        return new SnapshotProjection<>(name, aggregator, shardCount);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int getShardCount() {
        return shardCount;
    }

    @Override
    public Set<Class<?>> getEventTypes() {
        return aggregator.getHandledEventTypes();
    }

    public Aggregator<T> getAggregator() {
        return aggregator;
    }

    public Class<T> getAggregateType() {
        return aggregator.getAggregateType();
    }

    @Override
    public Future<Void> apply(ProjectionContext context, SqlConnection conn, ProjectionBatch batch,
                              List<StreamEvent<?>> page, ApplyErrorHandler errors) {
        Map<StreamKey, List<StreamEvent<?>>> byStream = new LinkedHashMap<>();
        for (StreamEvent<?> event : page) {
            String tenant = context.snapshots().tenantKey(event.getTenantId());
            byStream.computeIfAbsent(new StreamKey(tenant, event.getStreamIdentity()),
                key -> new ArrayList<>()).add(event);
        }
        return applyStreams(context, conn, batch, new ArrayList<>(byStream.entrySet()), 0, errors);
    }

    private Future<Void> applyStreams(ProjectionContext context, SqlConnection conn, ProjectionBatch batch,
                                      List<Map.Entry<StreamKey, List<StreamEvent<?>>>> streams, int index,
                                      ApplyErrorHandler errors) {
        if (index >= streams.size()) {
            return Future.succeededFuture();
        }
        StreamKey key = streams.get(index).getKey();
        List<StreamEvent<?>> events = streams.get(index).getValue();
        SnapshotStore snapshots = context.snapshots();

        return snapshots.load(conn, getAggregateType(), key.identity(), key.tenantId())
            .compose(existing -> {
                fold(existing, events, errors).ifPresent(folded ->
                    snapshots.upsertInto(batch, getAggregateType(), key.identity(), key.tenantId(),
                        folded.version(), folded.document()));
                return applyStreams(context, conn, batch, streams, index + 1, errors);
            });
    }

    private Optional<Snapshot<T>> fold(Optional<Snapshot<T>> existing, List<StreamEvent<?>> events,
                                       ApplyErrorHandler errors) {
        T aggregate = existing.map(Snapshot::document).orElse(null);
        long version = existing.map(Snapshot::version).orElse(0L);
        long startVersion = version;

        for (StreamEvent<?> event : events) {
            if (event.getVersion() <= startVersion) {
                continue;
            }
            try {
                aggregate = aggregator.applyOne(aggregate, event);
                version = event.getVersion();
            } catch (RuntimeException e) {
                logger.debug("Snapshot projection {} failed on event #{}: {}", name, event.getSequence(), e.getMessage());
                errors.onApplyFailure(event, e);
            }
        }
        if (aggregate == null || version == startVersion) {
            return Optional.empty();
        }
        return Optional.of(new Snapshot<>(aggregate, version, null, null));
    }

    @Override
    public void teardown(ProjectionContext context, ProjectionBatch batch) {
        context.snapshots().deleteAllInto(batch, getAggregateType());
    }

    private record StreamKey(String tenantId, Object identity) {
    }
}
