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
import dev.mars.pgevents.api.projection.ShardName;
import dev.mars.pgevents.store.BaseStoreIntegrationTest;
import dev.mars.pgevents.store.EventSession;
import dev.mars.pgevents.store.PgEventStore;
import dev.mars.pgevents.store.StoreContext;
import dev.mars.pgevents.store.fixtures.Travelled;
import dev.mars.pgevents.store.fixtures.Trip;
import dev.mars.pgevents.store.fixtures.TripStarted;
import dev.mars.pgevents.test.SharedPostgresTestExtension;
import dev.mars.pgevents.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Reads of aggregates maintained by a {@link SnapshotProjection}.
 *
 * <p>The projection is applied by hand here, the way a shard agent would.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-07
 * @version 1.0
 */
@Tag(TestCategories.INTEGRATION)
class SnapshotCatchUpIntegrationTest extends BaseStoreIntegrationTest {

    private static final ShardName TRIP_SHARD = ShardName.all("Trip");

    @Override
    protected PgEventStore.Builder configure(PgEventStore.Builder builder) {
        return builder.projection(SnapshotProjection.of(Trip.AGGREGATOR));
    }

    @Test
    void aggregateIsFoldedFromEventsBeforeAnySnapshot() throws Exception {
        UUID tripId = UUID.randomUUID();
        try (EventSession session = store.openSession()) {
            session.startStream(Trip.class, tripId, new TripStarted("sam"), new Travelled(10));
            session.saveChanges().get(10, TimeUnit.SECONDS);
        }

        try (EventSession session = store.openSession()) {
            assertTrue(session.loadSnapshot(Trip.class, tripId).get(10, TimeUnit.SECONDS).isEmpty());
            assertEquals(new Trip("sam", 10, false, 2),
                session.fetchForWriting(Trip.class, tripId).get(10, TimeUnit.SECONDS).getAggregate());
        }
    }

    @Test
    void currentSnapshotIsUsedAndNewerEventsAreFoldedOnTop() throws Exception {
        UUID tripId = UUID.randomUUID();
        try (EventSession session = store.openSession()) {
            session.startStream(Trip.class, tripId, new TripStarted("tess"), new Travelled(10));
            session.saveChanges().get(10, TimeUnit.SECONDS);
        }
        projectStream(tripId);

        Optional<Trip> snapshot = store.openSession().loadSnapshot(Trip.class, tripId).get(10, TimeUnit.SECONDS);
        assertEquals(new Trip("tess", 10, false, 2), snapshot.orElseThrow());

        // Only a snapshot read can see this value.
        SharedPostgresTestExtension.execute("UPDATE " + store.getContext().getSchema().snapshots()
            + " SET data = jsonb_set(data, '{kilometres}', '99'::jsonb)");
        try (EventSession session = store.openSession()) {
            assertEquals(99, session.fetchForWriting(Trip.class, tripId).get(10, TimeUnit.SECONDS)
                .getAggregate().kilometres());
            session.append(tripId, new Travelled(1));
            session.saveChanges().get(10, TimeUnit.SECONDS);
        }

        try (EventSession session = store.openSession()) {
            Trip caughtUp = session.fetchForWriting(Trip.class, tripId).get(10, TimeUnit.SECONDS).getAggregate();
            assertEquals(new Trip("tess", 100, false, 3), caughtUp);
            assertEquals(99, session.loadSnapshot(Trip.class, tripId).get(10, TimeUnit.SECONDS)
                .orElseThrow().kilometres());
        }
    }

    private void projectStream(UUID tripId) throws Exception {
        StoreContext context = store.getContext();
        SnapshotProjection<Trip> projection = context.getProjections().snapshotFor(Trip.class).orElseThrow();
        List<StreamEvent<?>> events = store.openSession().fetchStream(tripId).get(10, TimeUnit.SECONDS);
        long ceiling = events.get(events.size() - 1).getSequence();

        context.getPool().withTransaction(conn -> {
            ProjectionBatch batch = new ProjectionBatch();
            ApplyErrorHandler rethrow = (event, error) -> {
                throw new IllegalStateException("Failed to project event #" + event.getSequence(), error);
            };
            return projection.apply(context.getProjectionContext(), conn, batch, events, rethrow)
                .compose(v -> batch.execute(conn))
                .compose(v -> context.getProgress().ensure(conn, TRIP_SHARD))
                .compose(v -> context.getProgress().advance(conn, TRIP_SHARD, 0, ceiling));
        }).toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);

        assertEquals(ceiling, store.projectionProgressFor(TRIP_SHARD).get(10, TimeUnit.SECONDS)
            .orElseThrow().lastSequenceId());
    }
}
