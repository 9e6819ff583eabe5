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

import dev.mars.pgevents.api.SimpleStreamEvent;
import dev.mars.pgevents.api.StreamEvent;
import dev.mars.pgevents.api.projection.ShardName;
import dev.mars.pgevents.store.fixtures.Travelled;
import dev.mars.pgevents.store.fixtures.TripEnded;
import dev.mars.pgevents.store.fixtures.TripStarted;
import dev.mars.pgevents.test.categories.TestCategories;
import io.vertx.core.Future;
import io.vertx.sqlclient.Tuple;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class EventProjectionTest {

    private static StreamEvent<?> event(long sequence, Object streamId, Object data) {
        return new SimpleStreamEvent<>(UUID.randomUUID(), sequence, sequence, streamId, data,
            data.getClass().getSimpleName(), Instant.now(), null, false);
    }

    private static EventProjection distance(int shards) {
        return EventProjection.builder("Distance")
            .project(Travelled.class, (event, travelled, batch) ->
                batch.add("UPDATE distance SET km = km + $1", Tuple.of(travelled.kilometres())))
            .shards(shards)
            .teardown("DELETE FROM distance")
            .build();
    }

    @Test
    void testSingleShardIsAll() {
        EventProjection projection = distance(1);

        assertEquals(List.of(ShardName.all("Distance")), projection.getShardNames());
        assertEquals(ShardName.all("Distance"), projection.shardFor(UUID.randomUUID()));
        assertTrue(projection.belongsTo(ShardName.all("Distance"), event(1, UUID.randomUUID(), new Travelled(1))));
    }

    @Test
    void testStreamsAreSpreadOverShards() {
        EventProjection projection = distance(3);
        assertEquals(List.of(new ShardName("Distance", "0"), new ShardName("Distance", "1"), new ShardName("Distance", "2")),
            projection.getShardNames());

        for (int i = 0; i < 20; i++) {
            String streamId = "trip-" + i;
            ShardName owner = projection.shardFor(streamId);
            assertEquals(String.valueOf(Math.floorMod(streamId.hashCode(), 3)), owner.getShardKey());

            StreamEvent<?> travelled = event(i + 1, streamId, new Travelled(i));
            long owners = projection.getShardNames().stream().filter(shard -> projection.belongsTo(shard, travelled)).count();
            assertEquals(1, owners);
            assertTrue(projection.belongsTo(owner, travelled));
        }
    }

    @Test
    void testHandlesOnlyProjectedTypes() {
        EventProjection projection = distance(1);

        assertTrue(projection.handles(event(1, "trip-1", new Travelled(1))));
        assertFalse(projection.handles(event(2, "trip-1", new TripEnded("done"))));
    }

    @Test
    void testApplyWritesStatementsAndReportsFailures() {
        EventProjection projection = EventProjection.builder("Trips")
            .project(TripStarted.class, (event, started, batch) -> {
                if (started.driver() == null) {
                    throw new IllegalArgumentException("driver missing");
                }
                batch.add("INSERT INTO trips (driver) VALUES ($1)", Tuple.of(started.driver()));
            })
            .build();
        ProjectionBatch batch = new ProjectionBatch();
        List<StreamEvent<?>> failed = new ArrayList<>();

        Future<Void> applied = projection.apply(null, null, batch, List.of(
            event(1, "a", new TripStarted("Ann")),
            event(2, "b", new TripStarted(null)),
            event(3, "c", new Travelled(3)),
            event(4, "d", new TripStarted("Bob"))), (event, error) -> failed.add(event));

        assertTrue(applied.succeeded());
        assertEquals(2, batch.size());
        assertEquals(1, failed.size());
        assertEquals(2, failed.get(0).getSequence());
    }

    @Test
    void testTeardownAddsConfiguredStatements() {
        ProjectionBatch batch = new ProjectionBatch();

        distance(1).teardown(null, batch);

        assertEquals(1, batch.size());
        assertEquals("DELETE FROM distance", batch.getStatements().get(0).sql());
    }

    @Test
    void testProjectionNeedsHandlers() {
        assertThrows(IllegalStateException.class, () -> EventProjection.builder("Empty").build());
        assertThrows(IllegalArgumentException.class, () -> EventProjection.builder(" "));
        assertThrows(IllegalArgumentException.class, () -> EventProjection.builder("Distance").shards(0));
    }

    @Test
    void testRegistryRejectsDuplicateNames() {
        assertThrows(IllegalArgumentException.class,
            () -> new ProjectionRegistry(List.of(distance(1), distance(2))));

        ProjectionRegistry registry = new ProjectionRegistry(List.of(distance(2)));
        assertTrue(registry.find("Distance").isPresent());
        assertEquals(2, registry.allShardNames().size());
        assertTrue(registry.snapshotFor(String.class).isEmpty());
    }
}
