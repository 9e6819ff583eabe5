package dev.mars.pgevents.store.aggregation;

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
import dev.mars.pgevents.store.fixtures.Travelled;
import dev.mars.pgevents.store.fixtures.Trip;
import dev.mars.pgevents.store.fixtures.TripEnded;
import dev.mars.pgevents.store.fixtures.TripStarted;
import dev.mars.pgevents.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class AggregatorTest {

    private static final UUID STREAM = UUID.randomUUID();

    private static List<StreamEvent<?>> events(Object... data) {
        List<StreamEvent<?>> events = new ArrayList<>();
        for (int i = 0; i < data.length; i++) {
            events.add(new SimpleStreamEvent<>(UUID.randomUUID(), i + 1, i + 1, STREAM, data[i],
                data[i].getClass().getSimpleName(), Instant.now(), null, false));
        }
        return events;
    }

    @Test
    void testBuildFoldsInOrder() {
        Trip trip = Trip.AGGREGATOR.build(events(
            new TripStarted("Ann"), new Travelled(5), new Travelled(7), new TripEnded("arrived")));

        assertEquals(new Trip("Ann", 12, true, 4), trip);
    }

    @Test
    void testNoEventsBuildsNothing() {
        assertNull(Trip.AGGREGATOR.build(List.of()));
    }

    @Test
    void testFoldContinuesFromExistingAggregate() {
        Trip start = new Trip("Bob", 10, false, 2);

        Trip trip = Trip.AGGREGATOR.fold(start, events(new Travelled(3)));

        assertEquals(new Trip("Bob", 13, false, 3), trip);
    }

    @Test
    void testUnhandledEventsAreIgnored() {
        Trip trip = Trip.AGGREGATOR.build(events(new TripStarted("Ann"), "not a trip event", new Travelled(1)));

        assertEquals(1, trip.kilometres());
        assertEquals(2, trip.changes());
    }

    @Test
    void testFirstEventWithoutCreatorFails() {
        IllegalStateException error = assertThrows(IllegalStateException.class,
            () -> Trip.AGGREGATOR.build(events(new Travelled(4))));

        assertTrue(error.getMessage().contains("createdBy(Travelled)"));
    }

    @Test
    void testDefaultCreatorThenApply() {
        Aggregator<Trip> aggregator = Aggregator.forType(Trip.class)
            .defaultCreator(event -> new Trip("unknown", 0, false, 0))
            .apply(Travelled.class, Trip::travel)
            .build();

        Trip trip = aggregator.build(events(new Travelled(4)));

        assertEquals(new Trip("unknown", 4, false, 1), trip);
    }

    @Test
    void testSupertypeHandlersMatch() {
        Aggregator<Integer> counter = Aggregator.forType(Integer.class)
            .createdBy(CharSequence.class, text -> text.length())
            .apply(Number.class, (total, number) -> total + number.intValue())
            .build();

        assertEquals(8, counter.build(events("abc", 2, 3L)));
    }

    @Test
    void testHandledEventTypes() {
        assertEquals(Set.of(TripStarted.class, Travelled.class, TripEnded.class),
            Trip.AGGREGATOR.getHandledEventTypes());
        assertEquals(Trip.class, Trip.AGGREGATOR.getAggregateType());
    }
}
