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

import dev.mars.pgevents.api.StreamEvent;
import dev.mars.pgevents.api.StreamIdentity;
import dev.mars.pgevents.api.StreamState;
import dev.mars.pgevents.api.WritableStream;
import dev.mars.pgevents.api.error.StreamLockedException;
import dev.mars.pgevents.store.fixtures.Travelled;
import dev.mars.pgevents.store.fixtures.Trip;
import dev.mars.pgevents.store.fixtures.TripStarted;
import dev.mars.pgevents.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Streams keyed by strings.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-07
 * @version 1.0
 */
@Tag(TestCategories.INTEGRATION)
class StringStreamIdentityIntegrationTest extends BaseStoreIntegrationTest {

    @Override
    protected PgEventStore.Builder configure(PgEventStore.Builder builder) {
        return super.configure(builder).streamIdentity(StreamIdentity.AS_STRING);
    }

    @Test
    void streamsAreKeyedByString() throws Exception {
        try (EventSession session = store.openSession()) {
            session.startStream(Trip.class, "trip-42", new TripStarted("quinn"), new Travelled(4));
            session.saveChanges().get(10, TimeUnit.SECONDS);
        }

        StreamState state = store.fetchStreamState("trip-42").get(10, TimeUnit.SECONDS).orElseThrow();
        assertEquals("trip-42", state.getKey());
        assertNull(state.getId());
        assertEquals(2, state.getVersion());

        List<StreamEvent<?>> events = store.openSession().fetchStream("trip-42").get(10, TimeUnit.SECONDS);
        assertEquals("trip-42", events.get(1).getStreamKey());

        try (EventSession session = store.openSession()) {
            WritableStream<Trip> stream = session.fetchForWriting(Trip.class, "trip-42").get(10, TimeUnit.SECONDS);
            assertEquals("trip-42", stream.getKey());
            assertEquals(4, stream.getAggregate().kilometres());
        }
    }

    @Test
    void exclusiveLocksOfKeysWithEqualHashCodesAreIndependent() throws Exception {
        assertEquals("Aa".hashCode(), "BB".hashCode());
        try (EventSession session = store.openSession()) {
            session.startStream(Trip.class, "Aa", new TripStarted("sam"));
            session.startStream(Trip.class, "BB", new TripStarted("tess"));
            session.saveChanges().get(10, TimeUnit.SECONDS);
        }

        try (EventSession first = store.openSession();
             EventSession second = store.openSession();
             EventSession third = store.openSession()) {
            WritableStream<Trip> aa = first.fetchForExclusiveWriting(Trip.class, "Aa").get(10, TimeUnit.SECONDS);
            WritableStream<Trip> bb = second.fetchForExclusiveWriting(Trip.class, "BB").get(10, TimeUnit.SECONDS);
            assertEquals("Aa", aa.getKey());
            assertEquals("BB", bb.getKey());

            ExecutionException locked = assertThrows(ExecutionException.class,
                () -> third.fetchForExclusiveWriting(Trip.class, "Aa").get(10, TimeUnit.SECONDS));
            assertInstanceOf(StreamLockedException.class, locked.getCause());

            bb.appendOne(new Travelled(3));
            second.saveChanges().get(10, TimeUnit.SECONDS);
        }

        assertEquals(2, store.fetchStreamState("BB").get(10, TimeUnit.SECONDS).orElseThrow().getVersion());
    }

    @Test
    void guidIdentitiesAreRejected() {
        try (EventSession session = store.openSession()) {
            assertThrows(IllegalArgumentException.class,
                () -> session.startStream(UUID.randomUUID(), new TripStarted("rosa")));
        }
    }
}
