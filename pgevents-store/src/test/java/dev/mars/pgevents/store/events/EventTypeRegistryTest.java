package dev.mars.pgevents.store.events;

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

import dev.mars.pgevents.api.error.UnknownEventTypeException;
import dev.mars.pgevents.store.fixtures.Travelled;
import dev.mars.pgevents.store.fixtures.TripEnded;
import dev.mars.pgevents.store.fixtures.TripStarted;
import dev.mars.pgevents.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class EventTypeRegistryTest {

    @Test
    void testDefaultAliasIsSnakeCase() {
        assertEquals("trip_started", EventTypeRegistry.defaultAlias(TripStarted.class));
        assertEquals("travelled", EventTypeRegistry.defaultAlias(Travelled.class));
        assertEquals("trip_ended", EventTypeRegistry.defaultAlias(TripEnded.class));
    }

    @Test
    void testRegisteredAliases() {
        EventTypeRegistry registry = EventTypeRegistry.builder()
            .register(TripStarted.class)
            .register(Travelled.class, "moved")
            .build();

        assertEquals("trip_started", registry.aliasFor(TripStarted.class));
        assertEquals("moved", registry.aliasFor(Travelled.class));
        assertEquals(Optional.of(Travelled.class), registry.typeFor("moved"));
        assertTrue(registry.isRegistered(Travelled.class));
        assertFalse(registry.isRegistered(TripEnded.class));
        assertEquals("trip_ended", registry.aliasFor(TripEnded.class));
    }

    @Test
    void testResolvePrefersRegisteredAlias() {
        EventTypeRegistry registry = EventTypeRegistry.builder().register(Travelled.class, "moved").build();

        assertEquals(Travelled.class, registry.resolve("moved", "com.example.Gone"));
    }

    @Test
    void testResolveFallsBackToStoredClassName() {
        EventTypeRegistry registry = EventTypeRegistry.empty();

        assertEquals(TripEnded.class, registry.resolve("trip_ended", TripEnded.class.getName()));
    }

    @Test
    void testResolveRejectsClassNameNotMatchingAlias() {
        EventTypeRegistry registry = EventTypeRegistry.empty();

        assertThrows(UnknownEventTypeException.class, () -> registry.resolve("moved", TripEnded.class.getName()));
    }

    @Test
    void testUnknownTypeFails() {
        EventTypeRegistry registry = EventTypeRegistry.empty();

        assertThrows(UnknownEventTypeException.class, () -> registry.resolve("gone", "com.example.Gone"));
        assertThrows(UnknownEventTypeException.class, () -> registry.resolve("gone", null));
    }

    @Test
    void testDuplicateAliasIsRejected() {
        EventTypeRegistry.Builder builder = EventTypeRegistry.builder().register(Travelled.class, "moved");

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
            () -> builder.register(TripEnded.class, "moved"));
        assertTrue(error.getMessage().contains("already registered"));
        assertThrows(IllegalArgumentException.class, () -> builder.register(TripEnded.class, " "));
    }
}
