package dev.mars.pgevents.api.error;

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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@Tag("core")
class AggregateConcurrencyExceptionTest {

    @Test
    void testCarriesEveryConflict() {
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();
        ConcurrencyException a = new ConcurrencyException("Trip", first, 2, 3);
        ConcurrencyException b = new ConcurrencyException(null, second, 0, 1);

        AggregateConcurrencyException error = new AggregateConcurrencyException(List.of(a, b));

        assertEquals(2, error.getConflicts().size());
        assertSame(a, error.getConflicts().get(0));
        assertEquals(2, error.getSuppressed().length);
        assertEquals(PgEventsErrorCodes.AGGREGATE_CONCURRENCY_CONFLICT, error.getErrorCode());
        assertTrue(error.getMessage().startsWith("2 concurrency conflicts"));
    }

    @Test
    void testConflictDescribesVersions() {
        UUID id = UUID.randomUUID();
        ConcurrencyException error = new ConcurrencyException("Trip", id, 4, 6);

        assertEquals(4, error.getExpectedVersion());
        assertEquals(6, error.getActualVersion());
        assertEquals(id, error.getStreamIdentity());
        assertEquals(PgEventsErrorCodes.CONCURRENCY_CONFLICT, error.getErrorCode());
        assertTrue(error.getMessage().contains("expected 4 but was 6"));
    }

    @Test
    void testConflictWithoutAggregateTypeNamesTheStream() {
        ConcurrencyException error = new ConcurrencyException(null, "trip-9", 1, 2);

        assertTrue(error.getMessage().contains("stream #trip-9"));
    }
}
