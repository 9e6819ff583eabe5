package dev.mars.pgevents.daemon.deadletter;

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
import dev.mars.pgevents.api.StreamIdentity;
import dev.mars.pgevents.api.TenancyStyle;
import dev.mars.pgevents.api.projection.ShardName;
import dev.mars.pgevents.daemon.fixtures.Withdrawn;
import dev.mars.pgevents.store.projection.ProjectionBatch;
import dev.mars.pgevents.store.schema.EventStoreSchema;
import dev.mars.pgevents.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class DeadLetterEventManagerTest {

    private static final String GRINNING = "\uD83D\uDE00";

    @Test
    void testShortMessagesAreKept() {
        assertNull(DeadLetterEventManager.truncate(null));
        assertEquals("boom " + GRINNING, DeadLetterEventManager.truncate("boom " + GRINNING));
    }

    @Test
    void testLongMessagesAreCutOnCodePoints() {
        String message = "x" + GRINNING.repeat(DeadLetterEventManager.MAX_MESSAGE_LENGTH);

        String truncated = DeadLetterEventManager.truncate(message);

        assertEquals(DeadLetterEventManager.MAX_MESSAGE_LENGTH, truncated.codePointCount(0, truncated.length()));
        assertFalse(Character.isHighSurrogate(truncated.charAt(truncated.length() - 1)));
        assertTrue(truncated.endsWith(GRINNING));
    }

    @Test
    void testRecordInAddsOneInsertWithTheTruncatedMessage() {
        DeadLetterEventManager manager = new DeadLetterEventManager(null,
            new EventStoreSchema("ledger_test", StreamIdentity.AS_GUID, TenancyStyle.SINGLE));
        UUID streamId = UUID.randomUUID();
        SimpleStreamEvent<Withdrawn> event = new SimpleStreamEvent<>(UUID.randomUUID(), 7, 2, streamId,
            new Withdrawn(5000), "withdrawn", Instant.now(), null, false);
        ProjectionBatch batch = new ProjectionBatch();

        manager.recordIn(batch, ShardName.all("Ledger"), event,
            new IllegalArgumentException(GRINNING.repeat(DeadLetterEventManager.MAX_MESSAGE_LENGTH + 1)));

        assertEquals(1, batch.size());
        ProjectionBatch.Statement insert = batch.getStatements().get(0);
        assertTrue(insert.sql().startsWith("INSERT INTO ledger_test.pge_dead_letters"));
        assertEquals("Ledger", insert.params().getString(0));
        assertEquals(7L, insert.params().getLong(2));
        assertEquals(streamId.toString(), insert.params().getString(4));
        String message = insert.params().getString(7);
        assertEquals(DeadLetterEventManager.MAX_MESSAGE_LENGTH, message.codePointCount(0, message.length()));
    }
}
