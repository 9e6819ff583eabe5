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

import dev.mars.pgevents.api.error.ApplyEventException;
import dev.mars.pgevents.api.projection.ShardName;
import dev.mars.pgevents.daemon.BaseDaemonIntegrationTest;
import dev.mars.pgevents.daemon.PgProjectionDaemon;
import dev.mars.pgevents.daemon.agent.AgentStatus;
import dev.mars.pgevents.daemon.agent.ErrorHandlingOptions;
import dev.mars.pgevents.daemon.fixtures.Deposited;
import dev.mars.pgevents.daemon.fixtures.Ledger;
import dev.mars.pgevents.daemon.fixtures.Withdrawn;
import dev.mars.pgevents.test.SharedPostgresTestExtension;
import dev.mars.pgevents.test.categories.TestCategories;
import io.vertx.pgclient.PgException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Events a projection cannot apply, with and without strict error handling.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-07
 * @version 1.0
 */
@Tag(TestCategories.INTEGRATION)
class DeadLetterIntegrationTest extends BaseDaemonIntegrationTest {

    @Test
    void testFailedEventsAreDeadLetteredAndSkipped() throws Exception {
        UUID gus = openAccount("gus", new Deposited(100), new Withdrawn(5000), new Deposited(1));
        daemon = PgProjectionDaemon.builder(manager, store).build();
        daemon.startAll().get(10, TimeUnit.SECONDS);
        daemon.waitForNonStaleData(Duration.ofSeconds(10)).get(15, TimeUnit.SECONDS);

        assertEquals(101, ledgerTotal());
        assertEquals(lastSequence(), progressOf(LEDGER_SHARD));
        assertEquals(AgentStatus.RUNNING, daemon.statuses().get(LEDGER_SHARD));

        List<DeadLetterEvent> deadLetters = daemon.deadLetters().findFor(Ledger.NAME)
            .toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
        assertEquals(1, deadLetters.size());
        DeadLetterEvent deadLetter = deadLetters.get(0);
        assertEquals(3, deadLetter.eventSequence());
        assertEquals(gus.toString(), deadLetter.streamId());
        assertEquals("withdrawn", deadLetter.eventType());
        assertEquals(LEDGER_SHARD.getIdentity(), deadLetter.shardName());
        assertEquals(IllegalArgumentException.class.getName(), deadLetter.errorType());
        assertTrue(deadLetter.errorMessage().contains("exceeds the limit"));

        assertEquals(1.0, meterRegistry.get("pgevents.projections.dead_letters").counter().count());
    }

    @Test
    void testRejectedStatementsAreDeadLetteredAndTheShardContinues() throws Exception {
        UUID jack = openAccount("jack", new Deposited(10), new Deposited(20), new Deposited(30));
        occupyLedgerRow(3);

        daemon = PgProjectionDaemon.builder(manager, store).build();
        daemon.startAll().get(10, TimeUnit.SECONDS);
        daemon.waitForNonStaleData(Duration.ofSeconds(10)).get(15, TimeUnit.SECONDS);

        assertEquals(AgentStatus.RUNNING, daemon.statuses().get(LEDGER_SHARD));
        assertEquals(lastSequence(), progressOf(LEDGER_SHARD));
        assertEquals(3, ledgerRows());
        assertEquals(10 + 500 + 30, ledgerTotal());

        List<DeadLetterEvent> deadLetters = daemon.deadLetters().findFor(Ledger.NAME)
            .toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
        assertEquals(1, deadLetters.size());
        assertEquals(3, deadLetters.get(0).eventSequence());
        assertEquals(jack.toString(), deadLetters.get(0).streamId());
        assertEquals("deposited", deadLetters.get(0).eventType());
        assertEquals(PgException.class.getName(), deadLetters.get(0).errorType());
        assertEquals(1.0, meterRegistry.get("pgevents.projections.dead_letters").counter().count());
    }

    @Test
    void testStrictProjectionPausesOnRejectedStatement() throws Exception {
        Map<ShardName, Throwable> failures = new ConcurrentHashMap<>();
        openAccount("kate", new Deposited(10), new Deposited(20));
        occupyLedgerRow(2);

        daemon = PgProjectionDaemon.builder(manager, store)
            .errorHandling(Ledger.NAME, ErrorHandlingOptions.strict())
            .onAgentFailure(failures::put)
            .build();
        daemon.startAll().get(10, TimeUnit.SECONDS);

        await().atMost(Duration.ofSeconds(15)).until(() -> failures.containsKey(LEDGER_SHARD));

        ApplyEventException error = assertInstanceOf(ApplyEventException.class, failures.get(LEDGER_SHARD));
        assertEquals(2, error.getSequence());
        assertInstanceOf(PgException.class, error.getCause());
        assertEquals(AgentStatus.PAUSED, daemon.statuses().get(LEDGER_SHARD));
        assertEquals(0, progressOf(LEDGER_SHARD));
        assertEquals(1, ledgerRows());
    }

    @Test
    void testRebuildReplacesDeadLetters() throws Exception {
        openAccount("ida", new Withdrawn(2000), new Deposited(4));
        daemon = PgProjectionDaemon.builder(manager, store).build();
        daemon.startAll().get(10, TimeUnit.SECONDS);
        daemon.waitForNonStaleData(Duration.ofSeconds(10)).get(15, TimeUnit.SECONDS);

        daemon.rebuildProjection(Ledger.NAME).get(30, TimeUnit.SECONDS);

        assertEquals(1L, daemon.deadLetters().countFor(Ledger.NAME)
            .toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS));
        assertEquals(4, ledgerTotal());
    }

    @Test
    void testStrictProjectionPausesOnFailure() throws Exception {
        Map<ShardName, Throwable> failures = new ConcurrentHashMap<>();
        openAccount("hana", new Deposited(10), new Withdrawn(2000));
        long last = lastSequence();

        daemon = PgProjectionDaemon.builder(manager, store)
            .errorHandling(Ledger.NAME, ErrorHandlingOptions.strict())
            .onAgentFailure(failures::put)
            .build();
        daemon.startAll().get(10, TimeUnit.SECONDS);

        await().atMost(Duration.ofSeconds(15)).until(() -> failures.containsKey(LEDGER_SHARD));

        ApplyEventException error = assertInstanceOf(ApplyEventException.class, failures.get(LEDGER_SHARD));
        assertEquals(3, error.getSequence());
        assertEquals(AgentStatus.PAUSED, daemon.statuses().get(LEDGER_SHARD));
        assertEquals(0, progressOf(LEDGER_SHARD));
        assertEquals(0, ledgerRows());
        assertEquals(0L, daemon.deadLetters().countFor(Ledger.NAME)
            .toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS));

        await().atMost(Duration.ofSeconds(15)).until(() -> progressOf(ACCOUNT_SHARD) == last);
        assertEquals(AgentStatus.RUNNING, daemon.statuses().get(ACCOUNT_SHARD));
        assertFalse(failures.containsKey(ACCOUNT_SHARD));
    }

    /**
     * Inserts a ledger row under {@code sequence}, so projecting that event violates the primary key.
     */
    private void occupyLedgerRow(long sequence) throws Exception {
        SharedPostgresTestExtension.execute("INSERT INTO " + Ledger.table(schema)
            + " (seq_id, stream_id, amount) VALUES (" + sequence + ", 'manual', 500)");
    }
}
