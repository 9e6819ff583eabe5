package dev.mars.pgevents.daemon;

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

import dev.mars.pgevents.api.error.ExistingStreamIdCollisionException;
import dev.mars.pgevents.api.error.PgEventsErrorCodes;
import dev.mars.pgevents.api.error.PgEventsException;
import dev.mars.pgevents.api.projection.ShardName;
import dev.mars.pgevents.daemon.agent.AgentStatus;
import dev.mars.pgevents.daemon.fixtures.Account;
import dev.mars.pgevents.daemon.fixtures.AccountOpened;
import dev.mars.pgevents.daemon.fixtures.Deposited;
import dev.mars.pgevents.daemon.fixtures.Ledger;
import dev.mars.pgevents.daemon.fixtures.Withdrawn;
import dev.mars.pgevents.db.PgEventsManager;
import dev.mars.pgevents.store.EventSession;
import dev.mars.pgevents.store.PgEventStore;
import dev.mars.pgevents.store.projection.SnapshotProjection;
import dev.mars.pgevents.test.SharedPostgresTestExtension;
import dev.mars.pgevents.test.categories.TestCategories;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Shard agents, the high-water agent and projection rebuilds running against a real database.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-07
 * @version 1.0
 */
@Tag(TestCategories.INTEGRATION)
class ProjectionDaemonIntegrationTest extends BaseDaemonIntegrationTest {

    @Test
    void testStartAllCatchesUpEveryProjection() throws Exception {
        UUID alice = openAccount("alice", new Deposited(100), new Deposited(50));
        openAccount("bob", new Deposited(10), new Withdrawn(5));
        append(alice, new Withdrawn(30));
        long last = lastSequence();

        daemon = PgProjectionDaemon.builder(manager, store).build();
        daemon.startAll().get(10, TimeUnit.SECONDS);

        await().atMost(Duration.ofSeconds(15))
            .until(() -> progressOf(LEDGER_SHARD) == last && progressOf(ACCOUNT_SHARD) == last);

        assertEquals(125, ledgerTotal());
        try (EventSession session = store.openSession()) {
            assertEquals(new Account("alice", 120), session.loadSnapshot(Account.class, alice)
                .get(10, TimeUnit.SECONDS).orElseThrow());
        }
        assertEquals(Map.of(LEDGER_SHARD, AgentStatus.RUNNING, ACCOUNT_SHARD, AgentStatus.RUNNING), daemon.statuses());
        assertEquals(last, daemon.highWater().getMark());
        assertEquals(last, daemon.tracker().highWaterMark());
    }

    @Test
    void testWaitForNonStaleDataCoversNewEvents() throws Exception {
        daemon = PgProjectionDaemon.builder(manager, store).build();
        daemon.startAll().get(10, TimeUnit.SECONDS);

        UUID carol = openAccount("carol", new Deposited(40));
        append(carol, new Deposited(2));
        daemon.waitForNonStaleData(Duration.ofSeconds(10)).get(15, TimeUnit.SECONDS);

        assertEquals(42, ledgerTotal());
        assertEquals(lastSequence(), progressOf(ACCOUNT_SHARD));
    }

    @Test
    void testStoppedAgentKeepsItsProgress() throws Exception {
        daemon = PgProjectionDaemon.builder(manager, store).build();
        daemon.startAll().get(10, TimeUnit.SECONDS);
        UUID dan = openAccount("dan", new Deposited(5));
        daemon.waitForNonStaleData(Duration.ofSeconds(10)).get(15, TimeUnit.SECONDS);

        daemon.stopAgent(LEDGER_SHARD).get(10, TimeUnit.SECONDS);
        assertEquals(AgentStatus.STOPPED, daemon.statuses().get(LEDGER_SHARD));
        long stoppedAt = progressOf(LEDGER_SHARD);

        append(dan, new Deposited(7));
        long last = lastSequence();
        await().atMost(Duration.ofSeconds(15)).until(() -> progressOf(ACCOUNT_SHARD) == last);
        assertEquals(stoppedAt, progressOf(LEDGER_SHARD));
        assertEquals(5, ledgerTotal());

        daemon.startAgent(LEDGER_SHARD).get(10, TimeUnit.SECONDS);
        await().atMost(Duration.ofSeconds(15)).until(() -> ledgerTotal() == 12);
        assertEquals(last, progressOf(LEDGER_SHARD));
    }

    @Test
    void testRebuildReplaysTheProjectionFromScratch() throws Exception {
        openAccount("erin", new Deposited(20), new Deposited(30), new Withdrawn(5));
        openAccount("finn", new Deposited(1));
        daemon = PgProjectionDaemon.builder(manager, store).build();
        daemon.startAll().get(10, TimeUnit.SECONDS);
        daemon.waitForNonStaleData(Duration.ofSeconds(10)).get(15, TimeUnit.SECONDS);

        SharedPostgresTestExtension.execute("UPDATE " + Ledger.table(schema) + " SET amount = 0");
        assertEquals(0, ledgerTotal());

        daemon.rebuildProjection(Ledger.NAME).get(30, TimeUnit.SECONDS);

        assertEquals(46, ledgerTotal());
        assertEquals(4, ledgerRows());
        assertEquals(lastSequence(), progressOf(LEDGER_SHARD));
        assertEquals(AgentStatus.STOPPED, daemon.statuses().get(LEDGER_SHARD));
        assertEquals(AgentStatus.RUNNING, daemon.statuses().get(ACCOUNT_SHARD));
    }

    @Test
    void testRebuildByAggregateTypeWithoutStartingTheDaemon() throws Exception {
        UUID gail = openAccount("gail", new Deposited(9), new Withdrawn(4));
        daemon = PgProjectionDaemon.builder(manager, store).build();

        daemon.rebuildProjection(Account.class, Duration.ofSeconds(30)).get(30, TimeUnit.SECONDS);

        try (EventSession session = store.openSession()) {
            assertEquals(new Account("gail", 5), session.loadSnapshot(Account.class, gail)
                .get(10, TimeUnit.SECONDS).orElseThrow());
        }
        assertEquals(lastSequence(), progressOf(ACCOUNT_SHARD));
        assertEquals(0, progressOf(LEDGER_SHARD));
    }

    @Test
    void testRebuildOfAnEmptyStoreDoesNothing() throws Exception {
        daemon = PgProjectionDaemon.builder(manager, store).build();

        daemon.rebuildProjection(Ledger.NAME).get(10, TimeUnit.SECONDS);

        assertEquals(0, progressOf(LEDGER_SHARD));
        assertTrue(store.projectionProgressFor(LEDGER_SHARD).get(10, TimeUnit.SECONDS).isEmpty());
    }

    @Test
    void testRebuildSkipsTheGapOfARolledBackSave() throws Exception {
        UUID ivy = openAccount("ivy", new Deposited(10));
        try (EventSession session = store.openSession()) {
            session.startStream(Account.class, ivy, new AccountOpened("ivy again"), new Deposited(99));
            ExecutionException collision = assertThrows(ExecutionException.class,
                () -> session.saveChanges().get(10, TimeUnit.SECONDS));
            assertInstanceOf(ExistingStreamIdCollisionException.class, collision.getCause());
        }
        openAccount("jon", new Deposited(5));
        backdateEvents(Duration.ofHours(1));
        long highest = highestCommittedSequence();
        assertEquals(6, highest);

        daemon = PgProjectionDaemon.builder(manager, store).build();
        daemon.rebuildProjection(Ledger.NAME).get(30, TimeUnit.SECONDS);

        assertEquals(highest, progressOf(LEDGER_SHARD));
        assertEquals(highest, daemon.tracker().highWaterMark());
        assertEquals(15, ledgerTotal());
        assertEquals(2, ledgerRows());
        assertEquals(1.0, meterRegistry.get("pgevents.daemon.skipped_gaps").counter().count());
    }

    @Test
    void testRebuildDrainsEveryShardInParallel() throws Exception {
        PgEventStore sharded = PgEventStore.builder(manager)
            .projection(Ledger.projection(schema, 3))
            .build();
        long expectedTotal = 0;
        for (int i = 1; i <= 12; i++) {
            openAccount("owner-" + i, new Deposited(i), new Deposited(100));
            expectedTotal += i + 100;
        }
        long last = lastSequence();

        daemon = PgProjectionDaemon.builder(manager, sharded).build();
        daemon.rebuildProjection(Ledger.NAME).get(30, TimeUnit.SECONDS);

        List<ShardName> shards = List.of(
            new ShardName(Ledger.NAME, "0"), new ShardName(Ledger.NAME, "1"), new ShardName(Ledger.NAME, "2"));
        for (ShardName shard : shards) {
            assertEquals(last, progressOf(shard), "progress of " + shard);
            assertEquals(AgentStatus.STOPPED, daemon.statuses().get(shard));
        }
        assertEquals(3, daemon.statuses().size());
        assertEquals(expectedTotal, ledgerTotal());
        assertEquals(24, ledgerRows());
    }

    @Test
    void testCancelledRebuildStopsItsAgents() throws Exception {
        long expectedTotal = fillLedger(10);

        daemon = PgProjectionDaemon.builder(manager, store).build();
        CompletableFuture<Void> rebuild = daemon.rebuildProjection(Ledger.NAME);
        assertTrue(rebuild.cancel(true));

        assertTrue(rebuild.isCancelled());
        assertThrows(CancellationException.class, () -> rebuild.get(10, TimeUnit.SECONDS));
        await().atMost(Duration.ofSeconds(15)).until(() ->
            daemon.statuses().getOrDefault(LEDGER_SHARD, AgentStatus.STOPPED) == AgentStatus.STOPPED);

        daemon.rebuildProjection(Ledger.NAME).get(30, TimeUnit.SECONDS);
        assertEquals(expectedTotal, ledgerTotal());
        assertEquals(lastSequence(), progressOf(LEDGER_SHARD));
    }

    @Test
    void testShardMissingTheRebuildTimeoutFailsTheRebuild() throws Exception {
        long expectedTotal = fillLedger(10);
        long last = lastSequence();

        daemon = PgProjectionDaemon.builder(manager, store).build();
        ExecutionException error = assertThrows(ExecutionException.class,
            () -> daemon.rebuildProjection(Ledger.NAME, Duration.ofMillis(1)).get(30, TimeUnit.SECONDS));

        assertInstanceOf(TimeoutException.class, error.getCause());
        assertEquals(AgentStatus.STOPPED, daemon.statuses().get(LEDGER_SHARD));
        assertTrue(progressOf(LEDGER_SHARD) < last);

        daemon.rebuildProjection(Ledger.NAME, Duration.ofSeconds(30)).get(30, TimeUnit.SECONDS);
        assertEquals(expectedTotal, ledgerTotal());
        assertEquals(last, progressOf(LEDGER_SHARD));
    }

    private long fillLedger(int accounts) throws Exception {
        long total = 0;
        for (int i = 1; i <= accounts; i++) {
            openAccount("saver-" + i, new Deposited(i), new Deposited(10), new Deposited(20), new Withdrawn(1));
            total += i + 29;
        }
        return total;
    }

    @Test
    void testUnknownProjectionsAreRejected() {
        daemon = PgProjectionDaemon.builder(manager, store).build();

        ExecutionException rebuild = assertThrows(ExecutionException.class,
            () -> daemon.rebuildProjection("Nope").get(10, TimeUnit.SECONDS));
        PgEventsException notFound = assertInstanceOf(PgEventsException.class, rebuild.getCause());
        assertEquals(PgEventsErrorCodes.PROJECTION_NOT_FOUND, notFound.getErrorCode());

        ExecutionException start = assertThrows(ExecutionException.class,
            () -> daemon.startAgent(ShardName.all("Nope")).get(10, TimeUnit.SECONDS));
        assertInstanceOf(PgEventsException.class, start.getCause());

        ExecutionException wrongShard = assertThrows(ExecutionException.class,
            () -> daemon.startAgent(new ShardName(Ledger.NAME, "3")).get(10, TimeUnit.SECONDS));
        assertInstanceOf(IllegalArgumentException.class, wrongShard.getCause());
    }

    @Test
    void testPrepareForRebuildsStopsPollingAtTheCurrentMark() throws Exception {
        daemon = PgProjectionDaemon.builder(manager, store).build();
        daemon.startAll().get(10, TimeUnit.SECONDS);
        openAccount("hugo", new Deposited(3));

        daemon.prepareForRebuilds().get(10, TimeUnit.SECONDS);

        assertFalse(daemon.highWater().isRunning());
        assertEquals(lastSequence(), daemon.highWater().getMark());
    }

    @Test
    void testPrepareForRebuildsCreatesMissingStorage() throws Exception {
        String bare = SharedPostgresTestExtension.createFreshSchema("bare_daemon");
        PgEventsManager bareManager = new PgEventsManager(
            SharedPostgresTestExtension.configurationFor(bare, daemonProperties()), new SimpleMeterRegistry());
        bareManager.start();
        PgEventStore bareStore = PgEventStore.builder(bareManager)
            .projection(SnapshotProjection.of(Account.AGGREGATOR))
            .build();
        try (PgProjectionDaemon bareDaemon = PgProjectionDaemon.builder(bareManager, bareStore).build()) {
            bareDaemon.prepareForRebuilds().get(10, TimeUnit.SECONDS);

            assertEquals(0, bareDaemon.highWater().getMark());
            assertEquals(1, bareStore.fetchEventStoreStatistics().get(10, TimeUnit.SECONDS).eventSequenceNumber());
            bareDaemon.rebuildProjection(Account.class, Duration.ofSeconds(10)).get(10, TimeUnit.SECONDS);
        } finally {
            bareManager.close();
        }
    }

    @Test
    void testStopAllStopsEveryAgent() throws Exception {
        daemon = PgProjectionDaemon.builder(manager, store).build();
        daemon.startAll().get(10, TimeUnit.SECONDS);

        daemon.stopAll().get(10, TimeUnit.SECONDS);

        assertTrue(daemon.statuses().values().stream().allMatch(status -> status == AgentStatus.STOPPED));
        assertFalse(daemon.highWater().isRunning());
    }
}
