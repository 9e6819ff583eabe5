package dev.mars.pgevents.daemon.loading;

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

import dev.mars.pgevents.api.error.EventLoaderException;
import dev.mars.pgevents.api.projection.ShardName;
import dev.mars.pgevents.db.config.PgEventsConfiguration;
import dev.mars.pgevents.db.resilience.RetryPolicyManager;
import dev.mars.pgevents.test.categories.TestCategories;
import io.vertx.core.Future;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class ResilientEventLoaderTest {

    private static final ShardName SHARD = ShardName.all("Ledger");
    private static final EventRequest REQUEST = new EventRequest(SHARD, 0, 10);

    private ScheduledExecutorService scheduler;
    private RetryPolicyManager retries;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        retries = new RetryPolicyManager(new PgEventsConfiguration.DaemonConfig(Duration.ofSeconds(1),
            Duration.ofSeconds(3), 100, 3, Duration.ofMillis(5), 1.5, Duration.ofMillis(50), Duration.ofMinutes(1)), null);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void testTransientFailuresAreRetried() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        EventLoader flaky = request -> attempts.incrementAndGet() < 3
            ? Future.failedFuture(new IllegalStateException("connection reset"))
            : Future.succeededFuture(new EventPage(request, List.of(), 0));

        EventPage page = load(new ResilientEventLoader(flaky, retries.getRetry("flaky"), scheduler, "db"));

        assertEquals(3, attempts.get());
        assertEquals(10, page.ceiling());
        assertTrue(page.isEmpty());
    }

    @Test
    void testExhaustedRetriesRaiseLoaderException() {
        AtomicInteger attempts = new AtomicInteger();
        EventLoader broken = request -> {
            attempts.incrementAndGet();
            return Future.failedFuture(new IllegalStateException("database down"));
        };
        ResilientEventLoader loader = new ResilientEventLoader(broken, retries.getRetry("broken"), scheduler, "db@host:5432");

        ExecutionException error = assertThrows(ExecutionException.class, () -> load(loader));

        EventLoaderException loaderError = assertInstanceOf(EventLoaderException.class, error.getCause());
        assertEquals(SHARD.getIdentity(), loaderError.getShardName());
        assertEquals("db@host:5432", loaderError.getDatabaseIdentifier());
        assertEquals("database down", loaderError.getCause().getMessage());
        assertEquals(3, attempts.get());
    }

    private static EventPage load(EventLoader loader) throws Exception {
        return loader.load(REQUEST).toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
    }
}
