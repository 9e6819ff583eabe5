package dev.mars.pgevents.db.resilience;

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

import dev.mars.pgevents.db.config.PgEventsConfiguration;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@Tag("core")
class RetryPolicyManagerTest {

    private static PgEventsConfiguration.DaemonConfig daemonConfig(int maxAttempts) {
        return new PgEventsConfiguration.DaemonConfig(Duration.ofSeconds(1), Duration.ofSeconds(3), 100,
            maxAttempts, Duration.ofMillis(5), 1.5, Duration.ofMillis(50), Duration.ofMinutes(1));
    }

    @Test
    void testOneRetryPerName() {
        RetryPolicyManager manager = new RetryPolicyManager(daemonConfig(3), new SimpleMeterRegistry());

        Retry first = manager.getRetry("Trip:All");
        Retry again = manager.getRetry("Trip:All");
        Retry other = manager.getRetry("Trip:1");

        assertSame(first, again);
        assertNotSame(first, other);
        assertEquals(Set.of("Trip:All", "Trip:1"), manager.getRetryNames());
        assertEquals(3, manager.getMaxAttempts());
    }

    @Test
    void testRetriesUntilSuccess() {
        RetryPolicyManager manager = new RetryPolicyManager(daemonConfig(3), null);
        AtomicInteger calls = new AtomicInteger();

        String result = manager.getRetry("flaky").executeSupplier(() -> {
            if (calls.incrementAndGet() < 3) {
                throw new IllegalStateException("connection reset");
            }
            return "page";
        });

        assertEquals("page", result);
        assertEquals(3, calls.get());
    }

    @Test
    void testGivesUpAfterMaxAttempts() {
        RetryPolicyManager manager = new RetryPolicyManager(daemonConfig(2), null);
        AtomicInteger calls = new AtomicInteger();

        IllegalStateException error = assertThrows(IllegalStateException.class,
            () -> manager.getRetry("broken").executeRunnable(() -> {
                calls.incrementAndGet();
                throw new IllegalStateException("database down");
            }));

        assertEquals("database down", error.getMessage());
        assertEquals(2, calls.get());
    }

    @Test
    void testRetryMetricsAreBound() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        RetryPolicyManager manager = new RetryPolicyManager(daemonConfig(2), registry);

        manager.getRetry("Trip:All").executeSupplier(() -> "ok");

        assertFalse(registry.find("resilience4j.retry.calls").meters().isEmpty());
    }
}
