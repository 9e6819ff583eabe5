package dev.mars.pgevents.db.connection;

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

import dev.mars.pgevents.db.config.PgConnectionConfig;
import dev.mars.pgevents.db.config.PgPoolConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.Vertx;
import io.vertx.sqlclient.Pool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Pool bookkeeping of {@link PgConnectionManager}. Pools connect lazily, so no database is needed.
 */
@Tag("core")
class PgConnectionManagerTest {

    private Vertx vertx;
    private SimpleMeterRegistry registry;
    private PgConnectionManager connections;

    private final PgConnectionConfig connectionConfig = new PgConnectionConfig.Builder()
        .host("localhost")
        .port(5432)
        .database("pgevents")
        .username("pgevents")
        .password("secret")
        .build();
    private final PgPoolConfig poolConfig = new PgPoolConfig.Builder().maxSize(2).build();

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        registry = new SimpleMeterRegistry();
        connections = new PgConnectionManager(vertx, registry);
    }

    @AfterEach
    void tearDown() throws Exception {
        connections.close();
        vertx.close().toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
    }

    @Test
    void testPoolsAreCreatedOncePerService() {
        Pool first = connections.getOrCreateReactivePool(null, connectionConfig, poolConfig);
        Pool second = connections.getOrCreateReactivePool("", connectionConfig, poolConfig);
        Pool daemon = connections.getOrCreateReactivePool("daemon", connectionConfig, poolConfig);

        assertSame(first, second);
        assertNotSame(first, daemon);
        assertSame(first, connections.getExistingPool(null));
        assertEquals(2.0, registry.find("pgevents.db.pool.created").counters().stream()
            .mapToDouble(counter -> counter.count()).sum());
    }

    @Test
    void testHealthOfAnUnknownServiceIsFalse() throws Exception {
        assertFalse(connections.checkHealth("missing").toCompletionStage().toCompletableFuture()
            .get(10, TimeUnit.SECONDS));
    }

    @Test
    void testClosedPoolsAreForgotten() throws Exception {
        connections.getOrCreateReactivePool(null, connectionConfig, poolConfig);
        connections.getOrCreateReactivePool("daemon", connectionConfig, poolConfig);

        connections.closePoolAsync("daemon").toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
        assertNull(connections.getExistingPool("daemon"));
        assertNotNull(connections.getExistingPool(null));

        connections.closeAsync().toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
        assertNull(connections.getExistingPool(null));
        assertEquals(2.0, registry.find("pgevents.db.pool.closed").counters().stream()
            .mapToDouble(counter -> counter.count()).sum());
    }
}
