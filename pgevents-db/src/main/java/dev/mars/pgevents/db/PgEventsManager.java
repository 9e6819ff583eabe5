package dev.mars.pgevents.db;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.pgevents.db.config.PgEventsConfiguration;
import dev.mars.pgevents.db.connection.PgConnectionManager;
import dev.mars.pgevents.db.metrics.EventStoreMetrics;
import dev.mars.pgevents.db.resilience.RetryPolicyManager;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.sqlclient.Pool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Central management facade for PgEvents.
 *
 * <p>Owns the Vert.x instance (unless one is supplied), the reactive pool, the
 * Jackson mapper, the meter registry and the shared resilience policies. Event
 * stores and projection daemons are built on top of a started manager.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class PgEventsManager implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PgEventsManager.class);

    private final PgEventsConfiguration configuration;
    private final Vertx vertx;
    private final boolean vertxOwnedByManager;
    private final MeterRegistry meterRegistry;
    private final boolean meterRegistryOwnedByManager;
    private final ObjectMapper objectMapper;
    private final PgConnectionManager connectionManager;
    private final Pool pool;
    private final EventStoreMetrics metrics;
    private final RetryPolicyManager retryPolicyManager;

    private volatile boolean started = false;

    public PgEventsManager() {
        this(new PgEventsConfiguration());
    }

    public PgEventsManager(PgEventsConfiguration configuration) {
        this(configuration, new SimpleMeterRegistry(), null, true);
    }

    public PgEventsManager(PgEventsConfiguration configuration, MeterRegistry meterRegistry) {
        this(configuration, meterRegistry, null, false);
    }

    /**
     * Constructor that allows an external Vert.x instance. The manager never closes a Vert.x it did not create.
     */
    public PgEventsManager(PgEventsConfiguration configuration, MeterRegistry meterRegistry, Vertx vertx) {
        this(configuration, meterRegistry, vertx, false);
    }

    private PgEventsManager(PgEventsConfiguration configuration, MeterRegistry meterRegistry, Vertx vertx,
                            boolean meterRegistryOwnedByManager) {
        this.meterRegistryOwnedByManager = meterRegistryOwnedByManager;
        this.configuration = configuration;
        this.meterRegistry = meterRegistry;
        this.objectMapper = createDefaultObjectMapper();

        logger.info("Initializing PgEvents Manager with profile: {}", configuration.getProfile());

        if (vertx != null) {
            this.vertx = vertx;
            this.vertxOwnedByManager = false;
        } else {
            this.vertx = Vertx.vertx();
            this.vertxOwnedByManager = true;
        }

        this.connectionManager = new PgConnectionManager(this.vertx, meterRegistry);
        this.pool = connectionManager.getOrCreateReactivePool(null,
            configuration.getDatabaseConfig(), configuration.getPoolConfig());

        PgEventsConfiguration.MetricsConfig metricsConfig = configuration.getMetricsConfig();
        this.metrics = new EventStoreMetrics(metricsConfig.getInstanceId());
        if (metricsConfig.isEnabled()) {
            metrics.bindTo(meterRegistry);
        }

        this.retryPolicyManager = new RetryPolicyManager(configuration.getDaemonConfig(),
            metricsConfig.isEnabled() ? meterRegistry : null);

        logger.info("PgEvents Manager initialized for database {}", configuration.getDatabaseConfig().getDatabaseIdentifier());
    }

    /**
     * Verifies database connectivity.
     */
    public Future<Void> startReactive() {
        if (started) {
            logger.warn("PgEvents Manager is already started");
            return Future.succeededFuture();
        }

        return connectionManager.checkHealth(null)
            .compose(healthy -> {
                if (!healthy) {
                    return Future.failedFuture(new IllegalStateException(
                        "Database " + configuration.getDatabaseConfig().getDatabaseIdentifier() + " is not reachable"));
                }
                started = true;
                logger.info("PgEvents Manager started successfully");
                return Future.<Void>succeededFuture();
            });
    }

    /**
     * Blocking start. Do not call this on an event loop thread.
     */
    public synchronized void start() {
        if (Vertx.currentContext() != null && Vertx.currentContext().isEventLoopContext()) {
            throw new IllegalStateException("Do not call blocking start() on event-loop thread - use startReactive() instead");
        }
        try {
            startReactive()
                .toCompletionStage()
                .toCompletableFuture()
                .get(30, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while starting PgEvents Manager", e);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to start PgEvents Manager", e);
        }
    }

    public boolean isStarted() {
        return started;
    }

    public Future<Void> closeReactive() {
        logger.info("Closing PgEvents Manager");
        started = false;
        return connectionManager.closeAsync()
            .compose(v -> vertxOwnedByManager ? vertx.close() : Future.<Void>succeededFuture())
            .onSuccess(v -> {
                if (meterRegistryOwnedByManager) {
                    meterRegistry.close();
                }
                logger.info("PgEvents Manager closed");
            });
    }

    @Override
    public void close() {
        try {
            closeReactive().toCompletionStage().toCompletableFuture().get(30, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Interrupted while closing PgEvents Manager", e);
        } catch (Exception e) {
            logger.error("Error closing PgEvents Manager", e);
        }
    }

    private static ObjectMapper createDefaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    public PgEventsConfiguration getConfiguration() {
        return configuration;
    }

    public Vertx getVertx() {
        return vertx;
    }

    public Pool getPool() {
        return pool;
    }

    public PgConnectionManager getConnectionManager() {
        return connectionManager;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }

    public EventStoreMetrics getMetrics() {
        return metrics;
    }

    public RetryPolicyManager getRetryPolicyManager() {
        return retryPolicyManager;
    }

    /**
     * Identifier of the database, used to tag loader failures.
     */
    public String getDatabaseIdentifier() {
        return configuration.getDatabaseConfig().getDatabaseIdentifier();
    }

    /**
     * Schema holding the event store tables.
     */
    public String getSchema() {
        return configuration.getDatabaseConfig().getSchema();
    }
}
