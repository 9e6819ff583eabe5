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

import dev.mars.pgevents.db.PgEventsDefaults;
import dev.mars.pgevents.db.config.PgConnectionConfig;
import dev.mars.pgevents.db.config.PgPoolConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.pgclient.PgBuilder;
import io.vertx.pgclient.PgConnectOptions;
import io.vertx.pgclient.SslMode;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.PoolOptions;
import io.vertx.sqlclient.SqlConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Owns the Vert.x reactive pools used by the event store and the projection daemon.
 *
 * <p>Pools are keyed by a service id. Callers passing {@code null} get the default pool.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class PgConnectionManager implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PgConnectionManager.class);

    private final MeterRegistry meter;
    private final Map<String, Pool> reactivePools = new ConcurrentHashMap<>();
    private final Vertx vertx;

    public PgConnectionManager(Vertx vertx) {
        this(vertx, null);
    }

    public PgConnectionManager(Vertx vertx, MeterRegistry meter) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx instance cannot be null");
        this.meter = meter;
    }

    /**
     * Creates or retrieves the reactive pool of a service.
     *
     * @param serviceId The service id, or null for the default pool
     * @param connectionConfig The PostgreSQL connection configuration
     * @param poolConfig The connection pool configuration
     * @return the pool
     */
    public Pool getOrCreateReactivePool(String serviceId,
                                        PgConnectionConfig connectionConfig,
                                        PgPoolConfig poolConfig) {
        Objects.requireNonNull(connectionConfig, "connectionConfig");
        Objects.requireNonNull(poolConfig, "poolConfig");

        return reactivePools.computeIfAbsent(resolveServiceId(serviceId), id -> {
            try {
                Pool pool = createReactivePool(connectionConfig, poolConfig);
                logger.info("Created reactive pool for service '{}' ({}, maxSize={})",
                    id, connectionConfig.getDatabaseIdentifier(), poolConfig.getMaxSize());
                countPoolEvent("pgevents.db.pool.created", id);
                return pool;
            } catch (Exception e) {
                logger.error("Failed to create pool for {}: {}", id, e.getMessage());
                countPoolEvent("pgevents.db.pool.create.failed", id);
                throw e;
            }
        });
    }

    /**
     * @return the pool, or null if none was created for the service
     */
    Pool getExistingPool(String serviceId) {
        return reactivePools.get(resolveServiceId(serviceId));
    }

    private <T> Future<T> withConnection(String serviceId, Function<SqlConnection, Future<T>> operation) {
        Pool pool = getExistingPool(serviceId);
        if (pool == null) {
            return Future.failedFuture(new IllegalStateException("No reactive pool found for service: " + resolveServiceId(serviceId)));
        }
        return pool.withConnection(operation);
    }

    private String resolveServiceId(String serviceId) {
        return (serviceId == null || serviceId.isBlank())
            ? PgEventsDefaults.DEFAULT_POOL_ID
            : serviceId;
    }

    private Pool createReactivePool(PgConnectionConfig connectionConfig, PgPoolConfig poolConfig) {
        Objects.requireNonNull(connectionConfig.getPassword(), "password");

        PgConnectOptions connectOptions = new PgConnectOptions()
            .setHost(connectionConfig.getHost())
            .setPort(connectionConfig.getPort())
            .setDatabase(connectionConfig.getDatabase())
            .setUser(connectionConfig.getUsername())
            .setPassword(connectionConfig.getPassword())
            .setSslMode(connectionConfig.isSslEnabled() ? SslMode.REQUIRE : SslMode.DISABLE);
        if (connectionConfig.getApplicationName() != null) {
            connectOptions.addProperty("application_name", connectionConfig.getApplicationName());
        }

        PoolOptions poolOptions = new PoolOptions()
            .setMaxSize(poolConfig.getMaxSize())
            .setMaxWaitQueueSize(poolConfig.getMaxWaitQueueSize())
            .setConnectionTimeout((int) poolConfig.getConnectionTimeout().toMillis())
            .setConnectionTimeoutUnit(TimeUnit.MILLISECONDS)
            .setIdleTimeout((int) poolConfig.getIdleTimeout().toSeconds())
            .setIdleTimeoutUnit(TimeUnit.SECONDS)
            .setShared(poolConfig.isShared());

        return PgBuilder.pool()
            .with(poolOptions)
            .connectingTo(connectOptions)
            .using(vertx)
            .build();
    }

    /**
     * Runs {@code SELECT 1} against the pool of a service.
     *
     * @return true when the database answered, false otherwise
     */
    public Future<Boolean> checkHealth(String serviceId) {
        if (getExistingPool(serviceId) == null) {
            return Future.succeededFuture(false);
        }
        return withConnection(serviceId, conn ->
            conn.query("SELECT 1").execute().map(rs -> true)
        ).recover(err -> {
            logger.warn("Health check failed for {}: {}", resolveServiceId(serviceId), err.getMessage());
            return Future.succeededFuture(false);
        });
    }

    public Future<Void> closePoolAsync(String serviceId) {
        String resolvedId = resolveServiceId(serviceId);
        Pool pool = reactivePools.remove(resolvedId);
        if (pool == null) {
            logger.debug("No pool found for service: {}", resolvedId);
            return Future.succeededFuture();
        }

        return pool.close()
            .onSuccess(v -> {
                logger.debug("Closed reactive pool for service: {}", resolvedId);
                countPoolEvent("pgevents.db.pool.closed", resolvedId);
            })
            .onFailure(err -> {
                logger.warn("Failed to close reactive pool for service: {}", resolvedId, err);
                countPoolEvent("pgevents.db.pool.close.failed", resolvedId);
            });
    }

    /**
     * Closes every pool. Individual close failures are logged and do not fail the returned future.
     */
    public Future<Void> closeAsync() {
        if (reactivePools.isEmpty()) {
            return Future.succeededFuture();
        }

        List<Future<Void>> closeFutures = new ArrayList<>();
        for (String serviceId : reactivePools.keySet()) {
            closeFutures.add(closePoolAsync(serviceId));
        }

        return Future.all(closeFutures)
            .<Void>mapEmpty()
            .recover(throwable -> {
                logger.warn("Some pools failed to close cleanly: {}", throwable.getMessage());
                return Future.succeededFuture();
            });
    }

    /**
     * Synchronous wrapper for AutoCloseable compatibility. Prefer {@link #closeAsync()}.
     */
    @Override
    public void close() {
        try {
            closeAsync().toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Interrupted while closing connection pools", e);
        } catch (Exception e) {
            logger.error("Error during synchronous close", e);
        }
    }

    private void countPoolEvent(String name, String serviceId) {
        if (meter != null) {
            Counter.builder(name)
                .tag("service", serviceId)
                .register(meter)
                .increment();
        }
    }
}
