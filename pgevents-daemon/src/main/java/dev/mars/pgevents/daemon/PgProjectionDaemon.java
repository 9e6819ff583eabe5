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

import dev.mars.pgevents.api.error.PgEventsErrorCodes;
import dev.mars.pgevents.api.error.PgEventsException;
import dev.mars.pgevents.api.projection.ShardName;
import dev.mars.pgevents.daemon.agent.AgentStatus;
import dev.mars.pgevents.daemon.agent.ErrorHandlingOptions;
import dev.mars.pgevents.daemon.agent.ShardAgent;
import dev.mars.pgevents.daemon.agent.ShardPageProcessor;
import dev.mars.pgevents.daemon.deadletter.DeadLetterEventManager;
import dev.mars.pgevents.daemon.highwater.HighWaterAgent;
import dev.mars.pgevents.daemon.highwater.HighWaterDetector;
import dev.mars.pgevents.daemon.loading.EventLoader;
import dev.mars.pgevents.daemon.loading.PgEventLoader;
import dev.mars.pgevents.daemon.loading.ResilientEventLoader;
import dev.mars.pgevents.daemon.tracking.ShardState;
import dev.mars.pgevents.daemon.tracking.ShardStateTracker;
import dev.mars.pgevents.db.PgEventsManager;
import dev.mars.pgevents.db.config.PgEventsConfiguration;
import dev.mars.pgevents.store.PgEventStore;
import dev.mars.pgevents.store.StoreContext;
import dev.mars.pgevents.store.projection.ProjectionBatch;
import dev.mars.pgevents.store.projection.ProjectionSource;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.SqlConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BiConsumer;

/**
 * PostgreSQL implementation of {@link ProjectionDaemon}.
 *
 * <p>Agents run on the Vert.x instance of the {@link PgEventsManager}. Page loads
 * retry through the manager's {@link dev.mars.pgevents.db.resilience.RetryPolicyManager},
 * one Resilience4j retry per shard.</p>
 *
 * <pre>{@code
 * ProjectionDaemon daemon = PgProjectionDaemon.builder(manager, store)
 *     .errorHandling("TripDistance", ErrorHandlingOptions.strict())
 *     .onAgentFailure((shard, error) -> alerts.raise(shard, error))
 *     .build();
 * daemon.startAll().get();
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public class PgProjectionDaemon implements ProjectionDaemon {
    private static final Logger logger = LoggerFactory.getLogger(PgProjectionDaemon.class);

    private final StoreContext context;
    private final PgEventsManager manager;
    private final PgEventsConfiguration.DaemonConfig config;
    private final Vertx vertx;
    private final Pool pool;
    private final ShardStateTracker tracker = new ShardStateTracker();
    private final HighWaterDetector detector;
    private final HighWaterAgent highWater;
    private final DeadLetterEventManager deadLetters;
    private final ScheduledExecutorService retryScheduler;
    private final ErrorHandlingOptions defaultErrorHandling;
    private final Map<String, ErrorHandlingOptions> projectionErrorHandling;
    private final List<BiConsumer<ShardName, Throwable>> failureListeners;
    private final Map<ShardName, ShardAgent> agents = new ConcurrentHashMap<>();

    private PgProjectionDaemon(Builder builder) {
        this.manager = builder.manager;
        this.context = builder.store.getContext();
        this.config = manager.getConfiguration().getDaemonConfig();
        this.vertx = manager.getVertx();
        this.pool = context.getPool();
        this.detector = new HighWaterDetector(pool, context.getSchema(), config.getStaleSequenceThreshold());
        this.highWater = new HighWaterAgent(vertx, pool, detector, context.getProgress(), tracker,
            context.getMetrics(), config.getPollInterval(), config.getStaleSequenceThreshold(), builder.clock);
        this.deadLetters = new DeadLetterEventManager(pool, context.getSchema());
        this.retryScheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "pgevents-loader-retry");
            thread.setDaemon(true);
            return thread;
        });
        this.defaultErrorHandling = builder.defaultErrorHandling;
        this.projectionErrorHandling = Map.copyOf(builder.projectionErrorHandling);
        this.failureListeners = new CopyOnWriteArrayList<>(builder.failureListeners);

        logger.info("Projection daemon created for {} projections on {}",
            context.getProjections().all().size(), context.getDatabaseIdentifier());
    }

    public static Builder builder(PgEventsManager manager, PgEventStore store) {
        return new Builder(manager, store);
    }

    @Override
    public CompletableFuture<Void> startAll() {
        Future<Void> started = highWater.start().compose(v -> {
            List<Future<Void>> starts = new ArrayList<>();
            for (ProjectionSource source : context.getProjections().all()) {
                for (ShardName shard : source.getShardNames()) {
                    starts.add(startShard(source, shard));
                }
            }
            return Future.all(starts).<Void>mapEmpty();
        }).onSuccess(v -> logger.info("Projection daemon started {} shard agents", agents.size()));
        return toCompletable(started);
    }

    @Override
    public CompletableFuture<Void> startAgent(ShardName shard) {
        ProjectionSource source;
        try {
            source = projectionOwning(shard);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        Future<Void> highWaterRunning = highWater.isRunning() ? Future.succeededFuture() : highWater.start();
        return toCompletable(highWaterRunning.compose(v -> startShard(source, shard)));
    }

    private Future<Void> startShard(ProjectionSource source, ShardName shard) {
        ShardAgent agent = agents.computeIfAbsent(shard, key -> createAgent(source, key));
        AgentStatus status = agent.getStatus();
        if (status == AgentStatus.RUNNING || status == AgentStatus.REBUILDING) {
            logger.debug("Shard agent {} is already {}", shard, status);
            return Future.succeededFuture();
        }
        return agent.start();
    }

    @Override
    public CompletableFuture<Void> stopAgent(ShardName shard) {
        ShardAgent agent = agents.get(shard);
        if (agent == null) {
            return CompletableFuture.completedFuture(null);
        }
        return toCompletable(agent.stop());
    }

    @Override
    public CompletableFuture<Void> stopAll() {
        highWater.stop();
        List<Future<Void>> stops = new ArrayList<>();
        agents.values().forEach(agent -> stops.add(agent.stop()));
        return toCompletable(Future.all(stops).<Void>mapEmpty()
            .onSuccess(v -> logger.info("Projection daemon stopped all shard agents")));
    }

    @Override
    public CompletableFuture<Void> rebuildProjection(String projectionName) {
        return rebuildProjection(projectionName, config.getRebuildShardTimeout());
    }

    @Override
    public CompletableFuture<Void> rebuildProjection(Class<?> aggregateType, Duration shardTimeout) {
        Objects.requireNonNull(aggregateType, "aggregateType");
        String name = context.getProjections().snapshotFor(aggregateType)
            .map(ProjectionSource::getName)
            .orElse(aggregateType.getSimpleName());
        return rebuildProjection(name, shardTimeout);
    }

    @Override
    public CompletableFuture<Void> rebuildProjection(String projectionName, Duration shardTimeout) {
        CompletableFuture<Void> result = new CompletableFuture<>();
        ProjectionSource source = context.getProjections().find(projectionName).orElse(null);
        if (source == null) {
            result.completeExceptionally(projectionNotFound(projectionName));
            return result;
        }

        result.whenComplete((v, err) -> {
            if (result.isCancelled()) {
                logger.info("Rebuild of projection {} cancelled", projectionName);
                hardStopAgentsOf(source);
            }
        });

        rebuild(source, shardTimeout, result).onComplete(ar -> {
            if (ar.succeeded()) {
                result.complete(null);
            } else {
                result.completeExceptionally(ar.cause());
            }
        });
        return result;
    }

    private Future<Void> rebuild(ProjectionSource source, Duration shardTimeout, CompletableFuture<Void> cancellation) {
        logger.info("Starting to rebuild projection {}@{}", source.getName(), context.getDatabaseIdentifier());
        return hardStopAgentsOf(source)
            .compose(v -> abortIfCancelled(cancellation))
            .compose(v -> highWater.checkNow().<Void>mapEmpty())
            .compose(v -> {
                if (tracker.highWaterMark() == 0) {
                    logger.info("Aborting rebuild of projection {} because the high-water mark is 0 (no event data)",
                        source.getName());
                    return Future.<Void>succeededFuture();
                }
                return abortIfCancelled(cancellation)
                    .compose(x -> teardown(source))
                    .compose(x -> abortIfCancelled(cancellation))
                    .compose(x -> drain(source, tracker.highWaterMark(), shardTimeout));
            });
    }

    private Future<Void> teardown(ProjectionSource source) {
        List<ShardName> shards = source.getShardNames();
        return pool.withTransaction(conn -> {
            ProjectionBatch batch = new ProjectionBatch();
            source.teardown(context.getProjectionContext(), batch);
            return batch.execute(conn)
                .compose(v -> resetProgress(conn, shards, 0))
                .compose(v -> deadLetters.deleteFor(conn, source.getName()))
                .<Void>mapEmpty();
        }).onSuccess(v -> {
            shards.forEach(tracker::markAsRestarted);
            logger.info("Tore down projection {} and reset {} shards", source.getName(), shards.size());
        });
    }

    private Future<Void> resetProgress(SqlConnection conn, List<ShardName> shards, int index) {
        if (index >= shards.size()) {
            return Future.succeededFuture();
        }
        return context.getProgress().reset(conn, shards.get(index))
            .compose(v -> resetProgress(conn, shards, index + 1));
    }

    private Future<Void> drain(ProjectionSource source, long mark, Duration shardTimeout) {
        List<ShardAgent> rebuilding = new ArrayList<>();
        List<Future<Long>> drains = new ArrayList<>();
        for (ShardName shard : source.getShardNames()) {
            ShardAgent agent = agents.computeIfAbsent(shard, key -> createAgent(source, key));
            rebuilding.add(agent);
            tracker.markAsRestarted(shard);
            drains.add(withTimeout(agent.rebuildTo(mark), shardTimeout, shard, mark));
        }
        logger.info("Rebuilding {} shards of projection {} up to #{}", drains.size(), source.getName(), mark);

        return Future.all(drains).transform(ar -> {
            List<Future<Void>> stops = new ArrayList<>();
            rebuilding.forEach(agent -> stops.add(ar.succeeded() ? agent.stop() : agent.hardStop()));
            return Future.all(stops).transform(stopped -> {
                if (ar.failed()) {
                    logger.error("Rebuild of projection {} failed: {}", source.getName(), ar.cause().getMessage());
                    return Future.<Void>failedFuture(ar.cause());
                }
                logger.info("Rebuilt projection {} up to #{}", source.getName(), mark);
                return Future.<Void>succeededFuture();
            });
        });
    }

    private Future<Long> withTimeout(Future<Long> drain, Duration timeout, ShardName shard, long mark) {
        Promise<Long> promise = Promise.promise();
        long timerId = vertx.setTimer(Math.max(1, timeout.toMillis()), id -> promise.tryFail(new TimeoutException(
            "Shard " + shard + " did not reach #" + mark + " within " + timeout)));
        drain.onComplete(ar -> {
            vertx.cancelTimer(timerId);
            if (ar.succeeded()) {
                promise.tryComplete(ar.result());
            } else {
                promise.tryFail(ar.cause());
            }
        });
        return promise.future();
    }

    private Future<Void> hardStopAgentsOf(ProjectionSource source) {
        List<Future<Void>> stops = new ArrayList<>();
        for (ShardName shard : source.getShardNames()) {
            ShardAgent agent = agents.get(shard);
            if (agent != null) {
                stops.add(agent.hardStop());
            }
        }
        return Future.all(stops).mapEmpty();
    }

    private static Future<Void> abortIfCancelled(CompletableFuture<Void> cancellation) {
        if (cancellation.isCancelled()) {
            return Future.failedFuture(new CancellationException("Rebuild cancelled"));
        }
        return Future.succeededFuture();
    }

    @Override
    public CompletableFuture<Void> prepareForRebuilds() {
        if (highWater.isRunning()) {
            highWater.stop();
        }
        return toCompletable(context.getSchema().ensureStorageExists(pool)
            .compose(v -> highWater.checkNow())
            .<Void>mapEmpty());
    }

    @Override
    public CompletableFuture<Void> waitForNonStaleData(Duration timeout) {
        return toCompletable(detector.highestCommitted()).thenCompose(highest -> {
            List<CompletableFuture<ShardState>> waits = new ArrayList<>();
            agents.values().stream()
                .filter(agent -> agent.getStatus() == AgentStatus.RUNNING)
                .forEach(agent -> waits.add(tracker.waitForShardState(agent.getShardName(), highest, timeout)));
            logger.debug("Waiting for {} shards to reach #{}", waits.size(), highest);
            return CompletableFuture.allOf(waits.toArray(new CompletableFuture[0]));
        });
    }

    @Override
    public Map<ShardName, AgentStatus> statuses() {
        Map<ShardName, AgentStatus> statuses = new LinkedHashMap<>();
        agents.forEach((shard, agent) -> statuses.put(shard, agent.getStatus()));
        return statuses;
    }

    @Override
    public ShardStateTracker tracker() {
        return tracker;
    }

    @Override
    public DeadLetterEventManager deadLetters() {
        return deadLetters;
    }

    public HighWaterAgent highWater() {
        return highWater;
    }

    @Override
    public void close() {
        try {
            stopAll().get(30, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Interrupted while stopping projection daemon", e);
        } catch (Exception e) {
            logger.error("Error stopping projection daemon", e);
        } finally {
            retryScheduler.shutdownNow();
        }
    }

    private ShardAgent createAgent(ProjectionSource source, ShardName shard) {
        EventLoader loader = new ResilientEventLoader(
            new PgEventLoader(pool, context.getSchema().events(), context.getRowMapper()),
            manager.getRetryPolicyManager().getRetry(shard.getIdentity()),
            retryScheduler,
            context.getDatabaseIdentifier());
        ErrorHandlingOptions errorHandling = projectionErrorHandling.getOrDefault(source.getName(), defaultErrorHandling);
        ShardPageProcessor processor = new ShardPageProcessor(shard, source, context, deadLetters, errorHandling);
        logger.debug("Created shard agent {} ({} error handling)", shard, errorHandling);
        return new ShardAgent(shard, loader, processor, tracker, context.getProgress(), pool, vertx,
            config.getPageSize(), config.getAgentErrorBackoff(), this::onAgentFailure);
    }

    private ProjectionSource projectionOwning(ShardName shard) {
        ProjectionSource source = context.getProjections().find(shard.getProjectionName())
            .orElseThrow(() -> projectionNotFound(shard.getProjectionName()));
        if (!source.getShardNames().contains(shard)) {
            throw new IllegalArgumentException("Projection " + source.getName() + " has no shard " + shard.getShardKey()
                + "; its shards are " + source.getShardNames());
        }
        return source;
    }

    private PgEventsException projectionNotFound(String projectionName) {
        List<String> names = context.getProjections().all().stream().map(ProjectionSource::getName).toList();
        return new PgEventsException(PgEventsErrorCodes.PROJECTION_NOT_FOUND,
            "No registered projection matches the name '" + projectionName + "'. Available names are " + names);
    }

    private void onAgentFailure(ShardName shard, Throwable error) {
        for (BiConsumer<ShardName, Throwable> listener : failureListeners) {
            try {
                listener.accept(shard, error);
            } catch (RuntimeException e) {
                logger.warn("Agent failure listener threw for {}: {}", shard, e.getMessage(), e);
            }
        }
    }

    private static <T> CompletableFuture<T> toCompletable(Future<T> future) {
        return future.toCompletionStage().toCompletableFuture();
    }

    public static class Builder {
        private final PgEventsManager manager;
        private final PgEventStore store;
        private ErrorHandlingOptions defaultErrorHandling = ErrorHandlingOptions.deadLetters();
        private final Map<String, ErrorHandlingOptions> projectionErrorHandling = new HashMap<>();
        private final List<BiConsumer<ShardName, Throwable>> failureListeners = new ArrayList<>();
        private Clock clock = Clock.systemUTC();

        private Builder(PgEventsManager manager, PgEventStore store) {
            this.manager = Objects.requireNonNull(manager, "manager");
            this.store = Objects.requireNonNull(store, "store");
        }

        public Builder errorHandling(ErrorHandlingOptions options) {
            this.defaultErrorHandling = Objects.requireNonNull(options, "options");
            return this;
        }

        public Builder errorHandling(String projectionName, ErrorHandlingOptions options) {
            projectionErrorHandling.put(projectionName, Objects.requireNonNull(options, "options"));
            return this;
        }

        /**
         * Called when a shard agent pauses on a failure it cannot retry.
         */
        public Builder onAgentFailure(BiConsumer<ShardName, Throwable> listener) {
            failureListeners.add(Objects.requireNonNull(listener, "listener"));
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public PgProjectionDaemon build() {
            return new PgProjectionDaemon(this);
        }
    }
}
