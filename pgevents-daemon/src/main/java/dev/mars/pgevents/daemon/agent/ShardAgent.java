package dev.mars.pgevents.daemon.agent;

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
import dev.mars.pgevents.daemon.loading.EventLoader;
import dev.mars.pgevents.daemon.loading.EventRequest;
import dev.mars.pgevents.daemon.tracking.ShardState;
import dev.mars.pgevents.daemon.tracking.ShardStateTracker;
import dev.mars.pgevents.store.progress.ProjectionProgressStore;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.sqlclient.SqlClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.function.BiConsumer;

/**
 * Feeds one projection shard from the event log.
 *
 * <p>The agent wakes up whenever the {@link ShardStateTracker} publishes a
 * high-water mark above the shard's last applied sequence. Each cycle loads the
 * range {@code (lastApplied, min(lastApplied + pageSize, mark)]}, applies it
 * through the {@link ShardPageProcessor} and publishes the new shard state.
 * Only one cycle runs at a time.</p>
 *
 * <p>Loader failures are retried after the error backoff. Any other failure
 * pauses the agent and is handed to the failure listener.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public class ShardAgent {
    private static final Logger logger = LoggerFactory.getLogger(ShardAgent.class);

    private final ShardName shard;
    private final EventLoader loader;
    private final ShardPageProcessor processor;
    private final ShardStateTracker tracker;
    private final ProjectionProgressStore progress;
    private final SqlClient client;
    private final Vertx vertx;
    private final int pageSize;
    private final Duration errorBackoff;
    private final BiConsumer<ShardName, Throwable> failureListener;

    private volatile AgentStatus status = AgentStatus.STOPPED;
    private volatile long lastApplied = 0;
    private long ceiling = Long.MAX_VALUE;
    private long generation = 0;
    private boolean cycling = false;
    private Runnable unsubscribe;
    private Promise<Long> rebuild;
    private final List<Promise<Void>> idleWaiters = new ArrayList<>();

    public ShardAgent(ShardName shard, EventLoader loader, ShardPageProcessor processor, ShardStateTracker tracker,
                      ProjectionProgressStore progress, SqlClient client, Vertx vertx, int pageSize,
                      Duration errorBackoff, BiConsumer<ShardName, Throwable> failureListener) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("Page size must be positive: " + pageSize);
        }
        this.shard = shard;
        this.loader = loader;
        this.processor = processor;
        this.tracker = tracker;
        this.progress = progress;
        this.client = client;
        this.vertx = vertx;
        this.pageSize = pageSize;
        this.errorBackoff = errorBackoff;
        this.failureListener = failureListener;
    }

    /**
     * Resumes from the shard's persisted progress and follows the high-water mark.
     */
    public Future<Void> start() {
        return startWith(AgentStatus.RUNNING, Long.MAX_VALUE);
    }

    /**
     * Resumes from the persisted progress and stops consuming once {@code target} is applied.
     *
     * @return completes with the shard's last applied sequence once it reaches {@code target}
     */
    public Future<Long> rebuildTo(long target) {
        Promise<Long> done = Promise.promise();
        synchronized (this) {
            rebuild = done;
        }
        return startWith(AgentStatus.REBUILDING, target).compose(v -> done.future());
    }

    private Future<Void> startWith(AgentStatus mode, long bound) {
        synchronized (this) {
            if (status == AgentStatus.RUNNING || status == AgentStatus.REBUILDING) {
                return Future.failedFuture(new IllegalStateException("Shard agent " + shard + " is already " + status));
            }
        }
        return progress.ensure(client, shard)
            .compose(v -> progress.lastSequence(client, shard))
            .map(last -> {
                synchronized (this) {
                    lastApplied = last;
                    ceiling = bound;
                    generation++;
                    status = mode;
                    unsubscribe = tracker.subscribe(state -> {
                        if (state.isHighWater()) {
                            wake();
                        }
                    });
                }
                tracker.publish(ShardState.of(shard, last));
                logger.info("Shard agent {} started in {} mode at #{}{}", shard, mode, last,
                    bound == Long.MAX_VALUE ? "" : " with ceiling #" + bound);
                wake();
                return null;
            });
    }

    /**
     * Stops after the cycle in flight, keeping its progress.
     */
    public Future<Void> stop() {
        return halt(false);
    }

    /**
     * Stops without waiting for new work; the result of a cycle in flight is rolled back.
     * The returned future completes once that cycle has settled.
     */
    public Future<Void> hardStop() {
        return halt(true);
    }

    private Future<Void> halt(boolean discardInFlight) {
        Promise<Long> abandoned;
        Promise<Void> idle = null;
        synchronized (this) {
            if (discardInFlight) {
                generation++;
            }
            boolean wasActive = isActive();
            status = AgentStatus.STOPPED;
            detach();
            abandoned = rebuild;
            rebuild = null;
            if (cycling) {
                idle = Promise.promise();
                idleWaiters.add(idle);
            }
            if (wasActive) {
                logger.info("Shard agent {} {} at #{}", shard, discardInFlight ? "hard stopped" : "stopping", lastApplied);
            }
        }
        if (abandoned != null) {
            abandoned.tryFail(new CancellationException("Rebuild of shard " + shard + " was stopped"));
        }
        return idle == null ? Future.succeededFuture() : idle.future();
    }

    private void wake() {
        Promise<Long> finished = null;
        CycleRange range = null;
        synchronized (this) {
            if (!isActive() || cycling) {
                return;
            }
            if (lastApplied >= ceiling) {
                finished = completeRebuild();
            } else {
                long mark = Math.min(tracker.highWaterMark(), ceiling);
                if (mark <= lastApplied) {
                    return;
                }
                cycling = true;
                range = new CycleRange(generation, lastApplied, Math.min(lastApplied + pageSize, mark));
            }
        }
        if (range != null) {
            runCycle(range);
        } else if (finished != null) {
            finished.tryComplete(lastApplied);
        }
    }

    private void runCycle(CycleRange range) {
        long gen = range.generation();
        loader.load(new EventRequest(shard, range.floor(), range.ceiling()))
            .compose(page -> processor.process(page, () -> isGeneration(gen)))
            .onComplete(ar -> {
                List<Promise<Void>> waiters;
                boolean current;
                synchronized (this) {
                    cycling = false;
                    current = generation == gen;
                    if (ar.succeeded() && current) {
                        lastApplied = ar.result().ceiling();
                    }
                    waiters = new ArrayList<>(idleWaiters);
                    idleWaiters.clear();
                }
                if (ar.succeeded() && current) {
                    tracker.publish(ShardState.of(shard, ar.result().ceiling()));
                }
                waiters.forEach(Promise::tryComplete);

                if (ar.succeeded()) {
                    wake();
                } else {
                    onCycleFailure(gen, ar.cause());
                }
            });
    }

    private void onCycleFailure(long gen, Throwable err) {
        if (!isGeneration(gen) || !isActive() || err instanceof CancellationException) {
            logger.debug("Discarded cycle of stopped shard agent {}: {}", shard, err.getMessage());
            return;
        }
        if (err instanceof EventLoaderException) {
            logger.warn("Shard agent {} could not load events, retrying in {}: {}", shard, errorBackoff, err.getMessage());
            vertx.setTimer(Math.max(1, errorBackoff.toMillis()), id -> wake());
            return;
        }

        Promise<Long> failedRebuild;
        synchronized (this) {
            if (generation != gen) {
                return;
            }
            status = AgentStatus.PAUSED;
            detach();
            failedRebuild = rebuild;
            rebuild = null;
        }
        logger.error("Shard agent {} paused at #{}: {}", shard, lastApplied, err.getMessage(), err);
        if (failedRebuild != null) {
            failedRebuild.tryFail(err);
        }
        failureListener.accept(shard, err);
    }

    private Promise<Long> completeRebuild() {
        Promise<Long> finished = rebuild;
        rebuild = null;
        if (finished != null) {
            logger.info("Shard agent {} reached rebuild ceiling #{}", shard, ceiling);
        }
        return finished;
    }

    private synchronized boolean isGeneration(long gen) {
        return generation == gen;
    }

    private boolean isActive() {
        return status == AgentStatus.RUNNING || status == AgentStatus.REBUILDING;
    }

    private void detach() {
        if (unsubscribe != null) {
            unsubscribe.run();
            unsubscribe = null;
        }
    }

    public ShardName getShardName() {
        return shard;
    }

    public AgentStatus getStatus() {
        return status;
    }

    public long getLastApplied() {
        return lastApplied;
    }

    private record CycleRange(long generation, long floor, long ceiling) {
    }
}
