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

import dev.mars.pgevents.api.projection.ShardName;
import dev.mars.pgevents.daemon.agent.AgentStatus;
import dev.mars.pgevents.daemon.deadletter.DeadLetterEventManager;
import dev.mars.pgevents.daemon.tracking.ShardStateTracker;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Runs the asynchronous projections of an event store.
 *
 * <p>One high-water agent tracks how far the event log is safe to read and one
 * shard agent per projection shard applies the log to its projection.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public interface ProjectionDaemon extends AutoCloseable {

    /**
     * Starts the high-water agent and an agent for every shard of every registered projection.
     */
    CompletableFuture<Void> startAll();

    CompletableFuture<Void> startAgent(ShardName shard);

    /**
     * Gracefully stops one shard agent. The cycle in flight commits.
     */
    CompletableFuture<Void> stopAgent(ShardName shard);

    CompletableFuture<Void> stopAll();

    /**
     * Rebuilds a projection from the start of the event log up to the high-water mark
     * found by a fresh detection.
     *
     * <p>Cancelling the returned future aborts the rebuild and leaves the projection's agents stopped.</p>
     *
     * @param shardTimeout how long each shard may take to drain
     */
    CompletableFuture<Void> rebuildProjection(String projectionName, Duration shardTimeout);

    /**
     * Rebuilds the snapshot projection of an aggregate type, or the projection named after the type.
     */
    CompletableFuture<Void> rebuildProjection(Class<?> aggregateType, Duration shardTimeout);

    /**
     * As {@link #rebuildProjection(String, Duration)} with the configured shard timeout.
     */
    CompletableFuture<Void> rebuildProjection(String projectionName);

    /**
     * Makes sure the store's tables exist, stops high-water polling and runs a single detection.
     */
    CompletableFuture<Void> prepareForRebuilds();

    /**
     * Completes once every running shard has applied the highest committed sequence.
     */
    CompletableFuture<Void> waitForNonStaleData(Duration timeout);

    Map<ShardName, AgentStatus> statuses();

    ShardStateTracker tracker();

    DeadLetterEventManager deadLetters();

    @Override
    void close();
}
