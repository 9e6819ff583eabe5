package dev.mars.pgevents.daemon.tracking;

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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * In-memory fan-out of shard progress and high-water mark changes.
 *
 * <p>Shard agents subscribe here instead of polling the database. The tracked
 * high-water mark only moves forward.</p>
 *
 * <p>Thread safe. Listeners run on the publishing thread.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public class ShardStateTracker {
    private static final Logger logger = LoggerFactory.getLogger(ShardStateTracker.class);

    private final Map<String, ShardState> states = new ConcurrentHashMap<>();
    private final List<Consumer<ShardState>> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong highWaterMark = new AtomicLong();

    public void publish(ShardState state) {
        if (state.isHighWater()) {
            long mark = highWaterMark.accumulateAndGet(state.sequence(), Math::max);
            if (mark != state.sequence()) {
                logger.debug("Ignoring high-water mark {} below the tracked mark {}", state.sequence(), mark);
                return;
            }
        }
        states.put(state.shardName(), state);
        for (Consumer<ShardState> listener : listeners) {
            try {
                listener.accept(state);
            } catch (RuntimeException e) {
                logger.warn("Shard state listener failed for {}: {}", state.shardName(), e.getMessage(), e);
            }
        }
    }

    public void markHighWater(long sequence) {
        publish(ShardState.highWater(sequence));
    }

    public long highWaterMark() {
        return highWaterMark.get();
    }

    /**
     * @return handle removing the listener
     */
    public Runnable subscribe(Consumer<ShardState> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public Optional<ShardState> statusFor(String shardName) {
        return Optional.ofNullable(states.get(shardName));
    }

    public Optional<ShardState> statusFor(ShardName shard) {
        return statusFor(shard.getIdentity());
    }

    /**
     * Completes with the first state of {@code shardName} at or beyond {@code sequence}.
     * Fails with {@link java.util.concurrent.TimeoutException} after {@code timeout}.
     */
    public CompletableFuture<ShardState> waitForShardState(String shardName, long sequence, Duration timeout) {
        CompletableFuture<ShardState> result = new CompletableFuture<>();
        Runnable unsubscribe = subscribe(state -> {
            if (state.shardName().equals(shardName) && state.sequence() >= sequence) {
                result.complete(state);
            }
        });
        result.whenComplete((state, err) -> unsubscribe.run());

        ShardState current = states.get(shardName);
        if (current != null && current.sequence() >= sequence) {
            result.complete(current);
        }
        return result.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public CompletableFuture<ShardState> waitForShardState(ShardName shard, long sequence, Duration timeout) {
        return waitForShardState(shard.getIdentity(), sequence, timeout);
    }

    /**
     * Forgets the progress of a shard that restarts from zero.
     */
    public void markAsRestarted(ShardName shard) {
        states.put(shard.getIdentity(), ShardState.of(shard, 0));
        logger.debug("Shard {} marked as restarted", shard);
    }

    public Map<String, ShardState> snapshot() {
        return Map.copyOf(states);
    }
}
