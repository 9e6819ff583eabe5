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

import java.time.Instant;
import java.util.Objects;

/**
 * Sequence reached by one shard, or by the high-water mark.
 *
 * @param shardName Shard identity such as {@code Trip:All}, or {@link ShardName#HIGH_WATER_MARK}
 * @param sequence  Last sequence applied by the shard
 * @param timestamp When the state was published
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public record ShardState(String shardName, long sequence, Instant timestamp) {

    public ShardState {
        Objects.requireNonNull(shardName, "shardName");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public static ShardState of(ShardName shard, long sequence) {
        return new ShardState(shard.getIdentity(), sequence, Instant.now());
    }

    public static ShardState highWater(long sequence) {
        return new ShardState(ShardName.HIGH_WATER_MARK, sequence, Instant.now());
    }

    public boolean isHighWater() {
        return ShardName.HIGH_WATER_MARK.equals(shardName);
    }
}
