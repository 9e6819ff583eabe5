package dev.mars.pgevents.api.projection;

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

import java.util.Objects;

/**
 * Identity of one projection shard, rendered as {@code ProjectionName:ShardKey}.
 *
 * <p>The identity is the primary key of the shard's progress row. A projection
 * with a single shard uses the key {@value #ALL}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public final class ShardName {

    public static final String ALL = "All";
    public static final String HIGH_WATER_MARK = "HighWaterMark";

    private final String projectionName;
    private final String shardKey;
    private final String identity;

    public ShardName(String projectionName, String shardKey) {
        if (projectionName == null || projectionName.isBlank()) {
            throw new IllegalArgumentException("Projection name cannot be null or empty");
        }
        if (shardKey == null || shardKey.isBlank()) {
            throw new IllegalArgumentException("Shard key cannot be null or empty");
        }
        this.projectionName = projectionName;
        this.shardKey = shardKey;
        this.identity = projectionName + ":" + shardKey;
    }

    public static ShardName all(String projectionName) {
        return new ShardName(projectionName, ALL);
    }

    /**
     * Parses a progress row name back into a shard name.
     *
     * @param identity {@code ProjectionName:ShardKey}, or a bare projection name
     */
    public static ShardName parse(String identity) {
        int separator = identity.lastIndexOf(':');
        if (separator < 0) {
            return all(identity);
        }
        return new ShardName(identity.substring(0, separator), identity.substring(separator + 1));
    }

    public String getProjectionName() {
        return projectionName;
    }

    public String getShardKey() {
        return shardKey;
    }

    public String getIdentity() {
        return identity;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return identity.equals(((ShardName) o).identity);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identity);
    }

    @Override
    public String toString() {
        return identity;
    }
}
