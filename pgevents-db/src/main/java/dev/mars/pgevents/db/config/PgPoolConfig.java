package dev.mars.pgevents.db.config;

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

import java.time.Duration;

/**
 * Reactive PostgreSQL pool configuration for Vert.x 5.x.
 *
 * <p>Exclusive stream writers keep one pooled connection for the lifetime of
 * their lock scope, so the pool needs headroom above the number of concurrent
 * exclusive sessions.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public final class PgPoolConfig {
    private final int maxSize;
    private final int maxWaitQueueSize;
    private final Duration connectionTimeout;
    private final Duration idleTimeout;
    private final boolean shared;

    private PgPoolConfig(Builder builder) {
        this.maxSize = builder.maxSize;
        this.maxWaitQueueSize = builder.maxWaitQueueSize;
        this.connectionTimeout = builder.connectionTimeout;
        this.idleTimeout = builder.idleTimeout;
        this.shared = builder.shared;
    }

    /**
     * Maximum number of connections in the pool. Maps to PoolOptions.setMaxSize().
     */
    public int getMaxSize() {
        return maxSize;
    }

    /**
     * Maximum number of requests waiting for a connection. Maps to PoolOptions.setMaxWaitQueueSize().
     */
    public int getMaxWaitQueueSize() {
        return maxWaitQueueSize;
    }

    public Duration getConnectionTimeout() {
        return connectionTimeout;
    }

    public Duration getIdleTimeout() {
        return idleTimeout;
    }

    public boolean isShared() {
        return shared;
    }

    @Override
    public String toString() {
        return "PgPoolConfig{" +
            "maxSize=" + maxSize +
            ", maxWaitQueueSize=" + maxWaitQueueSize +
            ", connectionTimeout=" + connectionTimeout +
            ", idleTimeout=" + idleTimeout +
            ", shared=" + shared +
            '}';
    }

    public static final class Builder {
        private int maxSize = 16;
        private int maxWaitQueueSize = 128;
        private Duration connectionTimeout = Duration.ofSeconds(30);
        private Duration idleTimeout = Duration.ofMinutes(10);
        private boolean shared = false;

        public Builder maxSize(int maxSize) {
            this.maxSize = maxSize;
            return this;
        }

        public Builder maxWaitQueueSize(int maxWaitQueueSize) {
            this.maxWaitQueueSize = maxWaitQueueSize;
            return this;
        }

        public Builder connectionTimeout(Duration connectionTimeout) {
            this.connectionTimeout = connectionTimeout;
            return this;
        }

        public Builder idleTimeout(Duration idleTimeout) {
            this.idleTimeout = idleTimeout;
            return this;
        }

        public Builder shared(boolean shared) {
            this.shared = shared;
            return this;
        }

        public PgPoolConfig build() {
            if (maxSize < 1) {
                throw new IllegalArgumentException("maxSize must be at least 1");
            }
            if (maxWaitQueueSize < -1) {
                throw new IllegalArgumentException("maxWaitQueueSize must be -1 (unbounded) or non-negative");
            }
            return new PgPoolConfig(this);
        }
    }
}
