package dev.mars.pgevents.api;

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

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Persisted state of one stream row.
 *
 * <p>The version always equals the number of events ever appended to the stream.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public final class StreamState {

    private final Object identity;
    private final long version;
    private final String aggregateTypeName;
    private final Instant created;
    private final Instant lastTimestamp;
    private final boolean archived;
    private final String tenantId;

    public StreamState(Object identity, long version, String aggregateTypeName, Instant created,
                       Instant lastTimestamp, boolean archived, String tenantId) {
        this.identity = Objects.requireNonNull(identity, "Stream identity cannot be null");
        this.version = version;
        this.aggregateTypeName = aggregateTypeName;
        this.created = created;
        this.lastTimestamp = lastTimestamp;
        this.archived = archived;
        this.tenantId = tenantId;
    }

    public Object getIdentity() {
        return identity;
    }

    /**
     * @return the stream id, or null when the store uses string keys
     */
    public UUID getId() {
        return identity instanceof UUID ? (UUID) identity : null;
    }

    /**
     * @return the stream key, or null when the store uses UUID ids
     */
    public String getKey() {
        return identity instanceof String ? (String) identity : null;
    }

    public long getVersion() {
        return version;
    }

    public String getAggregateTypeName() {
        return aggregateTypeName;
    }

    public Instant getCreated() {
        return created;
    }

    public Instant getLastTimestamp() {
        return lastTimestamp;
    }

    public boolean isArchived() {
        return archived;
    }

    public String getTenantId() {
        return tenantId;
    }

    @Override
    public String toString() {
        return "StreamState{" +
                "identity=" + identity +
                ", version=" + version +
                ", aggregateType='" + aggregateTypeName + '\'' +
                ", archived=" + archived +
                ", tenantId='" + tenantId + '\'' +
                '}';
    }
}
