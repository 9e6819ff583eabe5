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
 * Simple implementation of the StreamEvent interface.
 *
 * @param <T> The type of event payload
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class SimpleStreamEvent<T> implements StreamEvent<T> {

    private final UUID id;
    private final long sequence;
    private final long version;
    private final Object streamIdentity;
    private final T data;
    private final String eventTypeName;
    private final Instant timestamp;
    private final String tenantId;
    private final boolean archived;

    /**
     * Creates a new SimpleStreamEvent.
     *
     * @param id The unique event identifier
     * @param sequence The global sequence number
     * @param version The 1-based position within the stream
     * @param streamIdentity The stream id or key
     * @param data The event payload
     * @param eventTypeName The registered event type alias
     * @param timestamp When the event was recorded
     * @param tenantId The owning tenant
     * @param archived Whether the event belongs to an archived stream
     */
    public SimpleStreamEvent(UUID id, long sequence, long version, Object streamIdentity, T data,
                             String eventTypeName, Instant timestamp, String tenantId, boolean archived) {
        this.id = Objects.requireNonNull(id, "Event ID cannot be null");
        this.streamIdentity = Objects.requireNonNull(streamIdentity, "Stream identity cannot be null");
        this.data = Objects.requireNonNull(data, "Event data cannot be null");
        this.eventTypeName = Objects.requireNonNull(eventTypeName, "Event type name cannot be null");
        this.timestamp = Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        this.tenantId = tenantId != null ? tenantId : TenancyStyle.DEFAULT_TENANT_ID;
        this.sequence = sequence;
        this.version = version;
        this.archived = archived;

        if (version <= 0) {
            throw new IllegalArgumentException("Version must be positive");
        }
        if (sequence <= 0) {
            throw new IllegalArgumentException("Sequence must be positive");
        }
    }

    @Override
    public UUID getId() {
        return id;
    }

    @Override
    public long getSequence() {
        return sequence;
    }

    @Override
    public long getVersion() {
        return version;
    }

    @Override
    public Object getStreamIdentity() {
        return streamIdentity;
    }

    @Override
    public T getData() {
        return data;
    }

    @Override
    public String getEventTypeName() {
        return eventTypeName;
    }

    @Override
    public Class<?> getEventType() {
        return data.getClass();
    }

    @Override
    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String getTenantId() {
        return tenantId;
    }

    @Override
    public boolean isArchived() {
        return archived;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SimpleStreamEvent<?> that = (SimpleStreamEvent<?>) o;
        return sequence == that.sequence && id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, sequence);
    }

    @Override
    public String toString() {
        return "SimpleStreamEvent{" +
                "id=" + id +
                ", sequence=" + sequence +
                ", version=" + version +
                ", stream=" + streamIdentity +
                ", type='" + eventTypeName + '\'' +
                ", tenantId='" + tenantId + '\'' +
                '}';
    }
}
