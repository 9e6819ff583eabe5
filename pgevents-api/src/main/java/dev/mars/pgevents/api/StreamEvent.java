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
import java.util.UUID;

/**
 * An event that has been persisted into a stream.
 *
 * <p>Events are immutable once durable. The global {@link #getSequence() sequence}
 * orders events across the whole store, the {@link #getVersion() version} is the
 * 1-based position of the event inside its own stream. The two numbers are
 * assigned independently.</p>
 *
 * @param <T> The type of event payload
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public interface StreamEvent<T> {

    /**
     * Gets the unique identifier of this event.
     *
     * @return The event id
     */
    UUID getId();

    /**
     * Gets the global sequence number of this event.
     *
     * @return The sequence, never reused
     */
    long getSequence();

    /**
     * Gets the position of this event within its stream, starting at 1.
     *
     * @return The stream version of this event
     */
    long getVersion();

    /**
     * Gets the stream identity, either a {@link UUID} or a {@link String} key.
     *
     * @return The stream identity
     */
    Object getStreamIdentity();

    /**
     * Gets the stream id when the store identifies streams by UUID.
     *
     * @return The stream id, or null for string keyed stores
     */
    default UUID getStreamId() {
        Object identity = getStreamIdentity();
        return identity instanceof UUID ? (UUID) identity : null;
    }

    /**
     * Gets the stream key when the store identifies streams by string.
     *
     * @return The stream key, or null for UUID keyed stores
     */
    default String getStreamKey() {
        Object identity = getStreamIdentity();
        return identity instanceof String ? (String) identity : null;
    }

    /**
     * Gets the deserialized payload.
     *
     * @return The event data
     */
    T getData();

    /**
     * Gets the registered alias of the event type, as stored in the type column.
     *
     * @return The event type name
     */
    String getEventTypeName();

    /**
     * Gets the Java type of the payload.
     *
     * @return The payload class
     */
    Class<?> getEventType();

    Instant getTimestamp();

    String getTenantId();

    boolean isArchived();
}
