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

import java.util.List;
import java.util.UUID;

/**
 * Handle returned by a fetch-for-writing call.
 *
 * <p>The handle remembers the stream version found at fetch time. Events appended
 * through it are flushed with that version as the expected version, so a
 * concurrent writer that advanced the stream in between makes the flush fail
 * with a {@link dev.mars.pgevents.api.error.ConcurrencyException}.</p>
 *
 * @param <T> The aggregate type
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public interface WritableStream<T> {

    /**
     * The aggregate as of the fetch, null for a stream that does not exist yet.
     */
    T getAggregate();

    /**
     * The stream version found when the stream was fetched. Zero for a new stream.
     */
    long getStartingVersion();

    /**
     * The starting version plus every event appended through this handle.
     */
    long getCurrentVersion();

    Object getIdentity();

    default UUID getId() {
        Object identity = getIdentity();
        return identity instanceof UUID ? (UUID) identity : null;
    }

    default String getKey() {
        Object identity = getIdentity();
        return identity instanceof String ? (String) identity : null;
    }

    void appendOne(Object event);

    void appendMany(Object... events);

    void appendMany(List<?> events);
}
