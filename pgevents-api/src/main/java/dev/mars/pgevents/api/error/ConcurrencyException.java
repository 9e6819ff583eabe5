package dev.mars.pgevents.api.error;

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
 * Optimistic concurrency failure on one stream.
 *
 * <p>Raised when a guarded stream update affected no rows because the stream
 * version moved, or when an explicitly expected version does not match the
 * version found at fetch time.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class ConcurrencyException extends PgEventsException {

    private final String aggregateTypeName;
    private final Object streamIdentity;
    private final long expectedVersion;
    private final long actualVersion;

    public ConcurrencyException(String aggregateTypeName, Object streamIdentity,
                                long expectedVersion, long actualVersion) {
        super(PgEventsErrorCodes.CONCURRENCY_CONFLICT,
            String.format("Unexpected stream version for %s #%s: expected %d but was %d",
                aggregateTypeName == null ? "stream" : aggregateTypeName,
                streamIdentity, expectedVersion, actualVersion));
        this.aggregateTypeName = aggregateTypeName;
        this.streamIdentity = Objects.requireNonNull(streamIdentity, "Stream identity cannot be null");
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String getAggregateTypeName() {
        return aggregateTypeName;
    }

    public Object getStreamIdentity() {
        return streamIdentity;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
