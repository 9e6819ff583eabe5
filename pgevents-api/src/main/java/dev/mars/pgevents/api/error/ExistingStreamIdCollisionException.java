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

/**
 * Raised when a stream is started with an identity that already exists.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class ExistingStreamIdCollisionException extends PgEventsException {

    private final Object streamIdentity;
    private final String aggregateTypeName;

    public ExistingStreamIdCollisionException(Object streamIdentity, String aggregateTypeName) {
        super(PgEventsErrorCodes.STREAM_ID_COLLISION,
            String.format("Stream #%s already exists in the database%s", streamIdentity,
                aggregateTypeName == null ? "" : " (aggregate type " + aggregateTypeName + ")"));
        this.streamIdentity = streamIdentity;
        this.aggregateTypeName = aggregateTypeName;
    }

    public Object getStreamIdentity() {
        return streamIdentity;
    }

    public String getAggregateTypeName() {
        return aggregateTypeName;
    }
}
