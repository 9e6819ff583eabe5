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
 * Raised by an exclusive fetch when another session already holds the stream lock.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class StreamLockedException extends PgEventsException {

    private final Object streamIdentity;

    public StreamLockedException(Object streamIdentity) {
        super(PgEventsErrorCodes.STREAM_LOCKED,
            "Stream " + streamIdentity + " may be locked for updates by another session");
        this.streamIdentity = streamIdentity;
    }

    public Object getStreamIdentity() {
        return streamIdentity;
    }
}
