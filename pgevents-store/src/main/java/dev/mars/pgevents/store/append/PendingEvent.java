package dev.mars.pgevents.store.append;

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
import java.util.UUID;

/**
 * An event waiting in a {@link StreamAction} for the session to save it.
 *
 * <p>Version and sequence are assigned by the {@link StreamWriter} inside the
 * saving transaction; until then both are 0.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-04
 * @version 1.0
 */
public final class PendingEvent {

    private final UUID id;
    private final Object data;
    private final String eventTypeName;
    private long version;
    private long sequence;

    public PendingEvent(Object data, String eventTypeName) {
        this.id = UUID.randomUUID();
        this.data = Objects.requireNonNull(data, "Event data cannot be null");
        this.eventTypeName = Objects.requireNonNull(eventTypeName, "Event type name cannot be null");
    }

    void assign(long version, long sequence) {
        this.version = version;
        this.sequence = sequence;
    }

    public UUID getId() {
        return id;
    }

    public Object getData() {
        return data;
    }

    public String getEventTypeName() {
        return eventTypeName;
    }

    public String getJavaTypeName() {
        return data.getClass().getName();
    }

    public long getVersion() {
        return version;
    }

    public long getSequence() {
        return sequence;
    }
}
