package dev.mars.pgevents.store.events;

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

import dev.mars.pgevents.api.SimpleStreamEvent;
import dev.mars.pgevents.api.StreamEvent;
import dev.mars.pgevents.api.StreamIdentity;
import io.vertx.sqlclient.Row;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Maps {@code pge_events} rows to {@link StreamEvent}s.
 *
 * <p>Queries must select {@link #COLUMNS}; the payload is read as text
 * ({@code data::text}) and handed to the {@link EventSerializer}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-04
 * @version 1.0
 */
public class EventRowMapper {

    public static final String COLUMNS =
        "seq_id, id, stream_id, version, data::text AS data, type, java_type, timestamp, tenant_id, is_archived";

    private final StreamIdentity streamIdentity;
    private final EventTypeRegistry eventTypes;
    private final EventSerializer serializer;

    public EventRowMapper(StreamIdentity streamIdentity, EventTypeRegistry eventTypes, EventSerializer serializer) {
        this.streamIdentity = Objects.requireNonNull(streamIdentity, "streamIdentity");
        this.eventTypes = Objects.requireNonNull(eventTypes, "eventTypes");
        this.serializer = Objects.requireNonNull(serializer, "serializer");
    }

    public StreamEvent<Object> map(Row row) {
        String alias = row.getString("type");
        Class<?> eventType = eventTypes.resolve(alias, row.getString("java_type"));
        Object data = serializer.deserialize(row.getString("data"), eventType);
        OffsetDateTime timestamp = row.getOffsetDateTime("timestamp");

        return new SimpleStreamEvent<>(
            row.getUUID("id"),
            row.getLong("seq_id"),
            row.getLong("version"),
            readIdentity(row, "stream_id"),
            data,
            alias,
            timestamp.toInstant(),
            row.getString("tenant_id"),
            row.getBoolean("is_archived"));
    }

    public List<StreamEvent<?>> mapAll(Iterable<Row> rows) {
        List<StreamEvent<?>> events = new ArrayList<>();
        for (Row row : rows) {
            events.add(map(row));
        }
        return events;
    }

    /**
     * Reads a stream identity column in the store's identity type.
     */
    public Object readIdentity(Row row, String column) {
        return streamIdentity == StreamIdentity.AS_GUID ? row.getUUID(column) : row.getString(column);
    }
}
