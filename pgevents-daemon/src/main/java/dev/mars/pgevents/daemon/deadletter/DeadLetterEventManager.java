package dev.mars.pgevents.daemon.deadletter;

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

import dev.mars.pgevents.api.StreamEvent;
import dev.mars.pgevents.api.projection.ShardName;
import dev.mars.pgevents.store.projection.ProjectionBatch;
import dev.mars.pgevents.store.schema.EventStoreSchema;
import io.vertx.core.Future;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.SqlClient;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Records and queries events that projections failed to apply.
 *
 * <p>Dead letters are written through the shard's {@link ProjectionBatch}, so
 * they commit together with the page's projected data and progress. A page that
 * rolls back leaves no dead letters behind.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public class DeadLetterEventManager {
    private static final Logger logger = LoggerFactory.getLogger(DeadLetterEventManager.class);

    static final int MAX_MESSAGE_LENGTH = 4000;

    private final SqlClient client;
    private final String insertSql;
    private final String selectSql;
    private final String countSql;
    private final String deleteSql;

    public DeadLetterEventManager(SqlClient client, EventStoreSchema schema) {
        this.client = client;
        String table = schema.deadLetters();
        this.insertSql = "INSERT INTO " + table
            + " (projection_name, shard_name, event_sequence, event_id, stream_id, event_type, error_type, error_message)"
            + " VALUES ($1, $2, $3, $4, $5, $6, $7, $8)";
        this.selectSql = "SELECT id, projection_name, shard_name, event_sequence, event_id, stream_id, event_type,"
            + " error_type, error_message, recorded_at FROM " + table
            + " WHERE projection_name = $1 ORDER BY event_sequence, id";
        this.countSql = "SELECT count(*) AS total FROM " + table + " WHERE projection_name = $1";
        this.deleteSql = "DELETE FROM " + table + " WHERE projection_name = $1";
    }

    /**
     * Adds the dead letter insert for a failed event to the shard's batch.
     */
    public void recordIn(ProjectionBatch batch, ShardName shard, StreamEvent<?> event, Throwable error) {
        String message = truncate(error.getMessage());
        Tuple params = Tuple.tuple()
            .addString(shard.getProjectionName())
            .addString(shard.getIdentity())
            .addLong(event.getSequence())
            .addUUID(event.getId())
            .addString(String.valueOf(event.getStreamIdentity()))
            .addString(event.getEventTypeName())
            .addString(error.getClass().getName())
            .addString(message);
        batch.add(insertSql, params);
        logger.warn("Dead lettering event #{} ({}) of stream {} for {}: {}",
            event.getSequence(), event.getEventTypeName(), event.getStreamIdentity(), shard, error.getMessage());
    }

    public Future<List<DeadLetterEvent>> findFor(String projectionName) {
        return client.preparedQuery(selectSql).execute(Tuple.of(projectionName))
            .map(rows -> {
                List<DeadLetterEvent> events = new ArrayList<>(rows.size());
                for (Row row : rows) {
                    events.add(toEvent(row));
                }
                return events;
            });
    }

    public Future<Long> countFor(String projectionName) {
        return client.preparedQuery(countSql).execute(Tuple.of(projectionName))
            .map(rows -> rows.iterator().next().getLong("total"));
    }

    public Future<Integer> deleteFor(String projectionName) {
        return deleteFor(client, projectionName);
    }

    /**
     * Deletes the dead letters of a projection on the given client, typically a rebuild transaction.
     */
    public Future<Integer> deleteFor(SqlClient target, String projectionName) {
        return target.preparedQuery(deleteSql).execute(Tuple.of(projectionName))
            .map(rows -> {
                if (rows.rowCount() > 0) {
                    logger.info("Deleted {} dead letters of projection {}", rows.rowCount(), projectionName);
                }
                return rows.rowCount();
            });
    }

    /**
     * Cuts a message to {@link #MAX_MESSAGE_LENGTH} code points, never inside a surrogate pair.
     */
    static String truncate(String message) {
        if (message == null || message.codePointCount(0, message.length()) <= MAX_MESSAGE_LENGTH) {
            return message;
        }
        return message.substring(0, message.offsetByCodePoints(0, MAX_MESSAGE_LENGTH));
    }

    private static DeadLetterEvent toEvent(Row row) {
        OffsetDateTime recordedAt = row.getOffsetDateTime("recorded_at");
        return new DeadLetterEvent(
            row.getLong("id"),
            row.getString("projection_name"),
            row.getString("shard_name"),
            row.getLong("event_sequence"),
            row.getUUID("event_id"),
            row.getString("stream_id"),
            row.getString("event_type"),
            row.getString("error_type"),
            row.getString("error_message"),
            recordedAt == null ? null : recordedAt.toInstant());
    }
}
