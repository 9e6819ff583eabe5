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

import dev.mars.pgevents.api.StreamState;
import dev.mars.pgevents.api.error.AggregateConcurrencyException;
import dev.mars.pgevents.api.error.ConcurrencyException;
import dev.mars.pgevents.api.error.ExistingStreamIdCollisionException;
import dev.mars.pgevents.api.error.InvalidStreamOperationException;
import dev.mars.pgevents.api.error.NonExistentStreamException;
import dev.mars.pgevents.store.events.EventSerializer;
import dev.mars.pgevents.store.schema.EventStoreSchema;
import dev.mars.pgevents.store.session.VersionTracker;
import io.vertx.core.Future;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.RowSet;
import io.vertx.sqlclient.SqlConnection;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Writes the pending stream actions of one session inside the caller's transaction.
 *
 * <p>Sequence numbers for every pending event are reserved up front. Each action
 * then either inserts its stream row ({@code START}) or advances the stream
 * version with a guarded update ({@code APPEND}), and only then inserts its
 * events. Failures of individual streams are collected so that every conflicting
 * stream of the batch is reported; the returned future fails once all actions
 * were attempted, which rolls the transaction back.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-04
 * @version 1.0
 */
public class StreamWriter {
    private static final Logger logger = LoggerFactory.getLogger(StreamWriter.class);

    /** Document type under which sessions track observed stream revisions. */
    public static final Class<StreamState> STREAM_DOCUMENT_TYPE = StreamState.class;

    private final EventStoreSchema schema;
    private final EventSerializer serializer;

    private final String insertStreamSql;
    private final String updateStreamSql;
    private final String selectStreamSql;
    private final String insertEventSql;
    private final String archiveStreamSql;
    private final String archiveEventsSql;

    public StreamWriter(EventStoreSchema schema, EventSerializer serializer) {
        this.schema = Objects.requireNonNull(schema, "schema");
        this.serializer = Objects.requireNonNull(serializer, "serializer");

        String tenantFilter = schema.isConjoined() ? " AND tenant_id = $%d" : "";

        this.insertStreamSql = "INSERT INTO " + schema.streams()
            + " (id, type, version, tenant_id, timestamp, created) VALUES ($1, $2, $3, $4, now(), now())"
            + " ON CONFLICT DO NOTHING";
        this.updateStreamSql = "UPDATE " + schema.streams()
            + " SET version = $2, timestamp = now(), type = COALESCE(type, $4)"
            + " WHERE id = $1 AND version = $3 AND is_archived = false"
            + tenantFilter.formatted(5);
        this.selectStreamSql = "SELECT version, is_archived FROM " + schema.streams()
            + " WHERE id = $1" + tenantFilter.formatted(2);
        this.insertEventSql = "INSERT INTO " + schema.events()
            + " (seq_id, id, stream_id, version, data, type, java_type, timestamp, tenant_id, is_archived)"
            + " VALUES ($1, $2, $3, $4, $5::jsonb, $6, $7, now(), $8, false)";
        this.archiveStreamSql = "UPDATE " + schema.streams() + " SET is_archived = true WHERE id = $1"
            + tenantFilter.formatted(2);
        this.archiveEventsSql = "UPDATE " + schema.events() + " SET is_archived = true WHERE stream_id = $1"
            + tenantFilter.formatted(2);
    }

    /**
     * Writes every action, then archives the given streams.
     *
     * @param conn connection with an open transaction
     * @param actions pending actions in the order they were registered
     * @param archives identities of streams to archive
     * @param tenantId tenant of the archive requests
     * @param tracker revisions observed by the session
     * @return succeeded future, or a future failed with the collected stream failures
     */
    public Future<Void> write(SqlConnection conn, List<StreamAction> actions, List<Object> archives,
                              String tenantId, VersionTracker tracker) {
        int eventCount = actions.stream().mapToInt(action -> action.getEvents().size()).sum();
        List<RuntimeException> failures = new ArrayList<>();

        return SequenceAllocator.reserve(conn, schema.sequence(), eventCount)
            .compose(allocator -> writeInOrder(conn, actions, 0, allocator, tracker, failures))
            .compose(v -> {
                if (!failures.isEmpty()) {
                    logger.debug("{} of {} stream actions failed, rolling back", failures.size(), actions.size());
                    return Future.failedFuture(combine(failures));
                }
                return archiveInOrder(conn, archives, 0, tenantId);
            });
    }

    /**
     * One failure is returned as is, several concurrency conflicts are aggregated,
     * any other mix returns the first failure with the others suppressed.
     */
    public static RuntimeException combine(List<RuntimeException> failures) {
        if (failures.isEmpty()) {
            throw new IllegalArgumentException("No failures to combine");
        }
        if (failures.size() == 1) {
            return failures.get(0);
        }
        if (failures.stream().allMatch(ConcurrencyException.class::isInstance)) {
            List<ConcurrencyException> conflicts = new ArrayList<>();
            failures.forEach(failure -> conflicts.add((ConcurrencyException) failure));
            return new AggregateConcurrencyException(conflicts);
        }
        RuntimeException first = failures.get(0);
        for (int i = 1; i < failures.size(); i++) {
            first.addSuppressed(failures.get(i));
        }
        return first;
    }

    private Future<Void> writeInOrder(SqlConnection conn, List<StreamAction> actions, int index,
                                      SequenceAllocator allocator, VersionTracker tracker,
                                      List<RuntimeException> failures) {
        if (index >= actions.size()) {
            return Future.succeededFuture();
        }
        StreamAction action = actions.get(index);
        Future<Void> written = action.getActionType() == StreamAction.ActionType.START
            ? writeStart(conn, action, allocator, failures)
            : writeAppend(conn, action, allocator, tracker, failures);
        return written.compose(v -> writeInOrder(conn, actions, index + 1, allocator, tracker, failures));
    }

    private Future<Void> writeStart(SqlConnection conn, StreamAction action, SequenceAllocator allocator,
                                    List<RuntimeException> failures) {
        Tuple params = Tuple.of(action.getIdentity(), action.getAggregateTypeName(),
            (long) action.getEvents().size(), action.getTenantId());

        return conn.preparedQuery(insertStreamSql).execute(params)
            .compose(rows -> {
                if (rows.rowCount() == 0) {
                    logger.debug("Stream {} already exists", action.getIdentity());
                    failures.add(new ExistingStreamIdCollisionException(action.getIdentity(), action.getAggregateTypeName()));
                    return Future.succeededFuture();
                }
                action.prepare(0, allocator);
                return insertEvents(conn, action);
            });
    }

    private Future<Void> writeAppend(SqlConnection conn, StreamAction action, SequenceAllocator allocator,
                                     VersionTracker tracker, List<RuntimeException> failures) {
        return observedVersion(conn, action, tracker, failures)
            .compose(observed -> {
                if (observed.isEmpty()) {
                    return Future.succeededFuture();
                }
                long expected = observed.get();
                long newVersion = expected + action.getEvents().size();

                Tuple params = Tuple.of(action.getIdentity(), newVersion, expected, action.getAggregateTypeName());
                if (schema.isConjoined()) {
                    params.addString(action.getTenantId());
                }
                return conn.preparedQuery(updateStreamSql).execute(params)
                    .compose(rows -> {
                        if (rows.rowCount() == 0) {
                            return diagnoseMissedUpdate(conn, action, expected, failures);
                        }
                        action.prepare(expected, allocator);
                        return insertEvents(conn, action);
                    });
            });
    }

    /**
     * Explicit expected version, else the revision the session observed, else one read of the stream row.
     */
    private Future<Optional<Long>> observedVersion(SqlConnection conn, StreamAction action, VersionTracker tracker,
                                                   List<RuntimeException> failures) {
        if (action.hasExpectedVersion()) {
            return Future.succeededFuture(Optional.of(action.getExpectedVersion()));
        }
        Optional<Long> tracked = tracker.revisionFor(STREAM_DOCUMENT_TYPE, action.getIdentity());
        if (tracked.isPresent()) {
            return Future.succeededFuture(tracked);
        }
        return selectStream(conn, action).map(rows -> {
            if (rows.size() == 0) {
                failures.add(new NonExistentStreamException(action.getIdentity()));
                return Optional.<Long>empty();
            }
            Row row = rows.iterator().next();
            if (row.getBoolean("is_archived")) {
                failures.add(archivedStream(action));
                return Optional.<Long>empty();
            }
            return Optional.of(row.getLong("version"));
        });
    }

    private Future<Void> diagnoseMissedUpdate(SqlConnection conn, StreamAction action, long expected,
                                              List<RuntimeException> failures) {
        return selectStream(conn, action).map(rows -> {
            if (rows.size() == 0) {
                failures.add(new NonExistentStreamException(action.getIdentity()));
            } else {
                Row row = rows.iterator().next();
                if (row.getBoolean("is_archived")) {
                    failures.add(archivedStream(action));
                } else {
                    long actual = row.getLong("version");
                    logger.debug("Concurrency conflict on stream {}: expected {} actual {}",
                        action.getIdentity(), expected, actual);
                    failures.add(new ConcurrencyException(action.getAggregateTypeName(), action.getIdentity(), expected, actual));
                }
            }
            return null;
        });
    }

    private Future<RowSet<Row>> selectStream(SqlConnection conn, StreamAction action) {
        Tuple params = Tuple.of(action.getIdentity());
        if (schema.isConjoined()) {
            params.addString(action.getTenantId());
        }
        return conn.preparedQuery(selectStreamSql).execute(params);
    }

    private Future<Void> insertEvents(SqlConnection conn, StreamAction action) {
        if (action.getEvents().isEmpty()) {
            return Future.succeededFuture();
        }
        List<Tuple> batch = new ArrayList<>(action.getEvents().size());
        for (PendingEvent event : action.getEvents()) {
            batch.add(Tuple.of(
                event.getSequence(),
                event.getId(),
                action.getIdentity(),
                event.getVersion(),
                serializer.serialize(event.getData()),
                event.getEventTypeName(),
                event.getJavaTypeName(),
                action.getTenantId()));
        }
        return conn.preparedQuery(insertEventSql).executeBatch(batch)
            .onSuccess(rows -> logger.debug("Appended {} events to stream {} (version {} -> {})",
                batch.size(), action.getIdentity(), action.getStartingVersion(), action.getEndingVersion()))
            .mapEmpty();
    }

    private Future<Void> archiveInOrder(SqlConnection conn, List<Object> archives, int index, String tenantId) {
        if (index >= archives.size()) {
            return Future.succeededFuture();
        }
        Object identity = archives.get(index);
        Tuple params = Tuple.of(identity);
        if (schema.isConjoined()) {
            params.addString(tenantId);
        }
        return conn.preparedQuery(archiveStreamSql).execute(params)
            .compose(rows -> conn.preparedQuery(archiveEventsSql).execute(params))
            .compose(rows -> {
                logger.debug("Archived stream {}", identity);
                return archiveInOrder(conn, archives, index + 1, tenantId);
            });
    }

    private static InvalidStreamOperationException archivedStream(StreamAction action) {
        return new InvalidStreamOperationException(
            "Attempted to append events to archived stream " + action.getIdentity());
    }
}
