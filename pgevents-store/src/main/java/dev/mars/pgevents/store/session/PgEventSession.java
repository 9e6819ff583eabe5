package dev.mars.pgevents.store.session;

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
import dev.mars.pgevents.api.StreamState;
import dev.mars.pgevents.api.WritableStream;
import dev.mars.pgevents.api.error.AggregateConcurrencyException;
import dev.mars.pgevents.api.error.ConcurrencyException;
import dev.mars.pgevents.api.error.ExistingStreamIdCollisionException;
import dev.mars.pgevents.api.error.StreamLockedException;
import dev.mars.pgevents.store.EventSession;
import dev.mars.pgevents.store.StoreContext;
import dev.mars.pgevents.store.append.PendingEvent;
import dev.mars.pgevents.store.append.StreamAction;
import dev.mars.pgevents.store.append.StreamWriter;
import dev.mars.pgevents.store.fetch.FetchResult;
import dev.mars.pgevents.store.snapshot.SnapshotStore;
import io.vertx.core.Future;
import io.vertx.sqlclient.SqlClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * PostgreSQL implementation of {@link EventSession}.
 *
 * <p>Pending actions are kept per stream identity in registration order. A
 * second append to a stream already pending in the session extends the existing
 * action. Pending work is discarded once {@link #saveChanges()} is called,
 * whether the save commits or fails.</p>
 *
 * <p>Once an exclusive fetch succeeded, reads and the final save of the session go
 * through the locked connection, so the pending writes commit in the same
 * transaction that holds the stream locks.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
public class PgEventSession implements EventSession {
    private static final Logger logger = LoggerFactory.getLogger(PgEventSession.class);

    private final StoreContext context;
    private final String tenantId;
    private final VersionTracker tracker = new VersionTracker();
    private final Map<Object, StreamAction> pending = new LinkedHashMap<>();
    private final List<Object> archives = new ArrayList<>();

    private ExclusiveLockScope lockScope;
    private boolean closed = false;

    public PgEventSession(StoreContext context, String tenantId) {
        this.context = Objects.requireNonNull(context, "context");
        this.tenantId = Objects.requireNonNull(tenantId, "tenantId");
    }

    @Override
    public String getTenantId() {
        return tenantId;
    }

    @Override
    public StreamAction startStream(Object identity, Object... events) {
        return start(identity, null, Arrays.asList(events));
    }

    @Override
    public StreamAction startStream(Class<?> aggregateType, Object identity, Object... events) {
        Objects.requireNonNull(aggregateType, "aggregateType");
        return start(identity, aggregateTypeName(aggregateType), Arrays.asList(events));
    }

    @Override
    public StreamAction append(Object identity, Object... events) {
        ensureOpen();
        Object id = validate(identity);
        StreamAction action = pending.computeIfAbsent(id, key -> StreamAction.append(key, tenantId, null, null));
        return action.addEvents(toPending(Arrays.asList(events)));
    }

    @Override
    public StreamAction append(Object identity, long expectedVersion, List<?> events) {
        ensureOpen();
        Object id = validate(identity);
        StreamAction action = pending.get(id);
        if (action == null) {
            action = StreamAction.append(id, tenantId, null, expectedVersion);
            pending.put(id, action);
        } else {
            action.expectVersion(expectedVersion);
        }
        return action.addEvents(toPending(events));
    }

    private StreamAction start(Object identity, String aggregateTypeName, List<?> events) {
        ensureOpen();
        Object id = validate(identity);
        if (pending.containsKey(id)) {
            throw new ExistingStreamIdCollisionException(id, aggregateTypeName);
        }
        StreamAction action = StreamAction.start(id, tenantId, aggregateTypeName).addEvents(toPending(events));
        pending.put(id, action);
        return action;
    }

    /**
     * Queues events appended through a {@link PgWritableStream}.
     */
    void enqueueFromHandle(PgWritableStream<?> handle, List<?> events) {
        ensureOpen();
        Object id = handle.getIdentity();
        String typeName = aggregateTypeName(handle.getAggregateType());
        StreamAction action = pending.get(id);
        if (action == null) {
            action = handle.getStartingVersion() == 0
                ? StreamAction.start(id, tenantId, typeName)
                : StreamAction.append(id, tenantId, typeName, handle.getStartingVersion());
            pending.put(id, action);
        } else if (action.getActionType() == StreamAction.ActionType.APPEND) {
            action.expectVersion(handle.getStartingVersion());
        }
        action.describeAggregate(typeName);
        action.addEvents(toPending(events));
    }

    @Override
    public <T> CompletableFuture<WritableStream<T>> fetchForWriting(Class<T> aggregateType, Object identity) {
        return toCompletable(fetchHandle(readClient(), aggregateType, identity, null));
    }

    @Override
    public <T> CompletableFuture<WritableStream<T>> fetchForWriting(Class<T> aggregateType, Object identity,
                                                                   long expectedVersion) {
        return toCompletable(fetchHandle(readClient(), aggregateType, identity, expectedVersion));
    }

    @Override
    public <T> CompletableFuture<WritableStream<T>> fetchForExclusiveWriting(Class<T> aggregateType, Object identity) {
        Future<WritableStream<T>> fetched = Future.<Void>succeededFuture()
            .compose(v -> {
                ensureOpen();
                Object id = validate(identity);
                return lockScope()
                    .compose(scope -> scope.tryLock(id)
                        .recover(err -> releaseUnusedScope(scope, err))
                        .compose(locked -> fetchHandle(scope.connection(), aggregateType, id, null)));
            });
        return toCompletable(fetched);
    }

    private Future<ExclusiveLockScope> lockScope() {
        if (lockScope != null && lockScope.isOpen()) {
            return Future.succeededFuture(lockScope);
        }
        return ExclusiveLockScope.open(context.getPool(), context.getLockClassId())
            .onSuccess(scope -> this.lockScope = scope);
    }

    private Future<Void> releaseUnusedScope(ExclusiveLockScope scope, Throwable err) {
        if (err instanceof StreamLockedException) {
            context.getMetrics().recordStreamLockContention();
        }
        if (scope.holdsLocks()) {
            return Future.failedFuture(err);
        }
        lockScope = null;
        return scope.rollback().transform(ar -> Future.<Void>failedFuture(err));
    }

    private <T> Future<WritableStream<T>> fetchHandle(SqlClient client, Class<T> aggregateType, Object identity,
                                                     Long expectedVersion) {
        return Future.<Void>succeededFuture()
            .compose(v -> {
                ensureOpen();
                Object id = validate(identity);
                return context.getFetcher().fetchForWriting(client, aggregateType, id, tenantId)
                    .compose(result -> toHandle(aggregateType, id, result, expectedVersion));
            });
    }

    private <T> Future<WritableStream<T>> toHandle(Class<T> aggregateType, Object id, FetchResult<T> result,
                                                  Long expectedVersion) {
        if (expectedVersion != null && expectedVersion != result.version()) {
            return Future.failedFuture(new ConcurrencyException(aggregateTypeName(aggregateType), id,
                expectedVersion, result.version()));
        }
        if (!result.isNew()) {
            tracker.storeRevision(StreamWriter.STREAM_DOCUMENT_TYPE, id, result.version());
        }
        logger.debug("Fetched {} #{} for writing at version {}", aggregateType.getSimpleName(), id, result.version());
        return Future.succeededFuture(new PgWritableStream<>(this, aggregateType, id, result.aggregate(), result.version()));
    }

    @Override
    public CompletableFuture<Optional<StreamState>> fetchStreamState(Object identity) {
        Object id = validate(identity);
        return toCompletable(context.getFetcher().fetchState(readClient(), id, tenantId)
            .onSuccess(state -> state.ifPresent(found ->
                tracker.storeRevision(StreamWriter.STREAM_DOCUMENT_TYPE, id, found.getVersion()))));
    }

    @Override
    public CompletableFuture<List<StreamEvent<?>>> fetchStream(Object identity) {
        Object id = validate(identity);
        return toCompletable(context.getFetcher().fetchStream(readClient(), id, tenantId));
    }

    @Override
    public <T> CompletableFuture<T> aggregateStream(Class<T> aggregateType, Object identity) {
        Object id = validate(identity);
        return toCompletable(Future.<Void>succeededFuture()
            .compose(v -> context.getFetcher().aggregateStream(readClient(), aggregateType, id, tenantId)));
    }

    @Override
    public <T> CompletableFuture<Optional<T>> loadSnapshot(Class<T> aggregateType, Object identity) {
        Object id = validate(identity);
        SnapshotStore snapshots = context.getSnapshots();
        return toCompletable(snapshots.load(readClient(), aggregateType, id, tenantId)
            .map(found -> found.map(snapshot -> {
                tracker.storeVersion(aggregateType, id, snapshot.docVersion());
                return snapshot.document();
            })));
    }

    @Override
    public void archiveStream(Object identity) {
        ensureOpen();
        archives.add(validate(identity));
    }

    @Override
    public List<StreamAction> pendingActions() {
        return List.copyOf(pending.values());
    }

    @Override
    public CompletableFuture<Void> saveChanges() {
        if (closed) {
            return CompletableFuture.failedFuture(new IllegalStateException("Session is closed"));
        }
        List<StreamAction> actions = new ArrayList<>(pending.values());
        List<Object> archiving = new ArrayList<>(archives);
        pending.clear();
        archives.clear();

        ExclusiveLockScope scope = lockScope;
        lockScope = null;

        if (actions.isEmpty() && archiving.isEmpty() && scope == null) {
            return CompletableFuture.completedFuture(null);
        }

        Future<Void> saved;
        if (scope != null && scope.isOpen()) {
            saved = context.getWriter().write(scope.connection(), actions, archiving, tenantId, tracker)
                .compose(v -> scope.commit())
                .recover(err -> scope.rollback().transform(ar -> Future.<Void>failedFuture(err)));
        } else {
            saved = context.getPool().withTransaction(conn ->
                context.getWriter().write(conn, actions, archiving, tenantId, tracker));
        }

        return toCompletable(saved
            .onSuccess(v -> afterCommit(actions, archiving))
            .onFailure(this::afterFailure));
    }

    private void afterCommit(List<StreamAction> actions, List<Object> archiving) {
        int events = 0;
        for (StreamAction action : actions) {
            tracker.storeRevision(StreamWriter.STREAM_DOCUMENT_TYPE, action.getIdentity(), action.getEndingVersion());
            events += action.getEvents().size();
            if (action.getActionType() == StreamAction.ActionType.START) {
                context.getMetrics().recordStreamStarted();
            }
        }
        context.getMetrics().recordEventsAppended(events);
        logger.debug("Saved {} stream actions ({} events) and {} archives", actions.size(), events, archiving.size());
    }

    private void afterFailure(Throwable err) {
        if (err instanceof AggregateConcurrencyException aggregate) {
            context.getMetrics().recordConcurrencyConflicts(aggregate.getConflicts().size());
        } else if (err instanceof ConcurrencyException) {
            context.getMetrics().recordConcurrencyConflicts(1);
        }
        logger.debug("Saving session changes failed: {}", err.getMessage());
    }

    @Override
    public VersionTracker versions() {
        return tracker;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        pending.clear();
        archives.clear();
        if (lockScope != null && lockScope.isOpen()) {
            ExclusiveLockScope scope = lockScope;
            lockScope = null;
            scope.rollback().onFailure(err ->
                logger.warn("Failed to release exclusive stream locks on session close: {}", err.getMessage()));
        }
    }

    private SqlClient readClient() {
        return lockScope != null && lockScope.isOpen() ? lockScope.connection() : context.getPool();
    }

    private Object validate(Object identity) {
        return context.getStreamIdentity().validate(identity);
    }

    private List<PendingEvent> toPending(List<?> events) {
        List<PendingEvent> result = new ArrayList<>(events.size());
        for (Object event : events) {
            Objects.requireNonNull(event, "Events cannot be null");
            result.add(new PendingEvent(event, context.getEventTypes().aliasFor(event.getClass())));
        }
        return result;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Session is closed");
        }
    }

    static String aggregateTypeName(Class<?> aggregateType) {
        return SnapshotStore.documentTypeName(aggregateType);
    }

    private static <T> CompletableFuture<T> toCompletable(Future<T> future) {
        return future.toCompletionStage().toCompletableFuture();
    }
}
