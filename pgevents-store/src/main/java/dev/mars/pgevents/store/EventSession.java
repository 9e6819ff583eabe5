package dev.mars.pgevents.store;

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
import dev.mars.pgevents.store.append.StreamAction;
import dev.mars.pgevents.store.session.VersionTracker;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Unit of work against the event store.
 *
 * <p>Appends, stream starts and archives are only recorded in the session; nothing
 * is written until {@link #saveChanges()}, which commits every pending action in
 * a single transaction. Reads go to the database immediately.</p>
 *
 * <p>Stream identities are {@link java.util.UUID}s or {@link String}s depending on
 * the store's {@link dev.mars.pgevents.api.StreamIdentity}; passing the other type
 * raises {@link IllegalArgumentException}.</p>
 *
 * <p>A session is not thread safe. Do not start a new operation before the
 * previous one's future has completed.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
public interface EventSession extends AutoCloseable {

    String getTenantId();

    /**
     * Starts a new stream. Saving fails with
     * {@link dev.mars.pgevents.api.error.ExistingStreamIdCollisionException} if it already exists.
     */
    StreamAction startStream(Object identity, Object... events);

    StreamAction startStream(Class<?> aggregateType, Object identity, Object... events);

    /**
     * Appends to an existing stream, guarded by the version this session last observed.
     */
    StreamAction append(Object identity, Object... events);

    /**
     * Appends to an existing stream that must be at {@code expectedVersion} when saved.
     */
    StreamAction append(Object identity, long expectedVersion, List<?> events);

    /**
     * Reads the stream and its aggregate for optimistic writing.
     */
    <T> CompletableFuture<WritableStream<T>> fetchForWriting(Class<T> aggregateType, Object identity);

    /**
     * As {@link #fetchForWriting(Class, Object)}, failing immediately with a
     * {@link dev.mars.pgevents.api.error.ConcurrencyException} if the stream is not at {@code expectedVersion}.
     */
    <T> CompletableFuture<WritableStream<T>> fetchForWriting(Class<T> aggregateType, Object identity, long expectedVersion);

    /**
     * Locks the stream for this session, failing immediately with
     * {@link dev.mars.pgevents.api.error.StreamLockedException} if another session holds it.
     * The lock is released when the session saves or closes.
     */
    <T> CompletableFuture<WritableStream<T>> fetchForExclusiveWriting(Class<T> aggregateType, Object identity);

    CompletableFuture<Optional<StreamState>> fetchStreamState(Object identity);

    CompletableFuture<List<StreamEvent<?>>> fetchStream(Object identity);

    /**
     * Live aggregation of the whole stream.
     *
     * @return the aggregate, or null when the stream has no events
     */
    <T> CompletableFuture<T> aggregateStream(Class<T> aggregateType, Object identity);

    /**
     * The persisted snapshot document written by a snapshot projection.
     */
    <T> CompletableFuture<Optional<T>> loadSnapshot(Class<T> aggregateType, Object identity);

    /**
     * Marks the stream and its events archived when the session is saved.
     */
    void archiveStream(Object identity);

    List<StreamAction> pendingActions();

    CompletableFuture<Void> saveChanges();

    VersionTracker versions();

    /**
     * Discards pending work and releases any exclusive stream locks.
     */
    @Override
    void close();
}
