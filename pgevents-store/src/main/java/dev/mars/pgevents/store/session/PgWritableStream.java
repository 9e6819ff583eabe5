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

import dev.mars.pgevents.api.WritableStream;

import java.util.Arrays;
import java.util.List;

/**
 * Handle returned by the fetch-for-writing operations of {@link PgEventSession}.
 *
 * <p>Events appended through the handle are queued in the session with the
 * version seen at fetch time as the explicit expected version. A stream that did
 * not exist at fetch time is started instead.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
final class PgWritableStream<T> implements WritableStream<T> {

    private final PgEventSession session;
    private final Class<T> aggregateType;
    private final Object identity;
    private final T aggregate;
    private final long startingVersion;
    private long appended;

    PgWritableStream(PgEventSession session, Class<T> aggregateType, Object identity, T aggregate, long startingVersion) {
        this.session = session;
        this.aggregateType = aggregateType;
        this.identity = identity;
        this.aggregate = aggregate;
        this.startingVersion = startingVersion;
    }

    @Override
    public T getAggregate() {
        return aggregate;
    }

    @Override
    public long getStartingVersion() {
        return startingVersion;
    }

    @Override
    public long getCurrentVersion() {
        return startingVersion + appended;
    }

    @Override
    public Object getIdentity() {
        return identity;
    }

    Class<T> getAggregateType() {
        return aggregateType;
    }

    @Override
    public void appendOne(Object event) {
        appendMany(List.of(event));
    }

    @Override
    public void appendMany(Object... events) {
        appendMany(Arrays.asList(events));
    }

    @Override
    public void appendMany(List<?> events) {
        session.enqueueFromHandle(this, events);
        appended += events.size();
    }
}
