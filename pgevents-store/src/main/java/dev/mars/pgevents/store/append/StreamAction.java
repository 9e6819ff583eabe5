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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Pending unit of work against one stream.
 *
 * <p>A {@link ActionType#START} action requires the stream not to exist. An
 * {@link ActionType#APPEND} action requires it to exist, unarchived, at the
 * expected starting version. The expected version is either explicit (supplied
 * by the caller) or taken from what the session last observed.</p>
 *
 * <p>Owned by the session that created it until the session saves or discards it.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-04
 * @version 1.0
 */
public final class StreamAction {

    public enum ActionType {
        START,
        APPEND
    }

    private final Object identity;
    private final String tenantId;
    private final ActionType actionType;
    private String aggregateTypeName;
    private Long expectedVersion;
    private final List<PendingEvent> events = new ArrayList<>();

    private long startingVersion = -1;
    private long endingVersion = -1;

    private StreamAction(Object identity, String tenantId, ActionType actionType,
                         String aggregateTypeName, Long expectedVersion) {
        this.identity = Objects.requireNonNull(identity, "Stream identity cannot be null");
        this.tenantId = Objects.requireNonNull(tenantId, "tenantId");
        this.actionType = actionType;
        this.aggregateTypeName = aggregateTypeName;
        this.expectedVersion = expectedVersion;
    }

    public static StreamAction start(Object identity, String tenantId, String aggregateTypeName) {
        return new StreamAction(identity, tenantId, ActionType.START, aggregateTypeName, null);
    }

    public static StreamAction append(Object identity, String tenantId, String aggregateTypeName, Long expectedVersion) {
        if (expectedVersion != null && expectedVersion < 0) {
            throw new IllegalArgumentException("Expected version cannot be negative: " + expectedVersion);
        }
        return new StreamAction(identity, tenantId, ActionType.APPEND, aggregateTypeName, expectedVersion);
    }

    public StreamAction addEvents(List<PendingEvent> newEvents) {
        events.addAll(newEvents);
        return this;
    }

    /**
     * Sets the explicit expected starting version. A different explicit value already set is rejected.
     */
    public void expectVersion(long version) {
        if (expectedVersion != null && expectedVersion != version) {
            throw new IllegalStateException(String.format(
                "Stream %s already expects version %d, cannot also expect %d", identity, expectedVersion, version));
        }
        this.expectedVersion = version;
    }

    public void describeAggregate(String typeName) {
        if (aggregateTypeName == null) {
            this.aggregateTypeName = typeName;
        }
    }

    /**
     * Assigns version and sequence to every event, starting after {@code startingVersion}.
     */
    void prepare(long startingVersion, SequenceAllocator allocator) {
        this.startingVersion = startingVersion;
        long version = startingVersion;
        for (PendingEvent event : events) {
            version++;
            event.assign(version, allocator.next());
        }
        this.endingVersion = version;
    }

    public Object getIdentity() {
        return identity;
    }

    public String getTenantId() {
        return tenantId;
    }

    public ActionType getActionType() {
        return actionType;
    }

    public String getAggregateTypeName() {
        return aggregateTypeName;
    }

    public boolean hasExpectedVersion() {
        return expectedVersion != null;
    }

    public long getExpectedVersion() {
        if (expectedVersion == null) {
            throw new IllegalStateException("No explicit expected version on stream " + identity);
        }
        return expectedVersion;
    }

    public List<PendingEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }

    /**
     * Stream version before this action, or -1 before the action was written.
     */
    public long getStartingVersion() {
        return startingVersion;
    }

    /**
     * Stream version after this action, or -1 before the action was written.
     */
    public long getEndingVersion() {
        return endingVersion;
    }

    @Override
    public String toString() {
        return "StreamAction{" + actionType + " " + identity + ", events=" + events.size()
            + (expectedVersion == null ? "" : ", expectedVersion=" + expectedVersion) + '}';
    }
}
