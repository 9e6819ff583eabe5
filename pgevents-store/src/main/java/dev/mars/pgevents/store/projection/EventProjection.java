package dev.mars.pgevents.store.projection;

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
import io.vertx.core.Future;
import io.vertx.sqlclient.SqlConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Projection built from an explicit table of event handlers.
 *
 * <p>Each handler turns one event into SQL statements added to the page's
 * {@link ProjectionBatch}. Handlers run synchronously and in sequence order.</p>
 *
 * <pre>{@code
 * EventProjection counts = EventProjection.builder("TripCounts")
 *     .project(TripStarted.class, (event, data, batch) ->
 *         batch.add("UPDATE trip_counts SET started = started + 1"))
 *     .teardown("UPDATE trip_counts SET started = 0")
 *     .build();
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
public final class EventProjection implements ProjectionSource {
    private static final Logger logger = LoggerFactory.getLogger(EventProjection.class);

    /**
     * Writes the effect of one event into the batch.
     */
    @FunctionalInterface
    public interface EventHandler<E> {
        void handle(StreamEvent<?> event, E data, ProjectionBatch batch);
    }

    private final String name;
    private final int shardCount;
    private final Map<Class<?>, EventHandler<Object>> handlers;
    private final List<String> teardownStatements;

    private EventProjection(Builder builder) {
        this.name = builder.name;
        this.shardCount = builder.shardCount;
        this.handlers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.handlers));
        this.teardownStatements = List.copyOf(builder.teardownStatements);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int getShardCount() {
        return shardCount;
    }

    @Override
    public Set<Class<?>> getEventTypes() {
        return handlers.keySet();
    }

    @Override
    public Future<Void> apply(ProjectionContext context, SqlConnection conn, ProjectionBatch batch,
                              List<StreamEvent<?>> page, ApplyErrorHandler errors) {
        for (StreamEvent<?> event : page) {
            EventHandler<Object> handler = handlerFor(event.getData().getClass());
            if (handler == null) {
                continue;
            }
            try {
                handler.handle(event, event.getData(), batch);
            } catch (RuntimeException e) {
                logger.debug("Projection {} failed on event #{}: {}", name, event.getSequence(), e.getMessage());
                errors.onApplyFailure(event, e);
            }
        }
        return Future.succeededFuture();
    }

    @Override
    public void teardown(ProjectionContext context, ProjectionBatch batch) {
        teardownStatements.forEach(batch::add);
    }

    private EventHandler<Object> handlerFor(Class<?> eventType) {
        EventHandler<Object> handler = handlers.get(eventType);
        if (handler != null) {
            return handler;
        }
        for (Map.Entry<Class<?>, EventHandler<Object>> entry : handlers.entrySet()) {
            if (entry.getKey().isAssignableFrom(eventType)) {
                return entry.getValue();
            }
        }
        return null;
    }

    public static final class Builder {
        private final String name;
        private int shardCount = 1;
        private final Map<Class<?>, EventHandler<Object>> handlers = new LinkedHashMap<>();
        private final List<String> teardownStatements = new ArrayList<>();

        private Builder(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Projection name cannot be blank");
            }
            this.name = name;
        }

        public <E> Builder project(Class<E> eventType, EventHandler<E> handler) {
            Objects.requireNonNull(handler, "handler");
            handlers.put(eventType, (event, data, batch) -> handler.handle(event, eventType.cast(data), batch));
            return this;
        }

        public Builder shards(int count) {
            if (count < 1) {
                throw new IllegalArgumentException("Shard count must be at least 1");
            }
            this.shardCount = count;
            return this;
        }

        public Builder teardown(String sql) {
            teardownStatements.add(Objects.requireNonNull(sql, "sql"));
            return this;
        }

        public EventProjection build() {
            if (handlers.isEmpty()) {
                throw new IllegalStateException("Projection " + name + " has no event handlers");
            }
            return new EventProjection(this);
        }
    }
}
