package dev.mars.pgevents.store.aggregation;

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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Folds the events of one stream into an aggregate.
 *
 * <p>The apply table is fixed when {@link Builder#build()} is called:</p>
 * <ul>
 *   <li>the first event creates the aggregate through its {@code createdBy} handler,
 *       or through the default creator followed by its {@code apply} handler;</li>
 *   <li>every later event runs its {@code apply} handler; events without one are ignored.</li>
 * </ul>
 *
 * <pre>{@code
 * Aggregator<Trip> trips = Aggregator.forType(Trip.class)
 *     .createdBy(TripStarted.class, Trip::new)
 *     .apply(TripEnded.class, Trip::end)
 *     .build();
 * }</pre>
 *
 * @param <T> aggregate type
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
public final class Aggregator<T> {

    private final Class<T> aggregateType;
    private final Map<Class<?>, Function<Object, T>> creators;
    private final Map<Class<?>, BiFunction<T, Object, T>> appliers;
    private final Function<StreamEvent<?>, T> defaultCreator;
    private final Set<Class<?>> handledEventTypes;

    private Aggregator(Builder<T> builder) {
        this.aggregateType = builder.aggregateType;
        this.creators = Collections.unmodifiableMap(new LinkedHashMap<>(builder.creators));
        this.appliers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.appliers));
        this.defaultCreator = builder.defaultCreator;
        Set<Class<?>> handled = new LinkedHashSet<>(creators.keySet());
        handled.addAll(appliers.keySet());
        this.handledEventTypes = Collections.unmodifiableSet(handled);
    }

    public static <T> Builder<T> forType(Class<T> aggregateType) {
        return new Builder<>(aggregateType);
    }

    /**
     * Live aggregation from the first event.
     *
     * @return the aggregate, or null when there are no events
     */
    public T build(List<? extends StreamEvent<?>> events) {
        return fold(null, events);
    }

    /**
     * Applies events on top of an existing aggregate, which may be null.
     */
    public T fold(T start, List<? extends StreamEvent<?>> events) {
        T aggregate = start;
        for (StreamEvent<?> event : events) {
            aggregate = applyOne(aggregate, event);
        }
        return aggregate;
    }

    public T applyOne(T current, StreamEvent<?> event) {
        Object data = event.getData();
        T aggregate = current;
        if (aggregate == null) {
            Function<Object, T> creator = lookup(creators, data.getClass());
            if (creator != null) {
                return creator.apply(data);
            }
            if (defaultCreator == null) {
                throw new IllegalStateException(String.format(
                    "No way to create a %s from event %s; register createdBy(%s) or a default creator",
                    aggregateType.getSimpleName(), data.getClass().getSimpleName(), data.getClass().getSimpleName()));
            }
            aggregate = defaultCreator.apply(event);
        }
        BiFunction<T, Object, T> applier = lookup(appliers, data.getClass());
        return applier == null ? aggregate : applier.apply(aggregate, data);
    }

    public Class<T> getAggregateType() {
        return aggregateType;
    }

    public Set<Class<?>> getHandledEventTypes() {
        return handledEventTypes;
    }

    /**
     * Exact class first, then the first registered supertype.
     */
    private static <H> H lookup(Map<Class<?>, H> table, Class<?> eventType) {
        H handler = table.get(eventType);
        if (handler != null) {
            return handler;
        }
        for (Map.Entry<Class<?>, H> entry : table.entrySet()) {
            if (entry.getKey().isAssignableFrom(eventType)) {
                return entry.getValue();
            }
        }
        return null;
    }

    public static final class Builder<T> {
        private final Class<T> aggregateType;
        private final Map<Class<?>, Function<Object, T>> creators = new LinkedHashMap<>();
        private final Map<Class<?>, BiFunction<T, Object, T>> appliers = new LinkedHashMap<>();
        private Function<StreamEvent<?>, T> defaultCreator;

        private Builder(Class<T> aggregateType) {
            this.aggregateType = Objects.requireNonNull(aggregateType, "aggregateType");
        }

        public <E> Builder<T> createdBy(Class<E> eventType, Function<E, T> creator) {
            Objects.requireNonNull(creator, "creator");
            creators.put(eventType, data -> creator.apply(eventType.cast(data)));
            return this;
        }

        public Builder<T> defaultCreator(Function<StreamEvent<?>, T> creator) {
            this.defaultCreator = Objects.requireNonNull(creator, "creator");
            return this;
        }

        public <E> Builder<T> apply(Class<E> eventType, BiFunction<T, E, T> applier) {
            Objects.requireNonNull(applier, "applier");
            appliers.put(eventType, (aggregate, data) -> applier.apply(aggregate, eventType.cast(data)));
            return this;
        }

        public Aggregator<T> build() {
            return new Aggregator<>(this);
        }
    }
}
