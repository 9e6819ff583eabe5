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

import dev.mars.pgevents.api.projection.ShardName;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable set of the projections registered on an event store.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
public final class ProjectionRegistry {

    private final Map<String, ProjectionSource> projections;

    public ProjectionRegistry(Collection<ProjectionSource> sources) {
        Map<String, ProjectionSource> byName = new LinkedHashMap<>();
        for (ProjectionSource source : sources) {
            if (byName.putIfAbsent(source.getName(), source) != null) {
                throw new IllegalArgumentException("Duplicate projection name: " + source.getName());
            }
        }
        this.projections = Collections.unmodifiableMap(byName);
    }

    public Collection<ProjectionSource> all() {
        return projections.values();
    }

    public Optional<ProjectionSource> find(String name) {
        return Optional.ofNullable(projections.get(name));
    }

    /**
     * The snapshot projection maintaining documents of the given aggregate type, if any.
     */
    @SuppressWarnings("unchecked")
    public <T> Optional<SnapshotProjection<T>> snapshotFor(Class<T> aggregateType) {
        for (ProjectionSource source : projections.values()) {
            if (source instanceof SnapshotProjection<?> snapshot && snapshot.getAggregateType().equals(aggregateType)) {
                return Optional.of((SnapshotProjection<T>) snapshot);
            }
        }
        return Optional.empty();
    }

    public List<ShardName> allShardNames() {
        List<ShardName> names = new ArrayList<>();
        projections.values().forEach(source -> names.addAll(source.getShardNames()));
        return names;
    }

    public boolean isEmpty() {
        return projections.isEmpty();
    }
}
