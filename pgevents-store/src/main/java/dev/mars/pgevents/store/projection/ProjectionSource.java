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
import dev.mars.pgevents.api.projection.ShardName;
import io.vertx.core.Future;
import io.vertx.sqlclient.SqlConnection;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * An asynchronous projection run by the projection daemon.
 *
 * <p>A projection with one shard consumes the whole log under the shard
 * {@code Name:All}. With more shards each shard {@code Name:<index>} only sees the
 * streams whose identity hashes to its index.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
public interface ProjectionSource {

    String getName();

    default int getShardCount() {
        return 1;
    }

    /**
     * Event classes the projection handles. Empty means every event.
     */
    Set<Class<?>> getEventTypes();

    /**
     * Applies one page of events, writing its changes into {@code batch}.
     *
     * @param conn the connection of the apply transaction, for reads
     * @param page events of this shard in sequence order
     * @param errors called for every event that fails to apply
     */
    Future<Void> apply(ProjectionContext context, SqlConnection conn, ProjectionBatch batch,
                       List<StreamEvent<?>> page, ApplyErrorHandler errors);

    /**
     * Adds the statements deleting everything this projection wrote, run before a rebuild.
     */
    void teardown(ProjectionContext context, ProjectionBatch batch);

    default List<ShardName> getShardNames() {
        int count = getShardCount();
        if (count <= 1) {
            return List.of(ShardName.all(getName()));
        }
        List<ShardName> names = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            names.add(new ShardName(getName(), String.valueOf(i)));
        }
        return names;
    }

    default boolean handles(StreamEvent<?> event) {
        Set<Class<?>> types = getEventTypes();
        if (types.isEmpty()) {
            return true;
        }
        Class<?> eventType = event.getData().getClass();
        for (Class<?> type : types) {
            if (type.isAssignableFrom(eventType)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Whether the event belongs to the given shard of this projection.
     */
    default boolean belongsTo(ShardName shard, StreamEvent<?> event) {
        if (ShardName.ALL.equals(shard.getShardKey())) {
            return true;
        }
        return shardFor(event.getStreamIdentity()).equals(shard);
    }

    /**
     * The shard consuming the events of one stream.
     */
    default ShardName shardFor(Object streamIdentity) {
        int count = getShardCount();
        if (count <= 1) {
            return ShardName.all(getName());
        }
        return new ShardName(getName(), String.valueOf(Math.floorMod(streamIdentity.hashCode(), count)));
    }
}
