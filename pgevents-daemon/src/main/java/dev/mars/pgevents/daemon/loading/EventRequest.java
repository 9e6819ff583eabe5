package dev.mars.pgevents.daemon.loading;

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

import java.util.Objects;

/**
 * A range of the event log requested by one shard: {@code floor < seq_id <= ceiling}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public record EventRequest(ShardName shard, long floor, long ceiling) {

    public EventRequest {
        Objects.requireNonNull(shard, "shard");
        if (floor < 0 || ceiling < floor) {
            throw new IllegalArgumentException("Invalid event range (" + floor + ", " + ceiling + "] for " + shard);
        }
    }
}
