package dev.mars.pgevents.api.error;

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

/**
 * Raised when a shard tries to advance its progress row from a floor that is no
 * longer current, meaning another agent is processing the same shard.
 */
public class ProgressionProgressOutOfOrderException extends PgEventsException {

    private final String shardName;

    public ProgressionProgressOutOfOrderException(String shardName, long expectedFloor) {
        super(PgEventsErrorCodes.PROGRESS_OUT_OF_ORDER,
            String.format("Progression for %s is out of order. Expected last sequence %d; another agent may be running this shard",
                shardName, expectedFloor));
        this.shardName = shardName;
    }

    public String getShardName() {
        return shardName;
    }
}
