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
 * A projection failed to apply one event.
 *
 * <p>Outside strict mode the failure is recorded as a dead letter and the shard
 * continues. In strict mode this exception halts the shard.</p>
 */
public class ApplyEventException extends PgEventsException {

    private final String shardName;
    private final long sequence;

    public ApplyEventException(String shardName, long sequence, String eventTypeName, Throwable cause) {
        super(PgEventsErrorCodes.APPLY_EVENT_FAILED,
            String.format("Shard %s failed to apply event #%d (%s): %s",
                shardName, sequence, eventTypeName, cause.getMessage()), cause);
        this.shardName = shardName;
        this.sequence = sequence;
    }

    public String getShardName() {
        return shardName;
    }

    public long getSequence() {
        return sequence;
    }
}
