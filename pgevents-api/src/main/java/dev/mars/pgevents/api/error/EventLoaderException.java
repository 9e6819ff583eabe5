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
 * Loading a page of events for a projection shard failed after every retry.
 *
 * <p>Projection agents treat this as a transient failure: they back off and
 * retry the whole cycle instead of stopping.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class EventLoaderException extends PgEventsException {

    private final String shardName;
    private final String databaseIdentifier;

    public EventLoaderException(String shardName, String databaseIdentifier, Throwable cause) {
        super(PgEventsErrorCodes.EVENT_LOADER_FAILED,
            String.format("Failure while trying to load events for projection shard '%s' of database '%s'",
                shardName, databaseIdentifier), cause);
        this.shardName = shardName;
        this.databaseIdentifier = databaseIdentifier;
    }

    public String getShardName() {
        return shardName;
    }

    public String getDatabaseIdentifier() {
        return databaseIdentifier;
    }
}
