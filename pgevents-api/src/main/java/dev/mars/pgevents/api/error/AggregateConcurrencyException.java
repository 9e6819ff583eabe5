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

import java.util.List;
import java.util.stream.Collectors;

/**
 * Several concurrency conflicts detected while flushing one batch.
 *
 * <p>Every conflicting stream of the batch is reported, not just the first one.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class AggregateConcurrencyException extends PgEventsException {

    private final List<ConcurrencyException> conflicts;

    public AggregateConcurrencyException(List<ConcurrencyException> conflicts) {
        super(PgEventsErrorCodes.AGGREGATE_CONCURRENCY_CONFLICT,
            conflicts.size() + " concurrency conflicts: " + conflicts.stream()
                .map(Throwable::getMessage)
                .collect(Collectors.joining("; ")));
        this.conflicts = List.copyOf(conflicts);
        this.conflicts.forEach(this::addSuppressed);
    }

    public List<ConcurrencyException> getConflicts() {
        return conflicts;
    }
}
