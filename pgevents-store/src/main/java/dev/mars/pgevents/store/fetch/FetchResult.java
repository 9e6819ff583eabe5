package dev.mars.pgevents.store.fetch;

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

import dev.mars.pgevents.api.StreamState;

/**
 * Stream state and aggregate read for writing.
 *
 * @param state the stream row, null for a stream that does not exist yet
 * @param aggregate the aggregate folded up to {@code version}, null for a new stream
 * @param version stream version the aggregate reflects, 0 for a new stream
 */
public record FetchResult<T>(StreamState state, T aggregate, long version) {

    public boolean isNew() {
        return state == null;
    }
}
