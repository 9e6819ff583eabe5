package dev.mars.pgevents.store.snapshot;

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

import java.time.Instant;
import java.util.UUID;

/**
 * A persisted aggregate snapshot.
 *
 * @param document the aggregate
 * @param version the last stream version folded into the document
 * @param docVersion replaced by a new random value on every write
 * @param lastModified time of the last write
 */
public record Snapshot<T>(T document, long version, UUID docVersion, Instant lastModified) {
}
