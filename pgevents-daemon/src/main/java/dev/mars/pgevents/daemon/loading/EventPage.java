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

import dev.mars.pgevents.api.StreamEvent;

import java.util.List;

/**
 * Events loaded for an {@link EventRequest}, in sequence order.
 *
 * @param skipped rows left out because their event type could not be resolved
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public record EventPage(EventRequest request, List<StreamEvent<?>> events, int skipped) {

    public EventPage {
        events = List.copyOf(events);
    }

    public long floor() {
        return request.floor();
    }

    public long ceiling() {
        return request.ceiling();
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }
}
