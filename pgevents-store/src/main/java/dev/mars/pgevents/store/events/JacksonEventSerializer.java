package dev.mars.pgevents.store.events;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.pgevents.api.error.PgEventsErrorCodes;
import dev.mars.pgevents.api.error.PgEventsException;

import java.util.Objects;

/**
 * {@link EventSerializer} backed by the manager's Jackson {@link ObjectMapper}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-04
 * @version 1.0
 */
public class JacksonEventSerializer implements EventSerializer {

    private final ObjectMapper objectMapper;

    public JacksonEventSerializer(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public String serialize(Object value) {
        Objects.requireNonNull(value, "Cannot serialize a null event or document");
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new PgEventsException(PgEventsErrorCodes.INTERNAL_ERROR,
                "Failed to serialize " + value.getClass().getName() + ": " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public <T> T deserialize(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new PgEventsException(PgEventsErrorCodes.EVENT_DESERIALIZATION_FAILED,
                "Failed to deserialize " + type.getName() + ": " + e.getOriginalMessage(), e);
        }
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
