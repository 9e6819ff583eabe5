package dev.mars.pgevents.api;

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

import java.util.UUID;

/**
 * How streams are identified within one event store.
 *
 * <p>The identity style is fixed when the store is built. A store configured
 * with {@link #AS_GUID} only accepts {@link UUID} identities, a store configured
 * with {@link #AS_STRING} only accepts {@link String} keys.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public enum StreamIdentity {
    AS_GUID(UUID.class, "uuid"),
    AS_STRING(String.class, "varchar");

    private final Class<?> idType;
    private final String columnType;

    StreamIdentity(Class<?> idType, String columnType) {
        this.idType = idType;
        this.columnType = columnType;
    }

    public Class<?> getIdType() {
        return idType;
    }

    /**
     * PostgreSQL column type used for stream identity columns.
     */
    public String getColumnType() {
        return columnType;
    }

    /**
     * Checks that the given identity matches this identity style.
     *
     * @param identity the stream id or key
     * @return the identity, unchanged
     * @throws IllegalArgumentException if the identity is null or of the wrong type
     */
    public Object validate(Object identity) {
        if (identity == null) {
            throw new IllegalArgumentException("Stream identity cannot be null");
        }
        if (!idType.isInstance(identity)) {
            throw new IllegalArgumentException(String.format(
                "Stream identity '%s' is a %s but this store identifies streams %s (%s)",
                identity, identity.getClass().getSimpleName(), name(), idType.getSimpleName()));
        }
        if (identity instanceof String && ((String) identity).isBlank()) {
            throw new IllegalArgumentException("Stream key cannot be blank");
        }
        return identity;
    }
}
