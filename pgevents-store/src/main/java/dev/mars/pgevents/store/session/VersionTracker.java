package dev.mars.pgevents.store.session;

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

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Session-scoped cache of the last observed version of documents and streams.
 *
 * <p>Two kinds of entries are kept per (document type, id type): a {@link UUID}
 * version, used for snapshot documents, and a {@code long} revision, used for
 * stream versions. The cache is never persisted and is not thread safe; it lives
 * and dies with its session.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-04
 * @version 1.0
 */
public class VersionTracker {

    private final Map<TypeKey, Map<?, UUID>> versions = new HashMap<>();
    private final Map<TypeKey, Map<?, Long>> revisions = new HashMap<>();

    /**
     * The live version map of one document type. Repeated calls return the same map.
     */
    @SuppressWarnings("unchecked")
    public <TDoc, TId> Map<TId, UUID> forType(Class<TDoc> documentType, Class<TId> idType) {
        return (Map<TId, UUID>) versions.computeIfAbsent(new TypeKey(documentType, idType), key -> new HashMap<TId, UUID>());
    }

    /**
     * The live revision map of one document type. Repeated calls return the same map.
     */
    @SuppressWarnings("unchecked")
    public <TDoc, TId> Map<TId, Long> revisionsFor(Class<TDoc> documentType, Class<TId> idType) {
        return (Map<TId, Long>) revisions.computeIfAbsent(new TypeKey(documentType, idType), key -> new HashMap<TId, Long>());
    }

    @SuppressWarnings("unchecked")
    public <TDoc, TId> Optional<UUID> versionFor(Class<TDoc> documentType, TId id) {
        Map<TId, UUID> map = (Map<TId, UUID>) versions.get(new TypeKey(documentType, id.getClass()));
        return map == null ? Optional.empty() : Optional.ofNullable(map.get(id));
    }

    @SuppressWarnings("unchecked")
    public <TDoc, TId> Optional<Long> revisionFor(Class<TDoc> documentType, TId id) {
        Map<TId, Long> map = (Map<TId, Long>) revisions.get(new TypeKey(documentType, id.getClass()));
        return map == null ? Optional.empty() : Optional.ofNullable(map.get(id));
    }

    @SuppressWarnings("unchecked")
    public <TDoc, TId> void storeVersion(Class<TDoc> documentType, TId id, UUID version) {
        forType(documentType, (Class<TId>) id.getClass()).put(id, version);
    }

    @SuppressWarnings("unchecked")
    public <TDoc, TId> void storeRevision(Class<TDoc> documentType, TId id, long revision) {
        revisionsFor(documentType, (Class<TId>) id.getClass()).put(id, revision);
    }

    public <TDoc, TId> void clearVersion(Class<TDoc> documentType, TId id) {
        Map<?, UUID> map = versions.get(new TypeKey(documentType, id.getClass()));
        if (map != null) {
            map.remove(id);
        }
    }

    public <TDoc, TId> void clearRevision(Class<TDoc> documentType, TId id) {
        Map<?, Long> map = revisions.get(new TypeKey(documentType, id.getClass()));
        if (map != null) {
            map.remove(id);
        }
    }

    public void clear() {
        versions.clear();
        revisions.clear();
    }

    private record TypeKey(Class<?> documentType, Class<?> idType) {
    }
}
