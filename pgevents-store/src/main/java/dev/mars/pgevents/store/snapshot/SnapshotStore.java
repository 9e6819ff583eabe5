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

import dev.mars.pgevents.api.TenancyStyle;
import dev.mars.pgevents.store.events.EventSerializer;
import dev.mars.pgevents.store.events.EventTypeRegistry;
import dev.mars.pgevents.store.projection.ProjectionBatch;
import dev.mars.pgevents.store.schema.EventStoreSchema;
import io.vertx.core.Future;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.SqlClient;
import io.vertx.sqlclient.Tuple;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Reads and writes rows of {@code pge_snapshots}.
 *
 * <p>Snapshots are keyed by document type name, tenant and the stream identity
 * as text. With {@link TenancyStyle#SINGLE} every snapshot is stored under the
 * default tenant.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
public class SnapshotStore {

    private final EventStoreSchema schema;
    private final EventSerializer serializer;
    private final String selectSql;
    private final String upsertSql;
    private final String deleteTypeSql;

    public SnapshotStore(EventStoreSchema schema, EventSerializer serializer) {
        this.schema = Objects.requireNonNull(schema, "schema");
        this.serializer = Objects.requireNonNull(serializer, "serializer");
        this.selectSql = "SELECT version, doc_version, data::text AS data, last_modified FROM " + schema.snapshots()
            + " WHERE type = $1 AND tenant_id = $2 AND id = $3";
        this.upsertSql = "INSERT INTO " + schema.snapshots()
            + " (type, id, tenant_id, version, doc_version, data, last_modified)"
            + " VALUES ($1, $2, $3, $4, $5, $6::jsonb, transaction_timestamp())"
            + " ON CONFLICT (type, tenant_id, id) DO UPDATE SET version = EXCLUDED.version,"
            + " doc_version = EXCLUDED.doc_version, data = EXCLUDED.data, last_modified = EXCLUDED.last_modified";
        this.deleteTypeSql = "DELETE FROM " + schema.snapshots() + " WHERE type = $1";
    }

    public static String documentTypeName(Class<?> documentType) {
        return EventTypeRegistry.defaultAlias(documentType);
    }

    public String tenantKey(String tenantId) {
        return schema.isConjoined() && tenantId != null ? tenantId : TenancyStyle.DEFAULT_TENANT_ID;
    }

    public <T> Future<Optional<Snapshot<T>>> load(SqlClient client, Class<T> documentType, Object identity, String tenantId) {
        Tuple params = Tuple.of(documentTypeName(documentType), tenantKey(tenantId), identity.toString());
        return client.preparedQuery(selectSql).execute(params)
            .map(rows -> {
                if (rows.size() == 0) {
                    return Optional.<Snapshot<T>>empty();
                }
                Row row = rows.iterator().next();
                T document = serializer.deserialize(row.getString("data"), documentType);
                return Optional.of(new Snapshot<>(document, row.getLong("version"), row.getUUID("doc_version"),
                    row.getOffsetDateTime("last_modified").toInstant()));
            });
    }

    /**
     * Adds an upsert of the snapshot to the batch.
     *
     * @return the new document version
     */
    public UUID upsertInto(ProjectionBatch batch, Class<?> documentType, Object identity, String tenantId,
                           long version, Object document) {
        UUID docVersion = UUID.randomUUID();
        batch.add(upsertSql, Tuple.of(documentTypeName(documentType), identity.toString(), tenantKey(tenantId),
            version, docVersion, serializer.serialize(document)));
        return docVersion;
    }

    public void deleteAllInto(ProjectionBatch batch, Class<?> documentType) {
        batch.add(deleteTypeSql, Tuple.of(documentTypeName(documentType)));
    }
}
