package dev.mars.pgevents.store.schema;

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

import dev.mars.pgevents.api.StreamIdentity;
import dev.mars.pgevents.api.TenancyStyle;
import dev.mars.pgevents.db.util.PostgreSqlIdentifierValidator;
import io.vertx.core.Future;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.SqlConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Fixed bootstrap script of the event store tables.
 *
 * <p>Every statement is idempotent ({@code IF NOT EXISTS}), so the script can run
 * on every start. There is one variant per {@link StreamIdentity} and
 * {@link TenancyStyle}; changing either on an existing schema is not supported.</p>
 *
 * <p>The class also owns the schema-qualified names of every table, so SQL built
 * elsewhere never depends on the connection's {@code search_path}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-04
 * @version 1.0
 */
public final class EventStoreSchema {
    private static final Logger logger = LoggerFactory.getLogger(EventStoreSchema.class);

    public static final String EVENTS_SEQUENCE = "pge_events_sequence";
    public static final String STREAMS_TABLE = "pge_streams";
    public static final String EVENTS_TABLE = "pge_events";
    public static final String PROGRESSION_TABLE = "pge_event_progression";
    public static final String DEAD_LETTERS_TABLE = "pge_dead_letters";
    public static final String SNAPSHOTS_TABLE = "pge_snapshots";

    /** Advisory lock key serializing concurrent bootstraps of the same database. */
    static final long BOOTSTRAP_LOCK_ID = 4_242_000_001L;

    private final String schema;
    private final StreamIdentity streamIdentity;
    private final TenancyStyle tenancy;

    public EventStoreSchema(String schema, StreamIdentity streamIdentity, TenancyStyle tenancy) {
        PostgreSqlIdentifierValidator.validate(schema, "schema");
        this.schema = schema;
        this.streamIdentity = Objects.requireNonNull(streamIdentity, "streamIdentity");
        this.tenancy = Objects.requireNonNull(tenancy, "tenancy");
    }

    public String getSchema() {
        return schema;
    }

    public StreamIdentity getStreamIdentity() {
        return streamIdentity;
    }

    public TenancyStyle getTenancy() {
        return tenancy;
    }

    public boolean isConjoined() {
        return tenancy == TenancyStyle.CONJOINED;
    }

    public String sequence() {
        return PostgreSqlIdentifierValidator.qualify(schema, EVENTS_SEQUENCE);
    }

    public String streams() {
        return PostgreSqlIdentifierValidator.qualify(schema, STREAMS_TABLE);
    }

    public String events() {
        return PostgreSqlIdentifierValidator.qualify(schema, EVENTS_TABLE);
    }

    public String progression() {
        return PostgreSqlIdentifierValidator.qualify(schema, PROGRESSION_TABLE);
    }

    public String deadLetters() {
        return PostgreSqlIdentifierValidator.qualify(schema, DEAD_LETTERS_TABLE);
    }

    public String snapshots() {
        return PostgreSqlIdentifierValidator.qualify(schema, SNAPSHOTS_TABLE);
    }

    /**
     * The statements of the bootstrap script, in execution order.
     */
    public List<String> bootstrapStatements() {
        String idType = streamIdentity.getColumnType();
        String streamKey = isConjoined() ? "tenant_id, id" : "id";
        String eventStreamKey = isConjoined() ? "tenant_id, stream_id" : "stream_id";

        List<String> statements = new ArrayList<>();
        statements.add("CREATE SCHEMA IF NOT EXISTS " + schema);
        statements.add("CREATE SEQUENCE IF NOT EXISTS " + sequence());

        statements.add("""
            CREATE TABLE IF NOT EXISTS %s (
                id %s NOT NULL,
                type varchar NULL,
                version bigint NOT NULL DEFAULT 0,
                timestamp timestamptz NOT NULL DEFAULT now(),
                created timestamptz NOT NULL DEFAULT now(),
                tenant_id varchar NOT NULL DEFAULT '%s',
                is_archived boolean NOT NULL DEFAULT false,
                CONSTRAINT pkey_pge_streams PRIMARY KEY (%s)
            )""".formatted(streams(), idType, TenancyStyle.DEFAULT_TENANT_ID, streamKey));

        statements.add("""
            CREATE TABLE IF NOT EXISTS %s (
                seq_id bigint NOT NULL,
                id uuid NOT NULL,
                stream_id %s NOT NULL,
                version bigint NOT NULL,
                data jsonb NOT NULL,
                type varchar(500) NOT NULL,
                java_type varchar(500) NULL,
                timestamp timestamptz NOT NULL DEFAULT now(),
                tenant_id varchar NOT NULL DEFAULT '%s',
                is_archived boolean NOT NULL DEFAULT false,
                CONSTRAINT pkey_pge_events PRIMARY KEY (seq_id),
                CONSTRAINT uq_pge_events_stream_version UNIQUE (%s, version),
                CONSTRAINT fkey_pge_events_stream FOREIGN KEY (%s)
                    REFERENCES %s (%s) ON DELETE CASCADE
            )""".formatted(events(), idType, TenancyStyle.DEFAULT_TENANT_ID,
                eventStreamKey, eventStreamKey, streams(), streamKey));

        statements.add("""
            CREATE TABLE IF NOT EXISTS %s (
                name varchar NOT NULL,
                last_seq_id bigint NULL,
                last_updated timestamptz NULL DEFAULT transaction_timestamp(),
                CONSTRAINT pkey_pge_event_progression PRIMARY KEY (name)
            )""".formatted(progression()));

        statements.add("""
            CREATE TABLE IF NOT EXISTS %s (
                id bigserial NOT NULL,
                projection_name varchar NOT NULL,
                shard_name varchar NOT NULL,
                event_sequence bigint NOT NULL,
                event_id uuid NULL,
                stream_id varchar NULL,
                event_type varchar NULL,
                error_type varchar NOT NULL,
                error_message text NULL,
                recorded_at timestamptz NOT NULL DEFAULT now(),
                CONSTRAINT pkey_pge_dead_letters PRIMARY KEY (id)
            )""".formatted(deadLetters()));

        statements.add("CREATE INDEX IF NOT EXISTS idx_pge_dead_letters_projection ON "
            + deadLetters() + " (projection_name)");

        statements.add("""
            CREATE TABLE IF NOT EXISTS %s (
                type varchar NOT NULL,
                id varchar NOT NULL,
                tenant_id varchar NOT NULL DEFAULT '%s',
                version bigint NOT NULL,
                doc_version uuid NOT NULL,
                data jsonb NOT NULL,
                last_modified timestamptz NOT NULL DEFAULT transaction_timestamp(),
                CONSTRAINT pkey_pge_snapshots PRIMARY KEY (type, tenant_id, id)
            )""".formatted(snapshots(), TenancyStyle.DEFAULT_TENANT_ID));

        return statements;
    }

    /**
     * Runs the bootstrap script in one transaction holding a transaction-scoped advisory lock.
     */
    public Future<Void> ensureStorageExists(Pool pool) {
        List<String> statements = bootstrapStatements();
        logger.info("Ensuring event store storage exists in schema '{}' ({}, {})",
            schema, streamIdentity, tenancy);

        return pool.withTransaction(conn ->
            conn.query("SELECT pg_advisory_xact_lock(" + BOOTSTRAP_LOCK_ID + ")").execute()
                .compose(locked -> runInOrder(conn, statements, 0))
        ).onSuccess(v -> logger.info("Event store storage ready in schema '{}'", schema))
         .onFailure(err -> logger.error("Failed to bootstrap event store storage in schema '{}': {}",
             schema, err.getMessage()));
    }

    private static Future<Void> runInOrder(SqlConnection conn, List<String> statements, int index) {
        if (index >= statements.size()) {
            return Future.succeededFuture();
        }
        return conn.query(statements.get(index)).execute()
            .compose(done -> runInOrder(conn, statements, index + 1));
    }
}
