package dev.mars.pgevents.store.progress;

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

import dev.mars.pgevents.api.error.ProgressionProgressOutOfOrderException;
import dev.mars.pgevents.api.projection.ShardName;
import dev.mars.pgevents.api.projection.ShardProgress;
import dev.mars.pgevents.store.schema.EventStoreSchema;
import io.vertx.core.Future;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.SqlClient;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads and writes {@code pge_event_progression}.
 *
 * <p>Each projection shard owns one row holding the last sequence it applied.
 * Shards advance their row with a guarded update so that two agents running the
 * same shard cannot both commit the same page. The high-water mark is stored in
 * the row named {@link ShardName#HIGH_WATER_MARK}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
public class ProjectionProgressStore {
    private static final Logger logger = LoggerFactory.getLogger(ProjectionProgressStore.class);

    private final String selectAllSql;
    private final String selectOneSql;
    private final String ensureSql;
    private final String advanceSql;
    private final String resetSql;
    private final String upsertSql;

    public ProjectionProgressStore(EventStoreSchema schema) {
        String table = schema.progression();
        this.selectAllSql = "SELECT name, last_seq_id, last_updated FROM " + table + " ORDER BY name";
        this.selectOneSql = "SELECT name, last_seq_id, last_updated FROM " + table + " WHERE name = $1";
        this.ensureSql = "INSERT INTO " + table + " (name, last_seq_id) VALUES ($1, 0) ON CONFLICT (name) DO NOTHING";
        this.advanceSql = "UPDATE " + table + " SET last_seq_id = $2, last_updated = transaction_timestamp()"
            + " WHERE name = $1 AND last_seq_id = $3";
        this.resetSql = "DELETE FROM " + table + " WHERE name = $1";
        this.upsertSql = "INSERT INTO " + table + " (name, last_seq_id) VALUES ($1, $2)"
            + " ON CONFLICT (name) DO UPDATE SET last_seq_id = EXCLUDED.last_seq_id, last_updated = transaction_timestamp()";
    }

    public Future<List<ShardProgress>> all(SqlClient client) {
        return client.preparedQuery(selectAllSql).execute()
            .map(rows -> {
                List<ShardProgress> progress = new ArrayList<>();
                for (Row row : rows) {
                    progress.add(toProgress(row));
                }
                return progress;
            });
    }

    public Future<Optional<ShardProgress>> find(SqlClient client, String name) {
        return client.preparedQuery(selectOneSql).execute(Tuple.of(name))
            .map(rows -> rows.size() == 0
                ? Optional.<ShardProgress>empty()
                : Optional.of(toProgress(rows.iterator().next())));
    }

    /**
     * Last applied sequence of a shard, 0 when the shard never ran.
     */
    public Future<Long> lastSequence(SqlClient client, ShardName shard) {
        return find(client, shard.getIdentity()).map(found -> found.map(ShardProgress::lastSequenceId).orElse(0L));
    }

    /**
     * Creates the shard's row at 0 unless it exists.
     */
    public Future<Void> ensure(SqlClient client, ShardName shard) {
        return client.preparedQuery(ensureSql).execute(Tuple.of(shard.getIdentity())).mapEmpty();
    }

    /**
     * Moves a shard from {@code floor} to {@code ceiling}.
     *
     * @throws ProgressionProgressOutOfOrderException (as a failed future) when the stored value is not {@code floor}
     */
    public Future<Void> advance(SqlClient client, ShardName shard, long floor, long ceiling) {
        return client.preparedQuery(advanceSql).execute(Tuple.of(shard.getIdentity(), ceiling, floor))
            .compose(rows -> {
                if (rows.rowCount() == 0) {
                    logger.warn("Progress of {} was not at {}; another agent may own this shard", shard, floor);
                    return Future.failedFuture(new ProgressionProgressOutOfOrderException(shard.getIdentity(), floor));
                }
                return Future.<Void>succeededFuture();
            });
    }

    public Future<Void> reset(SqlClient client, ShardName shard) {
        return client.preparedQuery(resetSql).execute(Tuple.of(shard.getIdentity())).mapEmpty();
    }

    /**
     * Writes a value unconditionally. Used for the high-water mark.
     */
    public Future<Void> store(SqlClient client, String name, long sequence) {
        return client.preparedQuery(upsertSql).execute(Tuple.of(name, sequence)).mapEmpty();
    }

    private static ShardProgress toProgress(Row row) {
        Long last = row.getLong("last_seq_id");
        OffsetDateTime updated = row.getOffsetDateTime("last_updated");
        return new ShardProgress(row.getString("name"), last == null ? 0L : last,
            updated == null ? null : updated.toInstant());
    }
}
