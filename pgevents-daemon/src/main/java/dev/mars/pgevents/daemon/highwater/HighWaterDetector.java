package dev.mars.pgevents.daemon.highwater;

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

import dev.mars.pgevents.store.schema.EventStoreSchema;
import io.vertx.core.Future;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.SqlClient;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Finds the highest sequence below which every sequence has been committed.
 *
 * <p>Sequences are reserved before the owning transaction commits, so committed
 * events can sit above a sequence that is still in flight or was rolled back.
 * The detector reports the end of the contiguous run after the current mark
 * (the safe harbor) and the first committed sequence beyond it. The gap in
 * front of that sequence is stale once the event was committed longer ago than
 * the stale sequence threshold, measured on the database clock, so gaps left by
 * long rolled back transactions are recognised on the first detection.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public class HighWaterDetector {
    private static final Logger logger = LoggerFactory.getLogger(HighWaterDetector.class);

    private final SqlClient client;
    private final Duration staleSequenceThreshold;
    private final String detectSql;
    private final String highestCommittedSql;

    /**
     * @param staleSequenceThreshold age of the first committed event above a gap after which the gap counts as stale
     */
    public HighWaterDetector(SqlClient client, EventStoreSchema schema, Duration staleSequenceThreshold) {
        this.client = client;
        this.staleSequenceThreshold = staleSequenceThreshold;
        this.detectSql = """
            WITH run AS (
                SELECT COALESCE(max(seq_id), $1::bigint) AS run_end
                FROM (
                    SELECT seq_id, seq_id - row_number() OVER (ORDER BY seq_id) AS grp
                    FROM %1$s
                    WHERE seq_id > $1::bigint
                ) numbered
                WHERE grp = $1::bigint
            ),
            beyond AS (
                SELECT min(e.seq_id) AS next_after_gap
                FROM %1$s e, run
                WHERE e.seq_id > run.run_end
            )
            SELECT
                (SELECT CASE WHEN is_called THEN last_value ELSE 0 END FROM %2$s) AS highest_sequence,
                run.run_end AS safe_harbor,
                beyond.next_after_gap,
                COALESCE((SELECT e.timestamp <= now() - ($2::bigint * interval '1 millisecond')
                          FROM %1$s e WHERE e.seq_id = beyond.next_after_gap), false) AS stale_gap
            FROM run, beyond""".formatted(schema.events(), schema.sequence());
        this.highestCommittedSql = "SELECT COALESCE(max(seq_id), 0) AS highest FROM " + schema.events();
    }

    public Future<HighWaterStatistics> detect(long currentMark) {
        return client.preparedQuery(detectSql).execute(Tuple.of(currentMark, staleSequenceThreshold.toMillis()))
            .map(rows -> {
                Row row = rows.iterator().next();
                HighWaterStatistics statistics = new HighWaterStatistics(
                    currentMark,
                    row.getLong("safe_harbor"),
                    row.getLong("highest_sequence"),
                    row.getLong("next_after_gap"),
                    row.getBoolean("stale_gap"));
                logger.debug("High-water detection from {}: {}", currentMark, statistics);
                return statistics;
            });
    }

    /**
     * Highest committed sequence, ignoring gaps.
     */
    public Future<Long> highestCommitted() {
        return client.query(highestCommittedSql).execute()
            .map(rows -> rows.iterator().next().getLong("highest"));
    }
}
