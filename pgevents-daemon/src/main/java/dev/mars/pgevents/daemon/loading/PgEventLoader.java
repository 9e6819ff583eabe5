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
import dev.mars.pgevents.api.error.UnknownEventTypeException;
import dev.mars.pgevents.store.events.EventRowMapper;
import io.vertx.core.Future;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.SqlClient;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads a sequence range of non-archived events across every stream and tenant.
 *
 * <p>Rows whose event type alias is neither registered nor resolvable through the
 * stored Java type are left out of the page with a warning; the shard still
 * advances past them.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public class PgEventLoader implements EventLoader {
    private static final Logger logger = LoggerFactory.getLogger(PgEventLoader.class);

    private final SqlClient client;
    private final EventRowMapper rowMapper;
    private final String selectSql;

    public PgEventLoader(SqlClient client, String eventsTable, EventRowMapper rowMapper) {
        this.client = client;
        this.rowMapper = rowMapper;
        this.selectSql = "SELECT " + EventRowMapper.COLUMNS + " FROM " + eventsTable
            + " WHERE seq_id > $1 AND seq_id <= $2 AND is_archived = false ORDER BY seq_id";
    }

    @Override
    public Future<EventPage> load(EventRequest request) {
        return client.preparedQuery(selectSql).execute(Tuple.of(request.floor(), request.ceiling()))
            .map(rows -> {
                List<StreamEvent<?>> events = new ArrayList<>(rows.size());
                int skipped = 0;
                for (Row row : rows) {
                    try {
                        events.add(rowMapper.map(row));
                    } catch (UnknownEventTypeException e) {
                        skipped++;
                        logger.warn("Shard {} skips event #{}: {}", request.shard(), row.getLong("seq_id"), e.getMessage());
                    }
                }
                logger.debug("Loaded {} events for {} in ({}, {}]", events.size(), request.shard(),
                    request.floor(), request.ceiling());
                return new EventPage(request, events, skipped);
            });
    }
}
