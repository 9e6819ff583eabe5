package dev.mars.pgevents.store.projection;

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

import io.vertx.core.Future;
import io.vertx.sqlclient.SqlConnection;
import io.vertx.sqlclient.Tuple;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Statements collected while a projection applies one page of events.
 *
 * <p>The batch is executed in order, in the same transaction that records dead
 * letters and advances the shard's progress, so projected data and progress
 * never diverge.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
public class ProjectionBatch {

    private final List<Statement> statements = new ArrayList<>();

    public ProjectionBatch add(String sql) {
        return add(sql, Tuple.tuple());
    }

    public ProjectionBatch add(String sql, Tuple params) {
        statements.add(new Statement(Objects.requireNonNull(sql, "sql"), Objects.requireNonNull(params, "params")));
        return this;
    }

    public List<Statement> getStatements() {
        return Collections.unmodifiableList(statements);
    }

    public int size() {
        return statements.size();
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    public Future<Void> execute(SqlConnection conn) {
        return executeFrom(conn, 0);
    }

    private Future<Void> executeFrom(SqlConnection conn, int index) {
        if (index >= statements.size()) {
            return Future.succeededFuture();
        }
        Statement statement = statements.get(index);
        return conn.preparedQuery(statement.sql()).execute(statement.params())
            .compose(rows -> executeFrom(conn, index + 1));
    }

    public record Statement(String sql, Tuple params) {
    }
}
