package dev.mars.pgevents.daemon.agent;

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
import dev.mars.pgevents.api.error.ApplyEventException;
import dev.mars.pgevents.api.projection.ShardName;
import dev.mars.pgevents.daemon.deadletter.DeadLetterEventManager;
import dev.mars.pgevents.daemon.loading.EventPage;
import dev.mars.pgevents.store.StoreContext;
import dev.mars.pgevents.store.projection.ApplyErrorHandler;
import dev.mars.pgevents.store.projection.ProjectionBatch;
import dev.mars.pgevents.store.projection.ProjectionSource;
import io.vertx.core.Future;
import io.vertx.pgclient.PgException;
import io.vertx.sqlclient.SqlConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * Applies one page of events to one projection shard.
 *
 * <p>The projection's statements, the dead letters and the guarded progress
 * update run in a single transaction. When {@code stillCurrent} turns false
 * before the progress update the transaction is rolled back with a
 * {@link CancellationException}.</p>
 *
 * <p>The page is first applied as a whole under a savepoint. When the database
 * rejects one of the projection's statements, the page is rolled back to that
 * savepoint and replayed one event at a time, each under its own savepoint, so
 * only the events whose statements fail are dead lettered (or, in strict mode,
 * reported as an {@link ApplyEventException}).</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public class ShardPageProcessor {
    private static final Logger logger = LoggerFactory.getLogger(ShardPageProcessor.class);

    private static final String PAGE_SAVEPOINT = "pge_page";
    private static final String EVENT_SAVEPOINT = "pge_event";

    /**
     * Outcome of a committed page.
     */
    public record PageResult(long ceiling, int applied, int deadLettered) {
    }

    private record ApplyFailure(StreamEvent<?> event, Throwable error) {
    }

    private final ShardName shard;
    private final ProjectionSource source;
    private final StoreContext context;
    private final DeadLetterEventManager deadLetters;
    private final ErrorHandlingOptions errorHandling;

    public ShardPageProcessor(ShardName shard, ProjectionSource source, StoreContext context,
                              DeadLetterEventManager deadLetters, ErrorHandlingOptions errorHandling) {
        this.shard = shard;
        this.source = source;
        this.context = context;
        this.deadLetters = deadLetters;
        this.errorHandling = errorHandling;
    }

    public Future<PageResult> process(EventPage page, BooleanSupplier stillCurrent) {
        List<StreamEvent<?>> events = page.events().stream()
            .filter(event -> source.handles(event) && source.belongsTo(shard, event))
            .toList();

        return context.getPool().withTransaction(conn -> {
            ProjectionBatch deadLetterBatch = new ProjectionBatch();
            AtomicInteger deadLettered = new AtomicInteger();
            ApplyErrorHandler errors = (event, error) -> {
                if (errorHandling.isStrict()) {
                    throw new ApplyEventException(shard.getIdentity(), event.getSequence(), event.getEventTypeName(), error);
                }
                deadLetters.recordIn(deadLetterBatch, shard, event, error);
                deadLettered.incrementAndGet();
            };

            Future<Void> applied = events.isEmpty()
                ? Future.succeededFuture()
                : applyPage(conn, events, errors);

            return applied
                .compose(v -> deadLetterBatch.execute(conn))
                .compose(v -> {
                    if (!stillCurrent.getAsBoolean()) {
                        return Future.failedFuture(new CancellationException(
                            "Shard " + shard + " was stopped while applying (" + page.floor() + ", " + page.ceiling() + "]"));
                    }
                    return context.getProgress().advance(conn, shard, page.floor(), page.ceiling());
                })
                .map(v -> new PageResult(page.ceiling(), events.size() - deadLettered.get(), deadLettered.get()));
        }).onSuccess(result -> {
            context.getMetrics().recordEventsApplied(shard.getIdentity(), result.applied());
            for (int i = 0; i < result.deadLettered(); i++) {
                context.getMetrics().recordDeadLetter(shard.getProjectionName());
            }
            logger.debug("Shard {} applied {} events ({} dead lettered) up to #{}",
                shard, result.applied(), result.deadLettered(), result.ceiling());
        });
    }

    private Future<Void> applyPage(SqlConnection conn, List<StreamEvent<?>> events, ApplyErrorHandler errors) {
        return applyUnderSavepoint(conn, PAGE_SAVEPOINT, events, errors)
            .recover(err -> {
                if (!isStatementFailure(err)) {
                    return Future.failedFuture(err);
                }
                logger.warn("Shard {} could not write a page of {} events, replaying them one by one: {}",
                    shard, events.size(), err.getMessage());
                return rollbackTo(conn, PAGE_SAVEPOINT)
                    .compose(v -> replay(conn, events, 0, errors));
            });
    }

    private Future<Void> replay(SqlConnection conn, List<StreamEvent<?>> events, int index, ApplyErrorHandler errors) {
        if (index >= events.size()) {
            return Future.succeededFuture();
        }
        StreamEvent<?> event = events.get(index);
        return applyUnderSavepoint(conn, EVENT_SAVEPOINT, List.of(event), errors)
            .recover(err -> {
                if (!isStatementFailure(err)) {
                    return Future.failedFuture(err);
                }
                return rollbackTo(conn, EVENT_SAVEPOINT).compose(v -> {
                    errors.onApplyFailure(event, err);
                    return Future.<Void>succeededFuture();
                });
            })
            .compose(v -> replay(conn, events, index + 1, errors));
    }

    /**
     * Applies and writes {@code events}. Failures the projection reports for single
     * events are handed to {@code errors} only once the statements were written.
     */
    private Future<Void> applyUnderSavepoint(SqlConnection conn, String savepoint, List<StreamEvent<?>> events,
                                             ApplyErrorHandler errors) {
        ProjectionBatch batch = new ProjectionBatch();
        List<ApplyFailure> failures = new ArrayList<>();
        return conn.query("SAVEPOINT " + savepoint).execute()
            .compose(v -> source.apply(context.getProjectionContext(), conn, batch, events,
                (event, error) -> failures.add(new ApplyFailure(event, error))))
            .compose(v -> batch.execute(conn))
            .compose(v -> conn.query("RELEASE SAVEPOINT " + savepoint).execute())
            .compose(v -> {
                failures.forEach(failure -> errors.onApplyFailure(failure.event(), failure.error()));
                return Future.<Void>succeededFuture();
            });
    }

    private static Future<Void> rollbackTo(SqlConnection conn, String savepoint) {
        return conn.query("ROLLBACK TO SAVEPOINT " + savepoint).execute()
            .compose(v -> conn.query("RELEASE SAVEPOINT " + savepoint).execute())
            .mapEmpty();
    }

    /**
     * The database rejected a statement and the transaction can continue from a savepoint.
     */
    private static boolean isStatementFailure(Throwable error) {
        return error instanceof PgException;
    }
}
