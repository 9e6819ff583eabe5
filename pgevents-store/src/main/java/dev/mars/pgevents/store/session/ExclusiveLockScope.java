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

import dev.mars.pgevents.api.error.StreamLockedException;
import io.vertx.core.Future;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.SqlConnection;
import io.vertx.sqlclient.Transaction;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Set;

/**
 * A dedicated connection with an open transaction holding stream advisory locks.
 *
 * <p>Locks are transaction scoped ({@code pg_try_advisory_xact_lock}), so they are
 * released exactly when the transaction commits or rolls back. The connection
 * goes back to the pool at the same moment.</p>
 *
 * <p>The lock key is the 64-bit {@code hashtextextended} of the stream identity's
 * text, seeded with the lock class id.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
public final class ExclusiveLockScope {
    private static final Logger logger = LoggerFactory.getLogger(ExclusiveLockScope.class);

    private static final String TRY_LOCK_SQL =
        "SELECT pg_try_advisory_xact_lock(hashtextextended($2::text, $1::bigint)) AS locked";

    private final SqlConnection connection;
    private final Transaction transaction;
    private final int lockClassId;
    private final Set<Object> locked = new HashSet<>();
    private boolean open = true;

    private ExclusiveLockScope(SqlConnection connection, Transaction transaction, int lockClassId) {
        this.connection = connection;
        this.transaction = transaction;
        this.lockClassId = lockClassId;
    }

    public static Future<ExclusiveLockScope> open(Pool pool, int lockClassId) {
        return pool.getConnection().compose(conn -> conn.begin()
            .map(tx -> new ExclusiveLockScope(conn, tx, lockClassId))
            .recover(err -> conn.close().compose(v -> Future.<ExclusiveLockScope>failedFuture(err))));
    }

    /**
     * Text the lock key is hashed from.
     */
    static String lockText(Object identity) {
        return identity.toString();
    }

    /**
     * Tries to lock a stream without waiting.
     *
     * @return succeeded future once the lock is held, or a future failed with {@link StreamLockedException}
     */
    public Future<Void> tryLock(Object identity) {
        if (!open) {
            return Future.failedFuture(new IllegalStateException("Exclusive lock scope is already closed"));
        }
        if (locked.contains(identity)) {
            return Future.succeededFuture();
        }
        return connection.preparedQuery(TRY_LOCK_SQL).execute(Tuple.of((long) lockClassId, lockText(identity)))
            .compose(rows -> {
                boolean acquired = rows.iterator().next().getBoolean("locked");
                if (!acquired) {
                    logger.debug("Stream {} is locked by another session", identity);
                    return Future.failedFuture(new StreamLockedException(identity));
                }
                locked.add(identity);
                logger.debug("Acquired exclusive lock on stream {}", identity);
                return Future.<Void>succeededFuture();
            });
    }

    public SqlConnection connection() {
        return connection;
    }

    public boolean isOpen() {
        return open;
    }

    public boolean holdsLocks() {
        return !locked.isEmpty();
    }

    public Future<Void> commit() {
        if (!open) {
            return Future.succeededFuture();
        }
        open = false;
        return transaction.commit()
            .eventually(connection::close)
            .onSuccess(v -> logger.debug("Committed exclusive scope, released {} stream locks", locked.size()));
    }

    public Future<Void> rollback() {
        if (!open) {
            return Future.succeededFuture();
        }
        open = false;
        return transaction.rollback()
            .eventually(connection::close)
            .onComplete(ar -> logger.debug("Rolled back exclusive scope, released {} stream locks", locked.size()));
    }
}
