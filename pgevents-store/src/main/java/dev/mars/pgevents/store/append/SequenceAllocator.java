package dev.mars.pgevents.store.append;

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
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.SqlClient;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Reserves a block of global event sequence numbers in one round trip.
 *
 * <p>Numbers are handed out in ascending order and each exactly once. Numbers
 * reserved by a transaction that later rolls back are never reused; they show up
 * as gaps in {@code pge_events.seq_id}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-04
 * @version 1.0
 */
public class SequenceAllocator {
    private static final Logger logger = LoggerFactory.getLogger(SequenceAllocator.class);

    private final Deque<Long> reserved;

    SequenceAllocator(Deque<Long> reserved) {
        this.reserved = reserved;
    }

    /**
     * Reserves {@code count} numbers from the event sequence.
     *
     * @param client connection or transaction the reservation runs on
     * @param sequenceName schema-qualified sequence name
     */
    public static Future<SequenceAllocator> reserve(SqlClient client, String sequenceName, int count) {
        if (count <= 0) {
            return Future.succeededFuture(new SequenceAllocator(new ArrayDeque<>()));
        }
        String sql = "select nextval('" + sequenceName + "') from generate_series(1, $1)";
        return client.preparedQuery(sql)
            .execute(Tuple.of(count))
            .map(rows -> {
                Deque<Long> numbers = new ArrayDeque<>(count);
                for (Row row : rows) {
                    numbers.add(row.getLong(0));
                }
                logger.debug("Reserved {} event sequence numbers starting at {}", numbers.size(), numbers.peekFirst());
                return new SequenceAllocator(numbers);
            });
    }

    /**
     * @throws IllegalStateException when every reserved number was already consumed
     */
    public long next() {
        Long value = reserved.pollFirst();
        if (value == null) {
            throw new IllegalStateException("No reserved event sequence numbers left; more events were written than reserved");
        }
        return value;
    }

    public int remaining() {
        return reserved.size();
    }
}
