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

import dev.mars.pgevents.api.error.EventLoaderException;
import io.github.resilience4j.retry.Retry;
import io.vertx.core.Future;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Retries an {@link EventLoader} with a Resilience4j {@link Retry}.
 *
 * <p>Once the retry budget is spent the last failure is wrapped into an
 * {@link EventLoaderException} carrying the shard name and the database
 * identifier.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public class ResilientEventLoader implements EventLoader {

    private final EventLoader inner;
    private final Retry retry;
    private final ScheduledExecutorService scheduler;
    private final String databaseIdentifier;

    public ResilientEventLoader(EventLoader inner, Retry retry, ScheduledExecutorService scheduler,
                                String databaseIdentifier) {
        this.inner = inner;
        this.retry = retry;
        this.scheduler = scheduler;
        this.databaseIdentifier = databaseIdentifier;
    }

    @Override
    public Future<EventPage> load(EventRequest request) {
        return Future.fromCompletionStage(
                retry.executeCompletionStage(scheduler, () -> inner.load(request).toCompletionStage()))
            .recover(err -> Future.failedFuture(new EventLoaderException(
                request.shard().getIdentity(), databaseIdentifier, unwrap(err))));
    }

    private static Throwable unwrap(Throwable err) {
        return err instanceof CompletionException && err.getCause() != null ? err.getCause() : err;
    }
}
