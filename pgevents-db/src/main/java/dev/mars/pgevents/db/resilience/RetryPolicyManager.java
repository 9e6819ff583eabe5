package dev.mars.pgevents.db.resilience;

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

import dev.mars.pgevents.db.config.PgEventsConfiguration;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.micrometer.tagged.TaggedRetryMetrics;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Manages the retry policies used when projection shards load pages of events.
 *
 * <p>One {@link Retry} instance exists per shard so retry events and metrics are
 * tagged with the shard name. Every instance shares the exponential backoff
 * configured under {@code pgevents.daemon.loader.*}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class RetryPolicyManager {
    private static final Logger logger = LoggerFactory.getLogger(RetryPolicyManager.class);

    private final RetryRegistry retryRegistry;
    private final ConcurrentMap<String, Retry> retries = new ConcurrentHashMap<>();
    private final RetryConfig retryConfig;

    public RetryPolicyManager(PgEventsConfiguration.DaemonConfig config, MeterRegistry meterRegistry) {
        this.retryConfig = RetryConfig.custom()
            .maxAttempts(config.getLoaderMaxAttempts())
            .intervalFunction(IntervalFunction.ofExponentialBackoff(
                config.getLoaderInitialBackoff(), config.getLoaderBackoffMultiplier()))
            .retryExceptions(Exception.class)
            .build();
        this.retryRegistry = RetryRegistry.of(retryConfig);

        if (meterRegistry != null) {
            TaggedRetryMetrics.ofRetryRegistry(retryRegistry).bindTo(meterRegistry);
        }

        logger.info("Retry policy manager initialized: maxAttempts={}, initialBackoff={}, multiplier={}",
            config.getLoaderMaxAttempts(), config.getLoaderInitialBackoff(), config.getLoaderBackoffMultiplier());
    }

    /**
     * Gets or creates the retry policy of one operation, typically a shard name.
     */
    public Retry getRetry(String name) {
        return retries.computeIfAbsent(name, key -> {
            Retry retry = retryRegistry.retry(key);
            retry.getEventPublisher()
                .onRetry(event -> logger.warn("Retry '{}' attempt {} after {}: {}",
                    key, event.getNumberOfRetryAttempts(), event.getWaitInterval(),
                    event.getLastThrowable() == null ? "unknown" : event.getLastThrowable().getMessage()))
                .onError(event -> logger.error("Retry '{}' exhausted after {} attempts",
                    key, event.getNumberOfRetryAttempts()));
            return retry;
        });
    }

    public int getMaxAttempts() {
        return retryConfig.getMaxAttempts();
    }

    public Set<String> getRetryNames() {
        return Set.copyOf(retries.keySet());
    }
}
