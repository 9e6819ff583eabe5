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

import dev.mars.pgevents.api.projection.ShardName;
import dev.mars.pgevents.api.projection.ShardProgress;
import dev.mars.pgevents.daemon.tracking.ShardStateTracker;
import dev.mars.pgevents.db.metrics.EventStoreMetrics;
import dev.mars.pgevents.store.progress.ProjectionProgressStore;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.sqlclient.SqlClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Polls the {@link HighWaterDetector} and moves the high-water mark forward.
 *
 * <p>Every advance is persisted to the {@code HighWaterMark} progress row and
 * published to the {@link ShardStateTracker}. The mark never decreases.</p>
 *
 * <p>A gap is treated as sequences that will never commit once the first event
 * committed after it is older than the stale sequence threshold, or once this
 * agent has watched the gap hold the mark for that long. The mark then jumps to
 * just below the next committed sequence and the skip is logged and counted.</p>
 *
 * <p>Polls never overlap; {@link #checkNow()} queues behind a poll in flight.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public class HighWaterAgent {
    private static final Logger logger = LoggerFactory.getLogger(HighWaterAgent.class);

    private final Vertx vertx;
    private final SqlClient client;
    private final HighWaterDetector detector;
    private final ProjectionProgressStore progress;
    private final ShardStateTracker tracker;
    private final EventStoreMetrics metrics;
    private final Duration pollInterval;
    private final Duration staleSequenceThreshold;
    private final Clock clock;

    private volatile long mark = 0;
    private volatile boolean running = false;
    private long timerId = -1;
    private Future<Long> inFlight = Future.succeededFuture(0L);

    private long gapMark = -1;
    private Instant gapSince;

    public HighWaterAgent(Vertx vertx, SqlClient client, HighWaterDetector detector, ProjectionProgressStore progress,
                          ShardStateTracker tracker, EventStoreMetrics metrics, Duration pollInterval,
                          Duration staleSequenceThreshold, Clock clock) {
        this.vertx = vertx;
        this.client = client;
        this.detector = detector;
        this.progress = progress;
        this.tracker = tracker;
        this.metrics = metrics;
        this.pollInterval = pollInterval;
        this.staleSequenceThreshold = staleSequenceThreshold;
        this.clock = clock;
    }

    /**
     * Restores the persisted mark, then polls every poll interval.
     */
    public synchronized Future<Void> start() {
        if (running) {
            return Future.succeededFuture();
        }
        running = true;
        return restore().compose(restored -> {
            synchronized (this) {
                if (running && timerId == -1) {
                    timerId = vertx.setPeriodic(pollInterval.toMillis(), id -> onTick());
                }
            }
            logger.info("High-water agent started at mark {} (poll interval {}, stale sequence threshold {})",
                mark, pollInterval, staleSequenceThreshold);
            return checkNow().<Void>mapEmpty();
        });
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        if (timerId != -1) {
            vertx.cancelTimer(timerId);
            timerId = -1;
        }
        logger.info("High-water agent stopped at mark {}", mark);
    }

    public boolean isRunning() {
        return running;
    }

    public long getMark() {
        return mark;
    }

    /**
     * Runs one detection now, after any poll already in flight.
     *
     * @return the mark after the detection
     */
    public synchronized Future<Long> checkNow() {
        Future<Long> next = inFlight.transform(previous -> poll());
        inFlight = next;
        return next;
    }

    private void onTick() {
        Future<Long> current;
        synchronized (this) {
            current = inFlight;
        }
        if (!current.isComplete()) {
            return;
        }
        checkNow().onFailure(err -> logger.warn("High-water detection failed: {}", err.getMessage()));
    }

    private Future<Long> restore() {
        return progress.find(client, ShardName.HIGH_WATER_MARK)
            .map(found -> {
                long stored = found.map(ShardProgress::lastSequenceId).orElse(0L);
                if (stored > mark) {
                    mark = stored;
                }
                tracker.markHighWater(mark);
                metrics.recordHighWaterMark(mark);
                return mark;
            });
    }

    private Future<Long> poll() {
        return detector.detect(mark).compose(this::evaluate);
    }

    private Future<Long> evaluate(HighWaterStatistics statistics) {
        if (!statistics.hasGap()) {
            clearGap();
            return advanceTo(statistics.safeHarbor());
        }
        if (statistics.staleGap()) {
            clearGap();
            return skipGap(statistics, "first event after it is older than " + staleSequenceThreshold);
        }
        if (statistics.hasAdvanced()) {
            clearGap();
            return advanceTo(statistics.safeHarbor());
        }

        Instant now = clock.instant();
        synchronized (this) {
            if (gapSince == null || gapMark != statistics.currentMark()) {
                gapMark = statistics.currentMark();
                gapSince = now;
                logger.debug("Sequence gap after {} observed, next committed sequence is {}",
                    statistics.currentMark(), statistics.nextAfterGap());
                return Future.succeededFuture(mark);
            }
        }

        Duration stuckFor = Duration.between(gapSince, now);
        if (stuckFor.compareTo(staleSequenceThreshold) < 0) {
            return Future.succeededFuture(mark);
        }
        clearGap();
        return skipGap(statistics, "gap unchanged for " + stuckFor);
    }

    private Future<Long> skipGap(HighWaterStatistics statistics, String reason) {
        long skipTo = statistics.nextAfterGap() - 1;
        logger.warn("Skipping sequences {} to {}: {} (threshold {})",
            statistics.safeHarbor() + 1, skipTo, reason, staleSequenceThreshold);
        metrics.recordSkippedGap();
        return advanceTo(skipTo).compose(skipped -> poll());
    }

    private Future<Long> advanceTo(long newMark) {
        if (newMark <= mark) {
            return Future.succeededFuture(mark);
        }
        return progress.store(client, ShardName.HIGH_WATER_MARK, newMark)
            .map(stored -> {
                mark = Math.max(mark, newMark);
                tracker.markHighWater(mark);
                metrics.recordHighWaterMark(mark);
                logger.debug("High-water mark advanced to {}", mark);
                return mark;
            });
    }

    private synchronized void clearGap() {
        gapMark = -1;
        gapSince = null;
    }
}
