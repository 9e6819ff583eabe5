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

/**
 * Result of one high-water detection.
 *
 * @param currentMark     Mark the detection started from
 * @param safeHarbor      End of the contiguous run of committed sequences after the mark
 * @param highestSequence Highest sequence handed out so far, committed or not
 * @param nextAfterGap    First committed sequence above the safe harbor, null when there is none
 * @param staleGap        The event at {@code nextAfterGap} is older than the stale sequence threshold
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public record HighWaterStatistics(long currentMark, long safeHarbor, long highestSequence, Long nextAfterGap,
                                  boolean staleGap) {

    /**
     * A committed event sits above a missing sequence.
     */
    public boolean hasGap() {
        return nextAfterGap != null;
    }

    public boolean hasAdvanced() {
        return safeHarbor > currentMark;
    }
}
