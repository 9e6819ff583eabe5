package dev.mars.pgevents.api.error;

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
 * Standard error codes for PgEvents.
 *
 * Error code ranges:
 * - PGEERR0001-0049: General/System errors
 * - PGEERR0050-0099: Stream write errors
 * - PGEERR0100-0149: Stream read errors
 * - PGEERR0150-0199: Projection daemon errors
 * - PGEERR0200-0249: Configuration errors
 */
public final class PgEventsErrorCodes {

    private PgEventsErrorCodes() {
        // Utility class - no instantiation
    }

    // ========================================================================
    // General/System Errors (0001-0049)
    // ========================================================================
    public static final String INTERNAL_ERROR = "PGEERR0001";
    public static final String TIMEOUT = "PGEERR0009";

    // ========================================================================
    // Stream Write Errors (0050-0099)
    // ========================================================================
    public static final String STREAM_ID_COLLISION = "PGEERR0050";
    public static final String CONCURRENCY_CONFLICT = "PGEERR0051";
    public static final String AGGREGATE_CONCURRENCY_CONFLICT = "PGEERR0052";
    public static final String STREAM_LOCKED = "PGEERR0053";
    public static final String STREAM_NOT_FOUND = "PGEERR0054";
    public static final String INVALID_STREAM_OPERATION = "PGEERR0055";

    // ========================================================================
    // Stream Read Errors (0100-0149)
    // ========================================================================
    public static final String UNKNOWN_EVENT_TYPE = "PGEERR0100";
    public static final String EVENT_DESERIALIZATION_FAILED = "PGEERR0101";

    // ========================================================================
    // Projection Daemon Errors (0150-0199)
    // ========================================================================
    public static final String EVENT_LOADER_FAILED = "PGEERR0150";
    public static final String APPLY_EVENT_FAILED = "PGEERR0151";
    public static final String PROGRESS_OUT_OF_ORDER = "PGEERR0152";
    public static final String PROJECTION_NOT_FOUND = "PGEERR0153";
}
