package dev.mars.pgevents.db;

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
 * Internal defaults shared by PgEvents components.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public final class PgEventsDefaults {

    /**
     * Identifier of the default reactive pool.
     *
     * <p>External modules should pass {@code null} to request the default pool
     * rather than referencing this constant directly.</p>
     */
    public static final String DEFAULT_POOL_ID = "pgevents-main";

    /**
     * Schema used when none is configured.
     */
    public static final String DEFAULT_SCHEMA = "public";

    private PgEventsDefaults() {
        // Prevent instantiation
    }
}
