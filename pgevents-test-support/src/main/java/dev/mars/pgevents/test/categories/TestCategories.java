package dev.mars.pgevents.test.categories;

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
 * Test category constants used with JUnit 5 {@code @Tag} annotations.
 *
 * <ul>
 *   <li><strong>CORE</strong> - Fast unit tests without external infrastructure</li>
 *   <li><strong>INTEGRATION</strong> - Tests against a Testcontainers PostgreSQL instance</li>
 *   <li><strong>SLOW</strong> - Long-running tests such as stale sequence timeouts</li>
 * </ul>
 *
 * <pre>{@code
 * @Tag(TestCategories.INTEGRATION)
 * @ExtendWith(SharedPostgresTestExtension.class)
 * class StreamAppendIntegrationTest { ... }
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public final class TestCategories {

    public static final String CORE = "core";

    public static final String INTEGRATION = "integration";

    public static final String SLOW = "slow";

    private TestCategories() {
        // Utility class
    }
}
