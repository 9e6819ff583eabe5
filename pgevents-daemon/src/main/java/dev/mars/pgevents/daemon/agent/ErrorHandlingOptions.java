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

/**
 * What a shard does with an event its projection fails to apply.
 *
 * <p>By default the event is recorded as a dead letter and the shard moves on.
 * In strict mode the page is rolled back, the agent pauses and the failure is
 * reported as an {@link dev.mars.pgevents.api.error.ApplyEventException}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public final class ErrorHandlingOptions {

    private static final ErrorHandlingOptions DEAD_LETTERS = new ErrorHandlingOptions(false);
    private static final ErrorHandlingOptions STRICT = new ErrorHandlingOptions(true);

    private final boolean strict;

    private ErrorHandlingOptions(boolean strict) {
        this.strict = strict;
    }

    public static ErrorHandlingOptions deadLetters() {
        return DEAD_LETTERS;
    }

    public static ErrorHandlingOptions strict() {
        return STRICT;
    }

    public boolean isStrict() {
        return strict;
    }

    @Override
    public String toString() {
        return strict ? "strict" : "dead-letters";
    }
}
