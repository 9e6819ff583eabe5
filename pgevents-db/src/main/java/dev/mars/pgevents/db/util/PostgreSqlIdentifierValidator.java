package dev.mars.pgevents.db.util;

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
 * Validation of PostgreSQL identifiers that end up concatenated into SQL text.
 *
 * <p>Schema names cannot be bound as statement parameters, so every schema that
 * PgEvents interpolates into a statement passes through {@link #validate} first:</p>
 * <ul>
 *   <li>Maximum length: 63 characters</li>
 *   <li>Must start with a letter (a-z) or underscore (_)</li>
 *   <li>Can contain letters, digits (0-9), and underscores</li>
 *   <li>Cannot be a system schema (pg_*, information_schema)</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public final class PostgreSqlIdentifierValidator {

    /**
     * PostgreSQL maximum identifier length.
     */
    public static final int MAX_IDENTIFIER_LENGTH = 63;

    private static final String IDENTIFIER_PATTERN = "^[a-zA-Z_][a-zA-Z0-9_]*$";

    private PostgreSqlIdentifierValidator() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Validates that an identifier meets PostgreSQL requirements.
     *
     * @param identifier The identifier to validate
     * @param identifierType Type of identifier for error messages (e.g., "Schema")
     * @throws IllegalArgumentException if validation fails
     */
    public static void validate(String identifier, String identifierType) {
        if (identifier == null || identifier.trim().isEmpty()) {
            throw new IllegalArgumentException(identifierType + " name cannot be null or empty");
        }

        String trimmed = identifier.trim();

        if (trimmed.length() > MAX_IDENTIFIER_LENGTH) {
            throw new IllegalArgumentException(
                String.format("%s name '%s' exceeds PostgreSQL maximum length of %d characters (length: %d)",
                    identifierType, trimmed, MAX_IDENTIFIER_LENGTH, trimmed.length()));
        }

        if (!trimmed.matches(IDENTIFIER_PATTERN)) {
            throw new IllegalArgumentException(
                String.format("Invalid %s name: '%s'. Must start with letter or underscore, " +
                    "followed by alphanumeric characters or underscores only.",
                    identifierType, trimmed));
        }

        String lower = trimmed.toLowerCase();
        if (lower.startsWith("pg_") || lower.equals("information_schema")) {
            throw new IllegalArgumentException(
                String.format("Reserved %s name: '%s'. Cannot use PostgreSQL system schemas " +
                    "(pg_*, information_schema).",
                    identifierType, trimmed));
        }
    }

    /**
     * Validates the schema and qualifies a table or sequence name with it.
     *
     * @param schema the validated schema
     * @param name the unqualified object name
     * @return {@code schema.name}
     */
    public static String qualify(String schema, String name) {
        validate(schema, "Schema");
        validate(name, "Object");
        return schema.trim() + "." + name;
    }
}
