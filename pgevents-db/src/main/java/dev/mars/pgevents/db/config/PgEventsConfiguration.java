package dev.mars.pgevents.db.config;

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

import dev.mars.pgevents.api.StreamIdentity;
import dev.mars.pgevents.api.TenancyStyle;
import dev.mars.pgevents.db.util.PostgreSqlIdentifierValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.UUID;

/**
 * Configuration management for PgEvents.
 *
 * <p>Properties are layered in this order, later sources winning:</p>
 * <ol>
 *   <li>{@code /pgevents-default.properties}</li>
 *   <li>{@code /pgevents-{profile}.properties}</li>
 *   <li>{@code PGEVENTS_*} environment variables</li>
 *   <li>{@code pgevents.*} system properties</li>
 *   <li>explicit overrides passed to the constructor</li>
 * </ol>
 *
 * <p>All validation errors are collected and reported together.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class PgEventsConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(PgEventsConfiguration.class);

    private final Properties properties;
    private final String profile;

    public PgEventsConfiguration() {
        this(getActiveProfile());
    }

    public PgEventsConfiguration(String profile) {
        this(profile, new Properties());
    }

    /**
     * Creates a configuration with programmatic overrides applied on top of every other source.
     * Used by tests and embedding applications to avoid polluting system properties.
     *
     * @param profile the configuration profile to use
     * @param overrides properties that win over files, environment and system properties
     */
    public PgEventsConfiguration(String profile, Properties overrides) {
        this.profile = profile;
        this.properties = loadProperties(profile);
        overrides.forEach((key, value) -> properties.setProperty(key.toString(), value.toString()));
        validateConfiguration();
        logger.info("Loaded PgEvents configuration for profile: {}", profile);
    }

    /**
     * Creates a configuration with explicit database settings.
     *
     * @param profile the configuration profile to use
     * @param dbHost database host
     * @param dbPort database port
     * @param dbName database name
     * @param dbUsername database username
     * @param dbPassword database password
     * @param dbSchema event store schema (defaults to the configured schema if null)
     */
    public PgEventsConfiguration(String profile, String dbHost, int dbPort, String dbName,
                                 String dbUsername, String dbPassword, String dbSchema) {
        this(profile, databaseOverrides(dbHost, dbPort, dbName, dbUsername, dbPassword, dbSchema));
    }

    private static Properties databaseOverrides(String dbHost, int dbPort, String dbName,
                                                String dbUsername, String dbPassword, String dbSchema) {
        Properties overrides = new Properties();
        overrides.setProperty("pgevents.database.host", dbHost);
        overrides.setProperty("pgevents.database.port", String.valueOf(dbPort));
        overrides.setProperty("pgevents.database.name", dbName);
        overrides.setProperty("pgevents.database.username", dbUsername);
        overrides.setProperty("pgevents.database.password", dbPassword);
        if (dbSchema != null && !dbSchema.isEmpty()) {
            overrides.setProperty("pgevents.database.schema", dbSchema);
        }
        return overrides;
    }

    private static String getActiveProfile() {
        return System.getProperty("pgevents.profile",
               System.getenv("PGEVENTS_PROFILE") != null ? System.getenv("PGEVENTS_PROFILE") : "default");
    }

    private Properties loadProperties(String profile) {
        Properties props = new Properties();

        loadPropertiesFromResource(props, "/pgevents-default.properties");

        if (!"default".equals(profile)) {
            loadPropertiesFromResource(props, "/pgevents-" + profile + ".properties");
        }

        // PGEVENTS_DAEMON_POLL_INTERVAL -> pgevents.daemon.poll.interval
        System.getenv().forEach((key, value) -> {
            if (key.startsWith("PGEVENTS_")) {
                String propKey = key.toLowerCase(Locale.ROOT).replace("_", ".");
                props.setProperty(propKey, value);
            }
        });

        System.getProperties().forEach((key, value) -> {
            String keyStr = key.toString();
            if (keyStr.startsWith("pgevents.")) {
                props.setProperty(keyStr, value.toString());
            }
        });

        return props;
    }

    private void loadPropertiesFromResource(Properties props, String resourcePath) {
        try (InputStream is = getClass().getResourceAsStream(resourcePath)) {
            if (is != null) {
                props.load(is);
                logger.debug("Loaded properties from: {}", resourcePath);
            } else {
                logger.debug("Properties file not found: {}", resourcePath);
            }
        } catch (IOException e) {
            logger.warn("Failed to load properties from: {}", resourcePath, e);
        }
    }

    private void validateConfiguration() {
        List<String> errors = new ArrayList<>();

        validateDatabaseConfig(errors);
        validateEventStoreConfig(errors);
        validateDaemonConfig(errors);

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Configuration validation failed: " + String.join(", ", errors));
        }

        logger.debug("Configuration validation passed");
    }

    private void validateDatabaseConfig(List<String> errors) {
        if (getString("pgevents.database.host", "").isEmpty()) {
            errors.add("Database host is required");
        }

        int port = getInt("pgevents.database.port", 5432);
        if (port < 1 || port > 65535) {
            errors.add("Database port must be between 1 and 65535");
        }

        if (getString("pgevents.database.name", "").isEmpty()) {
            errors.add("Database name is required");
        }

        if (getString("pgevents.database.username", "").isEmpty()) {
            errors.add("Database username is required");
        }

        try {
            PostgreSqlIdentifierValidator.validate(getString("pgevents.database.schema", "public"), "Schema");
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }

        if (getInt("pgevents.database.pool.max-size", 16) < 2) {
            errors.add("Pool max size must be at least 2 (exclusive writers hold a dedicated connection)");
        }
    }

    private void validateEventStoreConfig(List<String> errors) {
        String identity = getString("pgevents.events.stream-identity", StreamIdentity.AS_GUID.name());
        try {
            StreamIdentity.valueOf(identity.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            errors.add("Unknown stream identity: " + identity);
        }

        String tenancy = getString("pgevents.events.tenancy", TenancyStyle.SINGLE.name());
        try {
            TenancyStyle.valueOf(tenancy.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            errors.add("Unknown tenancy style: " + tenancy);
        }
    }

    private void validateDaemonConfig(List<String> errors) {
        int pageSize = getInt("pgevents.daemon.page-size", 500);
        if (pageSize < 1 || pageSize > 10000) {
            errors.add("Daemon page size must be between 1 and 10000");
        }

        if (getDuration("pgevents.daemon.poll-interval", Duration.ofSeconds(1)).toMillis() < 10) {
            errors.add("Daemon poll interval must be at least 10ms");
        }

        if (getDuration("pgevents.daemon.stale-sequence-threshold", Duration.ofSeconds(3)).isNegative()) {
            errors.add("Stale sequence threshold cannot be negative");
        }

        if (getInt("pgevents.daemon.loader.max-attempts", 3) < 1) {
            errors.add("Loader max attempts must be at least 1");
        }

        if (getDouble("pgevents.daemon.loader.backoff-multiplier", 2.0) < 1.0) {
            errors.add("Loader backoff multiplier must be at least 1.0");
        }
    }

    // Configuration getters with defaults
    public String getString(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public String getString(String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            throw new IllegalArgumentException("Required configuration property not found: " + key);
        }
        return value;
    }

    public int getInt(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid long value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    /**
     * Reads an ISO-8601 duration such as {@code PT5S}.
     */
    public Duration getDuration(String key, Duration defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Duration.parse(value.trim());
        } catch (Exception e) {
            logger.warn("Invalid duration value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public double getDouble(String key, double defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid double value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    // Specific configuration builders
    public PgConnectionConfig getDatabaseConfig() {
        return new PgConnectionConfig.Builder()
            .host(getString("pgevents.database.host", "localhost"))
            .port(getInt("pgevents.database.port", 5432))
            .database(getString("pgevents.database.name", "pgevents"))
            .username(getString("pgevents.database.username", "pgevents"))
            .password(getString("pgevents.database.password", ""))
            .schema(getString("pgevents.database.schema", "public"))
            .sslEnabled(getBoolean("pgevents.database.ssl.enabled", false))
            .applicationName(getString("pgevents.database.application-name", "pgevents"))
            .build();
    }

    public PgPoolConfig getPoolConfig() {
        return new PgPoolConfig.Builder()
            .maxSize(getInt("pgevents.database.pool.max-size", 16))
            .maxWaitQueueSize(getInt("pgevents.database.pool.max-wait-queue-size", 128))
            .connectionTimeout(getDuration("pgevents.database.pool.connection-timeout", Duration.ofSeconds(30)))
            .idleTimeout(getDuration("pgevents.database.pool.idle-timeout", Duration.ofMinutes(10)))
            .shared(getBoolean("pgevents.database.pool.shared", false))
            .build();
    }

    public EventStoreConfig getEventStoreConfig() {
        return new EventStoreConfig(
            StreamIdentity.valueOf(getString("pgevents.events.stream-identity", "AS_GUID").toUpperCase(Locale.ROOT)),
            TenancyStyle.valueOf(getString("pgevents.events.tenancy", "SINGLE").toUpperCase(Locale.ROOT)),
            getInt("pgevents.events.lock-class-id", 4242)
        );
    }

    public DaemonConfig getDaemonConfig() {
        return new DaemonConfig(
            getDuration("pgevents.daemon.poll-interval", Duration.ofSeconds(1)),
            getDuration("pgevents.daemon.stale-sequence-threshold", Duration.ofSeconds(3)),
            getInt("pgevents.daemon.page-size", 500),
            getInt("pgevents.daemon.loader.max-attempts", 3),
            getDuration("pgevents.daemon.loader.initial-backoff", Duration.ofMillis(250)),
            getDouble("pgevents.daemon.loader.backoff-multiplier", 2.0),
            getDuration("pgevents.daemon.agent.error-backoff", Duration.ofSeconds(1)),
            getDuration("pgevents.daemon.rebuild.shard-timeout", Duration.ofMinutes(5))
        );
    }

    public MetricsConfig getMetricsConfig() {
        return new MetricsConfig(
            getBoolean("pgevents.metrics.enabled", true),
            getString("pgevents.metrics.instance-id", "pgevents-" + UUID.randomUUID().toString().substring(0, 8))
        );
    }

    // Configuration data classes
    public static class EventStoreConfig {
        private final StreamIdentity streamIdentity;
        private final TenancyStyle tenancy;
        private final int lockClassId;

        public EventStoreConfig(StreamIdentity streamIdentity, TenancyStyle tenancy, int lockClassId) {
            this.streamIdentity = streamIdentity;
            this.tenancy = tenancy;
            this.lockClassId = lockClassId;
        }

        public StreamIdentity getStreamIdentity() { return streamIdentity; }
        public TenancyStyle getTenancy() { return tenancy; }
        public int getLockClassId() { return lockClassId; }
    }

    /**
     * Settings of the asynchronous projection daemon.
     */
    public static class DaemonConfig {
        private final Duration pollInterval;
        private final Duration staleSequenceThreshold;
        private final int pageSize;
        private final int loaderMaxAttempts;
        private final Duration loaderInitialBackoff;
        private final double loaderBackoffMultiplier;
        private final Duration agentErrorBackoff;
        private final Duration rebuildShardTimeout;

        public DaemonConfig(Duration pollInterval, Duration staleSequenceThreshold, int pageSize,
                            int loaderMaxAttempts, Duration loaderInitialBackoff, double loaderBackoffMultiplier,
                            Duration agentErrorBackoff, Duration rebuildShardTimeout) {
            this.pollInterval = pollInterval;
            this.staleSequenceThreshold = staleSequenceThreshold;
            this.pageSize = pageSize;
            this.loaderMaxAttempts = loaderMaxAttempts;
            this.loaderInitialBackoff = loaderInitialBackoff;
            this.loaderBackoffMultiplier = loaderBackoffMultiplier;
            this.agentErrorBackoff = agentErrorBackoff;
            this.rebuildShardTimeout = rebuildShardTimeout;
        }

        public Duration getPollInterval() { return pollInterval; }
        public Duration getStaleSequenceThreshold() { return staleSequenceThreshold; }
        public int getPageSize() { return pageSize; }
        public int getLoaderMaxAttempts() { return loaderMaxAttempts; }
        public Duration getLoaderInitialBackoff() { return loaderInitialBackoff; }
        public double getLoaderBackoffMultiplier() { return loaderBackoffMultiplier; }
        public Duration getAgentErrorBackoff() { return agentErrorBackoff; }
        public Duration getRebuildShardTimeout() { return rebuildShardTimeout; }
    }

    public static class MetricsConfig {
        private final boolean enabled;
        private final String instanceId;

        public MetricsConfig(boolean enabled, String instanceId) {
            this.enabled = enabled;
            this.instanceId = instanceId;
        }

        public boolean isEnabled() { return enabled; }
        public String getInstanceId() { return instanceId; }
    }

    public String getProfile() { return profile; }
    public Properties getProperties() {
        Properties copy = new Properties();
        copy.putAll(properties);
        return copy;
    }
}
