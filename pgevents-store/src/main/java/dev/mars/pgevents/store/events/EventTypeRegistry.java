package dev.mars.pgevents.store.events;

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

import dev.mars.pgevents.api.error.UnknownEventTypeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable mapping between event classes and the aliases stored in {@code pge_events.type}.
 *
 * <p>Classes that were never registered can still be appended; they are written
 * under their default alias together with their class name in {@code java_type}.
 * On read the alias is resolved first, then the stored class name.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-04
 * @version 1.0
 */
public final class EventTypeRegistry {
    private static final Logger logger = LoggerFactory.getLogger(EventTypeRegistry.class);

    private final Map<Class<?>, String> aliasesByType;
    private final Map<String, Class<?>> typesByAlias;

    private EventTypeRegistry(Map<Class<?>, String> aliasesByType) {
        this.aliasesByType = Collections.unmodifiableMap(new LinkedHashMap<>(aliasesByType));
        Map<String, Class<?>> reverse = new LinkedHashMap<>();
        aliasesByType.forEach((type, alias) -> reverse.put(alias, type));
        this.typesByAlias = Collections.unmodifiableMap(reverse);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static EventTypeRegistry empty() {
        return new EventTypeRegistry(Map.of());
    }

    /**
     * Snake case of the simple class name, {@code TripStarted -> trip_started}.
     */
    public static String defaultAlias(Class<?> eventType) {
        String name = eventType.getSimpleName();
        return name.replaceAll("(\\P{Ll})(\\P{Ll}\\p{Ll})", "$1 $2")
            .replaceAll("(\\p{Ll})(\\P{Ll})", "$1 $2")
            .toLowerCase(Locale.ROOT)
            .replace(' ', '_');
    }

    public String aliasFor(Class<?> eventType) {
        String alias = aliasesByType.get(eventType);
        return alias != null ? alias : defaultAlias(eventType);
    }

    public Optional<Class<?>> typeFor(String alias) {
        return Optional.ofNullable(typesByAlias.get(alias));
    }

    public boolean isRegistered(Class<?> eventType) {
        return aliasesByType.containsKey(eventType);
    }

    /**
     * Resolves the class of a stored event.
     *
     * @param alias the stored {@code type} column
     * @param javaTypeName the stored {@code java_type} column, may be null
     * @throws UnknownEventTypeException when neither the alias nor the class name resolve
     */
    public Class<?> resolve(String alias, String javaTypeName) {
        Class<?> registered = typesByAlias.get(alias);
        if (registered != null) {
            return registered;
        }
        if (javaTypeName != null) {
            try {
                Class<?> type = Class.forName(javaTypeName, false, Thread.currentThread().getContextClassLoader());
                if (defaultAlias(type).equals(alias)) {
                    return type;
                }
            } catch (ClassNotFoundException e) {
                logger.debug("Stored event class {} for alias '{}' is not on the classpath", javaTypeName, alias);
            }
        }
        throw new UnknownEventTypeException(alias);
    }

    public Map<Class<?>, String> getAliases() {
        return aliasesByType;
    }

    public static final class Builder {
        private final Map<Class<?>, String> aliases = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(Class<?> eventType) {
            return register(eventType, defaultAlias(eventType));
        }

        public Builder register(Class<?> eventType, String alias) {
            Objects.requireNonNull(eventType, "eventType");
            if (alias == null || alias.isBlank()) {
                throw new IllegalArgumentException("Event type alias cannot be blank for " + eventType.getName());
            }
            for (Map.Entry<Class<?>, String> existing : aliases.entrySet()) {
                if (existing.getValue().equals(alias) && !existing.getKey().equals(eventType)) {
                    throw new IllegalArgumentException(String.format(
                        "Alias '%s' is already registered for %s", alias, existing.getKey().getName()));
                }
            }
            aliases.put(eventType, alias);
            return this;
        }

        public EventTypeRegistry build() {
            return new EventTypeRegistry(aliases);
        }
    }
}
