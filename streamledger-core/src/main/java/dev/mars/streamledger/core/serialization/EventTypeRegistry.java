package dev.mars.streamledger.core.serialization;

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

import dev.mars.streamledger.api.DomainEvent;
import dev.mars.streamledger.api.error.UnhandledEventTypeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps stored event type names to payload classes.
 *
 * <p>Resolution order: explicit registration, then the fully qualified class named in the
 * event's {@value #EVENT_CLASS_METADATA} metadata entry. Anything else is unhandled.</p>
 *
 * <p>Classes found through metadata are cached by class name, never by type name, since two
 * classes with the same simple name share a default type name.</p>
 */
public class EventTypeRegistry {
    private static final Logger logger = LoggerFactory.getLogger(EventTypeRegistry.class);

    public static final String EVENT_CLASS_METADATA = "event-class";

    private final Map<String, Class<? extends DomainEvent>> typesByName = new ConcurrentHashMap<>();
    private final Map<Class<? extends DomainEvent>, String> namesByType = new ConcurrentHashMap<>();
    private final Map<String, Class<? extends DomainEvent>> typesByClassName = new ConcurrentHashMap<>();

    public static String defaultTypeName(Class<?> eventClass) {
        return eventClass.getSimpleName().toLowerCase(Locale.ROOT);
    }

    public EventTypeRegistry register(Class<? extends DomainEvent> eventClass) {
        return register(defaultTypeName(eventClass), eventClass);
    }

    public EventTypeRegistry register(String typeName, Class<? extends DomainEvent> eventClass) {
        Objects.requireNonNull(typeName, "Type name cannot be null");
        Objects.requireNonNull(eventClass, "Event class cannot be null");
        Class<? extends DomainEvent> previous = typesByName.put(typeName, eventClass);
        if (previous != null && previous != eventClass) {
            logger.warn("Event type '{}' re-registered: {} replaces {}", typeName, eventClass.getName(), previous.getName());
        }
        namesByType.put(eventClass, typeName);
        return this;
    }

    public String typeNameOf(Class<? extends DomainEvent> eventClass) {
        return namesByType.getOrDefault(eventClass, defaultTypeName(eventClass));
    }

    public Class<? extends DomainEvent> resolve(String typeName, Map<String, String> metadata) {
        Class<? extends DomainEvent> registered = typesByName.get(typeName);
        if (registered != null) {
            return registered;
        }
        String className = metadata == null ? null : metadata.get(EVENT_CLASS_METADATA);
        if (className == null) {
            throw new UnhandledEventTypeException(typeName, "No class registered for event type '" + typeName + "'");
        }
        Class<? extends DomainEvent> cached = typesByClassName.get(className);
        if (cached != null) {
            return cached;
        }
        try {
            Class<?> candidate = Class.forName(className, true, Thread.currentThread().getContextClassLoader());
            if (!DomainEvent.class.isAssignableFrom(candidate)) {
                throw new UnhandledEventTypeException(typeName,
                    "Class " + className + " for event type '" + typeName + "' is not a DomainEvent");
            }
            Class<? extends DomainEvent> resolved = candidate.asSubclass(DomainEvent.class);
            typesByClassName.putIfAbsent(className, resolved);
            return resolved;
        } catch (ClassNotFoundException e) {
            throw new UnhandledEventTypeException(typeName,
                "Class " + className + " for event type '" + typeName + "' is not on the classpath");
        }
    }
}
