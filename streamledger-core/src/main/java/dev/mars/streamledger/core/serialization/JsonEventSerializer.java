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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.streamledger.api.DomainEvent;
import dev.mars.streamledger.api.error.EventSerializationException;

import java.util.Map;
import java.util.Objects;

/**
 * JSON codec for event payloads backed by Jackson.
 */
public class JsonEventSerializer {

    private final ObjectMapper objectMapper;
    private final EventTypeRegistry registry;

    public JsonEventSerializer(EventTypeRegistry registry) {
        this(createDefaultObjectMapper(), registry);
    }

    public JsonEventSerializer(ObjectMapper objectMapper, EventTypeRegistry registry) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper cannot be null");
        this.registry = Objects.requireNonNull(registry, "Registry cannot be null");
    }

    public static ObjectMapper createDefaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    public String serialize(DomainEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to serialize " + event.getClass().getName(), e);
        }
    }

    public DomainEvent deserialize(String eventType, String json, Map<String, String> metadata) {
        Class<? extends DomainEvent> type = registry.resolve(eventType, metadata);
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to deserialize event type '" + eventType + "'", e);
        }
    }

    public String serializeMetadata(Map<String, String> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata == null ? Map.of() : metadata);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to serialize metadata", e);
        }
    }

    @SuppressWarnings("unchecked")
    public Map<String, String> deserializeMetadata(String json) {
        if (json == null || json.isEmpty()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, Map.class);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to deserialize metadata", e);
        }
    }

    public EventTypeRegistry getRegistry() {
        return registry;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
