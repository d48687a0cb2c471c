package dev.mars.streamledger.api;

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

import java.util.Map;
import java.util.Objects;

/**
 * An event about to be appended: its type name, payload and metadata.
 *
 * @param eventType stable type name used to resolve the payload class on read
 * @param data the domain event payload
 * @param metadata free-form string metadata, copied on construction
 */
public record EventDescriptor(String eventType, DomainEvent data, Map<String, String> metadata) {

    public EventDescriptor {
        Objects.requireNonNull(eventType, "Event type cannot be null");
        Objects.requireNonNull(data, "Event data cannot be null");
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public EventDescriptor(String eventType, DomainEvent data) {
        this(eventType, data, Map.of());
    }
}
