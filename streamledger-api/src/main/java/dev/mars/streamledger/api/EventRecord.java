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

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A persisted event as read back from an {@link EventStore}.
 *
 * <p>{@code data} is {@code null} for tombstones and other system records that
 * carry no domain payload.</p>
 */
public record EventRecord(String streamId,
                          long version,
                          String eventType,
                          DomainEvent data,
                          Map<String, String> metadata,
                          Instant recordedAt) {

    /** Event types with this prefix are reserved for store bookkeeping. */
    public static final String SYSTEM_EVENT_PREFIX = "$";

    /** Stream ids with this prefix are reserved for system streams. */
    public static final String SYSTEM_STREAM_PREFIX = "$$";

    /** Event type of the tombstone written when a stream is hard-deleted. */
    public static final String STREAM_DELETED_EVENT = "$stream-deleted";

    public EventRecord {
        Objects.requireNonNull(streamId, "Stream id cannot be null");
        Objects.requireNonNull(eventType, "Event type cannot be null");
        Objects.requireNonNull(recordedAt, "Recorded-at cannot be null");
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /**
     * @return true for tombstones, system-stream records and records without a payload
     */
    public boolean isSystemRecord() {
        return data == null
            || eventType.startsWith(SYSTEM_EVENT_PREFIX)
            || streamId.startsWith(SYSTEM_STREAM_PREFIX);
    }
}
