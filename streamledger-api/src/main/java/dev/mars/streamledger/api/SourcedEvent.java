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

import java.util.Objects;

/**
 * A committed event delivered by an {@link EventSource}, tagged with the aggregate it belongs to.
 */
public record SourcedEvent(String aggregateId, EventRecord record) {

    public SourcedEvent {
        Objects.requireNonNull(aggregateId, "Aggregate id cannot be null");
        Objects.requireNonNull(record, "Record cannot be null");
    }

    /**
     * Keys the event by its full stream id, so aggregates of different types sharing an
     * id never share an ordering queue.
     */
    public static SourcedEvent of(EventRecord record) {
        return new SourcedEvent(record.streamId(), record);
    }
}
