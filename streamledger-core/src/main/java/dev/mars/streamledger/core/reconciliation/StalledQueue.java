package dev.mars.streamledger.core.reconciliation;

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

/**
 * Snapshot of a queue waiting for an operator decision.
 *
 * @param aggregateId the stalled aggregate
 * @param streamId stream of the failing head event
 * @param version version of the failing head event
 * @param eventType type of the failing head event
 * @param attempts dispatch attempts made before stalling
 * @param error the last failure
 * @param stalledSince when the queue stalled
 * @param bufferedEvents events waiting behind the head, the head included
 */
public record StalledQueue(String aggregateId,
                           String streamId,
                           long version,
                           String eventType,
                           int attempts,
                           Throwable error,
                           Instant stalledSince,
                           int bufferedEvents) {
}
