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

/**
 * Lifecycle of an {@link AggregateEventQueue}.
 */
public enum QueueState {
    /** Nothing buffered and no worker attached; eligible for eviction once idle. */
    EMPTY,
    /** Events buffered, waiting for a worker. */
    FILLING,
    /** A worker is dispatching the head event. */
    DRAINING,
    /** The head event exhausted its retries; the queue keeps buffering until an operator retries or skips. */
    STALLED
}
