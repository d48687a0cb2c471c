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

import java.util.concurrent.CompletableFuture;

/**
 * Read-model handler for one event type.
 *
 * <p>The returned future is cancelled when the dispatch is abandoned, for instance on a handler
 * timeout. Cancelling a {@link CompletableFuture} interrupts nothing, so a long-running handler
 * should check {@link CompletableFuture#isCancelled()} and stop. A handler may see the same event
 * again after a timeout or restart and must apply it idempotently.</p>
 *
 * @param <E> the event type handled
 */
@FunctionalInterface
public interface EventHandler<E extends DomainEvent> {

    CompletableFuture<Void> handle(E event);
}
