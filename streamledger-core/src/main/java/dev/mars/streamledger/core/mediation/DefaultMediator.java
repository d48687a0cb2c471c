package dev.mars.streamledger.core.mediation;

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
import dev.mars.streamledger.api.EventHandler;
import dev.mars.streamledger.api.Mediator;
import dev.mars.streamledger.api.error.HandlerDispatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Mediator that fans an event out to every handler registered for its class or one of
 * its supertypes. Handlers run concurrently; the publish future completes when all of
 * them have finished and fails with {@link HandlerDispatchException} if any failed.
 * Cancelling the publish future cancels every handler future that is still pending.
 */
public class DefaultMediator implements Mediator {
    private static final Logger logger = LoggerFactory.getLogger(DefaultMediator.class);

    private final Map<Class<?>, List<EventHandler<? extends DomainEvent>>> handlers = new ConcurrentHashMap<>();

    public <E extends DomainEvent> DefaultMediator register(Class<E> eventType, EventHandler<E> handler) {
        Objects.requireNonNull(eventType, "Event type cannot be null");
        Objects.requireNonNull(handler, "Handler cannot be null");
        handlers.computeIfAbsent(eventType, type -> new CopyOnWriteArrayList<>()).add(handler);
        logger.debug("Registered handler for {}", eventType.getSimpleName());
        return this;
    }

    public int getHandlerCount(Class<? extends DomainEvent> eventType) {
        return handlersFor(eventType).size();
    }

    @Override
    public CompletableFuture<Void> publish(DomainEvent event) {
        Objects.requireNonNull(event, "Event cannot be null");
        List<EventHandler<? extends DomainEvent>> targets = handlersFor(event.getClass());
        if (targets.isEmpty()) {
            logger.debug("No handlers for {}", event.getClass().getSimpleName());
            return CompletableFuture.completedFuture(null);
        }

        List<CompletableFuture<Void>> invocations = new ArrayList<>(targets.size());
        for (EventHandler<? extends DomainEvent> handler : targets) {
            invocations.add(invoke(handler, event));
        }

        CompletableFuture<Void> outcome = CompletableFuture.allOf(invocations.toArray(new CompletableFuture[0]))
            .handle((ignored, error) -> {
                if (error == null) {
                    return null;
                }
                List<Throwable> failures = new ArrayList<>();
                for (CompletableFuture<Void> invocation : invocations) {
                    try {
                        invocation.join();
                    } catch (CompletionException | CancellationException e) {
                        failures.add(unwrap(e));
                    }
                }
                throw new HandlerDispatchException(event.getClass().getSimpleName(), failures);
            });
        outcome.whenComplete((ignored, error) -> {
            if (outcome.isCancelled()) {
                invocations.forEach(invocation -> invocation.cancel(true));
            }
        });
        return outcome;
    }

    @SuppressWarnings("unchecked")
    private static CompletableFuture<Void> invoke(EventHandler<? extends DomainEvent> handler, DomainEvent event) {
        try {
            CompletableFuture<Void> result = ((EventHandler<DomainEvent>) handler).handle(event);
            return result != null ? result : CompletableFuture.completedFuture(null);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private List<EventHandler<? extends DomainEvent>> handlersFor(Class<?> eventType) {
        List<EventHandler<? extends DomainEvent>> matching = new ArrayList<>();
        handlers.forEach((type, registered) -> {
            if (type.isAssignableFrom(eventType)) {
                matching.addAll(registered);
            }
        });
        return matching;
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
