package dev.mars.streamledger.api.aggregate;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import dev.mars.streamledger.api.DomainEvent;
import dev.mars.streamledger.api.StreamDescriptor;
import dev.mars.streamledger.api.error.UnhandledEventTypeException;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Mutable state of an aggregate, evolved only by applying domain events.
 *
 * <p>Concrete states register one transition per event class in their constructor:</p>
 * <pre>{@code
 * public OrderState() {
 *     on(OrderCreated.class, e -> { setId(e.orderId()); status = Status.CREATED; });
 *     on(OrderPaid.class, e -> status = Status.PAID);
 * }
 * }</pre>
 *
 * <p>{@link #apply(DomainEvent)} fails with {@link UnhandledEventTypeException} for any event
 * class without a transition; events are never silently ignored.</p>
 *
 * @param <K> identifier type
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public abstract class AggregateState<K> {

    @JsonIgnore
    private final Map<Class<?>, Consumer<DomainEvent>> transitions = new HashMap<>();

    private K id;
    private long stateVersion = StreamDescriptor.NO_STREAM;
    private Instant createdAt;
    private Instant lastModified;

    protected <E extends DomainEvent> void on(Class<E> eventType, Consumer<E> transition) {
        Objects.requireNonNull(eventType, "Event type cannot be null");
        Objects.requireNonNull(transition, "Transition cannot be null");
        transitions.put(eventType, event -> transition.accept(eventType.cast(event)));
    }

    public final void apply(DomainEvent event) {
        Objects.requireNonNull(event, "Event cannot be null");
        Consumer<DomainEvent> transition = transitions.get(event.getClass());
        if (transition == null) {
            String type = event.getClass().getName();
            throw new UnhandledEventTypeException(type,
                getClass().getSimpleName() + " has no transition for event type " + type);
        }
        transition.accept(event);
    }

    public boolean handles(Class<? extends DomainEvent> eventType) {
        return transitions.containsKey(eventType);
    }

    public K getId() {
        return id;
    }

    protected void setId(K id) {
        this.id = id;
    }

    /**
     * @return version of the last persisted or replayed event, {@link StreamDescriptor#NO_STREAM} if none
     */
    public long getStateVersion() {
        return stateVersion;
    }

    public void setStateVersion(long stateVersion) {
        this.stateVersion = stateVersion;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastModified() {
        return lastModified;
    }

    /**
     * Records that an event happened at {@code timestamp}. The first call also sets the creation time.
     */
    public void touch(Instant timestamp) {
        if (createdAt == null) {
            createdAt = timestamp;
        }
        lastModified = timestamp;
    }
}
