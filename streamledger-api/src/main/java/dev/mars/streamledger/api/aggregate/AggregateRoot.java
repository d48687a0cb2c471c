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

import dev.mars.streamledger.api.DomainEvent;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Consistency boundary owning an {@link AggregateState} and the events raised since it was
 * last loaded or saved.
 *
 * <p>Subclasses need a no-argument constructor for replay by the aggregator.</p>
 *
 * @param <S> state type
 * @param <K> identifier type
 */
public abstract class AggregateRoot<S extends AggregateState<K>, K> {

    private final S state;
    private final Clock clock;
    private List<DomainEvent> pendingEvents = new ArrayList<>();

    protected AggregateRoot(S state) {
        this(state, Clock.systemUTC());
    }

    protected AggregateRoot(S state, Clock clock) {
        this.state = Objects.requireNonNull(state, "State cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    /**
     * Records a new event and applies it to the state immediately.
     */
    protected void registerEvent(DomainEvent event) {
        Objects.requireNonNull(event, "Event cannot be null");
        state.apply(event);
        state.touch(clock.instant());
        pendingEvents.add(event);
    }

    public List<DomainEvent> getPendingEvents() {
        return Collections.unmodifiableList(pendingEvents);
    }

    public boolean hasPendingEvents() {
        return !pendingEvents.isEmpty();
    }

    /**
     * Discards pending events; lists previously returned by {@link #getPendingEvents()} are left untouched.
     */
    public void clearPendingEvents() {
        pendingEvents = new ArrayList<>();
    }

    public S getState() {
        return state;
    }

    public K getId() {
        return state.getId();
    }

    public long getStateVersion() {
        return state.getStateVersion();
    }
}
