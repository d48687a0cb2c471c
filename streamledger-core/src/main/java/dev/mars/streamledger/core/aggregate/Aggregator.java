package dev.mars.streamledger.core.aggregate;

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

import dev.mars.streamledger.api.EventRecord;
import dev.mars.streamledger.api.aggregate.AggregateRoot;
import dev.mars.streamledger.api.aggregate.AggregateState;
import dev.mars.streamledger.api.error.UnhandledEventTypeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Rebuilds aggregates by replaying their stored events.
 *
 * <p>Replay is deterministic: timestamps come from the records, never from a clock, and the
 * state version is the version of the last record. The replayed aggregate always has an
 * empty pending-events list, so a subsequent save persists only newly registered events.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public final class Aggregator {
    private static final Logger logger = LoggerFactory.getLogger(Aggregator.class);

    private Aggregator() {
    }

    /**
     * Replays {@code records} into a new instance created with the aggregate's no-arg constructor.
     */
    public static <A extends AggregateRoot<?, ?>> A aggregate(List<EventRecord> records, Class<A> aggregateType) {
        Objects.requireNonNull(aggregateType, "Aggregate type cannot be null");
        return aggregate(records, () -> instantiate(aggregateType));
    }

    public static <A extends AggregateRoot<?, ?>> A aggregate(List<EventRecord> records, Supplier<A> factory) {
        Objects.requireNonNull(records, "Records cannot be null");
        Objects.requireNonNull(factory, "Factory cannot be null");

        A aggregate = factory.get();
        AggregateState<?> state = aggregate.getState();
        for (EventRecord record : records) {
            if (record.data() == null) {
                throw new UnhandledEventTypeException(record.eventType(),
                    "Record " + record.streamId() + " v" + record.version() + " carries no domain event");
            }
            state.apply(record.data());
            state.touch(record.recordedAt());
            state.setStateVersion(record.version());
        }
        aggregate.clearPendingEvents();

        logger.debug("Replayed {} event(s) into {} (state version {})",
            records.size(), aggregate.getClass().getSimpleName(), state.getStateVersion());
        return aggregate;
    }

    private static <A> A instantiate(Class<A> aggregateType) {
        try {
            Constructor<A> constructor = aggregateType.getDeclaredConstructor();
            constructor.setAccessible(true);
            return constructor.newInstance();
        } catch (NoSuchMethodException e) {
            throw new IllegalArgumentException(aggregateType.getName() + " must declare a no-argument constructor", e);
        } catch (InvocationTargetException e) {
            throw new IllegalStateException("Constructor of " + aggregateType.getName() + " failed", e.getCause());
        } catch (InstantiationException | IllegalAccessException e) {
            throw new IllegalArgumentException("Cannot instantiate " + aggregateType.getName(), e);
        }
    }
}
