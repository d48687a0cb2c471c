package dev.mars.streamledger.core.repository;

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
import dev.mars.streamledger.api.EventDescriptor;
import dev.mars.streamledger.api.EventStore;
import dev.mars.streamledger.api.Repository;
import dev.mars.streamledger.api.StreamDescriptor;
import dev.mars.streamledger.api.StreamReadDirection;
import dev.mars.streamledger.api.aggregate.AggregateRoot;
import dev.mars.streamledger.api.aggregate.SoftDeletable;
import dev.mars.streamledger.api.error.AggregateNotFoundException;
import dev.mars.streamledger.api.error.NothingToPersistException;
import dev.mars.streamledger.api.error.StreamNotFoundException;
import dev.mars.streamledger.core.aggregate.Aggregator;
import dev.mars.streamledger.core.serialization.EventTypeRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

/**
 * Repository that persists aggregates as event streams.
 *
 * <p>Each aggregate lives in the stream {@code <lowercased aggregate class name>-<id>}.
 * Saving appends the pending events with the aggregate's state version as the expected
 * version, so a concurrent writer is detected by the store and surfaced to the caller as a
 * {@link dev.mars.streamledger.api.error.ConcurrencyConflictException}. Conflicts are never
 * retried here.</p>
 *
 * <p>Events are not published from the repository. Read models are fed by the
 * reconciliator from the store's event feed.</p>
 *
 * @param <A> aggregate type
 * @param <K> identifier type
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class EventSourcingRepository<A extends AggregateRoot<?, K>, K> implements Repository<A, K> {
    private static final Logger logger = LoggerFactory.getLogger(EventSourcingRepository.class);

    public static final String AGGREGATE_TYPE_METADATA = "aggregate-type";
    public static final String AGGREGATE_ID_METADATA = "aggregate-id";

    private final EventStore eventStore;
    private final Class<A> aggregateType;
    private final Supplier<A> factory;
    private final EventTypeRegistry typeRegistry;
    private final EventSourcingRepositoryOptions options;
    private final String aggregateName;

    public EventSourcingRepository(EventStore eventStore, Class<A> aggregateType,
                                   Supplier<A> factory, EventTypeRegistry typeRegistry) {
        this(eventStore, aggregateType, factory, typeRegistry, EventSourcingRepositoryOptions.defaults());
    }

    public EventSourcingRepository(EventStore eventStore, Class<A> aggregateType, Supplier<A> factory,
                                   EventTypeRegistry typeRegistry, EventSourcingRepositoryOptions options) {
        this.eventStore = Objects.requireNonNull(eventStore, "Event store cannot be null");
        this.aggregateType = Objects.requireNonNull(aggregateType, "Aggregate type cannot be null");
        this.factory = Objects.requireNonNull(factory, "Factory cannot be null");
        this.typeRegistry = Objects.requireNonNull(typeRegistry, "Type registry cannot be null");
        this.options = Objects.requireNonNull(options, "Options cannot be null");
        this.aggregateName = aggregateType.getSimpleName().toLowerCase(Locale.ROOT);
    }

    public String streamIdFor(K id) {
        Objects.requireNonNull(id, "Aggregate id cannot be null");
        return aggregateName + "-" + id;
    }

    @Override
    public CompletableFuture<Optional<A>> get(K id) {
        String streamId = streamIdFor(id);
        return eventStore.read(streamId, StreamReadDirection.FORWARDS, 0)
            .thenApply(records -> Optional.of(Aggregator.aggregate(records, factory)))
            .exceptionally(error -> {
                if (unwrap(error) instanceof StreamNotFoundException) {
                    return Optional.empty();
                }
                throw error instanceof CompletionException ? (CompletionException) error : new CompletionException(error);
            });
    }

    @Override
    public CompletableFuture<Boolean> contains(K id) {
        return eventStore.streamExists(streamIdFor(id));
    }

    @Override
    public CompletableFuture<Void> add(A aggregate) {
        return save(aggregate);
    }

    @Override
    public CompletableFuture<Void> update(A aggregate) {
        Objects.requireNonNull(aggregate, "Aggregate cannot be null");
        if (aggregate.getStateVersion() == StreamDescriptor.NO_STREAM && aggregate.getId() != null) {
            return CompletableFuture.failedFuture(new StreamNotFoundException(streamIdFor(aggregate.getId())));
        }
        return save(aggregate);
    }

    @Override
    public CompletableFuture<Void> remove(K id) {
        switch (options.getDeleteMode()) {
            case SOFT:
                return softDelete(id);
            case HARD:
                String streamId = streamIdFor(id);
                return eventStore.delete(streamId).thenAccept(removed ->
                    logger.info("Hard delete of {}: {}", streamId, removed ? "stream removed" : "no stream"));
            case DISABLED:
            default:
                return CompletableFuture.failedFuture(new UnsupportedOperationException(
                    "Deletion is disabled for " + aggregateType.getSimpleName()
                        + "; configure a SOFT or HARD delete mode to enable it"));
        }
    }

    private CompletableFuture<Void> softDelete(K id) {
        return get(id).thenCompose(found -> {
            A aggregate = found.orElseThrow(() -> new AggregateNotFoundException(aggregateType.getSimpleName(), id));
            if (!(aggregate instanceof SoftDeletable)) {
                throw new IllegalArgumentException("Soft delete requires " + aggregateType.getSimpleName()
                    + " to implement " + SoftDeletable.class.getSimpleName());
            }
            ((SoftDeletable) aggregate).markAsDeleted();
            return update(aggregate);
        });
    }

    private CompletableFuture<Void> save(A aggregate) {
        Objects.requireNonNull(aggregate, "Aggregate cannot be null");
        List<DomainEvent> pending = aggregate.getPendingEvents();
        if (pending.isEmpty()) {
            return CompletableFuture.failedFuture(
                new NothingToPersistException(aggregateType.getSimpleName(), aggregate.getId()));
        }
        if (aggregate.getId() == null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException(
                aggregateType.getSimpleName() + " has no id; its first event must assign one"));
        }

        String streamId = streamIdFor(aggregate.getId());
        long expectedVersion = aggregate.getStateVersion();
        List<EventDescriptor> descriptors = encode(aggregate.getId(), pending);

        return eventStore.append(streamId, expectedVersion, descriptors)
            .thenAccept(stream -> {
                aggregate.getState().setStateVersion(stream.version());
                aggregate.clearPendingEvents();
                logger.debug("Saved {} event(s) to {} (version {} -> {})",
                    descriptors.size(), streamId, expectedVersion, stream.version());
            });
    }

    private List<EventDescriptor> encode(K id, List<DomainEvent> events) {
        List<EventDescriptor> descriptors = new ArrayList<>(events.size());
        for (DomainEvent event : events) {
            descriptors.add(new EventDescriptor(
                typeRegistry.typeNameOf(event.getClass()),
                event,
                Map.of(AGGREGATE_TYPE_METADATA, aggregateName,
                       AGGREGATE_ID_METADATA, String.valueOf(id),
                       EventTypeRegistry.EVENT_CLASS_METADATA, event.getClass().getName())));
        }
        return descriptors;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
