package dev.mars.streamledger.core.store;

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

import dev.mars.streamledger.api.EventDescriptor;
import dev.mars.streamledger.api.EventRecord;
import dev.mars.streamledger.api.EventSource;
import dev.mars.streamledger.api.EventStore;
import dev.mars.streamledger.api.SourcedEvent;
import dev.mars.streamledger.api.StreamDescriptor;
import dev.mars.streamledger.api.StreamIds;
import dev.mars.streamledger.api.StreamReadDirection;
import dev.mars.streamledger.api.error.ConcurrencyConflictException;
import dev.mars.streamledger.api.error.InvalidStreamException;
import dev.mars.streamledger.api.error.StreamNotFoundException;
import dev.mars.streamledger.core.serialization.JsonEventSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Event store held in process memory.
 *
 * <p>Payloads are kept as JSON and decoded on every read, so callers never share
 * mutable instances with the store. Appends to all streams are serialized by a single
 * monitor, which also fixes the global commit order seen by subscribers.</p>
 *
 * <p>As an {@link EventSource}, each subscriber first receives every committed record
 * (catch-up) and then live records, one at a time: the next record is only delivered
 * once the subscriber's future for the previous one has completed.</p>
 *
 * <p>A deleted stream id is never reused, so a stream's versions stay contiguous for every
 * reader and consumer checkpoint.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class InMemoryEventStore implements EventStore, EventSource {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryEventStore.class);

    private final JsonEventSerializer serializer;
    private final Clock clock;
    private final Map<String, List<StoredEvent>> streams = new HashMap<>();
    private final List<StoredEvent> log = new ArrayList<>();
    private final Set<String> deletedStreams = new HashSet<>();
    private final List<InMemorySubscription> subscriptions = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private static final AtomicInteger threadCounter = new AtomicInteger();

    public InMemoryEventStore(JsonEventSerializer serializer) {
        this(serializer, Clock.systemUTC());
    }

    public InMemoryEventStore(JsonEventSerializer serializer, Clock clock) {
        this.serializer = Objects.requireNonNull(serializer, "Serializer cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        logger.info("Created in-memory event store");
    }

    @Override
    public CompletableFuture<StreamDescriptor> append(String streamId, long expectedVersion, List<EventDescriptor> events) {
        try {
            StreamIds.validate(streamId);
            Objects.requireNonNull(events, "Events cannot be null");
            if (events.isEmpty()) {
                throw new IllegalArgumentException("At least one event is required to append to " + streamId);
            }
            checkOpen();
            return CompletableFuture.completedFuture(appendLocked(streamId, expectedVersion, events));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private synchronized StreamDescriptor appendLocked(String streamId, long expectedVersion, List<EventDescriptor> events) {
        if (deletedStreams.contains(streamId)) {
            logger.warn("Rejected append to {}: stream was deleted", streamId);
            throw new InvalidStreamException("Stream " + streamId + " was deleted and cannot be written to again");
        }
        List<StoredEvent> stream = streams.get(streamId);
        long current = stream == null ? StreamDescriptor.NO_STREAM : stream.size() - 1L;
        if (expectedVersion != StreamDescriptor.ANY && expectedVersion != current) {
            logger.warn("Rejected append to {}: expected version {} but was {}", streamId, expectedVersion, current);
            throw new ConcurrencyConflictException(streamId, expectedVersion, current);
        }

        // Encode everything before touching the stream so a bad payload leaves it unchanged
        Instant now = clock.instant();
        List<StoredEvent> batch = new ArrayList<>(events.size());
        long version = current;
        for (EventDescriptor descriptor : events) {
            version++;
            batch.add(new StoredEvent(streamId, version, descriptor.eventType(),
                serializer.serialize(descriptor.data()), descriptor.metadata(), now));
        }

        if (stream == null) {
            stream = new ArrayList<>();
            streams.put(streamId, stream);
        }
        stream.addAll(batch);
        log.addAll(batch);
        subscriptions.forEach(subscription -> subscription.offer(batch));

        logger.debug("Appended {} event(s) to {} (version {})", batch.size(), streamId, version);
        return describe(streamId, stream);
    }

    @Override
    public CompletableFuture<List<EventRecord>> read(String streamId, StreamReadDirection direction,
                                                     long fromVersion, int maxCount) {
        try {
            StreamIds.validate(streamId);
            Objects.requireNonNull(direction, "Direction cannot be null");
            if (maxCount < 0) {
                throw new IllegalArgumentException("maxCount must be non-negative");
            }
            List<StoredEvent> snapshot;
            synchronized (this) {
                List<StoredEvent> stream = streams.get(streamId);
                if (stream == null) {
                    throw new StreamNotFoundException(streamId);
                }
                snapshot = new ArrayList<>(stream);
            }

            List<EventRecord> result = new ArrayList<>();
            if (direction == StreamReadDirection.FORWARDS) {
                for (long i = Math.max(0, fromVersion); i < snapshot.size() && result.size() < maxCount; i++) {
                    result.add(toRecord(snapshot.get((int) i)));
                }
            } else {
                long start = Math.min(fromVersion, snapshot.size() - 1L);
                for (long i = start; i >= 0 && result.size() < maxCount; i--) {
                    result.add(toRecord(snapshot.get((int) i)));
                }
            }
            return CompletableFuture.completedFuture(result);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public synchronized CompletableFuture<Boolean> streamExists(String streamId) {
        return CompletableFuture.completedFuture(streams.containsKey(streamId));
    }

    @Override
    public CompletableFuture<StreamDescriptor> getStream(String streamId) {
        synchronized (this) {
            List<StoredEvent> stream = streams.get(streamId);
            if (stream == null) {
                return CompletableFuture.failedFuture(new StreamNotFoundException(streamId));
            }
            return CompletableFuture.completedFuture(describe(streamId, stream));
        }
    }

    @Override
    public CompletableFuture<Boolean> delete(String streamId) {
        try {
            StreamIds.validate(streamId);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        synchronized (this) {
            List<StoredEvent> removed = streams.remove(streamId);
            if (removed == null) {
                return CompletableFuture.completedFuture(false);
            }
            log.removeIf(event -> event.streamId.equals(streamId));
            deletedStreams.add(streamId);
            StoredEvent tombstone = new StoredEvent(streamId, removed.size(), EventRecord.STREAM_DELETED_EVENT,
                null, Map.of(), clock.instant());
            subscriptions.forEach(subscription -> subscription.offer(List.of(tombstone)));
            logger.info("Deleted stream {} ({} event(s))", streamId, removed.size());
            return CompletableFuture.completedFuture(true);
        }
    }

    @Override
    public Subscription subscribe(Function<SourcedEvent, CompletableFuture<Void>> subscriber) {
        Objects.requireNonNull(subscriber, "Subscriber cannot be null");
        checkOpen();
        InMemorySubscription subscription = new InMemorySubscription(subscriber);
        int backlog;
        synchronized (this) {
            backlog = log.size();
            subscription.offer(new ArrayList<>(log));
            subscriptions.add(subscription);
        }
        logger.info("Subscriber registered, catching up {} committed event(s)", backlog);
        return subscription;
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            subscriptions.forEach(InMemorySubscription::close);
            subscriptions.clear();
            logger.info("Closed in-memory event store");
        }
    }

    private void checkOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Event store is closed");
        }
    }

    private static StreamDescriptor describe(String streamId, List<StoredEvent> stream) {
        return new StreamDescriptor(streamId, stream.size() - 1L,
            stream.get(0).recordedAt, stream.get(stream.size() - 1).recordedAt);
    }

    private EventRecord toRecord(StoredEvent event) {
        return new EventRecord(event.streamId, event.version, event.eventType,
            event.json == null ? null : serializer.deserialize(event.eventType, event.json, event.metadata),
            event.metadata, event.recordedAt);
    }

    private static final class StoredEvent {
        final String streamId;
        final long version;
        final String eventType;
        final String json;
        final Map<String, String> metadata;
        final Instant recordedAt;

        StoredEvent(String streamId, long version, String eventType, String json,
                    Map<String, String> metadata, Instant recordedAt) {
            this.streamId = streamId;
            this.version = version;
            this.eventType = eventType;
            this.json = json;
            this.metadata = metadata;
            this.recordedAt = recordedAt;
        }
    }

    /**
     * Delivers records to one subscriber on its own thread, strictly one at a time.
     */
    private final class InMemorySubscription implements Subscription {
        private final Function<SourcedEvent, CompletableFuture<Void>> subscriber;
        private final ExecutorService deliveryExecutor;
        private volatile boolean active = true;

        InMemorySubscription(Function<SourcedEvent, CompletableFuture<Void>> subscriber) {
            this.subscriber = subscriber;
            this.deliveryExecutor = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "streamledger-delivery-" + threadCounter.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
        }

        void offer(List<StoredEvent> batch) {
            if (!active || batch.isEmpty()) {
                return;
            }
            List<StoredEvent> copy = List.copyOf(batch);
            try {
                deliveryExecutor.execute(() -> copy.forEach(this::deliver));
            } catch (RejectedExecutionException e) {
                logger.debug("Subscription closed, dropping {} undelivered event(s)", copy.size());
            }
        }

        private void deliver(StoredEvent event) {
            if (!active) {
                return;
            }
            try {
                subscriber.apply(SourcedEvent.of(toRecord(event))).join();
            } catch (RuntimeException e) {
                logger.error("Subscriber failed on {} v{}; continuing with the next event",
                    event.streamId, event.version, e);
            }
        }

        @Override
        public void close() {
            active = false;
            subscriptions.remove(this);
            deliveryExecutor.shutdown();
            try {
                if (!deliveryExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    deliveryExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                deliveryExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }
}
