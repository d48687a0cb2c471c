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

import dev.mars.streamledger.api.SourcedEvent;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * FIFO line of events for a single aggregate, consumed by at most one worker at a time.
 *
 * <p>The head event stays in the queue while it is being dispatched and is only removed by
 * {@link #completeHead(Instant)} or {@link #skipStalledHead(Instant)}, so a failed dispatch
 * can never let a later event overtake it.</p>
 *
 * <p>All methods are synchronized on the queue; the worker and the event source only ever
 * contend for the short critical sections here, never across a dispatch.</p>
 */
public class AggregateEventQueue {

    private final String aggregateId;
    private final int capacity;
    private final Deque<SourcedEvent> events = new ArrayDeque<>();
    private final List<CompletableFuture<Void>> waitingProducers = new ArrayList<>();
    private final Set<String> streamIds = new HashSet<>();

    private QueueState state = QueueState.EMPTY;
    private Instant lastActivity;
    private Throwable lastError;
    private int failedAttempts;
    private Instant stalledSince;

    public AggregateEventQueue(String aggregateId, int capacity, Instant createdAt) {
        this.aggregateId = Objects.requireNonNull(aggregateId, "Aggregate id cannot be null");
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be at least 1");
        }
        this.capacity = capacity;
        this.lastActivity = createdAt;
    }

    /**
     * Buffers an event.
     *
     * @return a future that completes once the queue has room again; already complete unless
     *         the queue is at capacity. Stalled queues never apply backpressure.
     */
    public synchronized CompletableFuture<Void> enqueue(SourcedEvent event, Instant now) {
        Objects.requireNonNull(event, "Event cannot be null");
        events.addLast(event);
        streamIds.add(event.record().streamId());
        lastActivity = now;
        if (state == QueueState.EMPTY) {
            state = QueueState.FILLING;
        }
        if (state != QueueState.STALLED && events.size() >= capacity) {
            CompletableFuture<Void> permit = new CompletableFuture<>();
            waitingProducers.add(permit);
            return permit;
        }
        return CompletableFuture.completedFuture(null);
    }

    /**
     * Claims the queue for a worker.
     *
     * @return true if the caller must schedule a drain; false if a worker already owns the
     *         queue, the queue is empty or it is stalled
     */
    public synchronized boolean tryStartDraining() {
        if (state == QueueState.FILLING) {
            state = QueueState.DRAINING;
            return true;
        }
        return false;
    }

    /**
     * Returns the head event without removing it, or releases the worker's claim and returns
     * null when nothing is buffered.
     */
    public synchronized SourcedEvent nextOrIdle(Instant now) {
        SourcedEvent head = events.peekFirst();
        if (head == null) {
            state = QueueState.EMPTY;
            lastActivity = now;
        }
        return head;
    }

    public synchronized void completeHead(Instant now) {
        events.pollFirst();
        lastActivity = now;
        failedAttempts = 0;
        releaseProducersBelowCapacity();
    }

    /**
     * Gives up the worker's claim without finishing the queue, e.g. on shutdown.
     */
    public synchronized void yieldDraining(Instant now) {
        if (state == QueueState.DRAINING) {
            state = events.isEmpty() ? QueueState.EMPTY : QueueState.FILLING;
        }
        lastActivity = now;
    }

    public synchronized void stall(Throwable error, int attempts, Instant now) {
        state = QueueState.STALLED;
        lastError = error;
        failedAttempts = attempts;
        stalledSince = now;
        lastActivity = now;
        releaseAllProducers();
    }

    /**
     * Moves a stalled queue back to draining so the head is dispatched again.
     *
     * @return true if the queue was stalled and the caller must schedule a drain
     */
    public synchronized boolean resume(Instant now) {
        if (state != QueueState.STALLED) {
            return false;
        }
        state = QueueState.DRAINING;
        clearFailure();
        lastActivity = now;
        return true;
    }

    /**
     * Drops the head of a stalled queue and moves it back to draining.
     *
     * @return the discarded event, or null if the queue was not stalled
     */
    public synchronized SourcedEvent skipStalledHead(Instant now) {
        if (state != QueueState.STALLED) {
            return null;
        }
        SourcedEvent skipped = events.pollFirst();
        state = QueueState.DRAINING;
        clearFailure();
        lastActivity = now;
        releaseProducersBelowCapacity();
        return skipped;
    }

    public synchronized boolean isEvictable(Instant now, Duration idleTimeout) {
        return state == QueueState.EMPTY
            && events.isEmpty()
            && !lastActivity.plus(idleTimeout).isAfter(now);
    }

    public synchronized void releaseAllProducers() {
        waitingProducers.forEach(permit -> permit.complete(null));
        waitingProducers.clear();
    }

    private void releaseProducersBelowCapacity() {
        if (events.size() < capacity) {
            releaseAllProducers();
        }
    }

    private void clearFailure() {
        lastError = null;
        failedAttempts = 0;
        stalledSince = null;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public synchronized QueueState getState() {
        return state;
    }

    public synchronized int size() {
        return events.size();
    }

    public synchronized SourcedEvent peek() {
        return events.peekFirst();
    }

    public synchronized Set<String> getStreamIds() {
        return Set.copyOf(streamIds);
    }

    public synchronized Instant getLastActivity() {
        return lastActivity;
    }

    public synchronized Throwable getLastError() {
        return lastError;
    }

    public synchronized int getFailedAttempts() {
        return failedAttempts;
    }

    public synchronized Instant getStalledSince() {
        return stalledSince;
    }

    @Override
    public synchronized String toString() {
        return "AggregateEventQueue{" +
                "aggregateId='" + aggregateId + '\'' +
                ", state=" + state +
                ", size=" + events.size() +
                ", lastActivity=" + lastActivity +
                '}';
    }
}
