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

import dev.mars.streamledger.api.CheckpointStore;
import dev.mars.streamledger.api.EventRecord;
import dev.mars.streamledger.api.EventSource;
import dev.mars.streamledger.api.Mediator;
import dev.mars.streamledger.api.SourcedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Feeds read models from an {@link EventSource} while keeping every aggregate's events in order.
 *
 * <p>Incoming events are demultiplexed into one {@link AggregateEventQueue} per aggregate id.
 * A queue is drained by at most one task at a time on a fixed pool of
 * {@code maxConcurrentAggregates} threads, so different aggregates progress in parallel while
 * each aggregate's events reach the {@link Mediator} strictly one after the other. A drain task
 * hands its thread back after {@value #DRAIN_BATCH_SIZE} events so that busy aggregates cannot
 * starve the others.</p>
 *
 * <p>A failed or timed-out dispatch is retried with exponential backoff. When the retries are
 * exhausted the queue stalls: it keeps buffering, other aggregates carry on, and nothing for
 * that aggregate is dispatched until an operator calls {@link #retry(String)} or
 * {@link #skip(String)}.</p>
 *
 * <p>On a timeout the mediator's future is cancelled, which cancels the pending handler futures.
 * Cancellation does not interrupt a handler that is already running: one that ignores it can
 * still be working when the retry, and then the aggregate's next event, are dispatched. Strict
 * one-at-a-time delivery per aggregate therefore holds only for handlers that finish or stop
 * within {@code handlerTimeout}.</p>
 *
 * <p>After each successful dispatch the event's version is written to the {@link CheckpointStore};
 * events at or below a stream's checkpoint are acknowledged without dispatch, which lets a restarted
 * reconciliator resume where it stopped. System records (tombstones, {@code $}-prefixed types) are
 * acknowledged without dispatch.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class ReadModelReconciliator implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ReadModelReconciliator.class);

    static final int DRAIN_BATCH_SIZE = 32;

    private enum Outcome { PROCESSED, STALLED, INTERRUPTED }

    private final EventSource eventSource;
    private final Mediator mediator;
    private final CheckpointStore checkpointStore;
    private final ReconciliatorOptions options;
    private final ReconciliatorMetrics metrics;
    private final Clock clock;

    private final Map<String, AggregateEventQueue> queues = new ConcurrentHashMap<>();
    private final Map<String, Long> checkpointCache = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<EventSource.Subscription> subscription = new AtomicReference<>();
    private final AtomicInteger stalledCount = new AtomicInteger(0);

    private volatile boolean stopping;
    private volatile CountDownLatch stopSignal = new CountDownLatch(1);
    private ExecutorService workerPool;
    private ScheduledExecutorService evictionScheduler;

    public ReadModelReconciliator(EventSource eventSource, Mediator mediator,
                                  CheckpointStore checkpointStore, ReconciliatorOptions options) {
        this(eventSource, mediator, checkpointStore, options, new ReconciliatorMetrics("default"), Clock.systemUTC());
    }

    public ReadModelReconciliator(EventSource eventSource, Mediator mediator, CheckpointStore checkpointStore,
                                  ReconciliatorOptions options, ReconciliatorMetrics metrics, Clock clock) {
        this.eventSource = Objects.requireNonNull(eventSource, "Event source cannot be null");
        this.mediator = Objects.requireNonNull(mediator, "Mediator cannot be null");
        this.checkpointStore = Objects.requireNonNull(checkpointStore, "Checkpoint store cannot be null");
        this.options = Objects.requireNonNull(options, "Options cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "Metrics cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            logger.debug("Reconciliator already running");
            return;
        }
        stopping = false;
        stopSignal = new CountDownLatch(1);

        AtomicInteger workerCounter = new AtomicInteger();
        workerPool = Executors.newFixedThreadPool(options.getMaxConcurrentAggregates(), r -> {
            Thread t = new Thread(r, "streamledger-reconciler-" + workerCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        evictionScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "streamledger-queue-evictor");
            t.setDaemon(true);
            return t;
        });
        long evictionMillis = options.getEvictionInterval().toMillis();
        evictionScheduler.scheduleAtFixedRate(this::runEviction, evictionMillis, evictionMillis, TimeUnit.MILLISECONDS);

        subscription.set(eventSource.subscribe(this::onEvent));
        logger.info("Read-model reconciliator started with {}", options);
    }

    /**
     * Accepts one event from the source.
     *
     * @return a future that completes once the event is buffered; completion is deferred while the
     *         aggregate's queue is at capacity
     */
    public CompletableFuture<Void> onEvent(SourcedEvent event) {
        Objects.requireNonNull(event, "Event cannot be null");
        if (!running.get() || stopping) {
            logger.debug("Reconciliator stopped, not accepting {} v{}",
                event.record().streamId(), event.record().version());
            return CompletableFuture.completedFuture(null);
        }
        metrics.recordEventReceived();

        Instant now = clock.instant();
        AtomicReference<CompletableFuture<Void>> accepted = new AtomicReference<>();
        AggregateEventQueue queue = queues.compute(event.aggregateId(), (id, existing) -> {
            AggregateEventQueue target = existing != null ? existing
                : new AggregateEventQueue(id, options.getQueueCapacity(), now);
            accepted.set(target.enqueue(event, now));
            return target;
        });
        updateQueueGauges();

        scheduleDrainIfIdle(queue);
        return accepted.get();
    }

    private void scheduleDrainIfIdle(AggregateEventQueue queue) {
        if (queue.tryStartDraining()) {
            submitDrain(queue);
        }
    }

    private void submitDrain(AggregateEventQueue queue) {
        ExecutorService pool = workerPool;
        if (pool == null || pool.isShutdown()) {
            queue.yieldDraining(clock.instant());
            return;
        }
        pool.execute(() -> drain(queue));
    }

    private void drain(AggregateEventQueue queue) {
        int processed = 0;
        while (true) {
            if (stopping) {
                queue.yieldDraining(clock.instant());
                return;
            }
            if (processed == DRAIN_BATCH_SIZE) {
                // Keep the claim but go to the back of the pool's line
                submitDrain(queue);
                return;
            }
            SourcedEvent event = queue.nextOrIdle(clock.instant());
            if (event == null) {
                return;
            }
            Outcome outcome = process(queue, event);
            if (outcome == Outcome.PROCESSED) {
                queue.completeHead(clock.instant());
                processed++;
            } else if (outcome == Outcome.INTERRUPTED) {
                queue.yieldDraining(clock.instant());
                return;
            } else {
                updateQueueGauges();
                return;
            }
        }
    }

    private Outcome process(AggregateEventQueue queue, SourcedEvent event) {
        EventRecord record = event.record();
        if (record.isSystemRecord()) {
            logger.debug("Skipping system record {} v{} ({})", record.streamId(), record.version(), record.eventType());
            return Outcome.PROCESSED;
        }

        int attempt = 0;
        while (true) {
            attempt++;
            try {
                if (isCheckpointed(record)) {
                    logger.debug("Skipping {} v{}: at or below checkpoint", record.streamId(), record.version());
                    return Outcome.PROCESSED;
                }
                long started = System.nanoTime();
                dispatch(record);
                advanceCheckpoint(record.streamId(), record.version());
                metrics.recordEventProcessed(Duration.ofNanos(System.nanoTime() - started));
                if (attempt > 1) {
                    logger.info("Dispatched {} v{} on attempt {}", record.streamId(), record.version(), attempt);
                }
                return Outcome.PROCESSED;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Outcome.INTERRUPTED;
            } catch (Exception e) {
                metrics.recordEventFailed();
                Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
                int retriesUsed = attempt - 1;
                if (retriesUsed >= options.getRetryAttempts()) {
                    queue.stall(cause, attempt, clock.instant());
                    stalledCount.incrementAndGet();
                    logger.error("Queue for aggregate {} stalled at {} v{} after {} attempt(s); awaiting retry or skip",
                        queue.getAggregateId(), record.streamId(), record.version(), attempt, cause);
                    return Outcome.STALLED;
                }

                Duration backoff = options.backoffFor(attempt);
                logger.warn("Dispatch of {} v{} failed on attempt {}: {}; retrying in {}ms",
                    record.streamId(), record.version(), attempt, cause.getMessage(), backoff.toMillis());
                metrics.recordEventRetried();
                try {
                    if (stopSignal.await(backoff.toMillis(), TimeUnit.MILLISECONDS)) {
                        return Outcome.INTERRUPTED;
                    }
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return Outcome.INTERRUPTED;
                }
            }
        }
    }

    private void dispatch(EventRecord record) throws InterruptedException, ExecutionException, TimeoutException {
        CompletableFuture<Void> result = mediator.publish(record.data());
        try {
            result.get(options.getHandlerTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            result.cancel(true);
            throw new TimeoutException("Handlers for " + record.streamId() + " v" + record.version()
                + " did not complete within " + options.getHandlerTimeout());
        }
    }

    private boolean isCheckpointed(EventRecord record) throws InterruptedException, ExecutionException, TimeoutException {
        Long checkpoint = checkpointCache.get(record.streamId());
        if (checkpoint == null) {
            Optional<Long> stored = checkpointStore.get(record.streamId())
                .get(options.getHandlerTimeout().toMillis(), TimeUnit.MILLISECONDS);
            if (stored.isEmpty()) {
                return false;
            }
            checkpoint = stored.get();
            checkpointCache.merge(record.streamId(), checkpoint, Math::max);
        }
        return record.version() <= checkpoint;
    }

    private void advanceCheckpoint(String streamId, long version)
            throws InterruptedException, ExecutionException, TimeoutException {
        checkpointStore.set(streamId, version).get(options.getHandlerTimeout().toMillis(), TimeUnit.MILLISECONDS);
        checkpointCache.merge(streamId, version, Math::max);
    }

    /**
     * Re-dispatches the failed head event of a stalled queue.
     *
     * @return false if the aggregate has no stalled queue
     */
    public boolean retry(String aggregateId) {
        AggregateEventQueue queue = queues.get(aggregateId);
        if (queue == null || !queue.resume(clock.instant())) {
            return false;
        }
        stalledCount.decrementAndGet();
        updateQueueGauges();
        logger.info("Operator retry for aggregate {}", aggregateId);
        submitDrain(queue);
        return true;
    }

    /**
     * Discards the failed head event of a stalled queue and resumes with the next one.
     * The checkpoint moves past the skipped event.
     *
     * @return false if the aggregate has no stalled queue
     */
    public boolean skip(String aggregateId) {
        AggregateEventQueue queue = queues.get(aggregateId);
        if (queue == null) {
            return false;
        }
        SourcedEvent skipped = queue.skipStalledHead(clock.instant());
        if (skipped == null) {
            return false;
        }
        stalledCount.decrementAndGet();
        metrics.recordEventSkipped();
        updateQueueGauges();

        EventRecord record = skipped.record();
        logger.warn("Operator skipped {} v{} ({}) for aggregate {}; read models will not see this event",
            record.streamId(), record.version(), record.eventType(), aggregateId);
        checkpointStore.set(record.streamId(), record.version())
            .whenComplete((ignored, error) -> {
                if (error != null) {
                    logger.error("Failed to checkpoint skipped event {} v{}", record.streamId(), record.version(), error);
                } else {
                    checkpointCache.merge(record.streamId(), record.version(), Math::max);
                }
                submitDrain(queue);
            });
        return true;
    }

    public List<StalledQueue> getStalledQueues() {
        List<StalledQueue> stalled = new ArrayList<>();
        queues.values().forEach(queue -> {
            SourcedEvent head = queue.peek();
            if (queue.getState() == QueueState.STALLED && head != null) {
                stalled.add(new StalledQueue(queue.getAggregateId(), head.record().streamId(),
                    head.record().version(), head.record().eventType(), queue.getFailedAttempts(),
                    queue.getLastError(), queue.getStalledSince(), queue.size()));
            }
        });
        return stalled;
    }

    /**
     * Removes queues that have been empty for longer than the idle timeout.
     *
     * @return number of queues evicted
     */
    public int evictIdleQueues() {
        Instant now = clock.instant();
        Duration idleTimeout = options.getQueueIdleTimeout();
        int evicted = 0;
        for (String aggregateId : new ArrayList<>(queues.keySet())) {
            AtomicReference<AggregateEventQueue> removed = new AtomicReference<>();
            queues.computeIfPresent(aggregateId, (id, queue) -> {
                if (queue.isEvictable(now, idleTimeout)) {
                    removed.set(queue);
                    return null;
                }
                return queue;
            });
            if (removed.get() != null) {
                removed.get().getStreamIds().forEach(checkpointCache::remove);
                evicted++;
            }
        }
        if (evicted > 0) {
            updateQueueGauges();
            logger.debug("Evicted {} idle aggregate queue(s), {} remaining", evicted, queues.size());
        }
        return evicted;
    }

    private void runEviction() {
        try {
            evictIdleQueues();
        } catch (RuntimeException e) {
            logger.error("Queue eviction failed", e);
        }
    }

    public int getActiveQueueCount() {
        return queues.size();
    }

    public Optional<QueueState> getQueueState(String aggregateId) {
        AggregateEventQueue queue = queues.get(aggregateId);
        return queue == null ? Optional.empty() : Optional.of(queue.getState());
    }

    public boolean isRunning() {
        return running.get();
    }

    private void updateQueueGauges() {
        metrics.updateQueueCounts(queues.size(), stalledCount.get());
    }

    /**
     * Stops accepting events and waits for in-flight dispatches to finish. No event is
     * interrupted mid-dispatch; events still buffered stay unprocessed and are picked up again
     * from the checkpoint on the next start.
     */
    public synchronized void stop() {
        if (!running.get()) {
            return;
        }
        logger.info("Stopping read-model reconciliator");
        stopping = true;
        stopSignal.countDown();
        queues.values().forEach(AggregateEventQueue::releaseAllProducers);

        EventSource.Subscription current = subscription.getAndSet(null);
        if (current != null) {
            current.close();
        }

        shutdown(workerPool, "worker pool");
        shutdown(evictionScheduler, "eviction scheduler");
        workerPool = null;
        evictionScheduler = null;

        queues.clear();
        checkpointCache.clear();
        stalledCount.set(0);
        updateQueueGauges();
        running.set(false);
        logger.info("Read-model reconciliator stopped");
    }

    private void shutdown(ExecutorService executor, String name) {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(options.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("Reconciliator {} did not terminate within {}, forcing shutdown",
                    name, options.getShutdownTimeout());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }
}
