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

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer metrics for the read-model reconciliator. Recording methods are no-ops
 * until {@link #bindTo(MeterRegistry)} has been called.
 */
public class ReconciliatorMetrics implements MeterBinder {
    private static final Logger logger = LoggerFactory.getLogger(ReconciliatorMetrics.class);

    private final String instanceId;

    private Counter eventsReceived;
    private Counter eventsProcessed;
    private Counter eventsFailed;
    private Counter eventsRetried;
    private Counter eventsSkipped;
    private Timer dispatchTime;

    private final AtomicLong activeQueues = new AtomicLong(0);
    private final AtomicLong stalledQueues = new AtomicLong(0);

    public ReconciliatorMetrics(String instanceId) {
        this.instanceId = instanceId;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        eventsReceived = Counter.builder("streamledger.events.received")
            .description("Events accepted from the event source")
            .tag("instance", instanceId)
            .register(registry);

        eventsProcessed = Counter.builder("streamledger.events.processed")
            .description("Events dispatched to completion")
            .tag("instance", instanceId)
            .register(registry);

        eventsFailed = Counter.builder("streamledger.events.failed")
            .description("Failed dispatch attempts, timeouts included")
            .tag("instance", instanceId)
            .register(registry);

        eventsRetried = Counter.builder("streamledger.events.retried")
            .description("Dispatch retries")
            .tag("instance", instanceId)
            .register(registry);

        eventsSkipped = Counter.builder("streamledger.events.skipped")
            .description("Events skipped by an operator")
            .tag("instance", instanceId)
            .register(registry);

        dispatchTime = Timer.builder("streamledger.event.dispatch.time")
            .description("Time taken to dispatch one event to all handlers")
            .tag("instance", instanceId)
            .register(registry);

        Gauge.builder("streamledger.queues.active", activeQueues::get)
            .description("Aggregate queues currently held in memory")
            .tag("instance", instanceId)
            .register(registry);

        Gauge.builder("streamledger.queues.stalled", stalledQueues::get)
            .description("Aggregate queues waiting for operator intervention")
            .tag("instance", instanceId)
            .register(registry);

        logger.info("Reconciliator metrics registered for instance: {}", instanceId);
    }

    public void recordEventReceived() {
        if (eventsReceived != null) {
            eventsReceived.increment();
        }
    }

    public void recordEventProcessed(Duration dispatchDuration) {
        if (eventsProcessed != null) {
            eventsProcessed.increment();
        }
        if (dispatchTime != null) {
            dispatchTime.record(dispatchDuration);
        }
    }

    public void recordEventFailed() {
        if (eventsFailed != null) {
            eventsFailed.increment();
        }
    }

    public void recordEventRetried() {
        if (eventsRetried != null) {
            eventsRetried.increment();
        }
    }

    public void recordEventSkipped() {
        if (eventsSkipped != null) {
            eventsSkipped.increment();
        }
    }

    public void updateQueueCounts(long active, long stalled) {
        activeQueues.set(active);
        stalledQueues.set(stalled);
    }

    public String getInstanceId() {
        return instanceId;
    }
}
