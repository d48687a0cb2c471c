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

import dev.mars.streamledger.api.EventRecord;
import dev.mars.streamledger.api.SourcedEvent;
import dev.mars.streamledger.core.testdomain.OrderPaid;
import dev.mars.streamledger.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class AggregateEventQueueTest {

    private static final Instant T0 = Instant.parse("2025-07-15T10:00:00Z");

    private static SourcedEvent event(long version) {
        return new SourcedEvent("order-1",
            new EventRecord("order-1", version, "orderpaid", new OrderPaid(version), Map.of(), T0));
    }

    @Test
    void testStateMachineEmptyFillingDrainingEmpty() {
        AggregateEventQueue queue = new AggregateEventQueue("order-1", 10, T0);
        assertEquals(QueueState.EMPTY, queue.getState());

        queue.enqueue(event(0), T0);
        assertEquals(QueueState.FILLING, queue.getState());

        assertTrue(queue.tryStartDraining());
        assertEquals(QueueState.DRAINING, queue.getState());
        assertFalse(queue.tryStartDraining(), "only one worker may claim the queue");

        assertEquals(0, queue.nextOrIdle(T0).record().version());
        queue.completeHead(T0);
        assertNull(queue.nextOrIdle(T0.plusSeconds(1)));
        assertEquals(QueueState.EMPTY, queue.getState());
        assertEquals(T0.plusSeconds(1), queue.getLastActivity());
    }

    @Test
    void testEventsArrivingWhileDrainingDoNotNeedASecondWorker() {
        AggregateEventQueue queue = new AggregateEventQueue("order-1", 10, T0);
        queue.enqueue(event(0), T0);
        queue.tryStartDraining();

        queue.enqueue(event(1), T0);

        assertEquals(QueueState.DRAINING, queue.getState());
        assertFalse(queue.tryStartDraining());
        assertEquals(2, queue.size());
    }

    @Test
    void testHeadStaysUntilCompleted() {
        AggregateEventQueue queue = new AggregateEventQueue("order-1", 10, T0);
        queue.enqueue(event(0), T0);
        queue.enqueue(event(1), T0);
        queue.tryStartDraining();

        assertEquals(0, queue.nextOrIdle(T0).record().version());
        assertEquals(0, queue.nextOrIdle(T0).record().version());
        queue.completeHead(T0);
        assertEquals(1, queue.nextOrIdle(T0).record().version());
    }

    @Test
    void testBackpressureAtCapacityReleasedWhenDrained() {
        AggregateEventQueue queue = new AggregateEventQueue("order-1", 2, T0);
        assertTrue(queue.enqueue(event(0), T0).isDone());

        CompletableFuture<Void> permit = queue.enqueue(event(1), T0);
        assertFalse(permit.isDone());

        queue.tryStartDraining();
        queue.nextOrIdle(T0);
        queue.completeHead(T0);
        assertTrue(permit.isDone());
    }

    @Test
    void testStalledQueueBuffersWithoutBackpressure() {
        AggregateEventQueue queue = new AggregateEventQueue("order-1", 2, T0);
        queue.enqueue(event(0), T0);
        CompletableFuture<Void> permit = queue.enqueue(event(1), T0);
        queue.tryStartDraining();

        queue.stall(new IllegalStateException("boom"), 4, T0);

        assertTrue(permit.isDone());
        assertEquals(QueueState.STALLED, queue.getState());
        assertTrue(queue.enqueue(event(2), T0).isDone());
        assertEquals(QueueState.STALLED, queue.getState());
        assertFalse(queue.tryStartDraining());
        assertEquals(4, queue.getFailedAttempts());
        assertEquals("boom", queue.getLastError().getMessage());
    }

    @Test
    void testResumeAndSkipOnlyApplyToStalledQueues() {
        AggregateEventQueue queue = new AggregateEventQueue("order-1", 10, T0);
        queue.enqueue(event(0), T0);
        queue.enqueue(event(1), T0);
        queue.tryStartDraining();
        assertFalse(queue.resume(T0));
        assertNull(queue.skipStalledHead(T0));

        queue.stall(new IllegalStateException("boom"), 1, T0);
        assertTrue(queue.resume(T0));
        assertEquals(QueueState.DRAINING, queue.getState());
        assertNull(queue.getLastError());

        queue.stall(new IllegalStateException("boom"), 1, T0);
        assertEquals(0, queue.skipStalledHead(T0).record().version());
        assertEquals(QueueState.DRAINING, queue.getState());
        assertEquals(1, queue.peek().record().version());
    }

    @Test
    void testOnlyIdleEmptyQueuesAreEvictable() {
        AggregateEventQueue queue = new AggregateEventQueue("order-1", 10, T0);
        Duration idle = Duration.ofMinutes(5);

        assertFalse(queue.isEvictable(T0.plusSeconds(60), idle));
        assertTrue(queue.isEvictable(T0.plus(idle), idle));

        queue.enqueue(event(0), T0);
        assertFalse(queue.isEvictable(T0.plus(Duration.ofHours(1)), idle));
    }
}
