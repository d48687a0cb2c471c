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
import dev.mars.streamledger.api.SourcedEvent;
import dev.mars.streamledger.api.EventSource;
import dev.mars.streamledger.api.StreamDescriptor;
import dev.mars.streamledger.api.StreamReadDirection;
import dev.mars.streamledger.api.error.ConcurrencyConflictException;
import dev.mars.streamledger.api.error.InvalidStreamException;
import dev.mars.streamledger.api.error.StreamNotFoundException;
import dev.mars.streamledger.core.serialization.EventTypeRegistry;
import dev.mars.streamledger.core.serialization.JsonEventSerializer;
import dev.mars.streamledger.core.testdomain.ItemAdded;
import dev.mars.streamledger.core.testdomain.OrderCreated;
import dev.mars.streamledger.core.testdomain.OrderPaid;
import dev.mars.streamledger.test.categories.TestCategories;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class InMemoryEventStoreTest {

    private static final Instant NOW = Instant.parse("2025-07-15T12:00:00Z");

    private InMemoryEventStore store;

    @BeforeEach
    void setUp() {
        EventTypeRegistry registry = new EventTypeRegistry()
            .register(OrderCreated.class)
            .register(ItemAdded.class)
            .register(OrderPaid.class);
        store = new InMemoryEventStore(new JsonEventSerializer(registry), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private static List<EventDescriptor> orderEvents() {
        return List.of(
            new EventDescriptor("ordercreated", new OrderCreated("42", "c-7")),
            new EventDescriptor("itemadded", new ItemAdded("sku-1", 1, 500)),
            new EventDescriptor("orderpaid", new OrderPaid(500)));
    }

    private static Throwable failureOf(CompletableFuture<?> future) {
        ExecutionException error = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        return error.getCause();
    }

    @Test
    void testAppendToFreshStreamAssignsContiguousVersions() throws Exception {
        StreamDescriptor stream = store.append("order-42", StreamDescriptor.NO_STREAM, orderEvents()).get();

        assertEquals("order-42", stream.id());
        assertEquals(2, stream.version());
        assertEquals(NOW, stream.firstEventAt());

        List<EventRecord> records = store.read("order-42", StreamReadDirection.FORWARDS, 0).get();
        assertEquals(3, records.size());
        for (int i = 0; i < records.size(); i++) {
            assertEquals(i, records.get(i).version());
            assertEquals(NOW, records.get(i).recordedAt());
        }
        assertEquals(new OrderCreated("42", "c-7"), records.get(0).data());
        assertEquals(new OrderPaid(500), records.get(2).data());
    }

    @Test
    void testSecondAppendContinuesFromExpectedVersion() throws Exception {
        store.append("order-42", StreamDescriptor.NO_STREAM, orderEvents().subList(0, 2)).get();

        StreamDescriptor stream = store.append("order-42", 1,
            List.of(new EventDescriptor("orderpaid", new OrderPaid(500)))).get();

        assertEquals(2, stream.version());
    }

    @Test
    void testStaleExpectedVersionConflictsAndLeavesStreamUnchanged() throws Exception {
        store.append("order-42", StreamDescriptor.NO_STREAM, orderEvents()).get();

        Throwable error = failureOf(store.append("order-42", 0,
            List.of(new EventDescriptor("orderpaid", new OrderPaid(1)))));

        assertInstanceOf(ConcurrencyConflictException.class, error);
        ConcurrencyConflictException conflict = (ConcurrencyConflictException) error;
        assertEquals(0, conflict.getExpectedVersion());
        assertEquals(2, conflict.getActualVersion());
        assertEquals(2, store.getStream("order-42").get().version());
        assertEquals(3, store.read("order-42", StreamReadDirection.FORWARDS, 0).get().size());
    }

    @Test
    void testCreatingAnExistingStreamConflicts() throws Exception {
        store.append("order-42", StreamDescriptor.NO_STREAM, orderEvents()).get();

        assertInstanceOf(ConcurrencyConflictException.class,
            failureOf(store.append("order-42", StreamDescriptor.NO_STREAM, orderEvents())));
    }

    @Test
    void testAnyVersionSkipsTheCheck() throws Exception {
        store.append("order-42", StreamDescriptor.NO_STREAM, orderEvents()).get();

        StreamDescriptor stream = store.append("order-42", StreamDescriptor.ANY,
            List.of(new EventDescriptor("orderpaid", new OrderPaid(1)))).get();

        assertEquals(3, stream.version());
    }

    @Test
    void testReadUnknownStreamFails() {
        assertInstanceOf(StreamNotFoundException.class,
            failureOf(store.read("order-404", StreamReadDirection.FORWARDS, 0)));
        assertInstanceOf(StreamNotFoundException.class, failureOf(store.getStream("order-404")));
    }

    @Test
    void testMalformedStreamIdsAreRejected() {
        assertInstanceOf(InvalidStreamException.class,
            failureOf(store.append("", StreamDescriptor.NO_STREAM, orderEvents())));
        assertInstanceOf(InvalidStreamException.class,
            failureOf(store.append("order 42", StreamDescriptor.NO_STREAM, orderEvents())));
        assertInstanceOf(InvalidStreamException.class,
            failureOf(store.append("$$system", StreamDescriptor.NO_STREAM, orderEvents())));
        assertInstanceOf(InvalidStreamException.class,
            failureOf(store.read("x".repeat(256), StreamReadDirection.FORWARDS, 0)));
    }

    @Test
    void testEmptyAppendIsRejected() {
        assertInstanceOf(IllegalArgumentException.class,
            failureOf(store.append("order-42", StreamDescriptor.NO_STREAM, List.of())));
    }

    @Test
    void testBackwardsReadReturnsDescendingVersions() throws Exception {
        store.append("order-42", StreamDescriptor.NO_STREAM, orderEvents()).get();

        List<EventRecord> fromEnd = store.read("order-42", StreamReadDirection.BACKWARDS, Long.MAX_VALUE).get();
        assertEquals(List.of(2L, 1L, 0L), fromEnd.stream().map(EventRecord::version).toList());

        List<EventRecord> fromOne = store.read("order-42", StreamReadDirection.BACKWARDS, 1).get();
        assertEquals(List.of(1L, 0L), fromOne.stream().map(EventRecord::version).toList());
    }

    @Test
    void testReadIsRestartableAndHonoursMaxCount() throws Exception {
        store.append("order-42", StreamDescriptor.NO_STREAM, orderEvents()).get();

        List<EventRecord> firstTwo = store.read("order-42", StreamReadDirection.FORWARDS, 0, 2).get();
        List<EventRecord> tail = store.read("order-42", StreamReadDirection.FORWARDS, 2).get();
        List<EventRecord> again = store.read("order-42", StreamReadDirection.FORWARDS, 0).get();

        assertEquals(2, firstTwo.size());
        assertEquals(1, tail.size());
        assertEquals(2, tail.get(0).version());
        assertEquals(3, again.size());
    }

    @Test
    void testReadersReceiveIndependentCopies() throws Exception {
        store.append("order-42", StreamDescriptor.NO_STREAM, orderEvents()).get();

        EventRecord first = store.read("order-42", StreamReadDirection.FORWARDS, 0).get().get(0);
        EventRecord second = store.read("order-42", StreamReadDirection.FORWARDS, 0).get().get(0);

        assertEquals(first.data(), second.data());
        assertNotSame(first.data(), second.data());
    }

    @Test
    void testStreamExistsAndDelete() throws Exception {
        assertFalse(store.streamExists("order-42").get());
        store.append("order-42", StreamDescriptor.NO_STREAM, orderEvents()).get();
        assertTrue(store.streamExists("order-42").get());

        assertTrue(store.delete("order-42").get());
        assertFalse(store.streamExists("order-42").get());
        assertFalse(store.delete("order-42").get());
    }

    @Test
    void testDeletedStreamCannotBeRecreated() throws Exception {
        store.append("order-42", StreamDescriptor.NO_STREAM, orderEvents()).get();
        store.delete("order-42").get();

        assertInstanceOf(InvalidStreamException.class,
            failureOf(store.append("order-42", StreamDescriptor.NO_STREAM, orderEvents())));
        assertInstanceOf(InvalidStreamException.class,
            failureOf(store.append("order-42", StreamDescriptor.ANY, orderEvents())));
        assertFalse(store.streamExists("order-42").get());
    }

    @Test
    void testConcurrentAppendsWithSameExpectedVersionHaveOneWinner() throws Exception {
        store.append("order-42", StreamDescriptor.NO_STREAM, orderEvents().subList(0, 1)).get();

        List<CompletableFuture<StreamDescriptor>> attempts = new CopyOnWriteArrayList<>();
        CountDownLatch start = new CountDownLatch(1);
        List<Thread> writers = new java.util.ArrayList<>();
        for (int i = 0; i < 8; i++) {
            Thread writer = new Thread(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                attempts.add(store.append("order-42", 0,
                    List.of(new EventDescriptor("orderpaid", new OrderPaid(1)))));
            });
            writers.add(writer);
            writer.start();
        }
        start.countDown();
        for (Thread writer : writers) {
            writer.join(5000);
        }

        long winners = attempts.stream().filter(f -> !f.isCompletedExceptionally()).count();
        assertEquals(8, attempts.size());
        assertEquals(1, winners);
        assertEquals(1, store.getStream("order-42").get().version());
    }

    @Test
    void testSubscriberCatchesUpThenReceivesLiveEventsInOrder() throws Exception {
        store.append("order-1", StreamDescriptor.NO_STREAM, orderEvents()).get();

        List<SourcedEvent> received = new CopyOnWriteArrayList<>();
        CountDownLatch allDelivered = new CountDownLatch(5);
        EventSource.Subscription subscription = store.subscribe(event -> {
            received.add(event);
            allDelivered.countDown();
            return CompletableFuture.completedFuture(null);
        });

        store.append("order-2", StreamDescriptor.NO_STREAM, orderEvents().subList(0, 2)).get();

        assertTrue(allDelivered.await(5, TimeUnit.SECONDS));
        subscription.close();

        assertEquals(List.of("order-1", "order-1", "order-1", "order-2", "order-2"),
            received.stream().map(e -> e.record().streamId()).toList());
        assertEquals("order-2", received.get(4).aggregateId());
        assertEquals(1, received.get(4).record().version());
    }

    @Test
    void testDeleteEmitsSystemRecordToSubscribers() throws Exception {
        store.append("order-1", StreamDescriptor.NO_STREAM, orderEvents()).get();
        List<SourcedEvent> received = new CopyOnWriteArrayList<>();
        CountDownLatch delivered = new CountDownLatch(4);
        store.subscribe(event -> {
            received.add(event);
            delivered.countDown();
            return CompletableFuture.completedFuture(null);
        });

        store.delete("order-1").get();

        assertTrue(delivered.await(5, TimeUnit.SECONDS));
        EventRecord tombstone = received.get(3).record();
        assertEquals(EventRecord.STREAM_DELETED_EVENT, tombstone.eventType());
        assertTrue(tombstone.isSystemRecord());
        assertNull(tombstone.data());
    }

    @Test
    void testClosedStoreRejectsAppends() {
        store.close();

        assertInstanceOf(IllegalStateException.class,
            failureOf(store.append("order-42", StreamDescriptor.NO_STREAM, orderEvents())));
    }
}
