package dev.mars.streamledger.api;

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

import dev.mars.streamledger.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class EventRecordTest {

    record AccountOpened(String owner) implements DomainEvent {
    }

    private static final Instant NOW = Instant.parse("2025-07-15T10:00:00Z");

    @Test
    void testDomainRecordIsNotSystemRecord() {
        EventRecord record = new EventRecord("account-1", 0, "accountopened", new AccountOpened("ann"), null, NOW);

        assertFalse(record.isSystemRecord());
        assertEquals(Map.of(), record.metadata());
    }

    @Test
    void testSystemRecords() {
        assertTrue(new EventRecord("account-1", 3, "$stream-deleted", null, Map.of(), NOW).isSystemRecord());
        assertTrue(new EventRecord("account-1", 3, "$marker", new AccountOpened("ann"), Map.of(), NOW).isSystemRecord());
        assertTrue(new EventRecord("$$settings", 0, "accountopened", new AccountOpened("ann"), Map.of(), NOW).isSystemRecord());
    }

    @Test
    void testMetadataIsCopied() {
        Map<String, String> metadata = new HashMap<>();
        metadata.put("aggregate-id", "1");
        EventRecord record = new EventRecord("account-1", 0, "accountopened", new AccountOpened("ann"), metadata, NOW);

        metadata.put("aggregate-id", "2");

        assertEquals("1", record.metadata().get("aggregate-id"));
        assertThrows(UnsupportedOperationException.class, () -> record.metadata().put("x", "y"));
    }

    @Test
    void testSourcedEventIsKeyedByStream() {
        EventRecord record = new EventRecord("account-1", 0, "accountopened", new AccountOpened("ann"), Map.of(), NOW);

        assertEquals("account-1", SourcedEvent.of(record).aggregateId());
    }
}
