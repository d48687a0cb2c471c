package dev.mars.streamledger.core.serialization;

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
import dev.mars.streamledger.api.error.EventSerializationException;
import dev.mars.streamledger.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class JsonEventSerializerTest {

    record DeliveryScheduled(String orderId, Instant deliverAt) implements DomainEvent {
    }

    private final JsonEventSerializer serializer =
        new JsonEventSerializer(new EventTypeRegistry().register(DeliveryScheduled.class));

    @Test
    void testInstantsAreWrittenAsIsoStrings() {
        String json = serializer.serialize(new DeliveryScheduled("order-1", Instant.parse("2025-07-15T10:15:30Z")));

        assertTrue(json.contains("\"deliverAt\":\"2025-07-15T10:15:30Z\""), json);
    }

    @Test
    void testUnknownPropertiesAreIgnoredOnRead() {
        DomainEvent event = serializer.deserialize("deliveryscheduled",
            "{\"orderId\":\"order-1\",\"deliverAt\":\"2025-07-15T10:15:30Z\",\"carrier\":\"dhl\"}", Map.of());

        assertEquals(new DeliveryScheduled("order-1", Instant.parse("2025-07-15T10:15:30Z")), event);
    }

    @Test
    void testMalformedPayloadIsReported() {
        assertThrows(EventSerializationException.class,
            () -> serializer.deserialize("deliveryscheduled", "{not json", Map.of()));
    }

    @Test
    void testMetadata() {
        String json = serializer.serializeMetadata(Map.of("aggregate-id", "order-1"));

        assertEquals(Map.of("aggregate-id", "order-1"), serializer.deserializeMetadata(json));
        assertEquals(Map.of(), serializer.deserializeMetadata(null));
        assertEquals("{}", serializer.serializeMetadata(null));
    }
}
