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

import dev.mars.streamledger.api.error.InvalidStreamException;
import dev.mars.streamledger.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class StreamIdsTest {

    @Test
    void testValidIdIsReturned() {
        assertEquals("order-42", StreamIds.validate("order-42"));
        String longest = "s".repeat(EventStore.MAX_STREAM_ID_LENGTH);
        assertEquals(longest, StreamIds.validate(longest));
    }

    @Test
    void testInvalidIds() {
        assertThrows(InvalidStreamException.class, () -> StreamIds.validate(null));
        assertThrows(InvalidStreamException.class, () -> StreamIds.validate("  "));
        assertThrows(InvalidStreamException.class, () -> StreamIds.validate("order 42"));
        assertThrows(InvalidStreamException.class, () -> StreamIds.validate("$stream-deleted"));
        assertThrows(InvalidStreamException.class,
            () -> StreamIds.validate("s".repeat(EventStore.MAX_STREAM_ID_LENGTH + 1)));
    }
}
