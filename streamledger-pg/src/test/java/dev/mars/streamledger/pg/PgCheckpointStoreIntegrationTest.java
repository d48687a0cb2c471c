package dev.mars.streamledger.pg;

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

import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.INTEGRATION)
class PgCheckpointStoreIntegrationTest extends PgIntegrationTestBase {

    @Test
    void testCheckpointsPersistAndNeverMoveBackwards() throws Exception {
        PgCheckpointStore checkpoints = new PgCheckpointStore(eventStore);

        assertEquals(Optional.empty(), checkpoints.get("screening-1").get(10, TimeUnit.SECONDS));

        checkpoints.set("screening-1", 3).get(10, TimeUnit.SECONDS);
        checkpoints.set("screening-1", 1).get(10, TimeUnit.SECONDS);
        assertEquals(Optional.of(3L), checkpoints.get("screening-1").get(10, TimeUnit.SECONDS));

        checkpoints.set("screening-1", 5).get(10, TimeUnit.SECONDS);
        assertEquals(Optional.of(5L), checkpoints.get("screening-1").get(10, TimeUnit.SECONDS));

        PgCheckpointStore reopened = new PgCheckpointStore(eventStore.getPool(), config);
        assertEquals(Optional.of(5L), reopened.get("screening-1").get(10, TimeUnit.SECONDS));
        assertEquals(Optional.empty(), reopened.get("screening-2").get(10, TimeUnit.SECONDS));
    }
}
