package dev.mars.streamledger.core.config;

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

import dev.mars.streamledger.core.reconciliation.ReconciliatorOptions;
import dev.mars.streamledger.core.repository.DeleteMode;
import dev.mars.streamledger.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class StreamLedgerConfigurationTest {

    @Test
    void testDefaultProfile() {
        StreamLedgerConfiguration config = new StreamLedgerConfiguration("default");

        ReconciliatorOptions options = config.getReconciliatorOptions();
        assertEquals(8, options.getMaxConcurrentAggregates());
        assertEquals(Duration.ofMillis(100), options.getRetryBackoff());
        assertEquals(Duration.ofMinutes(1), options.getEvictionInterval());
        assertEquals(DeleteMode.DISABLED, config.getRepositoryOptions().getDeleteMode());
        assertEquals("streamledger", config.getMetricsInstanceId());
        assertEquals(5432, config.getInt("streamledger.database.port", 0));
    }

    @Test
    void testProfileOverridesDefaults() {
        StreamLedgerConfiguration config = new StreamLedgerConfiguration("test");

        ReconciliatorOptions options = config.getReconciliatorOptions();
        assertEquals("test", config.getProfile());
        assertEquals(2, options.getMaxConcurrentAggregates());
        assertEquals(5, options.getRetryAttempts());
        assertEquals(Duration.ofSeconds(2), options.getHandlerTimeout());
        assertEquals(256, options.getQueueCapacity());
        assertEquals(DeleteMode.SOFT, config.getRepositoryOptions().getDeleteMode());
    }

    @Test
    void testExplicitOverridesWin() {
        Properties overrides = new Properties();
        overrides.setProperty("streamledger.reconciliator.queue.capacity", "16");
        overrides.setProperty("streamledger.repository.delete-mode", "hard");

        StreamLedgerConfiguration config = new StreamLedgerConfiguration("test", overrides);

        assertEquals(16, config.getReconciliatorOptions().getQueueCapacity());
        assertEquals(DeleteMode.HARD, config.getRepositoryOptions().getDeleteMode());
    }

    @Test
    void testEnvironmentVariablesReachHyphenatedKeys() {
        Map<String, String> environment = Map.of(
            "STREAMLEDGER_RECONCILIATOR_MAX_CONCURRENT_AGGREGATES", "3",
            "STREAMLEDGER_RECONCILIATOR_RETRY_BACKOFF_MULTIPLIER", "1.5",
            "STREAMLEDGER_RECONCILIATOR_QUEUE_IDLE_TIMEOUT", "PT1M",
            "STREAMLEDGER_REPOSITORY_DELETE_MODE", "hard",
            "STREAMLEDGER_METRICS_INSTANCE_ID", "node-7",
            "STREAMLEDGER_DATABASE_POOL_MAX_SIZE", "4",
            "STREAMLEDGER_DATABASE_POLL_INTERVAL", "PT2S",
            "STREAMLEDGER_CUSTOM_FLAG", "on",
            "PATH", "/usr/bin");

        StreamLedgerConfiguration config = new StreamLedgerConfiguration("default", new Properties(), environment);

        ReconciliatorOptions options = config.getReconciliatorOptions();
        assertEquals(3, options.getMaxConcurrentAggregates());
        assertEquals(1.5, options.getRetryBackoffMultiplier());
        assertEquals(Duration.ofMinutes(1), options.getQueueIdleTimeout());
        assertEquals(DeleteMode.HARD, config.getRepositoryOptions().getDeleteMode());
        assertEquals("node-7", config.getMetricsInstanceId());
        assertEquals(4, config.getInt("streamledger.database.pool.max-size", 16));
        assertEquals(Duration.ofSeconds(2), config.getDuration("streamledger.database.poll-interval", Duration.ZERO));
        assertEquals("on", config.getString("streamledger.custom.flag"));
    }

    @Test
    void testEnvironmentReachesKeysFromTheActiveProfile() {
        StreamLedgerConfiguration config = new StreamLedgerConfiguration("test", new Properties(),
            Map.of("STREAMLEDGER_RECONCILIATOR_HANDLER_TIMEOUT", "PT9S"));

        assertEquals(Duration.ofSeconds(9), config.getReconciliatorOptions().getHandlerTimeout());
    }

    @Test
    void testMalformedValuesFallBackToDefaults() {
        Properties overrides = new Properties();
        overrides.setProperty("streamledger.reconciliator.retry.backoff", "soon");
        overrides.setProperty("streamledger.database.pool.max-size", "many");

        StreamLedgerConfiguration config = new StreamLedgerConfiguration("default", overrides);

        assertEquals(Duration.ofMillis(100), config.getReconciliatorOptions().getRetryBackoff());
        assertEquals(16, config.getInt("streamledger.database.pool.max-size", 16));
    }

    @Test
    void testInvalidValuesFailValidation() {
        Properties overrides = new Properties();
        overrides.setProperty("streamledger.reconciliator.max-concurrent-aggregates", "0");
        overrides.setProperty("streamledger.repository.delete-mode", "shred");

        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> new StreamLedgerConfiguration("default", overrides));

        assertTrue(e.getMessage().contains("Max concurrent aggregates"));
        assertTrue(e.getMessage().contains("shred"));
    }

    @Test
    void testMissingRequiredProperty() {
        StreamLedgerConfiguration config = new StreamLedgerConfiguration("default");

        assertThrows(IllegalArgumentException.class, () -> config.getString("streamledger.nonexistent"));
    }
}
