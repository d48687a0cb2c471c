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

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Tuning surface of the {@link ReadModelReconciliator}.
 *
 * <p>{@code retryAttempts} counts retries after the first attempt, so a value of 3 allows
 * up to 4 dispatches of the same event before its queue stalls.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class ReconciliatorOptions {

    private final int maxConcurrentAggregates;
    private final Duration handlerTimeout;
    private final int retryAttempts;
    private final Duration retryBackoff;
    private final double retryBackoffMultiplier;
    private final Duration maxRetryBackoff;
    private final int queueCapacity;
    private final Duration queueIdleTimeout;
    private final Duration evictionInterval;
    private final Duration shutdownTimeout;

    private ReconciliatorOptions(Builder builder) {
        this.maxConcurrentAggregates = builder.maxConcurrentAggregates;
        this.handlerTimeout = builder.handlerTimeout;
        this.retryAttempts = builder.retryAttempts;
        this.retryBackoff = builder.retryBackoff;
        this.retryBackoffMultiplier = builder.retryBackoffMultiplier;
        this.maxRetryBackoff = builder.maxRetryBackoff;
        this.queueCapacity = builder.queueCapacity;
        this.queueIdleTimeout = builder.queueIdleTimeout;
        this.evictionInterval = builder.evictionInterval;
        this.shutdownTimeout = builder.shutdownTimeout;
    }

    public static ReconciliatorOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getMaxConcurrentAggregates() { return maxConcurrentAggregates; }
    public Duration getHandlerTimeout() { return handlerTimeout; }
    public int getRetryAttempts() { return retryAttempts; }
    public Duration getRetryBackoff() { return retryBackoff; }
    public double getRetryBackoffMultiplier() { return retryBackoffMultiplier; }
    public Duration getMaxRetryBackoff() { return maxRetryBackoff; }
    public int getQueueCapacity() { return queueCapacity; }
    public Duration getQueueIdleTimeout() { return queueIdleTimeout; }
    public Duration getEvictionInterval() { return evictionInterval; }
    public Duration getShutdownTimeout() { return shutdownTimeout; }

    /**
     * Backoff to wait before retry number {@code retry} (1-based).
     */
    public Duration backoffFor(int retry) {
        double millis = retryBackoff.toMillis() * Math.pow(retryBackoffMultiplier, Math.max(0, retry - 1));
        long capped = (long) Math.min(millis, maxRetryBackoff.toMillis());
        return Duration.ofMillis(capped);
    }

    @Override
    public String toString() {
        return "ReconciliatorOptions{" +
                "maxConcurrentAggregates=" + maxConcurrentAggregates +
                ", handlerTimeout=" + handlerTimeout +
                ", retryAttempts=" + retryAttempts +
                ", retryBackoff=" + retryBackoff +
                ", retryBackoffMultiplier=" + retryBackoffMultiplier +
                ", maxRetryBackoff=" + maxRetryBackoff +
                ", queueCapacity=" + queueCapacity +
                ", queueIdleTimeout=" + queueIdleTimeout +
                ", evictionInterval=" + evictionInterval +
                ", shutdownTimeout=" + shutdownTimeout +
                '}';
    }

    public static class Builder {
        private int maxConcurrentAggregates = 8;
        private Duration handlerTimeout = Duration.ofSeconds(30);
        private int retryAttempts = 3;
        private Duration retryBackoff = Duration.ofMillis(100);
        private double retryBackoffMultiplier = 2.0;
        private Duration maxRetryBackoff = Duration.ofSeconds(10);
        private int queueCapacity = 256;
        private Duration queueIdleTimeout = Duration.ofMinutes(5);
        private Duration evictionInterval = Duration.ofMinutes(1);
        private Duration shutdownTimeout = Duration.ofSeconds(30);

        public Builder maxConcurrentAggregates(int maxConcurrentAggregates) {
            this.maxConcurrentAggregates = maxConcurrentAggregates;
            return this;
        }

        public Builder handlerTimeout(Duration handlerTimeout) {
            this.handlerTimeout = handlerTimeout;
            return this;
        }

        public Builder retryAttempts(int retryAttempts) {
            this.retryAttempts = retryAttempts;
            return this;
        }

        public Builder retryBackoff(Duration retryBackoff) {
            this.retryBackoff = retryBackoff;
            return this;
        }

        public Builder retryBackoffMultiplier(double retryBackoffMultiplier) {
            this.retryBackoffMultiplier = retryBackoffMultiplier;
            return this;
        }

        public Builder maxRetryBackoff(Duration maxRetryBackoff) {
            this.maxRetryBackoff = maxRetryBackoff;
            return this;
        }

        public Builder queueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
            return this;
        }

        public Builder queueIdleTimeout(Duration queueIdleTimeout) {
            this.queueIdleTimeout = queueIdleTimeout;
            return this;
        }

        public Builder evictionInterval(Duration evictionInterval) {
            this.evictionInterval = evictionInterval;
            return this;
        }

        public Builder shutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public ReconciliatorOptions build() {
            List<String> errors = new ArrayList<>();
            if (maxConcurrentAggregates < 1) {
                errors.add("maxConcurrentAggregates must be at least 1");
            }
            if (retryAttempts < 0) {
                errors.add("retryAttempts must be non-negative");
            }
            if (retryBackoffMultiplier < 1.0) {
                errors.add("retryBackoffMultiplier must be at least 1.0");
            }
            if (queueCapacity < 1) {
                errors.add("queueCapacity must be at least 1");
            }
            requirePositive(errors, "handlerTimeout", handlerTimeout);
            requireNonNegative(errors, "retryBackoff", retryBackoff);
            requireNonNegative(errors, "maxRetryBackoff", maxRetryBackoff);
            requirePositive(errors, "queueIdleTimeout", queueIdleTimeout);
            requirePositive(errors, "evictionInterval", evictionInterval);
            requirePositive(errors, "shutdownTimeout", shutdownTimeout);
            if (!errors.isEmpty()) {
                throw new IllegalArgumentException("Invalid reconciliator options: " + String.join(", ", errors));
            }
            return new ReconciliatorOptions(this);
        }

        private static void requirePositive(List<String> errors, String name, Duration value) {
            if (Objects.isNull(value) || value.isNegative() || value.isZero()) {
                errors.add(name + " must be positive");
            }
        }

        private static void requireNonNegative(List<String> errors, String name, Duration value) {
            if (Objects.isNull(value) || value.isNegative()) {
                errors.add(name + " must be non-negative");
            }
        }
    }
}
