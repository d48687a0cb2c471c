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

import dev.mars.streamledger.api.EventRecord;
import dev.mars.streamledger.api.EventSource;
import dev.mars.streamledger.api.SourcedEvent;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.sqlclient.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Event feed that polls the events table by {@code global_position}.
 *
 * <p>Every subscription starts at the beginning of the log; consumers skip what they have
 * already processed through their checkpoints. Records are handed over one at a time and the
 * next is only delivered once the subscriber's future completes. The next poll is scheduled
 * after the current batch has been delivered, so polls never overlap.</p>
 *
 * <p>A row that cannot be decoded (malformed JSON, an event class missing from the classpath) is
 * logged and passed over so that one bad row never holds back the rest of the log.</p>
 */
public class PgEventSource implements EventSource {
    private static final Logger logger = LoggerFactory.getLogger(PgEventSource.class);

    private final Vertx vertx;
    private final PgEventStore eventStore;
    private final long pollIntervalMs;
    private final int batchSize;

    public PgEventSource(Vertx vertx, PgEventStore eventStore) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx cannot be null");
        this.eventStore = Objects.requireNonNull(eventStore, "Event store cannot be null");
        this.pollIntervalMs = eventStore.getConfig().getPollInterval().toMillis();
        this.batchSize = eventStore.getConfig().getPollBatchSize();
    }

    @Override
    public Subscription subscribe(Function<SourcedEvent, CompletableFuture<Void>> subscriber) {
        Objects.requireNonNull(subscriber, "Subscriber cannot be null");
        PollingSubscription subscription = new PollingSubscription(subscriber);
        subscription.schedule(0);
        logger.info("Polling subscription started (interval {}ms, batch {})", pollIntervalMs, batchSize);
        return subscription;
    }

    private final class PollingSubscription implements Subscription {
        private final Function<SourcedEvent, CompletableFuture<Void>> subscriber;
        private volatile boolean active = true;
        private volatile long timerId = -1;
        private long position;

        PollingSubscription(Function<SourcedEvent, CompletableFuture<Void>> subscriber) {
            this.subscriber = subscriber;
        }

        void schedule(long delayMs) {
            if (!active) {
                return;
            }
            timerId = vertx.setTimer(Math.max(1, delayMs), id -> poll());
        }

        private void poll() {
            if (!active) {
                return;
            }
            eventStore.readAll(position, batchSize)
                .compose(this::deliver)
                .onComplete(result -> {
                    if (result.failed()) {
                        logger.warn("Event poll after position {} failed: {}", position, result.cause().getMessage());
                        schedule(pollIntervalMs);
                    } else {
                        // A full batch means more is waiting
                        schedule(result.result() >= batchSize ? 0 : pollIntervalMs);
                    }
                });
        }

        private Future<Integer> deliver(List<Row> rows) {
            Future<Void> chain = Future.succeededFuture();
            for (Row row : rows) {
                chain = chain.compose(v -> {
                    if (!active) {
                        return Future.succeededFuture();
                    }
                    long rowPosition = PgEventStore.positionOf(row);
                    EventRecord decoded;
                    try {
                        decoded = eventStore.decode(row);
                    } catch (RuntimeException e) {
                        logger.warn("Skipping undecodable event {} v{} at position {}: {}",
                            row.getString("stream_id"), row.getLong("version"), rowPosition, e.getMessage());
                        position = rowPosition;
                        return Future.succeededFuture();
                    }
                    return ReactiveUtils.fromCompletableFuture(subscriber.apply(SourcedEvent.of(decoded)))
                        .onSuccess(done -> position = rowPosition);
                });
            }
            return chain.map(rows.size());
        }

        @Override
        public void close() {
            active = false;
            long id = timerId;
            if (id >= 0) {
                vertx.cancelTimer(id);
            }
            logger.info("Polling subscription closed at position {}", position);
        }
    }
}
