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

import dev.mars.streamledger.api.DomainEvent;
import dev.mars.streamledger.api.EventDescriptor;
import dev.mars.streamledger.api.EventRecord;
import dev.mars.streamledger.api.EventStore;
import dev.mars.streamledger.api.StreamDescriptor;
import dev.mars.streamledger.api.StreamIds;
import dev.mars.streamledger.api.StreamReadDirection;
import dev.mars.streamledger.api.error.ConcurrencyConflictException;
import dev.mars.streamledger.api.error.InvalidStreamException;
import dev.mars.streamledger.api.error.StreamNotFoundException;
import dev.mars.streamledger.core.serialization.JsonEventSerializer;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.pgclient.PgBuilder;
import io.vertx.pgclient.PgConnectOptions;
import io.vertx.pgclient.PgException;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.PoolOptions;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.RowSet;
import io.vertx.sqlclient.SqlClient;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * PostgreSQL event store on the Vert.x reactive client.
 *
 * <p>An append runs in one transaction: it takes a transaction-scoped advisory lock, checks the
 * stream's current version and batch-inserts the new rows. The advisory lock makes
 * {@code global_position} values commit in increasing order, which the polling
 * {@link PgEventSource} relies on. The {@code (stream_id, version)} unique key remains the
 * final guard; a violation surfaces as {@link ConcurrencyConflictException}.</p>
 *
 * <p>Deleting a stream replaces its rows with a single {@link EventRecord#STREAM_DELETED_EVENT}
 * row. That row is hidden from stream reads, reaches consumers through {@link PgEventSource} and
 * keeps the stream id from being written again.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class PgEventStore implements EventStore {
    private static final Logger logger = LoggerFactory.getLogger(PgEventStore.class);

    static final String UNIQUE_VIOLATION = "23505";
    private static final long APPEND_LOCK_KEY = 0x53_4C_45_56L; // "SLEV"

    private final Pool pool;
    private final PgConnectionConfig config;
    private final JsonEventSerializer serializer;
    private final Clock clock;
    private final String eventsTable;
    private volatile boolean closed;

    public PgEventStore(Vertx vertx, PgConnectionConfig config, JsonEventSerializer serializer) {
        this(createPool(vertx, config), config, serializer, Clock.systemUTC());
    }

    public PgEventStore(Pool pool, PgConnectionConfig config, JsonEventSerializer serializer, Clock clock) {
        this.pool = Objects.requireNonNull(pool, "Pool cannot be null");
        this.config = Objects.requireNonNull(config, "Config cannot be null");
        this.serializer = Objects.requireNonNull(serializer, "Serializer cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.eventsTable = config.table(PgSchemaInitializer.EVENTS_TABLE);
        logger.info("Created PostgreSQL event store: {}", config);
    }

    static Pool createPool(Vertx vertx, PgConnectionConfig config) {
        PgConnectOptions connectOptions = new PgConnectOptions()
            .setHost(config.getHost())
            .setPort(config.getPort())
            .setDatabase(config.getDatabase())
            .setUser(config.getUsername())
            .setPassword(config.getPassword());

        PoolOptions poolOptions = new PoolOptions()
            .setMaxSize(config.getMaxPoolSize())
            .setName("streamledger-pool");

        return PgBuilder.pool()
            .with(poolOptions)
            .connectingTo(connectOptions)
            .using(vertx)
            .build();
    }

    @Override
    public CompletableFuture<StreamDescriptor> append(String streamId, long expectedVersion, List<EventDescriptor> events) {
        try {
            StreamIds.validate(streamId);
            Objects.requireNonNull(events, "Events cannot be null");
            if (events.isEmpty()) {
                throw new IllegalArgumentException("At least one event is required to append to " + streamId);
            }
            checkOpen();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }

        Instant now = clock.instant();
        OffsetDateTime recordedAt = now.atOffset(ZoneOffset.UTC);

        Future<StreamDescriptor> transaction = pool.withTransaction(client ->
            client.query("SELECT pg_advisory_xact_lock(" + APPEND_LOCK_KEY + ")").execute()
                .compose(locked -> client.preparedQuery(
                        "SELECT COALESCE(MAX(version), -1) AS current_version, MIN(recorded_at) AS first_event_at, " +
                        "COALESCE(BOOL_OR(event_type = $2), FALSE) AS deleted " +
                        "FROM " + eventsTable + " WHERE stream_id = $1")
                    .execute(Tuple.of(streamId, EventRecord.STREAM_DELETED_EVENT)))
                .compose(rows -> {
                    Row row = rows.iterator().next();
                    if (row.getBoolean("deleted")) {
                        return Future.failedFuture(new InvalidStreamException(
                            "Stream " + streamId + " was deleted and cannot be written to again"));
                    }
                    long current = row.getLong("current_version");
                    if (expectedVersion != StreamDescriptor.ANY && expectedVersion != current) {
                        return Future.failedFuture(new ConcurrencyConflictException(streamId, expectedVersion, current));
                    }
                    OffsetDateTime first = row.getOffsetDateTime("first_event_at");
                    Instant firstEventAt = first != null ? first.toInstant() : now;
                    return insertBatch(client, streamId, current, events, recordedAt)
                        .map(lastVersion -> new StreamDescriptor(streamId, lastVersion, firstEventAt, now));
                }));

        return ReactiveUtils.toCompletableFuture(transaction
            .recover(error -> Future.failedFuture(translate(streamId, expectedVersion, error)))
            .onSuccess(stream -> logger.debug("Appended {} event(s) to {} (version {})",
                events.size(), streamId, stream.version()))
            .onFailure(error -> {
                if (error instanceof ConcurrencyConflictException || error instanceof InvalidStreamException) {
                    logger.warn("Rejected append to {}: {}", streamId, error.getMessage());
                } else {
                    logger.error("Failed to append to {}: {}", streamId, error.getMessage(), error);
                }
            }));
    }

    private Future<Long> insertBatch(SqlClient client, String streamId, long current,
                                     List<EventDescriptor> events, OffsetDateTime recordedAt) {
        List<Tuple> batch = new ArrayList<>(events.size());
        long version = current;
        for (EventDescriptor descriptor : events) {
            version++;
            batch.add(Tuple.of(streamId, version, descriptor.eventType(),
                new JsonObject(serializer.serialize(descriptor.data())),
                new JsonObject(serializer.serializeMetadata(descriptor.metadata())),
                recordedAt));
        }
        long lastVersion = version;
        return client.preparedQuery(
                "INSERT INTO " + eventsTable + " (stream_id, version, event_type, data, metadata, recorded_at) " +
                "VALUES ($1, $2, $3, $4, $5, $6)")
            .executeBatch(batch)
            .map(lastVersion);
    }

    private static Throwable translate(String streamId, long expectedVersion, Throwable error) {
        if (error instanceof PgException && UNIQUE_VIOLATION.equals(((PgException) error).getSqlState())) {
            return new ConcurrencyConflictException(streamId, expectedVersion, error);
        }
        return error;
    }

    @Override
    public CompletableFuture<List<EventRecord>> read(String streamId, StreamReadDirection direction,
                                                     long fromVersion, int maxCount) {
        try {
            StreamIds.validate(streamId);
            Objects.requireNonNull(direction, "Direction cannot be null");
            if (maxCount < 0) {
                throw new IllegalArgumentException("maxCount must be non-negative");
            }
            checkOpen();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }

        String sql = direction == StreamReadDirection.FORWARDS
            ? "SELECT stream_id, version, event_type, data, metadata, recorded_at FROM " + eventsTable +
              " WHERE stream_id = $1 AND version >= $2 AND event_type <> $4 ORDER BY version ASC LIMIT $3"
            : "SELECT stream_id, version, event_type, data, metadata, recorded_at FROM " + eventsTable +
              " WHERE stream_id = $1 AND version <= $2 AND event_type <> $4 ORDER BY version DESC LIMIT $3";

        Future<List<EventRecord>> query = pool.preparedQuery(sql)
            .execute(Tuple.of(streamId, fromVersion, (long) maxCount, EventRecord.STREAM_DELETED_EVENT))
            .compose(rows -> {
                if (rows.size() > 0) {
                    return Future.succeededFuture(mapRows(rows));
                }
                return existsReactive(streamId).compose(exists -> exists
                    ? Future.succeededFuture(List.<EventRecord>of())
                    : Future.failedFuture(new StreamNotFoundException(streamId)));
            });
        return ReactiveUtils.toCompletableFuture(query);
    }

    @Override
    public CompletableFuture<Boolean> streamExists(String streamId) {
        return ReactiveUtils.toCompletableFuture(existsReactive(streamId));
    }

    private Future<Boolean> existsReactive(String streamId) {
        return pool.preparedQuery("SELECT EXISTS (SELECT 1 FROM " + eventsTable +
                " WHERE stream_id = $1 AND event_type <> $2) AS present")
            .execute(Tuple.of(streamId, EventRecord.STREAM_DELETED_EVENT))
            .map(rows -> rows.iterator().next().getBoolean("present"));
    }

    @Override
    public CompletableFuture<StreamDescriptor> getStream(String streamId) {
        Future<StreamDescriptor> query = pool.preparedQuery(
                "SELECT COUNT(*) AS event_count, MAX(version) AS version, MIN(recorded_at) AS first_event_at, " +
                "MAX(recorded_at) AS last_event_at FROM " + eventsTable + " WHERE stream_id = $1 AND event_type <> $2")
            .execute(Tuple.of(streamId, EventRecord.STREAM_DELETED_EVENT))
            .compose(rows -> {
                Row row = rows.iterator().next();
                if (row.getLong("event_count") == 0) {
                    return Future.failedFuture(new StreamNotFoundException(streamId));
                }
                return Future.succeededFuture(new StreamDescriptor(streamId, row.getLong("version"),
                    row.getOffsetDateTime("first_event_at").toInstant(),
                    row.getOffsetDateTime("last_event_at").toInstant()));
            });
        return ReactiveUtils.toCompletableFuture(query);
    }

    @Override
    public CompletableFuture<Boolean> delete(String streamId) {
        try {
            StreamIds.validate(streamId);
            checkOpen();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        OffsetDateTime deletedAt = clock.instant().atOffset(ZoneOffset.UTC);

        // Same lock as append, so the tombstone commits in global_position order
        Future<Boolean> transaction = pool.withTransaction(client ->
            client.query("SELECT pg_advisory_xact_lock(" + APPEND_LOCK_KEY + ")").execute()
                .compose(locked -> client.preparedQuery(
                        "DELETE FROM " + eventsTable + " WHERE stream_id = $1 AND event_type <> $2 RETURNING version")
                    .execute(Tuple.of(streamId, EventRecord.STREAM_DELETED_EVENT)))
                .compose(deleted -> {
                    if (deleted.rowCount() == 0) {
                        return Future.succeededFuture(false);
                    }
                    long lastVersion = StreamDescriptor.NO_STREAM;
                    for (Row row : deleted) {
                        lastVersion = Math.max(lastVersion, row.getLong("version"));
                    }
                    return client.preparedQuery(
                            "INSERT INTO " + eventsTable + " (stream_id, version, event_type, data, metadata, recorded_at) " +
                            "VALUES ($1, $2, $3, NULL, '{}'::jsonb, $4)")
                        .execute(Tuple.of(streamId, lastVersion + 1, EventRecord.STREAM_DELETED_EVENT, deletedAt))
                        .map(true);
                }));

        return ReactiveUtils.toCompletableFuture(transaction
            .onSuccess(removed -> logger.info("Delete of stream {}: {}", streamId, removed ? "removed" : "not found")));
    }

    /**
     * Reads committed rows across all streams, in commit order, after {@code afterPosition}.
     * Rows are returned undecoded; see {@link #decode(Row)}.
     */
    Future<List<Row>> readAll(long afterPosition, int maxCount) {
        return pool.preparedQuery(
                "SELECT global_position, stream_id, version, event_type, data, metadata, recorded_at FROM " +
                eventsTable + " WHERE global_position > $1 ORDER BY global_position ASC LIMIT $2")
            .execute(Tuple.of(afterPosition, (long) maxCount))
            .map(rows -> {
                List<Row> result = new ArrayList<>(rows.size());
                rows.forEach(result::add);
                return result;
            });
    }

    static long positionOf(Row row) {
        return row.getLong("global_position");
    }

    EventRecord decode(Row row) {
        return toRecord(row);
    }

    private List<EventRecord> mapRows(RowSet<Row> rows) {
        List<EventRecord> records = new ArrayList<>(rows.size());
        for (Row row : rows) {
            records.add(toRecord(row));
        }
        return records;
    }

    private EventRecord toRecord(Row row) {
        String eventType = row.getString("event_type");
        Object metadataValue = row.getValue("metadata");
        Map<String, String> metadata = serializer.deserializeMetadata(metadataValue != null ? metadataValue.toString() : null);
        Object dataValue = row.getValue("data");
        DomainEvent data = dataValue == null ? null : serializer.deserialize(eventType, dataValue.toString(), metadata);
        return new EventRecord(row.getString("stream_id"), row.getLong("version"), eventType, data, metadata,
            row.getOffsetDateTime("recorded_at").toInstant());
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("Event store is closed");
        }
    }

    Pool getPool() {
        return pool;
    }

    PgConnectionConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        pool.close()
            .onSuccess(v -> logger.info("Closed PostgreSQL event store"))
            .onFailure(error -> logger.warn("Error closing PostgreSQL pool: {}", error.getMessage(), error));
    }
}
