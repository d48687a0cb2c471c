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

import dev.mars.streamledger.api.CheckpointStore;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.Tuple;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Checkpoints kept in the {@code streamledger_checkpoints} table. A checkpoint never moves backwards.
 */
public class PgCheckpointStore implements CheckpointStore {

    private final Pool pool;
    private final String table;

    public PgCheckpointStore(PgEventStore eventStore) {
        this(eventStore.getPool(), eventStore.getConfig());
    }

    public PgCheckpointStore(Pool pool, PgConnectionConfig config) {
        this.pool = Objects.requireNonNull(pool, "Pool cannot be null");
        this.table = config.table(PgSchemaInitializer.CHECKPOINTS_TABLE);
    }

    @Override
    public CompletableFuture<Optional<Long>> get(String streamId) {
        return ReactiveUtils.toCompletableFuture(
            pool.preparedQuery("SELECT version FROM " + table + " WHERE stream_id = $1")
                .execute(Tuple.of(streamId))
                .map(rows -> {
                    if (rows.size() == 0) {
                        return Optional.<Long>empty();
                    }
                    Row row = rows.iterator().next();
                    return Optional.of(row.getLong("version"));
                }));
    }

    @Override
    public CompletableFuture<Void> set(String streamId, long version) {
        return ReactiveUtils.toCompletableFuture(
            pool.preparedQuery(
                    "INSERT INTO " + table + " AS c (stream_id, version, updated_at) VALUES ($1, $2, now()) " +
                    "ON CONFLICT (stream_id) DO UPDATE SET version = GREATEST(c.version, EXCLUDED.version), " +
                    "updated_at = now()")
                .execute(Tuple.of(streamId, version))
                .mapEmpty());
    }
}
