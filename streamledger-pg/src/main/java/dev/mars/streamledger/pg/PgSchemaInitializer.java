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

import io.vertx.core.Future;
import io.vertx.sqlclient.Pool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Creates the StreamLedger tables if they do not exist yet.
 */
public class PgSchemaInitializer {
    private static final Logger logger = LoggerFactory.getLogger(PgSchemaInitializer.class);

    public static final String EVENTS_TABLE = "streamledger_events";
    public static final String CHECKPOINTS_TABLE = "streamledger_checkpoints";

    private final Pool pool;
    private final PgConnectionConfig config;

    public PgSchemaInitializer(Pool pool, PgConnectionConfig config) {
        this.pool = pool;
        this.config = config;
    }

    public CompletableFuture<Void> initialize() {
        String events = config.table(EVENTS_TABLE);
        String checkpoints = config.table(CHECKPOINTS_TABLE);
        List<String> statements = List.of(
            "CREATE SCHEMA IF NOT EXISTS " + config.getSchema(),
            """
            CREATE TABLE IF NOT EXISTS %s (
                global_position BIGSERIAL PRIMARY KEY,
                stream_id VARCHAR(255) NOT NULL,
                version BIGINT NOT NULL,
                event_type VARCHAR(255) NOT NULL,
                data JSONB,
                metadata JSONB NOT NULL DEFAULT '{}'::jsonb,
                recorded_at TIMESTAMPTZ NOT NULL,
                CONSTRAINT uq_streamledger_stream_version UNIQUE (stream_id, version)
            )
            """.formatted(events),
            """
            CREATE TABLE IF NOT EXISTS %s (
                stream_id VARCHAR(255) PRIMARY KEY,
                version BIGINT NOT NULL,
                updated_at TIMESTAMPTZ NOT NULL DEFAULT now()
            )
            """.formatted(checkpoints));

        Future<Void> chain = Future.succeededFuture();
        for (String statement : statements) {
            chain = chain.compose(v -> pool.query(statement).execute().mapEmpty());
        }
        return ReactiveUtils.toCompletableFuture(chain
            .onSuccess(v -> logger.info("StreamLedger schema ready in {}", config.getSchema()))
            .onFailure(error -> logger.error("Failed to initialize StreamLedger schema: {}", error.getMessage(), error)));
    }
}
