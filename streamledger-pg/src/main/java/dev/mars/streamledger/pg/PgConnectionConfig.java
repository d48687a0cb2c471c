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

import dev.mars.streamledger.core.config.StreamLedgerConfiguration;

import java.time.Duration;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Connection and polling settings for the PostgreSQL adapter.
 */
public class PgConnectionConfig {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final String host;
    private final int port;
    private final String database;
    private final String username;
    private final String password;
    private final String schema;
    private final int maxPoolSize;
    private final Duration pollInterval;
    private final int pollBatchSize;

    private PgConnectionConfig(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.database = builder.database;
        this.username = builder.username;
        this.password = builder.password;
        this.schema = builder.schema;
        this.maxPoolSize = builder.maxPoolSize;
        this.pollInterval = builder.pollInterval;
        this.pollBatchSize = builder.pollBatchSize;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static PgConnectionConfig from(StreamLedgerConfiguration configuration) {
        return builder()
            .host(configuration.getString("streamledger.database.host", "localhost"))
            .port(configuration.getInt("streamledger.database.port", 5432))
            .database(configuration.getString("streamledger.database.name", "streamledger"))
            .username(configuration.getString("streamledger.database.username", "streamledger"))
            .password(configuration.getString("streamledger.database.password", ""))
            .schema(configuration.getString("streamledger.database.schema", "public"))
            .maxPoolSize(configuration.getInt("streamledger.database.pool.max-size", 16))
            .pollInterval(configuration.getDuration("streamledger.database.poll-interval", Duration.ofMillis(500)))
            .pollBatchSize(configuration.getInt("streamledger.database.poll-batch-size", 100))
            .build();
    }

    public String getHost() { return host; }
    public int getPort() { return port; }
    public String getDatabase() { return database; }
    public String getUsername() { return username; }
    public String getPassword() { return password; }
    public String getSchema() { return schema; }
    public int getMaxPoolSize() { return maxPoolSize; }
    public Duration getPollInterval() { return pollInterval; }
    public int getPollBatchSize() { return pollBatchSize; }

    /** Schema-qualified name of a StreamLedger table. */
    public String table(String name) {
        return schema + "." + name;
    }

    @Override
    public String toString() {
        return "PgConnectionConfig{" +
                "host='" + host + '\'' +
                ", port=" + port +
                ", database='" + database + '\'' +
                ", username='" + username + '\'' +
                ", schema='" + schema + '\'' +
                ", maxPoolSize=" + maxPoolSize +
                '}';
    }

    public static class Builder {
        private String host = "localhost";
        private int port = 5432;
        private String database = "streamledger";
        private String username = "streamledger";
        private String password = "";
        private String schema = "public";
        private int maxPoolSize = 16;
        private Duration pollInterval = Duration.ofMillis(500);
        private int pollBatchSize = 100;

        public Builder host(String host) { this.host = host; return this; }
        public Builder port(int port) { this.port = port; return this; }
        public Builder database(String database) { this.database = database; return this; }
        public Builder username(String username) { this.username = username; return this; }
        public Builder password(String password) { this.password = password; return this; }
        public Builder schema(String schema) { this.schema = schema; return this; }
        public Builder maxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; return this; }
        public Builder pollInterval(Duration pollInterval) { this.pollInterval = pollInterval; return this; }
        public Builder pollBatchSize(int pollBatchSize) { this.pollBatchSize = pollBatchSize; return this; }

        public PgConnectionConfig build() {
            Objects.requireNonNull(host, "Host cannot be null");
            Objects.requireNonNull(database, "Database cannot be null");
            Objects.requireNonNull(username, "Username cannot be null");
            Objects.requireNonNull(pollInterval, "Poll interval cannot be null");
            if (port < 1 || port > 65535) {
                throw new IllegalArgumentException("Port must be between 1 and 65535");
            }
            if (schema == null || !IDENTIFIER.matcher(schema).matches()) {
                throw new IllegalArgumentException("Invalid schema name: " + schema);
            }
            if (maxPoolSize < 1) {
                throw new IllegalArgumentException("Max pool size must be at least 1");
            }
            if (pollBatchSize < 1) {
                throw new IllegalArgumentException("Poll batch size must be at least 1");
            }
            if (pollInterval.isNegative() || pollInterval.isZero()) {
                throw new IllegalArgumentException("Poll interval must be positive");
            }
            return new PgConnectionConfig(this);
        }
    }
}
