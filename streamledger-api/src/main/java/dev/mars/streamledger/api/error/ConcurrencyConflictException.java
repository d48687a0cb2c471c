package dev.mars.streamledger.api.error;

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

/**
 * Raised when an append names an expected version that does not match the stream's
 * current version. The stream is left unchanged.
 */
public class ConcurrencyConflictException extends StreamLedgerException {

    public static final long UNKNOWN_VERSION = Long.MIN_VALUE;

    private final String streamId;
    private final long expectedVersion;
    private final long actualVersion;

    public ConcurrencyConflictException(String streamId, long expectedVersion, long actualVersion) {
        super(StreamLedgerErrorCodes.CONCURRENCY_CONFLICT,
              String.format("Concurrency conflict on stream '%s': expected version %d but was %d",
                            streamId, expectedVersion, actualVersion));
        this.streamId = streamId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    /**
     * For conflicts detected by the storage's unique key, where the winning version is not known.
     */
    public ConcurrencyConflictException(String streamId, long expectedVersion, Throwable cause) {
        super(StreamLedgerErrorCodes.CONCURRENCY_CONFLICT,
              String.format("Concurrency conflict on stream '%s': stream was modified after version %d",
                            streamId, expectedVersion), cause);
        this.streamId = streamId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = UNKNOWN_VERSION;
    }

    public String getStreamId() {
        return streamId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
