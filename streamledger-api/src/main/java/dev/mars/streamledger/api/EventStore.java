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

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Append-only store of event streams with optimistic concurrency.
 *
 * <p>Each stream is an ordered sequence of events numbered from 0 with no gaps.
 * An append succeeds only when the caller's expected version equals the stream's
 * current version, and then adds the whole batch atomically; otherwise it fails
 * with {@link dev.mars.streamledger.api.error.ConcurrencyConflictException} and
 * the stream is unchanged.</p>
 *
 * <p>Stream identifiers must be non-blank, contain no whitespace, be at most
 * {@value #MAX_STREAM_ID_LENGTH} characters and must not start with {@code $}.
 * Violations fail with {@link dev.mars.streamledger.api.error.InvalidStreamException}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public interface EventStore extends AutoCloseable {

    int MAX_STREAM_ID_LENGTH = 255;

    /**
     * Appends events to a stream.
     *
     * @param streamId target stream
     * @param expectedVersion current version of the stream, {@link StreamDescriptor#NO_STREAM}
     *                        for a new stream or {@link StreamDescriptor#ANY} to skip the check
     * @param events events to append, at least one
     * @return descriptor whose version is that of the last appended event
     */
    CompletableFuture<StreamDescriptor> append(String streamId, long expectedVersion, List<EventDescriptor> events);

    /**
     * Reads a stream. Forwards returns versions {@code >= fromVersion} in ascending order,
     * backwards returns versions {@code <= fromVersion} in descending order. Every call
     * reads the store afresh.
     *
     * @return the records; fails with {@link dev.mars.streamledger.api.error.StreamNotFoundException}
     *         when the stream does not exist
     */
    default CompletableFuture<List<EventRecord>> read(String streamId, StreamReadDirection direction, long fromVersion) {
        return read(streamId, direction, fromVersion, Integer.MAX_VALUE);
    }

    CompletableFuture<List<EventRecord>> read(String streamId, StreamReadDirection direction,
                                              long fromVersion, int maxCount);

    CompletableFuture<Boolean> streamExists(String streamId);

    CompletableFuture<StreamDescriptor> getStream(String streamId);

    /**
     * Physically removes a stream's events and publishes a {@link EventRecord#STREAM_DELETED_EVENT}
     * tombstone. The stream id stays reserved: later appends to it fail with
     * {@link dev.mars.streamledger.api.error.InvalidStreamException}. Only the hard-delete mode of the
     * repository uses this.
     *
     * @return true if a stream was removed
     */
    CompletableFuture<Boolean> delete(String streamId);

    @Override
    void close();
}
