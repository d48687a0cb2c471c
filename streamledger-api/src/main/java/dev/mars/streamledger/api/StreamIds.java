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

import dev.mars.streamledger.api.error.InvalidStreamException;

/**
 * Stream identifier validation shared by every {@link EventStore} implementation.
 */
public final class StreamIds {

    private StreamIds() {
    }

    public static String validate(String streamId) {
        if (streamId == null || streamId.isBlank()) {
            throw new InvalidStreamException("Stream id cannot be null or blank");
        }
        if (streamId.length() > EventStore.MAX_STREAM_ID_LENGTH) {
            throw new InvalidStreamException("Stream id exceeds " + EventStore.MAX_STREAM_ID_LENGTH
                + " characters: " + streamId.substring(0, 32) + "...");
        }
        if (streamId.startsWith(EventRecord.SYSTEM_EVENT_PREFIX)) {
            throw new InvalidStreamException("Stream id '" + streamId + "' uses the reserved '$' prefix");
        }
        for (int i = 0; i < streamId.length(); i++) {
            if (Character.isWhitespace(streamId.charAt(i))) {
                throw new InvalidStreamException("Stream id '" + streamId + "' contains whitespace");
            }
        }
        return streamId;
    }
}
