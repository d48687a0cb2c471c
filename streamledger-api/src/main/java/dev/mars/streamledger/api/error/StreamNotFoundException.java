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

public class StreamNotFoundException extends StreamLedgerException {

    private final String streamId;

    public StreamNotFoundException(String streamId) {
        super(StreamLedgerErrorCodes.STREAM_NOT_FOUND, "Stream not found: " + streamId);
        this.streamId = streamId;
    }

    public String getStreamId() {
        return streamId;
    }
}
