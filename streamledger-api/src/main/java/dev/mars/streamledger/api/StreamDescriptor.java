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

import java.time.Instant;

/**
 * Current shape of a stream.
 *
 * @param id stream identifier
 * @param version version of the last appended event
 * @param firstEventAt recording time of version 0
 * @param lastEventAt recording time of the last appended event
 */
public record StreamDescriptor(String id, long version, Instant firstEventAt, Instant lastEventAt) {

    /** Expected version of a stream that has never been written. */
    public static final long NO_STREAM = -1L;

    /** Expected version that disables the optimistic concurrency check. */
    public static final long ANY = -2L;
}
