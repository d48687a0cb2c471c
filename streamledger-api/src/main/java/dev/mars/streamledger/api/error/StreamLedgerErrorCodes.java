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
 * Standard error codes for StreamLedger.
 *
 * Error code ranges:
 * - SLERR0001-0049: General/System errors
 * - SLERR0050-0099: Event Store errors
 * - SLERR0100-0149: Aggregate/Repository errors
 * - SLERR0150-0199: Serialization errors
 * - SLERR0200-0249: Dispatch/Reconciliation errors
 */
public final class StreamLedgerErrorCodes {

    private StreamLedgerErrorCodes() {
        // Utility class - no instantiation
    }

    // ========================================================================
    // General/System Errors (0001-0049)
    // ========================================================================
    public static final String INTERNAL_ERROR = "SLERR0001";
    public static final String INVALID_CONFIGURATION = "SLERR0002";

    // ========================================================================
    // Event Store Errors (0050-0099)
    // ========================================================================
    public static final String CONCURRENCY_CONFLICT = "SLERR0050";
    public static final String STREAM_NOT_FOUND = "SLERR0051";
    public static final String INVALID_STREAM = "SLERR0052";
    public static final String EVENT_STORE_FAILED = "SLERR0053";

    // ========================================================================
    // Aggregate/Repository Errors (0100-0149)
    // ========================================================================
    public static final String UNHANDLED_EVENT_TYPE = "SLERR0100";
    public static final String NOTHING_TO_PERSIST = "SLERR0101";
    public static final String AGGREGATE_NOT_FOUND = "SLERR0102";

    // ========================================================================
    // Serialization Errors (0150-0199)
    // ========================================================================
    public static final String EVENT_SERIALIZATION_FAILED = "SLERR0150";

    // ========================================================================
    // Dispatch/Reconciliation Errors (0200-0249)
    // ========================================================================
    public static final String HANDLER_DISPATCH_FAILED = "SLERR0200";
    public static final String HANDLER_TIMEOUT = "SLERR0201";
}
