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

import java.util.ArrayList;
import java.util.List;

/**
 * Aggregated failure of one or more handlers for a single published event.
 * Every individual failure is attached as a suppressed exception.
 */
public class HandlerDispatchException extends StreamLedgerException {

    private final String eventType;

    public HandlerDispatchException(String eventType, List<Throwable> failures) {
        super(StreamLedgerErrorCodes.HANDLER_DISPATCH_FAILED,
              failures.size() + " handler(s) failed for event " + eventType,
              failures.isEmpty() ? null : failures.get(0));
        this.eventType = eventType;
        for (int i = 1; i < failures.size(); i++) {
            addSuppressed(failures.get(i));
        }
    }

    public String getEventType() {
        return eventType;
    }

    /**
     * @return every handler failure, the first one being the cause
     */
    public List<Throwable> getFailures() {
        List<Throwable> all = new ArrayList<>();
        if (getCause() != null) {
            all.add(getCause());
        }
        all.addAll(List.of(getSuppressed()));
        return all;
    }
}
