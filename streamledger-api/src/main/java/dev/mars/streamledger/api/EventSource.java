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

import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Push-based feed of committed events in commit order.
 *
 * <p>The subscriber's returned future is the backpressure signal: a source must not
 * deliver the next event until the previous delivery's future has completed.</p>
 */
public interface EventSource {

    /**
     * @return a handle used to cancel the subscription
     */
    Subscription subscribe(Function<SourcedEvent, CompletableFuture<Void>> subscriber);

    interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}
