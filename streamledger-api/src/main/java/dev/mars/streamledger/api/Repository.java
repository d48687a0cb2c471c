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

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Persistence boundary for aggregates.
 *
 * @param <A> aggregate type
 * @param <K> identifier type
 */
public interface Repository<A, K> {

    CompletableFuture<Optional<A>> get(K id);

    CompletableFuture<Boolean> contains(K id);

    CompletableFuture<Void> add(A aggregate);

    CompletableFuture<Void> update(A aggregate);

    CompletableFuture<Void> remove(K id);
}
