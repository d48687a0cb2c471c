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

import io.vertx.core.Future;
import io.vertx.core.Promise;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Bridges between Vert.x futures and {@link CompletableFuture}, which the StreamLedger
 * contracts expose.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public final class ReactiveUtils {
    private static final Logger logger = LoggerFactory.getLogger(ReactiveUtils.class);

    private ReactiveUtils() {
        // Utility class
    }

    public static <T> CompletableFuture<T> toCompletableFuture(Future<T> future) {
        CompletableFuture<T> completableFuture = new CompletableFuture<>();
        future.onSuccess(completableFuture::complete)
            .onFailure(error -> {
                logger.trace("Vert.x Future failed: {}", error.getMessage());
                completableFuture.completeExceptionally(error);
            });
        return completableFuture;
    }

    public static <T> Future<T> fromCompletableFuture(CompletableFuture<T> completableFuture) {
        Promise<T> promise = Promise.promise();
        completableFuture.whenComplete((result, error) -> {
            if (error != null) {
                promise.fail(error);
            } else {
                promise.complete(result);
            }
        });
        return promise.future();
    }
}
