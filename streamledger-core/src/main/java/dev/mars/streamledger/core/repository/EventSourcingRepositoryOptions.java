package dev.mars.streamledger.core.repository;

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

import java.util.Objects;

public class EventSourcingRepositoryOptions {

    private final DeleteMode deleteMode;

    private EventSourcingRepositoryOptions(Builder builder) {
        this.deleteMode = builder.deleteMode;
    }

    public static EventSourcingRepositoryOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public DeleteMode getDeleteMode() {
        return deleteMode;
    }

    @Override
    public String toString() {
        return "EventSourcingRepositoryOptions{deleteMode=" + deleteMode + "}";
    }

    public static class Builder {
        private DeleteMode deleteMode = DeleteMode.DISABLED;

        public Builder deleteMode(DeleteMode deleteMode) {
            this.deleteMode = Objects.requireNonNull(deleteMode, "Delete mode cannot be null");
            return this;
        }

        public EventSourcingRepositoryOptions build() {
            return new EventSourcingRepositoryOptions(this);
        }
    }
}
