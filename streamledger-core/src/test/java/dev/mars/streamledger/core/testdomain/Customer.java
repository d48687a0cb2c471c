package dev.mars.streamledger.core.testdomain;

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

import dev.mars.streamledger.api.DomainEvent;
import dev.mars.streamledger.api.aggregate.AggregateRoot;
import dev.mars.streamledger.api.aggregate.AggregateState;

/**
 * Aggregate without soft-delete support.
 */
public class Customer extends AggregateRoot<Customer.CustomerState, String> {

    public record CustomerRegistered(String customerId, String name) implements DomainEvent {
    }

    public static class CustomerState extends AggregateState<String> {
        private String name;

        public CustomerState() {
            on(CustomerRegistered.class, e -> {
                setId(e.customerId());
                name = e.name();
            });
        }

        public String getName() {
            return name;
        }
    }

    public Customer() {
        super(new CustomerState());
    }

    public static Customer register(String customerId, String name) {
        Customer customer = new Customer();
        customer.registerEvent(new CustomerRegistered(customerId, name));
        return customer;
    }
}
