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

import dev.mars.streamledger.api.aggregate.AggregateRoot;
import dev.mars.streamledger.api.aggregate.SoftDeletable;

import java.time.Clock;

public class Order extends AggregateRoot<OrderState, String> implements SoftDeletable {

    public Order() {
        super(new OrderState());
    }

    public Order(Clock clock) {
        super(new OrderState(), clock);
    }

    public static Order create(String orderId, String customerId) {
        Order order = new Order();
        order.registerEvent(new OrderCreated(orderId, customerId));
        return order;
    }

    public void addItem(String sku, int quantity, long unitPriceCents) {
        if (getState().getStatus() != OrderState.Status.CREATED) {
            throw new IllegalStateException("Items can only be added to an open order");
        }
        registerEvent(new ItemAdded(sku, quantity, unitPriceCents));
    }

    public void pay(long amountCents) {
        registerEvent(new OrderPaid(amountCents));
    }

    public void ship(String carrier) {
        if (getState().getStatus() != OrderState.Status.PAID) {
            throw new IllegalStateException("Only paid orders can ship");
        }
        registerEvent(new OrderShipped(carrier));
    }

    public void addNote(String note) {
        registerEvent(new OrderNoteAdded(note));
    }

    @Override
    public void markAsDeleted() {
        registerEvent(new OrderDeleted("removed"));
    }
}
