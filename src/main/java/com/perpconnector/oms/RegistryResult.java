package com.perpconnector.oms;

import com.perpconnector.domain.enums.ApplyOutcome;
import com.perpconnector.domain.enums.OrderState;
import com.perpconnector.domain.model.Order;

/**
 * Result of one registry mutation.
 *
 * @param outcome       what happened to the update
 * @param order         copy of the order after the mutation; null when no order was found
 * @param previousState state before the mutation; null when no order was found
 */
public record RegistryResult(ApplyOutcome outcome, Order order, OrderState previousState) {

    public static RegistryResult of(ApplyOutcome outcome) {
        return new RegistryResult(outcome, null, null);
    }

    public boolean stateChanged() {
        return order != null && previousState != null && order.getState() != previousState;
    }
}
