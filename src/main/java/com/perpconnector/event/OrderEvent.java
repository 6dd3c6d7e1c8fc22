package com.perpconnector.event;

import com.perpconnector.domain.enums.OrderState;
import com.perpconnector.domain.model.Order;
import org.springframework.context.ApplicationEvent;

/**
 * Published after every order state transition applied by the order registry.
 *
 * <p>The order is a snapshot copy taken right after the transition; listeners may keep it.
 * {@code previousState} is null for CREATED events.
 */
public class OrderEvent extends ApplicationEvent {

    private final Order order;
    private final OrderEventType eventType;
    private final OrderState previousState;

    public OrderEvent(Object source, Order order, OrderEventType eventType, OrderState previousState) {
        super(source);
        this.order = order;
        this.eventType = eventType;
        this.previousState = previousState;
    }

    public Order getOrder() {
        return order;
    }

    public OrderEventType getEventType() {
        return eventType;
    }

    public OrderState getPreviousState() {
        return previousState;
    }
}
