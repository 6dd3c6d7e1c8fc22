package com.perpconnector.event;

import com.perpconnector.domain.enums.OrderState;
import com.perpconnector.domain.model.FundingPayment;
import com.perpconnector.domain.model.Order;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods over Spring's {@link ApplicationEventPublisher} for connector events.
 *
 * <p>Listeners run synchronously on the publishing thread unless they are annotated
 * {@code @Async}; callers never publish while holding a registry or ledger lock.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Order ----

    public void publishOrderCreated(Object source, Order order) {
        applicationEventPublisher.publishEvent(new OrderEvent(source, order, OrderEventType.CREATED, null));
    }

    public void publishOrderTransition(Object source, Order order, OrderState previousState) {
        OrderEventType eventType = eventTypeFor(order.getState());
        if (eventType == null) {
            return;
        }
        applicationEventPublisher.publishEvent(new OrderEvent(source, order, eventType, previousState));
    }

    // ---- Funding ----

    public void publishFundingPayment(Object source, FundingPayment payment) {
        applicationEventPublisher.publishEvent(new FundingPaymentEvent(source, payment));
    }

    static OrderEventType eventTypeFor(OrderState state) {
        return switch (state) {
            case PENDING_CREATE -> null;
            case OPEN -> OrderEventType.OPENED;
            case PARTIALLY_FILLED -> OrderEventType.PARTIALLY_FILLED;
            case FILLED -> OrderEventType.FILLED;
            case CANCELED -> OrderEventType.CANCELED;
            case FAILED -> OrderEventType.FAILED;
        };
    }
}
