package com.perpconnector.oms;

import com.perpconnector.broker.ExchangeGateway;
import com.perpconnector.broker.OrderAck;
import com.perpconnector.broker.SubmitOrderRequest;
import com.perpconnector.broker.SymbolMapper;
import com.perpconnector.domain.enums.OrderSide;
import com.perpconnector.domain.enums.OrderState;
import com.perpconnector.domain.enums.OrderType;
import com.perpconnector.domain.model.Order;
import com.perpconnector.event.EventPublisherHelper;
import com.perpconnector.exception.BrokerException;
import com.perpconnector.exception.ExchangeRejectionException;
import com.perpconnector.exception.InvalidOrderException;
import com.perpconnector.exception.OrderNotFoundOnExchangeException;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Entry point for placing and cancelling orders.
 *
 * <p>Placement pipeline:
 * <ol>
 *   <li>Validate the request locally (invalid requests are never registered)</li>
 *   <li>Generate the client order id and register the order in PENDING_CREATE</li>
 *   <li>On the submission executor: resolve the exchange symbol and call the gateway</li>
 *   <li>On acknowledgement, record the exchange order id (order becomes OPEN)</li>
 * </ol>
 *
 * <p>Any failure after registration marks the order FAILED and completes the returned
 * future exceptionally with the typed error. Nothing is retried here; the next poll cycle
 * picks up whatever the exchange actually did.
 */
@Service
public class OrderPlacementService {

    private static final Logger log = LoggerFactory.getLogger(OrderPlacementService.class);

    private final OrderRegistry orderRegistry;
    private final ClientOrderIdGenerator clientOrderIdGenerator;
    private final ExchangeGateway exchangeGateway;
    private final SymbolMapper symbolMapper;
    private final EventPublisherHelper eventPublisherHelper;
    private final Executor submissionExecutor;
    private final Clock clock;

    public OrderPlacementService(
            OrderRegistry orderRegistry,
            ClientOrderIdGenerator clientOrderIdGenerator,
            ExchangeGateway exchangeGateway,
            SymbolMapper symbolMapper,
            EventPublisherHelper eventPublisherHelper,
            @Qualifier("submissionExecutor") Executor submissionExecutor,
            Clock clock) {
        this.orderRegistry = orderRegistry;
        this.clientOrderIdGenerator = clientOrderIdGenerator;
        this.exchangeGateway = exchangeGateway;
        this.symbolMapper = symbolMapper;
        this.eventPublisherHelper = eventPublisherHelper;
        this.submissionExecutor = submissionExecutor;
        this.clock = clock;
    }

    /**
     * Places a buy order and returns its client order id without waiting for the exchange.
     *
     * @throws InvalidOrderException if the request fails local validation
     */
    public String buy(String tradingPair, BigDecimal amount, OrderType type, BigDecimal price) {
        return start(request(tradingPair, OrderSide.BUY, amount, type, price)).clientOrderId();
    }

    /**
     * Places a sell order and returns its client order id without waiting for the exchange.
     *
     * @throws InvalidOrderException if the request fails local validation
     */
    public String sell(String tradingPair, BigDecimal amount, OrderType type, BigDecimal price) {
        return start(request(tradingPair, OrderSide.SELL, amount, type, price)).clientOrderId();
    }

    /**
     * Places an order. The future completes with the accepted (OPEN) order, or exceptionally
     * with the validation or broker error that stopped it. Only a validation error or an
     * exchange rejection marks the order FAILED; on any other error the order stays tracked
     * in its current state until the stream or the status poll reports it.
     */
    public CompletableFuture<Order> submit(OrderRequest orderRequest) {
        try {
            return start(orderRequest).result();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Cancels an order on the exchange.
     *
     * <p>Completes with true when the exchange confirms the cancel or no longer knows the order
     * (treated as already cancelled), and false when the order has no exchange id yet or is not
     * tracked. An exchange rejection completes the future exceptionally and leaves the order as is.
     */
    public CompletableFuture<Boolean> cancel(String clientOrderId) {
        Optional<Order> tracked = orderRegistry.getOrder(clientOrderId);
        if (tracked.isEmpty()) {
            log.warn("Cancel requested for untracked order: clientOrderId={}", clientOrderId);
            return CompletableFuture.completedFuture(false);
        }
        Order order = tracked.get();
        if (order.isDone()) {
            return CompletableFuture.completedFuture(order.getState() == OrderState.CANCELED);
        }
        if (order.getExchangeOrderId() == null) {
            log.info("Cancel deferred, order not yet acknowledged: clientOrderId={}", clientOrderId);
            return CompletableFuture.completedFuture(false);
        }
        return CompletableFuture.supplyAsync(() -> executeCancel(order), submissionExecutor);
    }

    // ---- Placement ----

    private Submission start(OrderRequest orderRequest) {
        validate(orderRequest);

        String clientOrderId = clientOrderIdGenerator.generate(orderRequest.getSide(), orderRequest.getTradingPair());
        Order registered = orderRegistry.register(Order.builder()
                .clientOrderId(clientOrderId)
                .tradingPair(orderRequest.getTradingPair())
                .side(orderRequest.getSide())
                .type(orderRequest.getType())
                .price(orderRequest.getType() == OrderType.MARKET ? null : orderRequest.getPrice())
                .amount(orderRequest.getAmount())
                .state(OrderState.PENDING_CREATE)
                .creationTimestamp(clock.instant())
                .build());
        eventPublisherHelper.publishOrderCreated(this, registered);

        CompletableFuture<Order> result = CompletableFuture.supplyAsync(() -> place(registered), submissionExecutor);
        return new Submission(clientOrderId, result);
    }

    private Order place(Order order) {
        String clientOrderId = order.getClientOrderId();
        try {
            String exchangeSymbol = symbolMapper
                    .toExchangeSymbol(order.getTradingPair())
                    .orElseThrow(() -> new InvalidOrderException(
                            "No exchange symbol for pair " + order.getTradingPair(),
                            Map.of("tradingPair", order.getTradingPair())));

            OrderAck ack = exchangeGateway.submitOrder(SubmitOrderRequest.builder()
                    .clientOrderId(clientOrderId)
                    .exchangeSymbol(exchangeSymbol)
                    .side(order.getSide())
                    .type(order.getType())
                    .amount(order.getAmount())
                    .price(order.getPrice())
                    .build());

            RegistryResult accepted =
                    orderRegistry.markAccepted(clientOrderId, ack.exchangeOrderId(), ack.acceptedAt());
            if (accepted.stateChanged()) {
                eventPublisherHelper.publishOrderTransition(this, accepted.order(), accepted.previousState());
            }
            return accepted.order() != null
                    ? accepted.order()
                    : orderRegistry.getOrder(clientOrderId).orElse(order);
        } catch (InvalidOrderException | ExchangeRejectionException e) {
            log.warn(
                    "Order submission rejected: clientOrderId={}, code={}, error={}",
                    clientOrderId,
                    e.getErrorCode().getCode(),
                    e.getMessage());
            fail(clientOrderId, e.getMessage());
            throw e;
        } catch (BrokerException e) {
            // Outcome unknown: the order may be live. Stream and status poll settle it.
            log.warn(
                    "Order submission outcome unknown, awaiting reconciliation: clientOrderId={}, kind={}, error={}",
                    clientOrderId,
                    e.getKind(),
                    e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error(
                    "Order submission outcome unknown, awaiting reconciliation: clientOrderId={}, error={}",
                    clientOrderId,
                    e.getMessage(),
                    e);
            throw e;
        }
    }

    private void fail(String clientOrderId, String reason) {
        RegistryResult failed = orderRegistry.markFailed(clientOrderId, reason, clock.instant());
        if (failed.stateChanged()) {
            eventPublisherHelper.publishOrderTransition(this, failed.order(), failed.previousState());
        }
    }

    // ---- Cancellation ----

    private boolean executeCancel(Order order) {
        String clientOrderId = order.getClientOrderId();
        String exchangeSymbol = symbolMapper.toExchangeSymbol(order.getTradingPair()).orElse(null);
        if (exchangeSymbol == null) {
            log.warn("Cancel skipped, no exchange symbol: clientOrderId={}, pair={}", clientOrderId, order.getTradingPair());
            return false;
        }
        try {
            boolean confirmed = exchangeGateway.cancelOrder(order.getExchangeOrderId(), exchangeSymbol);
            log.info("Cancel sent: clientOrderId={}, confirmed={}", clientOrderId, confirmed);
            return confirmed;
        } catch (OrderNotFoundOnExchangeException e) {
            log.info("Order not found on exchange, treating as cancelled: clientOrderId={}", clientOrderId);
            RegistryResult canceled = orderRegistry.markCanceled(clientOrderId, e.getMessage(), clock.instant());
            if (canceled.stateChanged()) {
                eventPublisherHelper.publishOrderTransition(this, canceled.order(), canceled.previousState());
            }
            return true;
        } catch (BrokerException e) {
            log.warn("Cancel failed: clientOrderId={}, kind={}, error={}", clientOrderId, e.getKind(), e.getMessage());
            throw e;
        }
    }

    // ---- Validation ----

    private static OrderRequest request(
            String tradingPair, OrderSide side, BigDecimal amount, OrderType type, BigDecimal price) {
        return OrderRequest.builder()
                .tradingPair(tradingPair)
                .side(side)
                .amount(amount)
                .type(type != null ? type : OrderType.LIMIT)
                .price(price)
                .build();
    }

    static void validate(OrderRequest orderRequest) {
        if (orderRequest.getTradingPair() == null || orderRequest.getTradingPair().isBlank()) {
            throw new InvalidOrderException("Trading pair is required");
        }
        if (orderRequest.getSide() == null || orderRequest.getType() == null) {
            throw new InvalidOrderException("Order side and type are required");
        }
        if (orderRequest.getAmount() == null || orderRequest.getAmount().signum() <= 0) {
            throw new InvalidOrderException(
                    "Order amount must be positive", Map.of("amount", String.valueOf(orderRequest.getAmount())));
        }
        if (orderRequest.getType() != OrderType.MARKET
                && (orderRequest.getPrice() == null || orderRequest.getPrice().signum() <= 0)) {
            throw new InvalidOrderException(
                    orderRequest.getType() + " order requires a positive price",
                    Map.of("price", String.valueOf(orderRequest.getPrice())));
        }
    }

    private record Submission(String clientOrderId, CompletableFuture<Order> result) {}
}
