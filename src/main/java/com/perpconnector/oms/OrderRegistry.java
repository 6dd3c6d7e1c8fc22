package com.perpconnector.oms;

import com.perpconnector.config.ConnectorProperties;
import com.perpconnector.domain.enums.ApplyOutcome;
import com.perpconnector.domain.enums.OrderState;
import com.perpconnector.domain.model.Order;
import com.perpconnector.domain.model.OrderFill;
import com.perpconnector.domain.update.FillUpdate;
import com.perpconnector.domain.update.OrderStatusUpdate;
import com.perpconnector.exception.DuplicateOrderException;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Authoritative in-memory store of client order id to order state.
 *
 * <p>All mutations run under one write lock, so concurrent fills for the same order are
 * linearizable and a trade id is applied at most once. Every order handed out is a copy.
 *
 * <p>Orders that reach FILLED, CANCELED or FAILED leave the active map and move into a
 * bounded completed history (oldest evicted first). Late fills for a completed order are
 * still deduplicated and accumulated there, without any further state change.
 *
 * <p>Rules applied to status updates:
 * <ul>
 *   <li>Unknown client order id: no-op.</li>
 *   <li>{@code update.timestamp < order.lastUpdateTimestamp}: stale, ignored.</li>
 *   <li>Terminal orders never change state; states never move backwards.</li>
 *   <li>exchangeOrderId is written once; a different later value is ignored.</li>
 * </ul>
 */
@Component
public class OrderRegistry {

    private static final Logger log = LoggerFactory.getLogger(OrderRegistry.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<String, Order> activeOrders = new LinkedHashMap<>();
    private final Map<String, String> clientIdsByExchangeId = new HashMap<>();
    private final Map<String, Order> completedOrders;
    private final List<OrderFill> fillHistory = new ArrayList<>();

    private final BigDecimal fillEpsilon;
    private final Clock clock;

    public OrderRegistry(ConnectorProperties connectorProperties, Clock clock) {
        this.fillEpsilon = connectorProperties.getFillEpsilon();
        this.clock = clock;
        int historySize = connectorProperties.getCompletedOrderHistorySize();
        this.completedOrders = new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Order> eldest) {
                return size() > historySize;
            }
        };
    }

    // ---- Mutations ----

    /**
     * Inserts a new order in PENDING_CREATE. A missing creation timestamp defaults to now.
     *
     * @throws DuplicateOrderException if the client order id is already tracked (active or completed)
     */
    public Order register(Order order) {
        lock.writeLock().lock();
        try {
            String clientOrderId = order.getClientOrderId();
            if (activeOrders.containsKey(clientOrderId) || completedOrders.containsKey(clientOrderId)) {
                throw new DuplicateOrderException(clientOrderId);
            }
            Order stored = order.copy();
            stored.setState(OrderState.PENDING_CREATE);
            stored.setExchangeOrderId(null);
            if (stored.getCreationTimestamp() == null) {
                stored.setCreationTimestamp(clock.instant());
            }
            if (stored.getLastUpdateTimestamp() == null) {
                stored.setLastUpdateTimestamp(stored.getCreationTimestamp());
            }
            activeOrders.put(clientOrderId, stored);
            log.info(
                    "Order registered: clientOrderId={}, pair={}, side={}, amount={}",
                    clientOrderId,
                    stored.getTradingPair(),
                    stored.getSide(),
                    stored.getAmount());
            return stored.copy();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Records the create acknowledgement: assigns the exchange id and opens the order. */
    public RegistryResult markAccepted(String clientOrderId, String exchangeOrderId, Instant acceptedAt) {
        lock.writeLock().lock();
        try {
            Order order = activeOrders.get(clientOrderId);
            if (order == null) {
                log.debug("Ack for untracked or completed order ignored: clientOrderId={}", clientOrderId);
                return RegistryResult.of(ApplyOutcome.IGNORED);
            }
            OrderState previous = order.getState();
            assignExchangeId(order, exchangeOrderId);
            if (previous == OrderState.PENDING_CREATE) {
                order.setState(OrderState.OPEN);
            }
            if (acceptedAt != null && isAfter(acceptedAt, order.getLastUpdateTimestamp())) {
                order.setLastUpdateTimestamp(acceptedAt);
            }
            log.info("Order accepted: clientOrderId={}, exchangeOrderId={}", clientOrderId, exchangeOrderId);
            return new RegistryResult(ApplyOutcome.APPLIED, order.copy(), previous);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Marks an order FAILED locally after a rejected submission. Only applies while the order
     * is still PENDING_CREATE without an exchange id; otherwise IGNORED.
     */
    public RegistryResult markFailed(String clientOrderId, String reason, Instant at) {
        return forceTerminal(clientOrderId, OrderState.FAILED, reason, at);
    }

    /** Marks an active order CANCELED locally, e.g. when the exchange no longer knows it. */
    public RegistryResult markCanceled(String clientOrderId, String reason, Instant at) {
        return forceTerminal(clientOrderId, OrderState.CANCELED, reason, at);
    }

    /**
     * Applies an order status update under last-update-wins ordering.
     *
     * <p>When the update carries no client order id, the order is looked up by exchange id.
     */
    public RegistryResult applyStatusUpdate(OrderStatusUpdate update) {
        lock.writeLock().lock();
        try {
            String clientOrderId = update.clientOrderId() != null
                    ? update.clientOrderId()
                    : clientIdsByExchangeId.get(update.exchangeOrderId());
            Order order = clientOrderId != null ? activeOrders.get(clientOrderId) : null;
            if (order == null) {
                if (clientOrderId != null && completedOrders.containsKey(clientOrderId)) {
                    log.debug(
                            "Status update for completed order ignored: clientOrderId={}, state={}",
                            clientOrderId,
                            update.newState());
                    return RegistryResult.of(ApplyOutcome.IGNORED);
                }
                log.debug(
                        "Status update for unknown order ignored: clientOrderId={}, exchangeOrderId={}, state={}",
                        update.clientOrderId(),
                        update.exchangeOrderId(),
                        update.newState());
                return RegistryResult.of(ApplyOutcome.UNATTRIBUTED);
            }

            if (update.timestamp().isBefore(order.getLastUpdateTimestamp())) {
                log.debug(
                        "Stale status update ignored: clientOrderId={}, state={}, updateTs={}, lastUpdateTs={}",
                        clientOrderId,
                        update.newState(),
                        update.timestamp(),
                        order.getLastUpdateTimestamp());
                return new RegistryResult(ApplyOutcome.STALE, order.copy(), order.getState());
            }

            OrderState previous = order.getState();
            assignExchangeId(order, update.exchangeOrderId());
            order.setLastUpdateTimestamp(update.timestamp());

            if (!previous.canAdvanceTo(update.newState())) {
                log.debug(
                        "Status update would not advance order: clientOrderId={}, current={}, reported={}",
                        clientOrderId,
                        previous,
                        update.newState());
                return new RegistryResult(ApplyOutcome.IGNORED, order.copy(), previous);
            }

            order.setState(update.newState());
            if (update.newState() == OrderState.FAILED && update.reason() != null) {
                order.setFailureReason(update.reason());
            }
            if (order.isDone()) {
                complete(order);
            }
            log.info(
                    "Order state updated: clientOrderId={}, {} -> {}, source={}",
                    clientOrderId,
                    previous,
                    order.getState(),
                    update.source());
            return new RegistryResult(ApplyOutcome.APPLIED, order.copy(), previous);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Applies a fill to the order identified by {@code clientOrderId}.
     *
     * <p>Rejected as DUPLICATE if the trade id is already recorded for the order. Rejected as
     * IGNORED if it would push the cumulative filled amount beyond the requested amount by
     * more than the fill epsilon.
     */
    public RegistryResult applyFill(String clientOrderId, FillUpdate fill) {
        lock.writeLock().lock();
        try {
            Order order = activeOrders.get(clientOrderId);
            boolean completed = false;
            if (order == null) {
                order = completedOrders.get(clientOrderId);
                completed = order != null;
            }
            if (order == null) {
                log.warn("Fill for unknown order dropped: clientOrderId={}, tradeId={}", clientOrderId, fill.tradeId());
                return RegistryResult.of(ApplyOutcome.UNATTRIBUTED);
            }

            OrderState previous = order.getState();
            if (order.getTradeIds().contains(fill.tradeId())) {
                log.debug("Duplicate fill ignored: clientOrderId={}, tradeId={}", clientOrderId, fill.tradeId());
                return new RegistryResult(ApplyOutcome.DUPLICATE, order.copy(), previous);
            }

            BigDecimal newFilled = order.getFilledAmount().add(fill.fillBaseAmount());
            if (newFilled.compareTo(order.getAmount().add(fillEpsilon)) > 0) {
                log.warn(
                        "Fill anomaly, cumulative amount exceeds order amount: clientOrderId={}, tradeId={}, filled={}, fill={}, amount={}",
                        clientOrderId,
                        fill.tradeId(),
                        order.getFilledAmount(),
                        fill.fillBaseAmount(),
                        order.getAmount());
                return new RegistryResult(ApplyOutcome.IGNORED, order.copy(), previous);
            }

            BigDecimal newQuote = order.getFilledQuoteAmount().add(fill.fillQuoteAmount());
            order.getTradeIds().add(fill.tradeId());
            order.setFilledAmount(newFilled);
            order.setFilledQuoteAmount(newQuote);
            order.setAverageFillPrice(vwap(order, fill));
            assignExchangeId(order, fill.exchangeOrderId());
            fillHistory.add(toOrderFill(clientOrderId, fill));

            if (!completed) {
                order.setState(isFullyFilled(order) ? OrderState.FILLED : OrderState.PARTIALLY_FILLED);
                if (fill.fillTimestamp() != null && isAfter(fill.fillTimestamp(), order.getLastUpdateTimestamp())) {
                    order.setLastUpdateTimestamp(fill.fillTimestamp());
                }
                if (order.isDone()) {
                    complete(order);
                }
            }

            log.info(
                    "Fill applied: clientOrderId={}, tradeId={}, filled={}/{}, state={}, source={}",
                    clientOrderId,
                    fill.tradeId(),
                    order.getFilledAmount(),
                    order.getAmount(),
                    order.getState(),
                    fill.source());
            return new RegistryResult(ApplyOutcome.APPLIED, order.copy(), previous);
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ---- Lookups used for fill attribution ----

    /** Client order id owning {@code exchangeOrderId}, via the reverse index. */
    public Optional<String> findByExchangeId(String exchangeOrderId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(clientIdsByExchangeId.get(exchangeOrderId));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Active orders whose exchange id equals {@code exchangeOrderId}, found by scanning
     * every active order instead of the reverse index.
     */
    public List<String> scanActiveByExchangeId(String exchangeOrderId) {
        lock.readLock().lock();
        try {
            List<String> matches = new ArrayList<>();
            for (Order order : activeOrders.values()) {
                if (exchangeOrderId.equals(order.getExchangeOrderId())) {
                    matches.add(order.getClientOrderId());
                }
            }
            return matches;
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Client order id of a completed order with this exchange id. */
    public Optional<String> findCompletedByExchangeId(String exchangeOrderId) {
        lock.readLock().lock();
        try {
            for (Order order : completedOrders.values()) {
                if (exchangeOrderId.equals(order.getExchangeOrderId())) {
                    return Optional.of(order.getClientOrderId());
                }
            }
            return Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    // ---- Read views ----

    /** Active or recently completed order. */
    public Optional<Order> getOrder(String clientOrderId) {
        lock.readLock().lock();
        try {
            Order order = activeOrders.get(clientOrderId);
            if (order == null) {
                order = completedOrders.get(clientOrderId);
            }
            return Optional.ofNullable(order).map(Order::copy);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Order> getActiveOrders() {
        lock.readLock().lock();
        try {
            return activeOrders.values().stream().map(Order::copy).toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Active orders keyed by exchange order id; orders without one are omitted. */
    public Map<String, Order> getActiveOrdersByExchangeId() {
        lock.readLock().lock();
        try {
            Map<String, Order> result = new LinkedHashMap<>();
            for (Order order : activeOrders.values()) {
                if (order.getExchangeOrderId() != null) {
                    result.put(order.getExchangeOrderId(), order.copy());
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Active orders with an assigned exchange order id; the trade-history poll covers these. */
    public List<Order> getOrdersEligibleForTradeHistory() {
        lock.readLock().lock();
        try {
            return activeOrders.values().stream()
                    .filter(order -> order.getExchangeOrderId() != null)
                    .map(Order::copy)
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Order> getCompletedOrders() {
        lock.readLock().lock();
        try {
            return completedOrders.values().stream().map(Order::copy).toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Every applied fill in application order. */
    public List<OrderFill> getFillHistory() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(fillHistory));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<OrderFill> getFills(String clientOrderId) {
        lock.readLock().lock();
        try {
            return fillHistory.stream()
                    .filter(fill -> clientOrderId.equals(fill.getClientOrderId()))
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getActiveOrderCount() {
        lock.readLock().lock();
        try {
            return activeOrders.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    // ---- Internals ----

    private RegistryResult forceTerminal(String clientOrderId, OrderState terminal, String reason, Instant at) {
        lock.writeLock().lock();
        try {
            Order order = activeOrders.get(clientOrderId);
            if (order == null) {
                log.debug("Cannot mark {}: order not active, clientOrderId={}", terminal, clientOrderId);
                return RegistryResult.of(ApplyOutcome.IGNORED);
            }
            OrderState previous = order.getState();
            if (terminal == OrderState.FAILED
                    && (previous != OrderState.PENDING_CREATE || order.getExchangeOrderId() != null)) {
                log.warn(
                        "Refusing to fail an order the exchange already acknowledged: clientOrderId={}, state={}, exchangeOrderId={}",
                        clientOrderId,
                        previous,
                        order.getExchangeOrderId());
                return RegistryResult.of(ApplyOutcome.IGNORED);
            }
            order.setState(terminal);
            if (terminal == OrderState.FAILED) {
                order.setFailureReason(reason);
            }
            if (at != null && isAfter(at, order.getLastUpdateTimestamp())) {
                order.setLastUpdateTimestamp(at);
            }
            complete(order);
            log.info("Order {}: clientOrderId={}, previous={}, reason={}", terminal, clientOrderId, previous, reason);
            return new RegistryResult(ApplyOutcome.APPLIED, order.copy(), previous);
        } finally {
            lock.writeLock().unlock();
        }
    }

    // Caller holds the write lock for the helpers below

    private void assignExchangeId(Order order, String exchangeOrderId) {
        if (exchangeOrderId == null) {
            return;
        }
        if (order.getExchangeOrderId() == null) {
            order.setExchangeOrderId(exchangeOrderId);
            clientIdsByExchangeId.put(exchangeOrderId, order.getClientOrderId());
        } else if (!order.getExchangeOrderId().equals(exchangeOrderId)) {
            log.warn(
                    "Conflicting exchange order id ignored: clientOrderId={}, current={}, reported={}",
                    order.getClientOrderId(),
                    order.getExchangeOrderId(),
                    exchangeOrderId);
        }
    }

    private void complete(Order order) {
        activeOrders.remove(order.getClientOrderId());
        if (order.getExchangeOrderId() != null) {
            clientIdsByExchangeId.remove(order.getExchangeOrderId());
        }
        completedOrders.put(order.getClientOrderId(), order);
    }

    private boolean isFullyFilled(Order order) {
        return order.getAmount().subtract(order.getFilledAmount()).abs().compareTo(fillEpsilon) <= 0;
    }

    /** VWAP over all fills, from the running quote and base totals. */
    private BigDecimal vwap(Order order, FillUpdate fill) {
        if (order.getFilledAmount().signum() == 0) {
            return fill.fillPrice();
        }
        return order.getFilledQuoteAmount().divide(order.getFilledAmount(), MathContext.DECIMAL64);
    }

    private static boolean isAfter(Instant candidate, Instant current) {
        return current == null || candidate.isAfter(current);
    }

    private static OrderFill toOrderFill(String clientOrderId, FillUpdate fill) {
        return OrderFill.builder()
                .tradeId(fill.tradeId())
                .clientOrderId(clientOrderId)
                .exchangeOrderId(fill.exchangeOrderId())
                .tradingPair(fill.tradingPair())
                .price(fill.fillPrice())
                .baseAmount(fill.fillBaseAmount())
                .quoteAmount(fill.fillQuoteAmount())
                .fee(fill.fee())
                .source(fill.source())
                .filledAt(fill.fillTimestamp())
                .build();
    }
}
