package com.perpconnector.domain.model;

import com.perpconnector.domain.enums.OrderSide;
import com.perpconnector.domain.enums.OrderState;
import com.perpconnector.domain.enums.OrderType;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;
import lombok.Builder;
import lombok.Data;

/**
 * A locally tracked order.
 *
 * <p>Owned exclusively by {@link com.perpconnector.oms.OrderRegistry}; every instance handed
 * out by the registry is a copy, so callers can read it freely without holding any lock.
 * The clientOrderId never changes, and exchangeOrderId is written at most once.
 *
 * <p>{@code tradeIds} holds every exchange trade id already applied to this order and is what
 * makes fill application idempotent across the stream and the trade-history poll.
 */
@Data
@Builder(toBuilder = true)
public class Order {

    private String clientOrderId;

    /** Exchange-assigned id. Null until the create request is acknowledged. */
    private String exchangeOrderId;

    private String tradingPair;
    private OrderSide side;
    private OrderType type;

    /** Requested limit price. Null for MARKET orders. */
    private BigDecimal price;

    /** Requested base amount. */
    private BigDecimal amount;

    private OrderState state;

    @Builder.Default
    private BigDecimal filledAmount = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal filledQuoteAmount = BigDecimal.ZERO;

    /** Volume-weighted average fill price. Null until the first fill. */
    private BigDecimal averageFillPrice;

    @Builder.Default
    private Set<String> tradeIds = new LinkedHashSet<>();

    /** Exchange or local reason for a FAILED order. */
    private String failureReason;

    private Instant creationTimestamp;
    private Instant lastUpdateTimestamp;

    public boolean isDone() {
        return state != null && state.isTerminal();
    }

    public BigDecimal getRemainingAmount() {
        return amount.subtract(filledAmount);
    }

    /** Deep copy, including the trade id set. */
    public Order copy() {
        return toBuilder().tradeIds(new LinkedHashSet<>(tradeIds)).build();
    }
}
