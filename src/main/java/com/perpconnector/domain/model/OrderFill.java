package com.perpconnector.domain.model;

import com.perpconnector.domain.enums.UpdateSource;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * One applied fill, kept in the append-only fill history for PnL bookkeeping.
 *
 * <p>An order's filledAmount is the sum of its fills' baseAmount, and its
 * averageFillPrice is the VWAP across them.
 */
@Value
@Builder
public class OrderFill {

    String tradeId;
    String clientOrderId;
    String exchangeOrderId;
    String tradingPair;
    BigDecimal price;
    BigDecimal baseAmount;
    BigDecimal quoteAmount;
    TradeFee fee;

    /** Which channel delivered the fill first. */
    UpdateSource source;

    Instant filledAt;
}
