package com.perpconnector.domain.update;

import com.perpconnector.domain.enums.UpdateSource;
import com.perpconnector.domain.model.TradeFee;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * A single trade execution against one of our orders.
 *
 * @param tradeId         exchange trade id, unique per exchange; the dedup key
 * @param clientOrderId   client order id when the payload carries one, else null
 * @param fillQuoteAmount exchange-reported quote amount, or price x amount when it was absent
 */
public record FillUpdate(
        String tradeId,
        String clientOrderId,
        String exchangeOrderId,
        String tradingPair,
        BigDecimal fillPrice,
        BigDecimal fillBaseAmount,
        BigDecimal fillQuoteAmount,
        TradeFee fee,
        Instant fillTimestamp,
        UpdateSource source)
        implements CanonicalUpdate {}
