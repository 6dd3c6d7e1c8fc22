package com.perpconnector.domain.model;

import java.math.BigDecimal;

/**
 * Most recent funding settlement for a trading pair.
 *
 * <p>"No payment" is the sentinel (timestamp 0, rate -1, payment -1), returned when the
 * exchange reports no event or a zero payment. It is distinct from a real transfer.
 *
 * @param timestamp  settlement time in epoch milliseconds
 * @param fundingRate funding rate / pnl reported at settlement
 * @param payment    realized payment amount
 */
public record FundingPayment(String tradingPair, long timestamp, BigDecimal fundingRate, BigDecimal payment) {

    private static final BigDecimal SENTINEL = BigDecimal.valueOf(-1);

    public static FundingPayment none(String tradingPair) {
        return new FundingPayment(tradingPair, 0L, SENTINEL, SENTINEL);
    }

    public boolean isNone() {
        return timestamp == 0L && SENTINEL.compareTo(payment) == 0 && SENTINEL.compareTo(fundingRate) == 0;
    }
}
