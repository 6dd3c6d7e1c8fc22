package com.perpconnector.domain.model;

import com.perpconnector.domain.enums.PositionSide;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An open perpetual position as last reported by the exchange.
 *
 * <p>Amount is signed: positive = LONG, negative = SHORT. A position with zero amount is
 * never stored; the ledger removes the entry instead.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    private String tradingPair;
    private PositionSide side;

    /** Signed base amount. */
    private BigDecimal amount;

    private BigDecimal entryPrice;
    private BigDecimal markPrice;
    private BigDecimal unrealizedPnl;
    private BigDecimal leverage;

    private Instant updatedAt;

    public PositionKey key() {
        return new PositionKey(tradingPair, side);
    }
}
