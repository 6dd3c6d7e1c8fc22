package com.perpconnector.oms;

import com.perpconnector.domain.enums.OrderSide;
import com.perpconnector.domain.enums.OrderType;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Parameters for one order submitted through {@link OrderPlacementService}.
 *
 * <p>Amount and price are expected to be already quantized to the instrument's trading
 * rules by the caller.
 */
@Data
@Builder
public class OrderRequest {

    /** Canonical pair, e.g. "ETH-USDC". */
    private String tradingPair;

    private OrderSide side;

    @Builder.Default
    private OrderType type = OrderType.LIMIT;

    /** Base amount, always positive. */
    private BigDecimal amount;

    /** Limit price. Required for LIMIT and LIMIT_MAKER, ignored for MARKET. */
    private BigDecimal price;
}
