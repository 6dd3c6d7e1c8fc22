package com.perpconnector.broker;

import com.perpconnector.domain.enums.OrderSide;
import com.perpconnector.domain.enums.OrderType;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Exchange-facing create-order parameters. The client order id travels as the
 * exchange's order label, which is how stream order updates are matched back.
 */
@Value
@Builder
public class SubmitOrderRequest {

    String clientOrderId;
    String exchangeSymbol;
    OrderSide side;
    OrderType type;
    BigDecimal amount;
    BigDecimal price;
}
