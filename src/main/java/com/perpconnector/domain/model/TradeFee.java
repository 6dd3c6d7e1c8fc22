package com.perpconnector.domain.model;

import java.math.BigDecimal;

/** Flat fee charged on a single fill, in the given asset. */
public record TradeFee(BigDecimal amount, String asset) {

    public static TradeFee zero(String asset) {
        return new TradeFee(BigDecimal.ZERO, asset);
    }
}
