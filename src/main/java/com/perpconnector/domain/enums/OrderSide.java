package com.perpconnector.domain.enums;

/** Buy or sell side of an order. Maps to the exchange's {@code direction} field. */
public enum OrderSide {
    BUY,
    SELL;

    /** Single-letter code used when building client order ids. */
    public String code() {
        return this == BUY ? "B" : "S";
    }
}
