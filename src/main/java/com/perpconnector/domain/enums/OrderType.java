package com.perpconnector.domain.enums;

/**
 * Order execution type supported by the connector.
 * LIMIT_MAKER is a post-only limit order; MARKET is sent as an immediate-or-cancel order.
 */
public enum OrderType {
    LIMIT,
    LIMIT_MAKER,
    MARKET
}
