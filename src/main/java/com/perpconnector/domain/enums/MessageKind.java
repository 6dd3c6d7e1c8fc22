package com.perpconnector.domain.enums;

/** Kind of raw payload handed to the event normalizer. */
public enum MessageKind {
    ORDER_STATUS,
    TRADE,
    POSITION_SNAPSHOT,
    BALANCE_SNAPSHOT,
    FUNDING_EVENT
}
