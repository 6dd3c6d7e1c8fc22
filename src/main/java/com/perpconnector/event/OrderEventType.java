package com.perpconnector.event;

/**
 * Classifies the order state transition behind an {@link OrderEvent}.
 */
public enum OrderEventType {

    /** Registered locally in PENDING_CREATE; create request about to be sent. */
    CREATED,

    /** Create request acknowledged; exchange order id assigned. */
    OPENED,

    /** A new fill arrived but the requested amount is not reached yet. */
    PARTIALLY_FILLED,

    /** Cumulative filled amount reached the requested amount, or the exchange said so. */
    FILLED,

    /** Cancelled on the exchange, explicitly or implicitly (order no longer exists). */
    CANCELED,

    /** Rejected by the exchange or failed locally before acknowledgement. */
    FAILED
}
