package com.perpconnector.exception;

/**
 * The exchange does not know the order. During cancel and status-poll flows this is an
 * implicit cancellation, not an error.
 */
public class OrderNotFoundOnExchangeException extends BrokerException {

    public OrderNotFoundOnExchangeException(String message) {
        super(BrokerErrorKind.NOT_FOUND, ErrorCode.NOT_FOUND, message, null);
    }
}
