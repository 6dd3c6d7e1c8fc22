package com.perpconnector.exception;

/** Order or cancel request rejected by the exchange for a business reason. */
public class ExchangeRejectionException extends BrokerException {

    public ExchangeRejectionException(String message) {
        super(BrokerErrorKind.REJECTED, ErrorCode.EXCHANGE_REJECTED, message, null);
    }
}
