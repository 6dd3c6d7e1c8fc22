package com.perpconnector.exception;

/**
 * Timeout, connection reset or rate limiting. Never retried synchronously: the poll
 * scheduler simply tries again on its next cycle.
 */
public class TransientNetworkException extends BrokerException {

    public TransientNetworkException(String message) {
        super(BrokerErrorKind.TRANSIENT_NETWORK, ErrorCode.TRANSIENT_NETWORK, message, null);
    }

    public TransientNetworkException(String message, Throwable cause) {
        super(BrokerErrorKind.TRANSIENT_NETWORK, ErrorCode.TRANSIENT_NETWORK, message, cause);
    }
}
