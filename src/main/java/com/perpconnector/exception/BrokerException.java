package com.perpconnector.exception;

import lombok.Getter;

/**
 * Failure reported by the transport collaborator. Subclasses narrow the kind so that call
 * sites can decide per case whether to drop, retry on the next poll cycle, or escalate.
 */
@Getter
public class BrokerException extends BaseException {

    private final BrokerErrorKind kind;

    public BrokerException(String message) {
        this(BrokerErrorKind.UNKNOWN, ErrorCode.BROKER_ERROR, message, null);
    }

    public BrokerException(String message, Throwable cause) {
        this(BrokerErrorKind.UNKNOWN, ErrorCode.BROKER_ERROR, message, cause);
    }

    protected BrokerException(BrokerErrorKind kind, ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.kind = kind;
    }
}
