package com.perpconnector.exception;

/** Classification of an exchange error envelope. */
public enum BrokerErrorKind {
    NOT_FOUND,
    REJECTED,
    TRANSIENT_NETWORK,
    UNKNOWN
}
