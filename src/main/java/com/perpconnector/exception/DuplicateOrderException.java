package com.perpconnector.exception;

import java.util.Map;

/** A client order id is already tracked. The order is never registered. */
public class DuplicateOrderException extends BaseException {

    public DuplicateOrderException(String clientOrderId) {
        super(
                ErrorCode.VALIDATION_ERROR,
                "Order already registered: clientOrderId=" + clientOrderId,
                Map.of("clientOrderId", clientOrderId));
    }
}
