package com.perpconnector.exception;

import java.util.Map;

/** An order request failed local validation and was never sent to the exchange. */
public class InvalidOrderException extends BaseException {

    public InvalidOrderException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public InvalidOrderException(String message, Map<String, Object> details) {
        super(ErrorCode.VALIDATION_ERROR, message, details);
    }
}
