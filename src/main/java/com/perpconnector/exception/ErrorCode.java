package com.perpconnector.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR"),
    NOT_FOUND("NOT_FOUND"),
    EXCHANGE_REJECTED("EXCHANGE_REJECTED"),
    TRANSIENT_NETWORK("TRANSIENT_NETWORK"),
    NORMALIZATION_ERROR("NORMALIZATION_ERROR"),
    BROKER_ERROR("BROKER_ERROR");

    private final String code;
}
