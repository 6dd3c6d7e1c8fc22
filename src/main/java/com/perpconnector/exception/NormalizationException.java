package com.perpconnector.exception;

import java.util.Map;
import lombok.Getter;

/**
 * A raw payload could not be turned into canonical updates, typically because it is an
 * exchange error envelope. Carries the exchange's own error message.
 */
@Getter
public class NormalizationException extends BaseException {

    private final String exchangeMessage;

    public NormalizationException(String message, String exchangeMessage) {
        super(
                ErrorCode.NORMALIZATION_ERROR,
                message,
                exchangeMessage != null ? Map.of("exchangeMessage", exchangeMessage) : Map.of());
        this.exchangeMessage = exchangeMessage;
    }
}
