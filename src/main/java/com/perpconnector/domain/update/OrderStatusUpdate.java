package com.perpconnector.domain.update;

import com.perpconnector.domain.enums.OrderState;
import com.perpconnector.domain.enums.UpdateSource;
import java.time.Instant;

/**
 * Exchange-reported order state.
 *
 * @param exchangeOrderId may be null when the exchange has not assigned one yet
 * @param timestamp       exchange last-update time; ordering key for last-update-wins
 * @param reason          optional status message (rejection reason)
 */
public record OrderStatusUpdate(
        String clientOrderId,
        String exchangeOrderId,
        String tradingPair,
        OrderState newState,
        Instant timestamp,
        UpdateSource source,
        String reason)
        implements CanonicalUpdate {}
