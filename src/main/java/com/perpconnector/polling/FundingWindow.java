package com.perpconnector.polling;

import java.time.Duration;
import java.time.Instant;

/**
 * Start of the funding history window: the beginning of the settlement period before the
 * current one, so the most recent completed settlement is always included.
 */
public final class FundingWindow {

    private final long periodMs;

    public FundingWindow(Duration period) {
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("Funding period must be positive: " + period);
        }
        this.periodMs = period.toMillis();
    }

    /** {@code (floor(now / period) - 1) * period}, in epoch milliseconds. */
    public long startTimestampMs(Instant now) {
        return (Math.floorDiv(now.toEpochMilli(), periodMs) - 1) * periodMs;
    }
}
