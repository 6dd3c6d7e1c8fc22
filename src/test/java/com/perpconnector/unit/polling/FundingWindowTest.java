package com.perpconnector.unit.polling;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.perpconnector.polling.FundingWindow;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class FundingWindowTest {

    private final FundingWindow hourly = new FundingWindow(Duration.ofHours(1));

    @Test
    @DisplayName("Window starts at the beginning of the previous period")
    void previousPeriodStart() {
        Instant now = Instant.parse("2024-06-01T10:42:17Z");

        assertThat(hourly.startTimestampMs(now)).isEqualTo(Instant.parse("2024-06-01T09:00:00Z").toEpochMilli());
    }

    @Test
    @DisplayName("Exactly on a boundary still reaches back one full period")
    void onBoundary() {
        Instant now = Instant.parse("2024-06-01T10:00:00Z");

        assertThat(hourly.startTimestampMs(now)).isEqualTo(Instant.parse("2024-06-01T09:00:00Z").toEpochMilli());
    }

    @Test
    @DisplayName("Non-positive period is rejected")
    void rejectsZeroPeriod() {
        assertThatThrownBy(() -> new FundingWindow(Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
    }
}
