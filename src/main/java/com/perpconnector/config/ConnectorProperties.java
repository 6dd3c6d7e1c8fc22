package com.perpconnector.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Connector configuration bound to the {@code connector.*} prefix in application.yml.
 *
 * <p>Poll cadences follow the exchange's settlement and rate-limit profile: a short cycle
 * for orders, fills, balances and positions, a long cycle for instrument metadata, and a
 * coarser interval for funding payments.
 */
@Validated
@ConfigurationProperties(prefix = "connector")
@Getter
@Setter
public class ConnectorProperties {

    /** Prefix of every locally generated client order id. */
    @NotBlank
    private String brokerId = "HBOT";

    /** Maximum length of the raw (pre-hash) client order id. */
    @Min(8)
    private int maxOrderIdLength = 32;

    /** Exchange subaccount this session trades on; also the stream channel prefix. */
    @NotBlank
    private String subaccountId = "0";

    /** Canonical pairs polled for funding payments. */
    private List<String> tradingPairs = new ArrayList<>();

    /** Collateral asset: quote side of every canonical pair and the fee asset. */
    @NotBlank
    private String quoteAsset = "USDC";

    /** Tolerance when comparing cumulative filled amount with the requested amount. */
    @NotNull
    private BigDecimal fillEpsilon = new BigDecimal("1E-9");

    /** Completed orders retained after reaching a terminal state. */
    @Min(1)
    private int completedOrderHistorySize = 1000;

    @Valid
    private Poll poll = new Poll();

    @Valid
    private Stream stream = new Stream();

    @Valid
    private Async async = new Async();

    @Getter
    @Setter
    public static class Poll {

        /** Order status, trade history, balances and positions. */
        private Duration shortInterval = Duration.ofSeconds(5);

        /** Instrument metadata and symbol map refresh. */
        private Duration longInterval = Duration.ofSeconds(12);

        /** Most recent funding settlement per pair. */
        private Duration fundingInterval = Duration.ofSeconds(120);

        /** Exchange funding settlement period. */
        private Duration fundingPeriod = Duration.ofHours(1);
    }

    @Getter
    @Setter
    public static class Stream {

        /** Channel suffix carrying order updates: {@code <subaccountId>.orders}. */
        @NotBlank
        private String orderChannelSuffix = "orders";

        /** Channel suffix carrying trade fills: {@code <subaccountId>.trades}. */
        @NotBlank
        private String tradeChannelSuffix = "trades";

        /** Pause after the stream itself fails to yield a message. */
        private Duration fetchRetryDelay = Duration.ofSeconds(1);

        /** Pause after an unexpected error while processing a message. */
        private Duration errorPause = Duration.ofSeconds(5);
    }

    @Getter
    @Setter
    public static class Async {

        @Min(1)
        private int pollPoolSize = 4;

        @Min(1)
        private int submissionPoolSize = 4;

        @Min(0)
        private int queueCapacity = 500;
    }
}
