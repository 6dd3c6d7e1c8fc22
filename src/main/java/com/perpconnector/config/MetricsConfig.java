package com.perpconnector.config;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.springframework.context.annotation.Configuration;

/**
 * Common tags for every connector metric. The metric definitions themselves live in
 * {@link com.perpconnector.observability.ReconciliationMetrics}.
 */
@Configuration
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final ConnectorProperties connectorProperties;

    public MetricsConfig(MeterRegistry meterRegistry, ConnectorProperties connectorProperties) {
        this.meterRegistry = meterRegistry;
        this.connectorProperties = connectorProperties;
    }

    @PostConstruct
    void configureCommonTags() {
        meterRegistry
                .config()
                .commonTags("application", "perp-connector", "subaccount", connectorProperties.getSubaccountId());
    }
}
