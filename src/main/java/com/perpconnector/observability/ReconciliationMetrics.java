package com.perpconnector.observability;

import com.perpconnector.domain.enums.ApplyOutcome;
import com.perpconnector.domain.enums.MessageKind;
import com.perpconnector.oms.OrderRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for the reconciliation core:
 * <ul>
 *   <li><b>reconciliation.updates</b> (counter, tag outcome): every canonical update applied or rejected</li>
 *   <li><b>stream.messages.failed</b> (counter): stream messages that could not be processed</li>
 *   <li><b>poll.fetch.failed</b> (counter, tag kind): failed poll fetches per kind</li>
 *   <li><b>orders.active</b> (gauge): orders currently in the active registry</li>
 * </ul>
 */
@Service
public class ReconciliationMetrics {

    private final MeterRegistry meterRegistry;
    private final Map<ApplyOutcome, Counter> updateCounters = new EnumMap<>(ApplyOutcome.class);
    private final Counter streamFailureCounter;

    public ReconciliationMetrics(MeterRegistry meterRegistry, OrderRegistry orderRegistry) {
        this.meterRegistry = meterRegistry;
        for (ApplyOutcome outcome : ApplyOutcome.values()) {
            updateCounters.put(
                    outcome,
                    Counter.builder("reconciliation.updates")
                            .description("Canonical updates processed by the reconciliation engine")
                            .tag("outcome", outcome.name())
                            .register(meterRegistry));
        }
        this.streamFailureCounter = Counter.builder("stream.messages.failed")
                .description("User stream messages dropped because they could not be processed")
                .register(meterRegistry);

        meterRegistry.gauge("orders.active", orderRegistry, OrderRegistry::getActiveOrderCount);
    }

    public void recordOutcome(ApplyOutcome outcome) {
        updateCounters.get(outcome).increment();
    }

    public void recordStreamFailure() {
        streamFailureCounter.increment();
    }

    public void recordPollFetchFailure(MessageKind kind) {
        recordPollFetchFailure(kind.name());
    }

    /** For fetches without a message kind, e.g. "INSTRUMENTS". */
    public void recordPollFetchFailure(String kind) {
        Counter.builder("poll.fetch.failed")
                .description("Poll fetches that failed and will be retried next cycle")
                .tag("kind", kind)
                .register(meterRegistry)
                .increment();
    }
}
