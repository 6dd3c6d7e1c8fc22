package com.perpconnector.reconciliation;

import com.perpconnector.domain.enums.ApplyOutcome;
import com.perpconnector.domain.enums.UpdateSource;
import com.perpconnector.domain.model.BatchResult;
import com.perpconnector.domain.update.BalanceSnapshot;
import com.perpconnector.domain.update.CanonicalUpdate;
import com.perpconnector.domain.update.FillUpdate;
import com.perpconnector.domain.update.FundingUpdate;
import com.perpconnector.domain.update.OrderStatusUpdate;
import com.perpconnector.domain.update.PositionSnapshot;
import com.perpconnector.domain.update.RawMessage;
import com.perpconnector.event.EventPublisherHelper;
import com.perpconnector.exception.NormalizationException;
import com.perpconnector.ledger.PositionBalanceLedger;
import com.perpconnector.normalizer.EventNormalizer;
import com.perpconnector.observability.ReconciliationMetrics;
import com.perpconnector.oms.OrderRegistry;
import com.perpconnector.oms.RegistryResult;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Single funnel for every exchange observation, whether it arrived on the user stream or
 * from a poll. Both ingress points normalize the raw payload and apply the resulting
 * updates in order, so merge semantics do not depend on the channel.
 *
 * <p>Routing:
 * <ul>
 *   <li>{@link OrderStatusUpdate} and {@link FillUpdate} go to the {@link OrderRegistry}</li>
 *   <li>{@link PositionSnapshot}, {@link BalanceSnapshot} and {@link FundingUpdate} go to the
 *       {@link PositionBalanceLedger}</li>
 * </ul>
 *
 * <p>A failure on one update (normalization error, unexpected exception) is counted as
 * FAILED and never stops the rest of the batch. Events are published after the registry
 * or ledger call returns, never under their locks.
 */
@Service
public class ReconciliationEngine {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationEngine.class);

    private final EventNormalizer eventNormalizer;
    private final OrderRegistry orderRegistry;
    private final PositionBalanceLedger positionBalanceLedger;
    private final EventPublisherHelper eventPublisherHelper;
    private final ReconciliationMetrics reconciliationMetrics;

    public ReconciliationEngine(
            EventNormalizer eventNormalizer,
            OrderRegistry orderRegistry,
            PositionBalanceLedger positionBalanceLedger,
            EventPublisherHelper eventPublisherHelper,
            ReconciliationMetrics reconciliationMetrics) {
        this.eventNormalizer = eventNormalizer;
        this.orderRegistry = orderRegistry;
        this.positionBalanceLedger = positionBalanceLedger;
        this.eventPublisherHelper = eventPublisherHelper;
        this.reconciliationMetrics = reconciliationMetrics;
    }

    /** Ingress for the user stream. */
    public BatchResult onStreamEvent(RawMessage raw) {
        return ingest(raw);
    }

    /** Ingress for poll responses. */
    public BatchResult onPollSnapshot(RawMessage raw) {
        return ingest(raw);
    }

    private BatchResult ingest(RawMessage raw) {
        List<CanonicalUpdate> updates;
        try {
            updates = eventNormalizer.normalize(raw);
        } catch (NormalizationException e) {
            log.warn(
                    "Normalization failed: source={}, kind={}, error={}", raw.source(), raw.kind(), e.getMessage());
            reconciliationMetrics.recordOutcome(ApplyOutcome.FAILED);
            BatchResult result = BatchResult.empty();
            result.record(ApplyOutcome.FAILED);
            return result;
        }
        return applyAll(updates);
    }

    /** Applies updates strictly in list order. */
    public BatchResult applyAll(List<CanonicalUpdate> updates) {
        BatchResult result = BatchResult.empty();
        for (CanonicalUpdate update : updates) {
            ApplyOutcome outcome;
            try {
                outcome = apply(update);
            } catch (RuntimeException e) {
                log.error("Failed to apply update: update={}, error={}", update, e.getMessage(), e);
                outcome = ApplyOutcome.FAILED;
                reconciliationMetrics.recordOutcome(outcome);
            }
            result.record(outcome);
        }
        return result;
    }

    public ApplyOutcome apply(CanonicalUpdate update) {
        ApplyOutcome outcome;
        if (update instanceof OrderStatusUpdate statusUpdate) {
            outcome = applyStatus(statusUpdate);
        } else if (update instanceof FillUpdate fillUpdate) {
            outcome = applyFill(fillUpdate);
        } else if (update instanceof PositionSnapshot positionSnapshot) {
            outcome = positionBalanceLedger.applyPositionSnapshot(positionSnapshot);
        } else if (update instanceof BalanceSnapshot balanceSnapshot) {
            outcome = positionBalanceLedger.applyBalanceSnapshot(balanceSnapshot);
        } else if (update instanceof FundingUpdate fundingUpdate) {
            outcome = applyFunding(fundingUpdate);
        } else {
            throw new IllegalArgumentException("Unsupported update type: " + update.getClass().getName());
        }
        reconciliationMetrics.recordOutcome(outcome);
        return outcome;
    }

    // ---- Orders ----

    private ApplyOutcome applyStatus(OrderStatusUpdate update) {
        RegistryResult result = orderRegistry.applyStatusUpdate(update);
        if (result.outcome() == ApplyOutcome.UNATTRIBUTED && update.newState().isTerminal()) {
            log.warn(
                    "Terminal state for untracked order: clientOrderId={}, exchangeOrderId={}, state={}",
                    update.clientOrderId(),
                    update.exchangeOrderId(),
                    update.newState());
        }
        publishTransition(result);
        return result.outcome();
    }

    private ApplyOutcome applyFill(FillUpdate fill) {
        Optional<String> owner = resolveOwner(fill);
        if (owner.isEmpty()) {
            // Trade history polls return every trade of the subaccount, including other sessions'
            if (fill.source() == UpdateSource.POLL) {
                log.debug(
                        "Polled trade for untracked order skipped: tradeId={}, exchangeOrderId={}",
                        fill.tradeId(),
                        fill.exchangeOrderId());
            } else {
                log.warn(
                        "Unattributable fill dropped: tradeId={}, exchangeOrderId={}, pair={}, amount={}",
                        fill.tradeId(),
                        fill.exchangeOrderId(),
                        fill.tradingPair(),
                        fill.fillBaseAmount());
            }
            return ApplyOutcome.UNATTRIBUTED;
        }
        RegistryResult result = orderRegistry.applyFill(owner.get(), fill);
        publishTransition(result);
        return result.outcome();
    }

    /**
     * The exchange no longer knows an order we still track as active. Treated as an
     * implicit cancellation.
     */
    public ApplyOutcome onOrderNotFound(String clientOrderId, String reason) {
        log.info("Order not found on exchange, marking cancelled: clientOrderId={}, reason={}", clientOrderId, reason);
        RegistryResult result = orderRegistry.markCanceled(clientOrderId, reason, null);
        publishTransition(result);
        reconciliationMetrics.recordOutcome(result.outcome());
        return result.outcome();
    }

    /**
     * Finds the client order id owning a fill: the exchange id index first, then the fill's
     * own label, then a scan of active orders (the index may lag while a create ack is in
     * flight), and finally recently completed orders.
     */
    Optional<String> resolveOwner(FillUpdate fill) {
        String exchangeOrderId = fill.exchangeOrderId();
        Optional<String> indexed = orderRegistry.findByExchangeId(exchangeOrderId);
        if (indexed.isPresent()) {
            return indexed;
        }

        if (fill.clientOrderId() != null && orderRegistry.getOrder(fill.clientOrderId()).isPresent()) {
            return Optional.of(fill.clientOrderId());
        }

        List<String> matches = orderRegistry.scanActiveByExchangeId(exchangeOrderId);
        if (!matches.isEmpty()) {
            if (matches.size() > 1) {
                log.warn(
                        "Fill anomaly, {} active orders share exchangeOrderId={}; attributing tradeId={} to {}",
                        matches.size(),
                        exchangeOrderId,
                        fill.tradeId(),
                        matches.get(0));
            }
            return Optional.of(matches.get(0));
        }

        return orderRegistry.findCompletedByExchangeId(exchangeOrderId);
    }

    private void publishTransition(RegistryResult result) {
        if (result.stateChanged()) {
            eventPublisherHelper.publishOrderTransition(this, result.order(), result.previousState());
        }
    }

    // ---- Funding ----

    private ApplyOutcome applyFunding(FundingUpdate update) {
        ApplyOutcome outcome = positionBalanceLedger.applyFundingPayment(update.payment());
        if (outcome == ApplyOutcome.APPLIED) {
            eventPublisherHelper.publishFundingPayment(this, update.payment());
        }
        return outcome;
    }
}
