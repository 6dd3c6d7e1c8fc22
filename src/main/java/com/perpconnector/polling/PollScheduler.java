package com.perpconnector.polling;

import com.fasterxml.jackson.databind.JsonNode;
import com.perpconnector.broker.ExchangeGateway;
import com.perpconnector.broker.InstrumentSymbolMapper;
import com.perpconnector.config.ConnectorProperties;
import com.perpconnector.domain.enums.MessageKind;
import com.perpconnector.domain.model.BatchResult;
import com.perpconnector.domain.model.Order;
import com.perpconnector.domain.update.RawMessage;
import com.perpconnector.exception.BrokerException;
import com.perpconnector.exception.NormalizationException;
import com.perpconnector.exception.OrderNotFoundOnExchangeException;
import com.perpconnector.observability.ReconciliationMetrics;
import com.perpconnector.oms.OrderRegistry;
import com.perpconnector.reconciliation.ReconciliationEngine;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic reconciliation passes against the exchange's REST endpoints.
 *
 * <p>Three cadences:
 * <ul>
 *   <li>Short cycle: status of every acknowledged active order, trade history (only when
 *       some order is eligible), balances and positions</li>
 *   <li>Long cycle: instrument metadata, which rebuilds the symbol map</li>
 *   <li>Funding cycle: most recent funding settlement per configured pair</li>
 * </ul>
 *
 * <p>Within a cycle all fetches run concurrently on the poll executor. Their responses are
 * then pushed through {@link ReconciliationEngine#onPollSnapshot} one by one on the
 * scheduler thread, in a fixed order. A failed fetch is logged and counted; its siblings
 * are still applied and the next cycle is the retry.
 *
 * <p>{@link #stop()} cancels in-flight fetches. A cycle that sees a cancelled fetch stops
 * before applying anything further.
 */
@Component
public class PollScheduler implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(PollScheduler.class);

    private final ExchangeGateway exchangeGateway;
    private final ReconciliationEngine reconciliationEngine;
    private final OrderRegistry orderRegistry;
    private final InstrumentSymbolMapper instrumentSymbolMapper;
    private final ReconciliationMetrics reconciliationMetrics;
    private final ConnectorProperties connectorProperties;
    private final Executor pollExecutor;
    private final Clock clock;
    private final FundingWindow fundingWindow;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Set<CompletableFuture<JsonNode>> inFlight = ConcurrentHashMap.newKeySet();

    public PollScheduler(
            ExchangeGateway exchangeGateway,
            ReconciliationEngine reconciliationEngine,
            OrderRegistry orderRegistry,
            InstrumentSymbolMapper instrumentSymbolMapper,
            ReconciliationMetrics reconciliationMetrics,
            ConnectorProperties connectorProperties,
            @Qualifier("pollExecutor") Executor pollExecutor,
            Clock clock) {
        this.exchangeGateway = exchangeGateway;
        this.reconciliationEngine = reconciliationEngine;
        this.orderRegistry = orderRegistry;
        this.instrumentSymbolMapper = instrumentSymbolMapper;
        this.reconciliationMetrics = reconciliationMetrics;
        this.connectorProperties = connectorProperties;
        this.pollExecutor = pollExecutor;
        this.clock = clock;
        this.fundingWindow = new FundingWindow(connectorProperties.getPoll().getFundingPeriod());
    }

    // ---- Lifecycle ----

    @Override
    public void start() {
        if (running.compareAndSet(false, true)) {
            log.info(
                    "PollScheduler started: short={}, long={}, funding={}",
                    connectorProperties.getPoll().getShortInterval(),
                    connectorProperties.getPoll().getLongInterval(),
                    connectorProperties.getPoll().getFundingInterval());
        }
    }

    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            int cancelled = 0;
            for (CompletableFuture<JsonNode> future : inFlight) {
                if (future.cancel(true)) {
                    cancelled++;
                }
            }
            inFlight.clear();
            log.info("PollScheduler stopped: cancelledFetches={}", cancelled);
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    // ---- Cycles ----

    /** Orders, trades, balances and positions. */
    @Scheduled(fixedDelayString = "${connector.poll.short-interval:5s}")
    public void runShortCycle() {
        if (!running.get()) {
            return;
        }
        List<PollFetch> fetches = new ArrayList<>();

        List<Order> eligible = orderRegistry.getOrdersEligibleForTradeHistory();
        for (Order order : eligible) {
            fetches.add(fetch(
                    MessageKind.ORDER_STATUS,
                    () -> exchangeGateway.fetchOrderStatus(order.getExchangeOrderId()),
                    order.getClientOrderId(),
                    null));
        }
        if (eligible.isEmpty()) {
            log.debug("Trade history poll skipped: no eligible orders");
        } else {
            fetches.add(fetch(MessageKind.TRADE, exchangeGateway::fetchTradeHistory, null, null));
        }
        fetches.add(fetch(MessageKind.BALANCE_SNAPSHOT, exchangeGateway::fetchBalances, null, null));
        fetches.add(fetch(MessageKind.POSITION_SNAPSHOT, exchangeGateway::fetchPositions, null, null));

        BatchResult result = applyInOrder(fetches);
        log.debug("Short poll cycle done: fetches={}, result={}", fetches.size(), result);
    }

    /** Instrument metadata and symbol map refresh. */
    @Scheduled(fixedDelayString = "${connector.poll.long-interval:12s}")
    public void runLongCycle() {
        if (!running.get()) {
            return;
        }
        try {
            JsonNode instruments = exchangeGateway.fetchInstruments();
            instrumentSymbolMapper.refresh(instruments);
        } catch (BrokerException e) {
            reconciliationMetrics.recordPollFetchFailure("INSTRUMENTS");
            log.warn("Instrument fetch failed, keeping previous symbol map: kind={}, error={}", e.getKind(), e.getMessage());
        } catch (NormalizationException e) {
            reconciliationMetrics.recordPollFetchFailure("INSTRUMENTS");
            log.warn("Instrument response rejected, keeping previous symbol map: {}", e.getMessage());
        }
    }

    /** Most recent funding settlement per configured pair. */
    @Scheduled(fixedDelayString = "${connector.poll.funding-interval:120s}")
    public void runFundingCycle() {
        if (!running.get()) {
            return;
        }
        long startTimestampMs = fundingWindow.startTimestampMs(clock.instant());
        List<PollFetch> fetches = new ArrayList<>();
        for (String tradingPair : connectorProperties.getTradingPairs()) {
            Optional<String> exchangeSymbol = instrumentSymbolMapper.toExchangeSymbol(tradingPair);
            if (exchangeSymbol.isEmpty()) {
                log.debug("Funding poll skipped, pair not in symbol map: pair={}", tradingPair);
                continue;
            }
            fetches.add(fetch(
                    MessageKind.FUNDING_EVENT,
                    () -> exchangeGateway.fetchFundingHistory(exchangeSymbol.get(), startTimestampMs),
                    null,
                    tradingPair));
        }
        BatchResult result = applyInOrder(fetches);
        log.debug("Funding poll cycle done: pairs={}, result={}", fetches.size(), result);
    }

    // ---- Fetch plumbing ----

    private PollFetch fetch(MessageKind kind, Supplier<JsonNode> call, String clientOrderId, String tradingPair) {
        CompletableFuture<JsonNode> future = CompletableFuture.supplyAsync(call, pollExecutor);
        inFlight.add(future);
        future.whenComplete((response, error) -> inFlight.remove(future));
        return new PollFetch(kind, future, clientOrderId, tradingPair);
    }

    private BatchResult applyInOrder(List<PollFetch> fetches) {
        BatchResult total = BatchResult.empty();
        for (int i = 0; i < fetches.size(); i++) {
            PollFetch fetch = fetches.get(i);
            JsonNode response;
            try {
                response = fetch.response().get();
            } catch (CancellationException e) {
                log.info("Poll cycle aborted: fetch cancelled, kind={}", fetch.kind());
                cancelFrom(fetches, i);
                return total;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("Poll cycle interrupted: kind={}", fetch.kind());
                cancelFrom(fetches, i);
                return total;
            } catch (ExecutionException e) {
                handleFetchFailure(fetch, e.getCause());
                continue;
            }

            if (!running.get()) {
                log.info("Poll cycle aborted: scheduler stopped");
                cancelFrom(fetches, i);
                return total;
            }
            RawMessage raw = RawMessage.poll(fetch.kind(), response, fetch.tradingPair());
            total.merge(reconciliationEngine.onPollSnapshot(raw));
        }
        return total;
    }

    private void handleFetchFailure(PollFetch fetch, Throwable cause) {
        if (cause instanceof OrderNotFoundOnExchangeException && fetch.clientOrderId() != null) {
            reconciliationEngine.onOrderNotFound(fetch.clientOrderId(), cause.getMessage());
            return;
        }
        reconciliationMetrics.recordPollFetchFailure(fetch.kind());
        if (cause instanceof BrokerException brokerException) {
            log.warn(
                    "Poll fetch failed, retrying next cycle: kind={}, errorKind={}, error={}",
                    fetch.kind(),
                    brokerException.getKind(),
                    cause.getMessage());
        } else {
            log.error("Poll fetch failed unexpectedly: kind={}", fetch.kind(), cause);
        }
    }

    private static void cancelFrom(List<PollFetch> fetches, int index) {
        for (int i = index; i < fetches.size(); i++) {
            fetches.get(i).response().cancel(true);
        }
    }

    private record PollFetch(
            MessageKind kind, CompletableFuture<JsonNode> response, String clientOrderId, String tradingPair) {}
}
