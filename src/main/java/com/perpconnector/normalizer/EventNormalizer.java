package com.perpconnector.normalizer;

import com.fasterxml.jackson.databind.JsonNode;
import com.perpconnector.broker.SymbolMapper;
import com.perpconnector.config.ConnectorProperties;
import com.perpconnector.domain.enums.OrderState;
import com.perpconnector.domain.enums.PositionSide;
import com.perpconnector.domain.enums.UpdateSource;
import com.perpconnector.domain.model.Balance;
import com.perpconnector.domain.model.FundingPayment;
import com.perpconnector.domain.model.Position;
import com.perpconnector.domain.model.TradeFee;
import com.perpconnector.domain.update.BalanceSnapshot;
import com.perpconnector.domain.update.CanonicalUpdate;
import com.perpconnector.domain.update.FillUpdate;
import com.perpconnector.domain.update.FundingUpdate;
import com.perpconnector.domain.update.OrderStatusUpdate;
import com.perpconnector.domain.update.PositionSnapshot;
import com.perpconnector.domain.update.RawMessage;
import com.perpconnector.exception.NormalizationException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Converts raw exchange payloads from both channels into canonical updates.
 *
 * <p>Payload shapes:
 * <ul>
 *   <li>Stream ORDER_STATUS / TRADE: the envelope's {@code data} array of order or trade objects</li>
 *   <li>Poll responses: {@code {"result": ...}} or an error envelope {@code {"error": {"message": ...}}}</li>
 * </ul>
 *
 * <p>An error envelope is never mapped to an update: it is raised as a
 * {@link NormalizationException} carrying the exchange's message. Within a well-formed payload,
 * individual elements that lack required fields or whose instrument cannot be resolved are
 * dropped with a warning and the rest of the payload is still normalized.
 */
@Component
public class EventNormalizer {

    private static final Logger log = LoggerFactory.getLogger(EventNormalizer.class);

    /** Exchange order_status values. Anything else is dropped as unknown. */
    static final Map<String, OrderState> ORDER_STATES = Map.of(
            "open", OrderState.OPEN,
            "untriggered", OrderState.OPEN,
            "filled", OrderState.FILLED,
            "cancelled", OrderState.CANCELED,
            "expired", OrderState.CANCELED,
            "rejected", OrderState.FAILED);

    private final SymbolMapper symbolMapper;
    private final ConnectorProperties connectorProperties;
    private final Clock clock;

    public EventNormalizer(SymbolMapper symbolMapper, ConnectorProperties connectorProperties, Clock clock) {
        this.symbolMapper = symbolMapper;
        this.connectorProperties = connectorProperties;
        this.clock = clock;
    }

    /**
     * Normalizes one raw message into zero or more canonical updates.
     *
     * @throws NormalizationException if the payload is an exchange error envelope or has no usable body
     */
    public List<CanonicalUpdate> normalize(RawMessage message) {
        return switch (message.kind()) {
            case ORDER_STATUS -> List.copyOf(orderUpdates(message));
            case TRADE -> List.copyOf(fillUpdates(message));
            case POSITION_SNAPSHOT -> List.of(positionSnapshot(message));
            case BALANCE_SNAPSHOT -> List.of(balanceSnapshot(message));
            case FUNDING_EVENT -> List.of(fundingUpdate(message));
        };
    }

    // ---- Orders ----

    private List<OrderStatusUpdate> orderUpdates(RawMessage message) {
        JsonNode body = message.source() == UpdateSource.STREAM ? message.payload() : result(message.payload());
        List<OrderStatusUpdate> updates = new ArrayList<>();
        for (JsonNode orderNode : JsonFields.elements(body)) {
            toOrderStatusUpdate(orderNode, message.source()).ifPresent(updates::add);
        }
        return updates;
    }

    Optional<OrderStatusUpdate> toOrderStatusUpdate(JsonNode orderNode, UpdateSource source) {
        String clientOrderId = JsonFields.text(orderNode, "label");
        String exchangeOrderId = JsonFields.text(orderNode, "order_id");
        if (clientOrderId == null && exchangeOrderId == null) {
            log.warn("Dropping order update without label or order_id: source={}, payload={}", source, orderNode);
            return Optional.empty();
        }

        String status = JsonFields.text(orderNode, "order_status");
        OrderState state = status != null ? ORDER_STATES.get(status) : null;
        if (state == null) {
            log.warn("Dropping order update with unknown status: clientOrderId={}, status={}", clientOrderId, status);
            return Optional.empty();
        }

        Optional<String> pair = resolvePair(JsonFields.text(orderNode, "instrument_name"));
        if (pair.isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(new OrderStatusUpdate(
                clientOrderId,
                exchangeOrderId,
                pair.get(),
                state,
                timestampOrNow(orderNode, "last_update_timestamp"),
                source,
                JsonFields.text(orderNode, "cancel_reason")));
    }

    // ---- Trades ----

    private List<FillUpdate> fillUpdates(RawMessage message) {
        JsonNode body = message.source() == UpdateSource.STREAM
                ? message.payload()
                : result(message.payload()).path("trades");
        List<FillUpdate> updates = new ArrayList<>();
        for (JsonNode tradeNode : JsonFields.elements(body)) {
            toFillUpdate(tradeNode, message.source()).ifPresent(updates::add);
        }
        return updates;
    }

    Optional<FillUpdate> toFillUpdate(JsonNode tradeNode, UpdateSource source) {
        String tradeId = JsonFields.text(tradeNode, "trade_id");
        String exchangeOrderId = JsonFields.text(tradeNode, "order_id");
        BigDecimal price = JsonFields.decimal(tradeNode, "trade_price");
        BigDecimal amount = JsonFields.decimal(tradeNode, "trade_amount");
        if (tradeId == null || exchangeOrderId == null || price == null || amount == null) {
            log.warn("Dropping trade missing required fields: source={}, payload={}", source, tradeNode);
            return Optional.empty();
        }

        Optional<String> pair = resolvePair(JsonFields.text(tradeNode, "instrument_name"));
        if (pair.isEmpty()) {
            return Optional.empty();
        }

        BigDecimal quoteAmount = JsonFields.decimal(tradeNode, "trade_quote_amount");
        if (quoteAmount == null) {
            quoteAmount = price.multiply(amount);
        }
        BigDecimal feeAmount = JsonFields.decimal(tradeNode, "trade_fee");
        String feeAsset = quoteOf(pair.get());

        return Optional.of(new FillUpdate(
                tradeId,
                JsonFields.text(tradeNode, "label"),
                exchangeOrderId,
                pair.get(),
                price,
                amount,
                quoteAmount,
                feeAmount != null ? new TradeFee(feeAmount, feeAsset) : TradeFee.zero(feeAsset),
                timestampOrNow(tradeNode, "timestamp"),
                source));
    }

    // ---- Positions ----

    private PositionSnapshot positionSnapshot(RawMessage message) {
        Instant now = clock.instant();
        List<Position> positions = new ArrayList<>();
        for (JsonNode positionNode : JsonFields.elements(result(message.payload()).path("positions"))) {
            BigDecimal amount = JsonFields.decimal(positionNode, "amount");
            if (amount == null || amount.signum() == 0) {
                continue;
            }
            Optional<String> pair = resolvePair(JsonFields.text(positionNode, "instrument_name"));
            if (pair.isEmpty()) {
                continue;
            }
            BigDecimal entryPrice = JsonFields.decimal(positionNode, "average_price");
            if (entryPrice == null) {
                entryPrice = JsonFields.decimal(positionNode, "index_price");
            }
            positions.add(Position.builder()
                    .tradingPair(pair.get())
                    .side(amount.signum() > 0 ? PositionSide.LONG : PositionSide.SHORT)
                    .amount(amount)
                    .entryPrice(entryPrice)
                    .markPrice(JsonFields.decimal(positionNode, "mark_price"))
                    .unrealizedPnl(JsonFields.decimal(positionNode, "unrealized_pnl"))
                    .leverage(JsonFields.decimal(positionNode, "leverage"))
                    .updatedAt(now)
                    .build());
        }
        return new PositionSnapshot(positions, now, message.source());
    }

    // ---- Balances ----

    private BalanceSnapshot balanceSnapshot(RawMessage message) {
        List<Balance> balances = new ArrayList<>();
        for (JsonNode collateral : JsonFields.elements(result(message.payload()).path("collaterals"))) {
            String asset = JsonFields.text(collateral, "asset_name");
            BigDecimal total = JsonFields.decimal(collateral, "amount");
            if (asset == null || total == null) {
                log.warn("Dropping balance entry missing asset_name or amount: {}", collateral);
                continue;
            }
            BigDecimal available = JsonFields.decimal(collateral, "available_amount");
            balances.add(Balance.builder()
                    .asset(asset)
                    .total(total)
                    .available(available != null ? available : total)
                    .build());
        }
        return new BalanceSnapshot(balances, clock.instant(), message.source());
    }

    // ---- Funding ----

    private FundingUpdate fundingUpdate(RawMessage message) {
        String tradingPair = message.tradingPair();
        if (tradingPair == null) {
            throw new NormalizationException("Funding payload has no trading pair", null);
        }
        List<JsonNode> events = JsonFields.elements(result(message.payload()).path("events"));
        if (events.isEmpty()) {
            return new FundingUpdate(FundingPayment.none(tradingPair), message.source());
        }

        // Newest first: only the latest settlement matters
        JsonNode latest = events.get(0);
        BigDecimal payment = JsonFields.decimal(latest, "funding");
        BigDecimal rate = JsonFields.decimal(latest, "pnl");
        Instant timestamp = JsonFields.millis(latest, "timestamp");
        if (payment == null || payment.signum() == 0 || timestamp == null) {
            return new FundingUpdate(FundingPayment.none(tradingPair), message.source());
        }
        return new FundingUpdate(
                new FundingPayment(
                        tradingPair, timestamp.toEpochMilli(), rate != null ? rate : BigDecimal.ZERO, payment),
                message.source());
    }

    // ---- Helpers ----

    /**
     * Unwraps a poll response's {@code result}, raising error envelopes as
     * {@link NormalizationException}.
     */
    JsonNode result(JsonNode response) {
        if (response == null || response.isNull()) {
            throw new NormalizationException("Empty exchange response", null);
        }
        JsonNode error = response.get("error");
        if (error != null && !error.isNull()) {
            String exchangeMessage = JsonFields.text(error, "message");
            throw new NormalizationException(
                    "Exchange returned error: " + (exchangeMessage != null ? exchangeMessage : error.toString()),
                    exchangeMessage != null ? exchangeMessage : error.toString());
        }
        JsonNode result = response.get("result");
        if (result == null || result.isNull()) {
            throw new NormalizationException("Exchange response has no result", null);
        }
        return result;
    }

    private Optional<String> resolvePair(String exchangeSymbol) {
        if (exchangeSymbol == null) {
            log.warn("Dropping update without instrument_name");
            return Optional.empty();
        }
        Optional<String> pair = symbolMapper.toCanonicalPair(exchangeSymbol);
        if (pair.isEmpty()) {
            log.warn("Dropping update for unresolved instrument: {}", exchangeSymbol);
        }
        return pair;
    }

    private String quoteOf(String tradingPair) {
        int dash = tradingPair.lastIndexOf('-');
        return dash >= 0 ? tradingPair.substring(dash + 1) : connectorProperties.getQuoteAsset();
    }

    private Instant timestampOrNow(JsonNode node, String field) {
        Instant timestamp = JsonFields.millis(node, field);
        return timestamp != null ? timestamp : clock.instant();
    }
}
