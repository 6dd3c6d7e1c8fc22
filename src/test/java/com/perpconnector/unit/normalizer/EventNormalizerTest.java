package com.perpconnector.unit.normalizer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.perpconnector.broker.SymbolMapper;
import com.perpconnector.config.ConnectorProperties;
import com.perpconnector.domain.enums.MessageKind;
import com.perpconnector.domain.enums.OrderState;
import com.perpconnector.domain.enums.PositionSide;
import com.perpconnector.domain.enums.UpdateSource;
import com.perpconnector.domain.model.Balance;
import com.perpconnector.domain.model.FundingPayment;
import com.perpconnector.domain.model.Position;
import com.perpconnector.domain.update.BalanceSnapshot;
import com.perpconnector.domain.update.CanonicalUpdate;
import com.perpconnector.domain.update.FillUpdate;
import com.perpconnector.domain.update.FundingUpdate;
import com.perpconnector.domain.update.OrderStatusUpdate;
import com.perpconnector.domain.update.PositionSnapshot;
import com.perpconnector.domain.update.RawMessage;
import com.perpconnector.exception.NormalizationException;
import com.perpconnector.normalizer.EventNormalizer;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for EventNormalizer covering each payload kind, error envelopes, missing
 * fields and unresolved instruments.
 */
class EventNormalizerTest {

    private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private EventNormalizer eventNormalizer;

    @BeforeEach
    void setUp() {
        SymbolMapper symbolMapper = mock(SymbolMapper.class);
        when(symbolMapper.toCanonicalPair("ETH-PERP")).thenReturn(Optional.of("ETH-USDC"));
        when(symbolMapper.toCanonicalPair("BTC-PERP")).thenReturn(Optional.of("BTC-USDC"));

        eventNormalizer =
                new EventNormalizer(symbolMapper, new ConnectorProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static JsonNode json(String text) {
        try {
            return MAPPER.readTree(text.replace('\'', '"'));
        } catch (Exception e) {
            throw new IllegalArgumentException(e);
        }
    }

    @Nested
    @DisplayName("Orders")
    class Orders {

        @Test
        @DisplayName("Stream order data maps to status updates")
        void streamOrders() {
            JsonNode data = json("[{'label':'C1','order_id':'E1','instrument_name':'ETH-PERP',"
                    + "'order_status':'open','last_update_timestamp':1717200001000},"
                    + "{'label':'C2','order_id':'E2','instrument_name':'ETH-PERP',"
                    + "'order_status':'expired','last_update_timestamp':1717200002000}]");

            List<CanonicalUpdate> updates = eventNormalizer.normalize(RawMessage.stream(MessageKind.ORDER_STATUS, data));

            assertThat(updates).hasSize(2);
            OrderStatusUpdate first = (OrderStatusUpdate) updates.get(0);
            assertThat(first.clientOrderId()).isEqualTo("C1");
            assertThat(first.exchangeOrderId()).isEqualTo("E1");
            assertThat(first.tradingPair()).isEqualTo("ETH-USDC");
            assertThat(first.newState()).isEqualTo(OrderState.OPEN);
            assertThat(first.timestamp()).isEqualTo(Instant.ofEpochMilli(1717200001000L));
            assertThat(first.source()).isEqualTo(UpdateSource.STREAM);
            assertThat(((OrderStatusUpdate) updates.get(1)).newState()).isEqualTo(OrderState.CANCELED);
        }

        @Test
        @DisplayName("Poll order result maps through the result envelope")
        void pollOrder() {
            JsonNode response = json("{'result':{'label':'C1','order_id':'E1','instrument_name':'ETH-PERP',"
                    + "'order_status':'rejected','last_update_timestamp':1717200001000}}");

            List<CanonicalUpdate> updates = eventNormalizer.normalize(RawMessage.poll(MessageKind.ORDER_STATUS, response));

            assertThat(updates).singleElement().satisfies(update -> {
                assertThat(((OrderStatusUpdate) update).newState()).isEqualTo(OrderState.FAILED);
                assertThat(update.source()).isEqualTo(UpdateSource.POLL);
            });
        }

        @Test
        @DisplayName("Unknown status and unresolved instrument are dropped, the rest is kept")
        void dropsBadElements() {
            JsonNode data = json("[{'label':'C1','order_id':'E1','instrument_name':'ETH-PERP','order_status':'weird'},"
                    + "{'label':'C2','order_id':'E2','instrument_name':'DOGE-PERP','order_status':'open'},"
                    + "{'label':'C3','order_id':'E3','instrument_name':'BTC-PERP','order_status':'filled'}]");

            List<CanonicalUpdate> updates = eventNormalizer.normalize(RawMessage.stream(MessageKind.ORDER_STATUS, data));

            assertThat(updates).singleElement().satisfies(update -> {
                assertThat(((OrderStatusUpdate) update).clientOrderId()).isEqualTo("C3");
                assertThat(((OrderStatusUpdate) update).newState()).isEqualTo(OrderState.FILLED);
            });
        }

        @Test
        @DisplayName("Missing timestamp falls back to receipt time")
        void missingTimestamp() {
            JsonNode data = json("[{'label':'C1','order_id':'E1','instrument_name':'ETH-PERP','order_status':'open'}]");

            OrderStatusUpdate update = (OrderStatusUpdate)
                    eventNormalizer.normalize(RawMessage.stream(MessageKind.ORDER_STATUS, data)).get(0);

            assertThat(update.timestamp()).isEqualTo(NOW);
        }
    }

    @Nested
    @DisplayName("Trades")
    class Trades {

        @Test
        @DisplayName("Trade maps to a fill with exchange quote amount and quote-asset fee")
        void tradeToFill() {
            JsonNode data = json("[{'trade_id':'T1','order_id':'E1','label':'C1','instrument_name':'ETH-PERP',"
                    + "'trade_price':'3000.5','trade_amount':'0.5','trade_quote_amount':'1500.20',"
                    + "'trade_fee':'0.75','timestamp':1717200003000}]");

            FillUpdate fill = (FillUpdate) eventNormalizer.normalize(RawMessage.stream(MessageKind.TRADE, data)).get(0);

            assertThat(fill.tradeId()).isEqualTo("T1");
            assertThat(fill.clientOrderId()).isEqualTo("C1");
            assertThat(fill.exchangeOrderId()).isEqualTo("E1");
            assertThat(fill.fillPrice()).isEqualByComparingTo("3000.5");
            assertThat(fill.fillBaseAmount()).isEqualByComparingTo("0.5");
            assertThat(fill.fillQuoteAmount()).isEqualByComparingTo("1500.20");
            assertThat(fill.fee().amount()).isEqualByComparingTo("0.75");
            assertThat(fill.fee().asset()).isEqualTo("USDC");
            assertThat(fill.fillTimestamp()).isEqualTo(Instant.ofEpochMilli(1717200003000L));
        }

        @Test
        @DisplayName("Quote amount is computed only when the exchange omits it")
        void quoteFallback() {
            JsonNode response = json("{'result':{'trades':[{'trade_id':'T1','order_id':'E1','instrument_name':'ETH-PERP',"
                    + "'trade_price':3000,'trade_amount':0.25,'timestamp':1717200003000}]}}");

            FillUpdate fill = (FillUpdate) eventNormalizer.normalize(RawMessage.poll(MessageKind.TRADE, response)).get(0);

            assertThat(fill.fillQuoteAmount()).isEqualByComparingTo("750");
            assertThat(fill.fee().amount()).isEqualByComparingTo("0");
            assertThat(fill.clientOrderId()).isNull();
        }

        @Test
        @DisplayName("Trade without trade_id is dropped")
        void missingTradeId() {
            JsonNode data = json("[{'order_id':'E1','instrument_name':'ETH-PERP','trade_price':1,'trade_amount':1}]");

            assertThat(eventNormalizer.normalize(RawMessage.stream(MessageKind.TRADE, data))).isEmpty();
        }
    }

    @Nested
    @DisplayName("Snapshots")
    class Snapshots {

        @Test
        @DisplayName("Positions take side from the sign and skip zero amounts")
        void positions() {
            JsonNode response = json("{'result':{'positions':["
                    + "{'instrument_name':'ETH-PERP','amount':'-2','average_price':'3000','mark_price':'3010',"
                    + "'unrealized_pnl':'-20','leverage':'5'},"
                    + "{'instrument_name':'BTC-PERP','amount':'0','average_price':'60000'},"
                    + "{'instrument_name':'BTC-PERP','amount':'0.1','index_price':'61000'}]}}");

            PositionSnapshot snapshot = (PositionSnapshot)
                    eventNormalizer.normalize(RawMessage.poll(MessageKind.POSITION_SNAPSHOT, response)).get(0);

            assertThat(snapshot.positions()).hasSize(2);
            Position eth = snapshot.positions().get(0);
            assertThat(eth.getSide()).isEqualTo(PositionSide.SHORT);
            assertThat(eth.getAmount()).isEqualByComparingTo("-2");
            assertThat(eth.getLeverage()).isEqualByComparingTo("5");
            Position btc = snapshot.positions().get(1);
            assertThat(btc.getSide()).isEqualTo(PositionSide.LONG);
            assertThat(btc.getEntryPrice()).isEqualByComparingTo("61000");
            assertThat(btc.getLeverage()).isNull();
        }

        @Test
        @DisplayName("Balances default available to the total amount")
        void balances() {
            JsonNode response = json("{'result':{'collaterals':["
                    + "{'asset_name':'USDC','amount':'1000','available_amount':'800'},"
                    + "{'asset_name':'ETH','amount':'1.5'}]}}");

            BalanceSnapshot snapshot = (BalanceSnapshot)
                    eventNormalizer.normalize(RawMessage.poll(MessageKind.BALANCE_SNAPSHOT, response)).get(0);

            assertThat(snapshot.balances()).extracting(Balance::getAsset).containsExactly("USDC", "ETH");
            assertThat(snapshot.balances().get(0).getAvailable()).isEqualByComparingTo("800");
            assertThat(snapshot.balances().get(1).getAvailable()).isEqualByComparingTo("1.5");
        }

        @Test
        @DisplayName("Error envelope raises a normalization failure carrying the exchange message")
        void errorEnvelope() {
            JsonNode response = json("{'error':{'code':-32000,'message':'Rate limit exceeded'}}");

            assertThatThrownBy(() -> eventNormalizer.normalize(RawMessage.poll(MessageKind.BALANCE_SNAPSHOT, response)))
                    .isInstanceOf(NormalizationException.class)
                    .extracting(e -> ((NormalizationException) e).getExchangeMessage())
                    .isEqualTo("Rate limit exceeded");
        }
    }

    @Nested
    @DisplayName("Funding")
    class Funding {

        @Test
        @DisplayName("Latest event becomes the funding payment")
        void latestEvent() {
            JsonNode response = json("{'result':{'events':["
                    + "{'timestamp':1717200000000,'funding':'-0.42','pnl':'0.0001'},"
                    + "{'timestamp':1717196400000,'funding':'-0.40','pnl':'0.0001'}]}}");

            FundingUpdate update = (FundingUpdate) eventNormalizer
                    .normalize(RawMessage.poll(MessageKind.FUNDING_EVENT, response, "ETH-USDC"))
                    .get(0);

            FundingPayment payment = update.payment();
            assertThat(payment.tradingPair()).isEqualTo("ETH-USDC");
            assertThat(payment.timestamp()).isEqualTo(1717200000000L);
            assertThat(payment.payment()).isEqualByComparingTo("-0.42");
            assertThat(payment.fundingRate()).isEqualByComparingTo("0.0001");
            assertThat(payment.isNone()).isFalse();
        }

        @Test
        @DisplayName("Zero payment is reported as the no-payment sentinel")
        void zeroPayment() {
            JsonNode response = json("{'result':{'events':[{'timestamp':1717200000000,'funding':'0','pnl':'0.0001'}]}}");

            FundingUpdate update = (FundingUpdate) eventNormalizer
                    .normalize(RawMessage.poll(MessageKind.FUNDING_EVENT, response, "ETH-USDC"))
                    .get(0);

            assertThat(update.payment().isNone()).isTrue();
            assertThat(update.payment().timestamp()).isZero();
            assertThat(update.payment().fundingRate()).isEqualByComparingTo("-1");
            assertThat(update.payment().payment()).isEqualByComparingTo("-1");
        }

        @Test
        @DisplayName("Empty event list is the no-payment sentinel")
        void emptyEvents() {
            JsonNode response = json("{'result':{'events':[]}}");

            FundingUpdate update = (FundingUpdate) eventNormalizer
                    .normalize(RawMessage.poll(MessageKind.FUNDING_EVENT, response, "BTC-USDC"))
                    .get(0);

            assertThat(update.payment()).isEqualTo(FundingPayment.none("BTC-USDC"));
        }
    }
}
