package com.perpconnector.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.perpconnector.broker.ExchangeGateway;
import com.perpconnector.broker.InstrumentSymbolMapper;
import com.perpconnector.broker.OrderAck;
import com.perpconnector.broker.StreamChannels;
import com.perpconnector.broker.UserEventStream;
import com.perpconnector.config.ConnectorProperties;
import com.perpconnector.domain.enums.OrderSide;
import com.perpconnector.domain.enums.OrderState;
import com.perpconnector.domain.enums.OrderType;
import com.perpconnector.domain.model.FundingPayment;
import com.perpconnector.domain.model.Order;
import com.perpconnector.event.EventPublisherHelper;
import com.perpconnector.event.FundingPaymentEvent;
import com.perpconnector.event.OrderEvent;
import com.perpconnector.event.OrderEventType;
import com.perpconnector.ledger.PositionBalanceLedger;
import com.perpconnector.normalizer.EventNormalizer;
import com.perpconnector.observability.ReconciliationMetrics;
import com.perpconnector.oms.ClientOrderIdGenerator;
import com.perpconnector.oms.OrderPlacementService;
import com.perpconnector.oms.OrderRegistry;
import com.perpconnector.oms.OrderRequest;
import com.perpconnector.polling.PollScheduler;
import com.perpconnector.reconciliation.ReconciliationEngine;
import com.perpconnector.stream.UserStreamListener;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;

/**
 * End-to-end reconciliation flow: real placement service, stream listener, poll scheduler,
 * normalizer, engine, registry and ledger, with only the exchange transport mocked.
 * Executors run on the calling thread.
 */
class ReconciliationFlowIntegrationTest {

    private static final Instant T0 = Instant.parse("2024-06-01T00:00:00Z");
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ExchangeGateway exchangeGateway;
    private ApplicationEventPublisher applicationEventPublisher;
    private OrderRegistry orderRegistry;
    private PositionBalanceLedger ledger;
    private OrderPlacementService orderPlacementService;
    private UserStreamListener userStreamListener;
    private PollScheduler pollScheduler;

    @BeforeEach
    void setUp() {
        ConnectorProperties connectorProperties = new ConnectorProperties();
        connectorProperties.setTradingPairs(List.of("ETH-USDC"));
        Clock clock = Clock.fixed(T0, ZoneOffset.UTC);

        exchangeGateway = mock(ExchangeGateway.class);
        applicationEventPublisher = mock(ApplicationEventPublisher.class);
        EventPublisherHelper eventPublisherHelper = new EventPublisherHelper(applicationEventPublisher);
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

        InstrumentSymbolMapper symbolMapper = new InstrumentSymbolMapper(connectorProperties);
        symbolMapper.refresh(json("{'result':{'instruments':["
                + "{'instrument_name':'ETH-PERP','is_active':true},"
                + "{'instrument_name':'X-PERP','is_active':true}]}}"));

        orderRegistry = new OrderRegistry(connectorProperties, clock);
        ledger = new PositionBalanceLedger();
        ReconciliationMetrics metrics = new ReconciliationMetrics(meterRegistry, orderRegistry);
        ReconciliationEngine engine = new ReconciliationEngine(
                new EventNormalizer(symbolMapper, connectorProperties, clock),
                orderRegistry,
                ledger,
                eventPublisherHelper,
                metrics);

        orderPlacementService = new OrderPlacementService(
                orderRegistry,
                new ClientOrderIdGenerator(connectorProperties, clock),
                exchangeGateway,
                symbolMapper,
                eventPublisherHelper,
                Runnable::run,
                clock);
        userStreamListener = new UserStreamListener(
                mock(UserEventStream.class),
                new StreamChannels(connectorProperties),
                engine,
                metrics,
                connectorProperties);
        pollScheduler = new PollScheduler(
                exchangeGateway, engine, orderRegistry, symbolMapper, metrics, connectorProperties, Runnable::run, clock);
        pollScheduler.start();

        when(exchangeGateway.fetchBalances()).thenReturn(json("{'result':{'collaterals':[]}}"));
        when(exchangeGateway.fetchPositions()).thenReturn(json("{'result':{'positions':[]}}"));
    }

    private static JsonNode json(String text) {
        try {
            return MAPPER.readTree(text.replace('\'', '"'));
        } catch (Exception e) {
            throw new IllegalArgumentException(e);
        }
    }

    private static String trade(String tradeId, String amount, long timestamp) {
        return "{'trade_id':'" + tradeId + "','order_id':'E1','instrument_name':'ETH-PERP','trade_price':'3000',"
                + "'trade_amount':'" + amount + "','trade_fee':'0.3','timestamp':" + timestamp + "}";
    }

    private List<ApplicationEvent> publishedEvents() {
        ArgumentCaptor<ApplicationEvent> captor = ArgumentCaptor.forClass(ApplicationEvent.class);
        verify(applicationEventPublisher, atLeastOnce()).publishEvent(captor.capture());
        return captor.getAllValues();
    }

    private String submitOrder() throws Exception {
        when(exchangeGateway.submitOrder(any())).thenReturn(new OrderAck("E1", T0));
        Order accepted = orderPlacementService
                .submit(OrderRequest.builder()
                        .tradingPair("ETH-USDC")
                        .side(OrderSide.BUY)
                        .type(OrderType.LIMIT)
                        .amount(new BigDecimal("1.0"))
                        .price(new BigDecimal("3000"))
                        .build())
                .get();
        return accepted.getClientOrderId();
    }

    @Test
    @DisplayName("Fill delivered by stream and poll is counted once and the order fills exactly once")
    void orderLifecycleAcrossChannels() throws Exception {
        String clientOrderId = submitOrder();
        Order opened = orderRegistry.getOrder(clientOrderId).orElseThrow();
        assertThat(opened.getState()).isEqualTo(OrderState.OPEN);
        assertThat(opened.getExchangeOrderId()).isEqualTo("E1");

        // Stream: first half
        userStreamListener.processMessage(json("{'channel':'0.trades','data':[" + trade("T1", "0.5", 1717200001000L) + "]}"));
        Order partial = orderRegistry.getOrder(clientOrderId).orElseThrow();
        assertThat(partial.getState()).isEqualTo(OrderState.PARTIALLY_FILLED);
        assertThat(partial.getFilledAmount()).isEqualByComparingTo("0.5");

        // Poll: same trade again plus an older "open" status
        when(exchangeGateway.fetchOrderStatus("E1")).thenReturn(json("{'result':{'label':'" + clientOrderId
                + "','order_id':'E1','instrument_name':'ETH-PERP','order_status':'open',"
                + "'last_update_timestamp':1717200000500}}"));
        when(exchangeGateway.fetchTradeHistory())
                .thenReturn(json("{'result':{'trades':[" + trade("T1", "0.5", 1717200001000L) + "]}}"));
        pollScheduler.runShortCycle();

        Order afterPoll = orderRegistry.getOrder(clientOrderId).orElseThrow();
        assertThat(afterPoll.getFilledAmount()).isEqualByComparingTo("0.5");
        assertThat(afterPoll.getState()).isEqualTo(OrderState.PARTIALLY_FILLED);

        // Stream: second half
        userStreamListener.processMessage(json("{'channel':'0.trades','data':[" + trade("T2", "0.5", 1717200002000L) + "]}"));
        Order filled = orderRegistry.getOrder(clientOrderId).orElseThrow();
        assertThat(filled.getState()).isEqualTo(OrderState.FILLED);
        assertThat(filled.getFilledAmount()).isEqualByComparingTo("1.0");
        assertThat(orderRegistry.getActiveOrders()).isEmpty();
        assertThat(orderRegistry.getFills(clientOrderId)).hasSize(2);

        // Stream: the exchange's own "filled" status arrives last and changes nothing
        userStreamListener.processMessage(json("{'channel':'0.orders','data':[{'label':'" + clientOrderId
                + "','order_id':'E1','instrument_name':'ETH-PERP','order_status':'filled',"
                + "'last_update_timestamp':1717200002500}]}"));

        List<OrderEventType> eventTypes = publishedEvents().stream()
                .filter(OrderEvent.class::isInstance)
                .map(e -> ((OrderEvent) e).getEventType())
                .toList();
        assertThat(eventTypes)
                .containsExactly(
                        OrderEventType.CREATED,
                        OrderEventType.OPENED,
                        OrderEventType.PARTIALLY_FILLED,
                        OrderEventType.FILLED);
    }

    @Test
    @DisplayName("Older poll status does not overwrite a newer stream status")
    void newerStreamStatusWins() throws Exception {
        String clientOrderId = submitOrder();

        userStreamListener.processMessage(json("{'channel':'0.orders','data':[{'label':'" + clientOrderId
                + "','order_id':'E1','instrument_name':'ETH-PERP','order_status':'cancelled',"
                + "'last_update_timestamp':1717200002000}]}"));
        when(exchangeGateway.fetchOrderStatus("E1")).thenReturn(json("{'result':{'label':'" + clientOrderId
                + "','order_id':'E1','instrument_name':'ETH-PERP','order_status':'open',"
                + "'last_update_timestamp':1717200001000}}"));
        pollScheduler.runShortCycle();

        assertThat(orderRegistry.getOrder(clientOrderId).orElseThrow().getState()).isEqualTo(OrderState.CANCELED);
    }

    @Test
    @DisplayName("Position missing from the next snapshot disappears from the ledger")
    void positionRemovedBySnapshot() {
        when(exchangeGateway.fetchPositions())
                .thenReturn(json("{'result':{'positions':[{'instrument_name':'X-PERP','amount':'2','average_price':'10'}]}}"))
                .thenReturn(json("{'result':{'positions':[]}}"));

        pollScheduler.runShortCycle();
        assertThat(ledger.getPosition("X-USDC")).isPresent();
        assertThat(ledger.getPosition("X-USDC").orElseThrow().getAmount()).isEqualByComparingTo("2");

        pollScheduler.runShortCycle();
        assertThat(ledger.getPosition("X-USDC")).isEmpty();
    }

    @Test
    @DisplayName("Balance snapshot lacking an asset removes it")
    void balanceRemovedBySnapshot() {
        when(exchangeGateway.fetchBalances())
                .thenReturn(json("{'result':{'collaterals':[{'asset_name':'USDC','amount':'100'},{'asset_name':'ETH','amount':'1'}]}}"))
                .thenReturn(json("{'result':{'collaterals':[{'asset_name':'USDC','amount':'90'}]}}"));

        pollScheduler.runShortCycle();
        pollScheduler.runShortCycle();

        assertThat(ledger.getBalances()).containsOnlyKeys("USDC");
    }

    @Test
    @DisplayName("Persistent poll failures keep the last known snapshot")
    void staleButPresent() {
        when(exchangeGateway.fetchBalances())
                .thenReturn(json("{'result':{'collaterals':[{'asset_name':'USDC','amount':'100'}]}}"))
                .thenReturn(json("{'error':{'code':-32000,'message':'Internal error'}}"));

        pollScheduler.runShortCycle();
        pollScheduler.runShortCycle();

        assertThat(ledger.getBalance("USDC")).isPresent();
    }

    @Test
    @DisplayName("Zero funding payment is reported as no payment")
    void zeroFundingIsNoPayment() {
        when(exchangeGateway.fetchFundingHistory(any(), anyLong()))
                .thenReturn(json("{'result':{'events':[{'timestamp':1717196400000,'funding':'0','pnl':'0.0001'}]}}"));

        pollScheduler.runFundingCycle();

        FundingPayment last = ledger.getLastFundingPayment("ETH-USDC");
        assertThat(last.timestamp()).isZero();
        assertThat(last.fundingRate()).isEqualByComparingTo("-1");
        assertThat(last.payment()).isEqualByComparingTo("-1");
    }

    @Test
    @DisplayName("Real funding payment is recorded and published once")
    void fundingPaymentPublishedOnce() {
        when(exchangeGateway.fetchFundingHistory(any(), anyLong()))
                .thenReturn(json("{'result':{'events':[{'timestamp':1717196400000,'funding':'-1.25','pnl':'0.0002'}]}}"));

        pollScheduler.runFundingCycle();
        pollScheduler.runFundingCycle();

        assertThat(ledger.getLastFundingPayment("ETH-USDC").payment()).isEqualByComparingTo("-1.25");
        assertThat(publishedEvents().stream().filter(FundingPaymentEvent.class::isInstance)).hasSize(1);
    }
}
