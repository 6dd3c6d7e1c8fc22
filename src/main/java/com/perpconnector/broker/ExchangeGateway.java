package com.perpconnector.broker;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Transport contract for every exchange request the connector makes. Request signing,
 * URL construction and rate limiting live behind this interface; nothing in the
 * reconciliation core talks HTTP directly.
 *
 * <p>Fetch methods return the raw response body. The body may itself be an exchange error
 * envelope ({@code {"error": {...}}}); that is left to the
 * {@link com.perpconnector.normalizer.EventNormalizer}. Failures the transport can classify
 * itself are thrown as {@link com.perpconnector.exception.BrokerException} subclasses.
 *
 * <p>Every method may block on the network. Callers must not hold registry or ledger
 * locks while calling it.
 */
public interface ExchangeGateway {

    // ---- Orders ----

    /**
     * Sends a create-order request.
     *
     * @return exchange order id and acceptance time
     * @throws com.perpconnector.exception.ExchangeRejectionException if the exchange refuses the order
     * @throws com.perpconnector.exception.TransientNetworkException  if the outcome is unknown
     */
    OrderAck submitOrder(SubmitOrderRequest request);

    /**
     * Cancels an open order.
     *
     * @return true if the exchange reports the order cancelled
     * @throws com.perpconnector.exception.OrderNotFoundOnExchangeException if the order is already gone
     */
    boolean cancelOrder(String exchangeOrderId, String exchangeSymbol);

    /** Current state of one order. */
    JsonNode fetchOrderStatus(String exchangeOrderId);

    /** Recent trades of the subaccount, across all instruments. */
    JsonNode fetchTradeHistory();

    // ---- Account ----

    /** Full collateral/balance list of the subaccount. */
    JsonNode fetchBalances();

    /** Full open-position list of the subaccount. */
    JsonNode fetchPositions();

    /**
     * Funding events for one instrument, newest first.
     *
     * @param startTimestampMs earliest settlement to include, epoch milliseconds
     */
    JsonNode fetchFundingHistory(String exchangeSymbol, long startTimestampMs);

    // ---- Metadata ----

    /** Tradable perpetual instruments. */
    JsonNode fetchInstruments();
}
