package com.perpconnector.broker;

import java.time.Instant;

/** Exchange acknowledgement of a create-order request. */
public record OrderAck(String exchangeOrderId, Instant acceptedAt) {}
