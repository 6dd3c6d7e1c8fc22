package com.perpconnector.broker;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Unbounded source of raw account events from the exchange's private stream. Each message
 * is a {@code {"channel": ..., "data": [...]}} envelope.
 */
public interface UserEventStream {

    /**
     * Blocks until the next message is available.
     *
     * @throws InterruptedException when the consuming thread is cancelled
     */
    JsonNode take() throws InterruptedException;
}
