package com.perpconnector.broker;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * In-process hand-off between the WebSocket transport (producer, calls {@link #publish})
 * and the {@link com.perpconnector.stream.UserStreamListener} (consumer, calls {@link #take}).
 */
@Component
public class QueueUserEventStream implements UserEventStream {

    private static final Logger log = LoggerFactory.getLogger(QueueUserEventStream.class);

    private final BlockingQueue<JsonNode> queue = new LinkedBlockingQueue<>();

    /** Enqueues a raw message received from the exchange. Never blocks. */
    public void publish(JsonNode message) {
        if (message == null) {
            log.warn("Dropping null user stream message");
            return;
        }
        queue.offer(message);
    }

    @Override
    public JsonNode take() throws InterruptedException {
        return queue.take();
    }
}
