package com.perpconnector.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.perpconnector.broker.StreamChannels;
import com.perpconnector.broker.UserEventStream;
import com.perpconnector.config.ConnectorProperties;
import com.perpconnector.domain.enums.MessageKind;
import com.perpconnector.domain.model.BatchResult;
import com.perpconnector.domain.update.RawMessage;
import com.perpconnector.observability.ReconciliationMetrics;
import com.perpconnector.reconciliation.ReconciliationEngine;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Dedicated consumer thread that drains the private user stream and feeds each message to
 * the {@link ReconciliationEngine}.
 *
 * <p>Blocks on {@link UserEventStream#take()}. A message on an unknown channel, a message
 * without data, or any error while processing one message is logged and the loop moves on.
 * If the stream itself fails to yield a message the loop pauses briefly and listens again.
 * {@link #stop()} interrupts the thread; a message already being applied finishes first.
 */
@Component
public class UserStreamListener implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(UserStreamListener.class);

    private final UserEventStream userEventStream;
    private final StreamChannels streamChannels;
    private final ReconciliationEngine reconciliationEngine;
    private final ReconciliationMetrics reconciliationMetrics;
    private final ConnectorProperties connectorProperties;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private Thread listenerThread;

    public UserStreamListener(
            UserEventStream userEventStream,
            StreamChannels streamChannels,
            ReconciliationEngine reconciliationEngine,
            ReconciliationMetrics reconciliationMetrics,
            ConnectorProperties connectorProperties) {
        this.userEventStream = userEventStream;
        this.streamChannels = streamChannels;
        this.reconciliationEngine = reconciliationEngine;
        this.reconciliationMetrics = reconciliationMetrics;
        this.connectorProperties = connectorProperties;
    }

    @Override
    public void start() {
        if (running.compareAndSet(false, true)) {
            listenerThread = new Thread(this::listenLoop, "user-stream-listener");
            listenerThread.setDaemon(true);
            listenerThread.start();
            log.info("UserStreamListener started: channels={}", streamChannels.all().keySet());
        }
    }

    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            if (listenerThread != null) {
                listenerThread.interrupt();
            }
            log.info("UserStreamListener stopping");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // Listen before the poll scheduler starts so stream updates are not missed
        return -10;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    private void listenLoop() {
        ConnectorProperties.Stream config = connectorProperties.getStream();
        while (running.get()) {
            JsonNode message;
            try {
                message = userEventStream.take();
            } catch (InterruptedException e) {
                if (!running.get()) {
                    log.info("UserStreamListener interrupted during shutdown");
                    Thread.currentThread().interrupt();
                    break;
                }
                log.warn("UserStreamListener interrupted unexpectedly, resuming");
                continue;
            } catch (RuntimeException e) {
                log.warn("User stream read failed, retrying in {}: {}", config.getFetchRetryDelay(), e.getMessage());
                if (!pause(config.getFetchRetryDelay())) {
                    break;
                }
                continue;
            }

            try {
                processMessage(message);
            } catch (RuntimeException e) {
                reconciliationMetrics.recordStreamFailure();
                log.error("Unexpected error processing user stream message, pausing {}", config.getErrorPause(), e);
                if (!pause(config.getErrorPause())) {
                    break;
                }
            }
        }
        log.info("UserStreamListener stopped");
    }

    /**
     * Routes one stream envelope ({@code {"channel": ..., "data": [...]}}) to the engine.
     *
     * @return per-outcome counts; empty when the message was dropped
     */
    public BatchResult processMessage(JsonNode message) {
        String channel = message.path("channel").asText(null);
        Optional<MessageKind> kind = streamChannels.kindOf(channel);
        if (kind.isEmpty()) {
            reconciliationMetrics.recordStreamFailure();
            log.error("Unknown user stream channel: channel={}", channel);
            return BatchResult.empty();
        }

        JsonNode data = message.get("data");
        if (data == null || data.isNull()) {
            reconciliationMetrics.recordStreamFailure();
            log.warn("Malformed user stream message without data: channel={}", channel);
            return BatchResult.empty();
        }

        BatchResult result = reconciliationEngine.onStreamEvent(RawMessage.stream(kind.get(), data));
        log.debug("User stream message processed: channel={}, result={}", channel, result);
        return result;
    }

    /** Sleeps for {@code delay}; false if interrupted while stopping. */
    private boolean pause(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            if (!running.get()) {
                Thread.currentThread().interrupt();
                return false;
            }
            return true;
        }
    }
}
