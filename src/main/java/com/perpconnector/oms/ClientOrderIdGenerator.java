package com.perpconnector.oms;

import com.perpconnector.config.ConnectorProperties;
import com.perpconnector.domain.enums.OrderSide;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HexFormat;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Generates client order ids accepted by the exchange's label field.
 *
 * <p>Raw id format: {@code {brokerId}{B|S}{base_4}{quote_4}{nonce}}, truncated to the
 * configured maximum length. Example: "HBOTBETHUSDC1718000000000001". The nonce is the
 * current time in microseconds, bumped by one whenever two ids are requested within the
 * same microsecond, so it is strictly increasing.
 *
 * <p>The id sent to the exchange is {@code "0x" + md5hex(rawId)}: 34 characters, hex only.
 */
@Component
public class ClientOrderIdGenerator {

    private static final Logger log = LoggerFactory.getLogger(ClientOrderIdGenerator.class);

    private final ConnectorProperties connectorProperties;
    private final Clock clock;

    private final AtomicLong lastNonce = new AtomicLong();

    public ClientOrderIdGenerator(ConnectorProperties connectorProperties, Clock clock) {
        this.connectorProperties = connectorProperties;
        this.clock = clock;
    }

    public String generate(OrderSide side, String tradingPair) {
        String rawId = rawId(side, tradingPair);
        String clientOrderId = "0x" + md5(rawId);
        log.debug("Generated client order id: raw={}, id={}", rawId, clientOrderId);
        return clientOrderId;
    }

    /** Unhashed id, truncated to {@code maxOrderIdLength}. */
    public String rawId(OrderSide side, String tradingPair) {
        String[] parts = tradingPair.split("-", 2);
        String base = prefix(parts[0]);
        String quote = parts.length > 1 ? prefix(parts[1]) : "";
        String raw = connectorProperties.getBrokerId() + side.code() + base + quote + nextNonce();
        int maxLength = connectorProperties.getMaxOrderIdLength();
        return raw.length() > maxLength ? raw.substring(0, maxLength) : raw;
    }

    public long nextNonce() {
        Instant now = clock.instant();
        long micros = ChronoUnit.MICROS.between(Instant.EPOCH, now);
        return lastNonce.updateAndGet(previous -> Math.max(previous + 1, micros));
    }

    private static String prefix(String asset) {
        return asset.substring(0, Math.min(4, asset.length()));
    }

    private static String md5(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
