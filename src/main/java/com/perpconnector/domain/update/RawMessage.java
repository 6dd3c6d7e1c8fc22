package com.perpconnector.domain.update;

import com.fasterxml.jackson.databind.JsonNode;
import com.perpconnector.domain.enums.MessageKind;
import com.perpconnector.domain.enums.UpdateSource;

/**
 * Raw exchange payload tagged with the channel it came from and what it describes.
 * Input to {@link com.perpconnector.normalizer.EventNormalizer}.
 *
 * @param tradingPair canonical pair the payload was requested for (funding polls), else null
 */
public record RawMessage(UpdateSource source, MessageKind kind, JsonNode payload, String tradingPair) {

    public static RawMessage stream(MessageKind kind, JsonNode payload) {
        return new RawMessage(UpdateSource.STREAM, kind, payload, null);
    }

    public static RawMessage poll(MessageKind kind, JsonNode payload) {
        return new RawMessage(UpdateSource.POLL, kind, payload, null);
    }

    public static RawMessage poll(MessageKind kind, JsonNode payload, String tradingPair) {
        return new RawMessage(UpdateSource.POLL, kind, payload, tradingPair);
    }
}
