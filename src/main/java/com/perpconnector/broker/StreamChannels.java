package com.perpconnector.broker;

import com.perpconnector.config.ConnectorProperties;
import com.perpconnector.domain.enums.MessageKind;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Names of the private stream channels this session subscribes to, and the message kind
 * each carries. Channel names are {@code <subaccountId>.<suffix>}.
 */
@Component
public class StreamChannels {

    private final Map<String, MessageKind> kindsByChannel;

    public StreamChannels(ConnectorProperties connectorProperties) {
        String subaccountId = connectorProperties.getSubaccountId();
        ConnectorProperties.Stream stream = connectorProperties.getStream();
        this.kindsByChannel = Map.of(
                subaccountId + "." + stream.getOrderChannelSuffix(), MessageKind.ORDER_STATUS,
                subaccountId + "." + stream.getTradeChannelSuffix(), MessageKind.TRADE);
    }

    /** Message kind for a channel name; empty for channels we never subscribed to. */
    public Optional<MessageKind> kindOf(String channel) {
        if (channel == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(kindsByChannel.get(channel));
    }

    public Map<String, MessageKind> all() {
        return kindsByChannel;
    }
}
