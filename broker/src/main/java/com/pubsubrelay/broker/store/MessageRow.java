package com.pubsubrelay.broker.store;

import lombok.Builder;
import lombok.Value;

/**
 * One stored message. {@code payload} and {@code senderMetadata} are JSON text.
 */
@Value
@Builder(toBuilder = true)
public class MessageRow {
    long id;
    String channel;
    String type;
    String payload;
    String senderId;
    long ts;
    String senderMetadata;
    byte[] attachment;

    public boolean hasAttachment() {
        return attachment != null;
    }
}
