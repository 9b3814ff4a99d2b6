package com.pubsubrelay.core.msg;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.nio.charset.StandardCharsets;

/**
 * One WebSocket data frame, text or binary, detached from any transport buffer.
 * <p>
 * The opcode is carried explicitly: text/binary is decided by the transport, never by sniffing
 * payload bytes.
 * </p>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class WireFrame {
    String text;
    byte[] binary;

    public static WireFrame text(String text) {
        return new WireFrame(text, null);
    }

    public static WireFrame binary(byte[] bytes) {
        return new WireFrame(null, bytes);
    }

    public boolean isBinary() {
        return binary != null;
    }

    /**
     * Payload size in bytes, for traffic metrics.
     */
    public long size() {
        return isBinary() ? binary.length : text.getBytes(StandardCharsets.UTF_8).length;
    }
}
