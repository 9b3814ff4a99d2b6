package com.pubsubrelay.core.error;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Malformed or invalid client frame.
 * <p>
 * Never fatal to the connection: the broker answers with an {@code error} frame that echoes
 * {@link #getRef()} when the request carried one.
 * </p>
 */
public class ProtocolException extends RuntimeException {
    private final transient JsonNode ref;

    public ProtocolException(String message) {
        this(message, null, null);
    }

    public ProtocolException(String message, JsonNode ref) {
        this(message, ref, null);
    }

    public ProtocolException(String message, JsonNode ref, Throwable cause) {
        super(message, cause);
        this.ref = ref;
    }

    public JsonNode getRef() {
        return ref;
    }
}
