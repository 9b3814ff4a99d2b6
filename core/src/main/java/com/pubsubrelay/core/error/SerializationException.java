package com.pubsubrelay.core.error;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A publish payload could not be encoded as JSON.
 */
public class SerializationException extends ProtocolException {

    public SerializationException(JsonNode ref, Throwable cause) {
        super("payload not serializable", ref, cause);
    }
}
