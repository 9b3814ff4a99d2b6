package com.pubsubrelay.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Value;

/**
 * Payload of a {@code "presence"} message: {@code {"action": "join", "metadata": {...}}}.
 */
@Value
public class PresencePayload {
    /**
     * Message type reserved for presence events.
     */
    public static final String TYPE = "presence";

    @JsonProperty("action")
    PresenceAction action;

    @JsonProperty("metadata")
    ObjectNode metadata;

    @JsonCreator
    public PresencePayload(
            @JsonProperty("action") PresenceAction action,
            @JsonProperty("metadata") ObjectNode metadata
    ) {
        this.action = action;
        this.metadata = metadata;
    }
}
