package com.pubsubrelay.core.msg;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Server → client frame.
 * <p>
 * Serialized as a JSON text frame, or, when {@link #attachment} is present, as the JSON header of a
 * binary frame followed by the raw attachment bytes. Optional fields left {@code null} are omitted
 * from the JSON.
 * </p>
 * <p>
 * {@code ref} is per-recipient: the broadcaster sets it only on the copy delivered to the
 * connection that made the request.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"kind", "id", "type", "payload", "senderId", "ts", "ref", "error", "senderMetadata", "contextId"})
public class ServerFrame {

    @JsonProperty("kind")
    FrameKind kind;

    /**
     * Store-assigned message id; present on {@code replay} and {@code persisted} frames only.
     */
    @JsonProperty("id")
    Long id;

    @JsonProperty("type")
    String type;

    @JsonProperty("payload")
    JsonNode payload;

    @JsonProperty("senderId")
    String senderId;

    /**
     * Server receive time (epoch millis).
     */
    @JsonProperty("ts")
    Long ts;

    /**
     * Client-supplied correlation id echoed back to the requester only.
     */
    @JsonProperty("ref")
    JsonNode ref;

    @JsonProperty("error")
    String error;

    @JsonProperty("senderMetadata")
    ObjectNode senderMetadata;

    @JsonProperty("contextId")
    String contextId;

    /**
     * Raw attachment; travels outside the JSON in a binary frame.
     */
    @JsonIgnore
    byte[] attachment;

    @JsonIgnore
    public boolean hasAttachment() {
        return attachment != null;
    }

    public static ServerFrame ready(String contextId) {
        return ServerFrame.builder().kind(FrameKind.READY).contextId(contextId).build();
    }

    public static ServerFrame error(String message, JsonNode ref) {
        return ServerFrame.builder().kind(FrameKind.ERROR).error(message).ref(ref).build();
    }
}
