package com.pubsubrelay.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.pubsubrelay.core.error.ProtocolException;
import com.pubsubrelay.core.msg.ClientAction;
import com.pubsubrelay.core.msg.PublishAction;
import com.pubsubrelay.core.msg.ServerFrame;
import com.pubsubrelay.core.msg.UpdateMetadataAction;
import com.pubsubrelay.core.msg.WireFrame;
import com.pubsubrelay.core.util.JsonUtils;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Maps WebSocket frames to typed client actions and server frames to WebSocket frames.
 * <p>
 * Text frames carry a JSON object. Binary frames follow {@link BinaryFrameCodec}; a binary frame
 * that does not match that layout is read as UTF-8 JSON, the same as a text frame.
 * </p>
 */
public final class WireCodec {
    private WireCodec() {
    }

    static final String INVALID_FORMAT = "invalid message format";
    static final String UNKNOWN_ACTION = "unknown action";

    /**
     * Decodes an inbound frame.
     *
     * @param frame inbound frame
     * @return decoded action and optional attachment
     * @throws ProtocolException if the frame is malformed or names an unknown action
     */
    public static DecodedAction decode(WireFrame frame) {
        if (!frame.isBinary()) {
            return new DecodedAction(decodeAction(parseObject(frame.getText())), null);
        }

        Optional<BinaryFrame> binary = BinaryFrameCodec.decode(frame.getBinary());
        if (binary.isEmpty()) {
            String text = new String(frame.getBinary(), StandardCharsets.UTF_8);
            return new DecodedAction(decodeAction(parseObject(text)), null);
        }

        String header = new String(binary.get().getHeader(), StandardCharsets.UTF_8);
        ClientAction action = decodeAction(parseObject(header));
        if (!(action instanceof PublishAction)) {
            throw new ProtocolException(UNKNOWN_ACTION, action.getRef());
        }
        return new DecodedAction(action, binary.get().getAttachment());
    }

    /**
     * Encodes a server frame: binary when it carries an attachment, text otherwise.
     */
    public static WireFrame encode(ServerFrame frame) {
        if (frame.hasAttachment()) {
            byte[] header = JsonUtils.writeValueAsBytes(frame);
            return WireFrame.binary(BinaryFrameCodec.encode(header, frame.getAttachment()));
        }
        return WireFrame.text(JsonUtils.writeValueAsString(frame));
    }

    private static JsonNode parseObject(String json) {
        JsonNode node;
        try {
            node = JsonUtils.readTree(json);
        } catch (IllegalArgumentException e) {
            throw new ProtocolException(INVALID_FORMAT, null, e);
        }
        if (node == null || !node.isObject()) {
            throw new ProtocolException(INVALID_FORMAT);
        }
        return node;
    }

    private static ClientAction decodeAction(JsonNode node) {
        JsonNode ref = node.hasNonNull("ref") ? node.get("ref") : null;
        String action = node.path("action").asText(null);
        if (action == null) {
            throw new ProtocolException(UNKNOWN_ACTION, ref);
        }

        switch (action) {
            case PublishAction.ACTION -> {
                PublishAction publish = treeToValue(node, PublishAction.class, ref);
                if (publish.getType() == null || publish.getType().isEmpty()) {
                    throw new ProtocolException("type required", ref);
                }
                return publish;
            }
            case UpdateMetadataAction.ACTION -> {
                return treeToValue(node, UpdateMetadataAction.class, ref);
            }
            default -> throw new ProtocolException(UNKNOWN_ACTION, ref);
        }
    }

    private static <T> T treeToValue(JsonNode node, Class<T> type, JsonNode ref) {
        try {
            return JsonUtils.mapper().treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new ProtocolException(INVALID_FORMAT, ref, e);
        }
    }
}
