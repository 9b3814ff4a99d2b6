package com.pubsubrelay.core.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.pubsubrelay.core.error.ProtocolException;
import com.pubsubrelay.core.msg.FrameKind;
import com.pubsubrelay.core.msg.PublishAction;
import com.pubsubrelay.core.msg.ServerFrame;
import com.pubsubrelay.core.msg.UpdateMetadataAction;
import com.pubsubrelay.core.msg.WireFrame;
import com.pubsubrelay.core.util.JsonUtils;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class WireCodecTest {

    @Test
    @DisplayName("Should decode a text publish with defaults")
    void testDecodeTextPublish() {
        DecodedAction decoded = WireCodec.decode(WireFrame.text(
                "{\"action\":\"publish\",\"type\":\"chat\",\"payload\":{\"text\":\"hi\"}}"));

        PublishAction publish = assertInstanceOf(PublishAction.class, decoded.getAction());
        assertEquals("chat", publish.getType());
        assertEquals("hi", publish.getPayload().get("text").asText());
        assertTrue(publish.isPersist(), "persist defaults to true");
        assertNull(publish.getRef());
        assertFalse(decoded.hasAttachment());
    }

    @Test
    @DisplayName("Should keep ephemeral flag and ref")
    void testDecodeEphemeralWithRef() {
        DecodedAction decoded = WireCodec.decode(WireFrame.text(
                "{\"action\":\"publish\",\"type\":\"cursor\",\"payload\":[1,2],\"persist\":false,\"ref\":7}"));

        PublishAction publish = (PublishAction) decoded.getAction();
        assertFalse(publish.isPersist());
        assertEquals(IntNode.valueOf(7), publish.getRef());
    }

    @Test
    @DisplayName("Should decode update-metadata with an arbitrary payload")
    void testDecodeUpdateMetadata() {
        DecodedAction decoded = WireCodec.decode(WireFrame.text(
                "{\"action\":\"update-metadata\",\"payload\":\"not-an-object\",\"ref\":\"r1\"}"));

        UpdateMetadataAction update = assertInstanceOf(UpdateMetadataAction.class, decoded.getAction());
        assertTrue(update.getPayload().isTextual());
        assertEquals(TextNode.valueOf("r1"), update.getRef());
    }

    @Test
    @DisplayName("Should reject malformed JSON and non-object frames")
    void testInvalidFormat() {
        ProtocolException notJson = assertThrows(ProtocolException.class,
                () -> WireCodec.decode(WireFrame.text("{not json")));
        assertEquals("invalid message format", notJson.getMessage());

        ProtocolException array = assertThrows(ProtocolException.class,
                () -> WireCodec.decode(WireFrame.text("[1,2,3]")));
        assertEquals("invalid message format", array.getMessage());
    }

    @Test
    @DisplayName("Should reject unknown actions and echo ref")
    void testUnknownAction() {
        ProtocolException e = assertThrows(ProtocolException.class,
                () -> WireCodec.decode(WireFrame.text("{\"action\":\"subscribe\",\"ref\":\"x\"}")));
        assertEquals("unknown action", e.getMessage());
        assertEquals(TextNode.valueOf("x"), e.getRef());
    }

    @Test
    @DisplayName("Should require a publish type")
    void testPublishTypeRequired() {
        ProtocolException e = assertThrows(ProtocolException.class,
                () -> WireCodec.decode(WireFrame.text("{\"action\":\"publish\",\"payload\":1,\"ref\":3}")));
        assertEquals("type required", e.getMessage());
        assertEquals(IntNode.valueOf(3), e.getRef());
    }

    @Test
    @DisplayName("Should decode a binary publish with its attachment")
    void testDecodeBinaryPublish() {
        byte[] header = "{\"action\":\"publish\",\"type\":\"file\",\"payload\":{\"name\":\"a.bin\"}}"
                .getBytes(StandardCharsets.UTF_8);
        byte[] attachment = {1, 2, 3, 4};

        DecodedAction decoded = WireCodec.decode(WireFrame.binary(BinaryFrameCodec.encode(header, attachment)));

        assertEquals("file", ((PublishAction) decoded.getAction()).getType());
        assertArrayEquals(attachment, decoded.getAttachment());
    }

    @Test
    @DisplayName("Should only allow publish inside a binary frame")
    void testBinaryUpdateMetadataRejected() {
        byte[] header = "{\"action\":\"update-metadata\",\"payload\":{},\"ref\":1}".getBytes(StandardCharsets.UTF_8);

        ProtocolException e = assertThrows(ProtocolException.class,
                () -> WireCodec.decode(WireFrame.binary(BinaryFrameCodec.encode(header, new byte[]{1}))));
        assertEquals("unknown action", e.getMessage());
        assertEquals(IntNode.valueOf(1), e.getRef());
    }

    @Test
    @DisplayName("Should read JSON sent in a binary frame without the layout")
    void testBinaryJsonFallback() {
        byte[] json = "{\"action\":\"publish\",\"type\":\"chat\",\"payload\":\"x\"}".getBytes(StandardCharsets.UTF_8);

        DecodedAction decoded = WireCodec.decode(WireFrame.binary(json));

        assertEquals("chat", ((PublishAction) decoded.getAction()).getType());
        assertNull(decoded.getAttachment());
    }

    @Test
    @DisplayName("Should encode frames without attachment as text, omitting absent fields")
    void testEncodeText() {
        WireFrame wire = WireCodec.encode(ServerFrame.ready(null));

        assertFalse(wire.isBinary());
        assertEquals("{\"kind\":\"ready\"}", wire.getText());
    }

    @Test
    @DisplayName("Should encode frames with attachment as binary with a JSON header")
    void testEncodeBinary() {
        ServerFrame frame = ServerFrame.builder()
                .kind(FrameKind.PERSISTED)
                .id(12L)
                .type("file")
                .payload(TextNode.valueOf("x"))
                .senderId("alice")
                .ts(1000L)
                .attachment(new byte[]{5, 6, 7})
                .build();

        WireFrame wire = WireCodec.encode(frame);

        assertTrue(wire.isBinary());
        BinaryFrame binary = BinaryFrameCodec.decode(wire.getBinary()).orElseThrow();
        JsonNode header = JsonUtils.readTree(new String(binary.getHeader(), StandardCharsets.UTF_8));
        assertEquals("persisted", header.get("kind").asText());
        assertEquals(12, header.get("id").asLong());
        assertFalse(header.has("attachment"));
        assertFalse(header.has("ref"));
        assertArrayEquals(new byte[]{5, 6, 7}, binary.getAttachment());
    }
}
