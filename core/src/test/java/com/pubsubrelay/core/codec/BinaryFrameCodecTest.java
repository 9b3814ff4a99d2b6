package com.pubsubrelay.core.codec;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class BinaryFrameCodecTest {

    @Test
    @DisplayName("Should lay out marker, little-endian header length, header and attachment")
    void testEncodeLayout() {
        byte[] header = "{\"a\":1}".getBytes(StandardCharsets.UTF_8);
        byte[] frame = BinaryFrameCodec.encode(header, new byte[]{9, 8});

        assertEquals(5 + header.length + 2, frame.length);
        assertEquals(0, frame[0]);
        assertEquals(header.length, frame[1]);
        assertEquals(0, frame[2]);
        assertEquals(0, frame[3]);
        assertEquals(0, frame[4]);
        assertEquals(9, frame[frame.length - 2]);
        assertEquals(8, frame[frame.length - 1]);
    }

    @Test
    @DisplayName("Should split a frame back into header and attachment")
    void testDecode() {
        byte[] header = "{\"type\":\"file\"}".getBytes(StandardCharsets.UTF_8);
        byte[] attachment = new byte[300];
        for (int i = 0; i < attachment.length; i++) {
            attachment[i] = (byte) i;
        }

        BinaryFrame decoded = BinaryFrameCodec.decode(BinaryFrameCodec.encode(header, attachment)).orElseThrow();

        assertArrayEquals(header, decoded.getHeader());
        assertArrayEquals(attachment, decoded.getAttachment());
    }

    @Test
    @DisplayName("Should accept an empty attachment")
    void testEmptyAttachment() {
        byte[] header = "{}".getBytes(StandardCharsets.UTF_8);
        BinaryFrame decoded = BinaryFrameCodec.decode(BinaryFrameCodec.encode(header, new byte[0])).orElseThrow();
        assertEquals(0, decoded.getAttachment().length);
    }

    @Test
    @DisplayName("Should reject bytes that do not follow the layout")
    void testInvalidLayouts() {
        // too short
        assertEquals(Optional.empty(), BinaryFrameCodec.decode(new byte[]{0, 1, 0}));
        // wrong marker
        assertEquals(Optional.empty(), BinaryFrameCodec.decode("{\"action\":\"publish\"}".getBytes(StandardCharsets.UTF_8)));
        // zero header length
        assertEquals(Optional.empty(), BinaryFrameCodec.decode(new byte[]{0, 0, 0, 0, 0, 1}));
        // header length beyond the frame
        assertEquals(Optional.empty(), BinaryFrameCodec.decode(new byte[]{0, 10, 0, 0, 0, '{', '}'}));
        // header length with the top bit set
        assertEquals(Optional.empty(), BinaryFrameCodec.decode(new byte[]{0, 1, 0, 0, (byte) 0x80, '{'}));
    }
}
