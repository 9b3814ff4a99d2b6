package com.pubsubrelay.broker.channel;

import io.netty.handler.codec.http.QueryStringDecoder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JoinRequestTest {

    private static JoinRequest parse(String uri) {
        return JoinRequest.fromQuery(new QueryStringDecoder(uri).parameters());
    }

    @Test
    @DisplayName("Should read every join parameter from the query string")
    void testAllParameters() {
        JoinRequest request = parse("/?token=abc&channel=room%201&sinceId=42&contextId=ctx"
            + "&metadata=%7B%22name%22%3A%22Alice%22%7D");

        assertEquals("abc", request.getToken());
        assertEquals("room 1", request.getChannel());
        assertEquals(42L, request.getSinceId());
        assertEquals("ctx", request.getContextId());
        assertEquals("{\"name\":\"Alice\"}", request.getMetadata());
    }

    @Test
    @DisplayName("Should treat missing, empty and non-integer values as absent")
    void testAbsentValues() {
        JoinRequest request = parse("/ws?token=&sinceId=abc");

        assertNull(request.getToken());
        assertNull(request.getChannel());
        assertNull(request.getSinceId());
        assertNull(request.getContextId());
        assertNull(request.getMetadata());
    }

    @Test
    @DisplayName("Should take the first of repeated parameters")
    void testRepeatedParameter() {
        assertEquals("a", parse("/?channel=a&channel=b").getChannel());
    }
}
