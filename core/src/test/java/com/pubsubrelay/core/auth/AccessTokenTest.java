package com.pubsubrelay.core.auth;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class AccessTokenTest {
    private static final String SECRET = "test-secret";
    private static final Duration TTL = Duration.ofHours(1);
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Test
    @DisplayName("Should resolve a fresh token to its client id")
    void testValidToken() {
        String token = AccessToken.generate("alice", NOW.minusSeconds(10), SECRET);

        assertEquals(Optional.of("alice"), AccessToken.verify(token, SECRET, TTL, NOW));
    }

    @Test
    @DisplayName("Should reject a token signed with another secret")
    void testWrongSecret() {
        String token = AccessToken.generate("alice", NOW, "other-secret");

        assertTrue(AccessToken.verify(token, SECRET, TTL, NOW).isEmpty());
    }

    @Test
    @DisplayName("Should reject expired and future-dated tokens")
    void testTokenAge() {
        String expired = AccessToken.generate("alice", NOW.minus(TTL).minusSeconds(1), SECRET);
        String future = AccessToken.generate("alice", NOW.plusSeconds(60), SECRET);

        assertTrue(AccessToken.verify(expired, SECRET, TTL, NOW).isEmpty());
        assertTrue(AccessToken.verify(future, SECRET, TTL, NOW).isEmpty());
    }

    @Test
    @DisplayName("Should reject garbage")
    void testMalformed() {
        assertTrue(AccessToken.verify("%%%", SECRET, TTL, NOW).isEmpty());
        assertTrue(AccessToken.verify("", SECRET, TTL, NOW).isEmpty());
        assertTrue(AccessToken.verify("YWxpY2U6MTIzOmFiYw", SECRET, TTL, NOW).isEmpty());
    }

    @Test
    @DisplayName("Should not issue tokens for ids containing the delimiter")
    void testDelimiterInClientId() {
        assertThrows(IllegalArgumentException.class, () -> AccessToken.generate("a:b", NOW, SECRET));
    }
}
