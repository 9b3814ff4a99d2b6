package com.pubsubrelay.broker.auth;

import com.pubsubrelay.core.auth.AccessToken;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

class HmacTokenValidatorTest {
    private static final String SECRET = "broker-secret";
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private HmacTokenValidator validator;

    @BeforeEach
    void setUp() {
        validator = new HmacTokenValidator(SECRET, Duration.ofMinutes(5), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should resolve a valid signed token")
    void testValidToken() {
        StepVerifier.create(validator.validate(AccessToken.generate("alice", NOW, SECRET)))
            .expectNext("alice")
            .verifyComplete();
    }

    @Test
    @DisplayName("Should reject expired, forged and empty tokens with an empty result")
    void testRejections() {
        StepVerifier.create(validator.validate(AccessToken.generate("alice", NOW.minusSeconds(301), SECRET)))
            .verifyComplete();
        StepVerifier.create(validator.validate(AccessToken.generate("alice", NOW, "forged")))
            .verifyComplete();
        StepVerifier.create(validator.validate(""))
            .verifyComplete();
    }
}
