package com.pubsubrelay.broker.auth;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.Map;

class StaticTokenValidatorTest {

    @Test
    @DisplayName("Should map configured and added tokens, reject the rest")
    void testLookup() {
        StaticTokenValidator validator = new StaticTokenValidator(Map.of("t-alice", "alice"))
            .addToken("t-bob", "bob");

        StepVerifier.create(validator.validate("t-alice")).expectNext("alice").verifyComplete();
        StepVerifier.create(validator.validate("t-bob")).expectNext("bob").verifyComplete();
        StepVerifier.create(validator.validate("t-eve")).verifyComplete();
        StepVerifier.create(validator.validate(null)).verifyComplete();
    }
}
