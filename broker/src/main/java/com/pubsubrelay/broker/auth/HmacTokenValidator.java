package com.pubsubrelay.broker.auth;

import com.pubsubrelay.core.auth.AccessToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;

/**
 * Accepts {@link AccessToken}s signed with the shared secret and younger than the TTL.
 */
public class HmacTokenValidator implements TokenValidator {
    private static final Logger log = LoggerFactory.getLogger(HmacTokenValidator.class);

    private final String secret;
    private final Duration ttl;
    private final Clock clock;

    public HmacTokenValidator(String secret, Duration ttl) {
        this(secret, ttl, Clock.systemUTC());
    }

    public HmacTokenValidator(String secret, Duration ttl, Clock clock) {
        this.secret = secret;
        this.ttl = ttl;
        this.clock = clock;
    }

    @Override
    public Mono<String> validate(String token) {
        return Mono.fromCallable(() -> {
            if (token == null || token.isEmpty()) {
                return null;
            }
            String clientId = AccessToken.verify(token, secret, ttl, clock.instant()).orElse(null);
            if (clientId == null) {
                log.debug("Rejected access token (bad signature, malformed or expired)");
            }
            return clientId;
        });
    }
}
