package com.pubsubrelay.broker.auth;

import reactor.core.publisher.Mono;

/**
 * Resolves an opaque connection token to a client identity.
 * <p>
 * Called once per connection attempt, before any channel state is touched.
 * </p>
 */
public interface TokenValidator {

    /**
     * @param token token from the join request (may be empty)
     * @return the identity, or an empty Mono to reject the connection
     */
    Mono<String> validate(String token);
}
