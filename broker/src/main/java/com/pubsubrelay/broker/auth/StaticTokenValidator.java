package com.pubsubrelay.broker.auth;

import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fixed token → identity table, for tests and local development.
 */
public class StaticTokenValidator implements TokenValidator {

    private final Map<String, String> tokens = new ConcurrentHashMap<>();

    public StaticTokenValidator() {
    }

    public StaticTokenValidator(Map<String, String> tokens) {
        this.tokens.putAll(tokens);
    }

    public StaticTokenValidator addToken(String token, String clientId) {
        tokens.put(token, clientId);
        return this;
    }

    @Override
    public Mono<String> validate(String token) {
        return Mono.justOrEmpty(token == null ? null : tokens.get(token));
    }
}
