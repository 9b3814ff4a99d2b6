package com.pubsubrelay.broker.config;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration for a broker node, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class BrokerConfig {

    String nodeId;
    String host;
    /**
     * 0 binds an OS-assigned port.
     */
    int httpPort;
    /**
     * {@code sqlite} or {@code memory}.
     */
    String storeType;
    String dbPath;
    /**
     * HMAC secret for signed access tokens; when blank, {@link #staticTokens} are used instead.
     */
    String tokenSecret;
    int tokenTtlSec;
    @Builder.Default
    Map<String, String> staticTokens = Map.of();
    int pingInterval;
    int idleTimeout;
    int maxFrameSize;

    public static BrokerConfig fromEnv() {
        return BrokerConfig.builder()
                .nodeId(getEnv("NODE_ID", "broker-node-1"))
                .host(getEnv("BROKER_HOST", "127.0.0.1"))
                .httpPort(Integer.parseInt(getEnv("HTTP_PORT", "0")))
                .storeType(getEnv("STORE_TYPE", "sqlite"))
                .dbPath(getEnv("DB_PATH", "data/pubsub-messages.db"))
                .tokenSecret(getEnv("TOKEN_SECRET", ""))
                .tokenTtlSec(Integer.parseInt(getEnv("TOKEN_TTL_SEC", "86400")))
                .staticTokens(parseTokens(getEnv("STATIC_TOKENS", "")))
                .pingInterval(Integer.parseInt(getEnv("PING_INTERVAL", "15")))
                .idleTimeout(Integer.parseInt(getEnv("IDLE_TIMEOUT", "60")))
                .maxFrameSize(Integer.parseInt(getEnv("MAX_FRAME_SIZE", String.valueOf(64 * 1024 * 1024))))
                .build();
    }

    public boolean isMemoryStore() {
        return "memory".equalsIgnoreCase(storeType);
    }

    public boolean hasTokenSecret() {
        return tokenSecret != null && !tokenSecret.isBlank();
    }

    /**
     * Parses {@code token=clientId,token2=clientId2}.
     */
    static Map<String, String> parseTokens(String value) {
        if (value == null || value.isBlank()) {
            return Map.of();
        }
        Map<String, String> tokens = new LinkedHashMap<>();
        for (String entry : value.split(",")) {
            int eq = entry.indexOf('=');
            if (eq <= 0 || eq == entry.length() - 1) {
                throw new IllegalArgumentException("Malformed STATIC_TOKENS entry: " + entry);
            }
            tokens.put(entry.substring(0, eq).trim(), entry.substring(eq + 1).trim());
        }
        return Collections.unmodifiableMap(tokens);
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
