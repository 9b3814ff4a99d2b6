package com.pubsubrelay.core.auth;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Optional;

/**
 * Self-contained signed access token.
 * <p>
 * <b>Token format:</b> {@code base64url(clientId:issuedAt:hmac)}
 * <ul>
 *   <li>{@code clientId}: identity the token resolves to (must not contain {@code ':'})</li>
 *   <li>{@code issuedAt}: issue timestamp (epoch seconds)</li>
 *   <li>{@code hmac}: hex HMAC-SHA256 over {@code "clientId:issuedAt"}</li>
 * </ul>
 * </p>
 * <p>
 * Issuance and rotation belong to whoever holds the secret; the broker only verifies.
 * </p>
 */
public final class AccessToken {
    private static final String DELIMITER = ":";

    private AccessToken() {
    }

    /**
     * Generates a token.
     *
     * @param clientId identity
     * @param issuedAt issue timestamp
     * @param secret   HMAC secret shared with the broker
     * @return Base64url-encoded token
     */
    public static String generate(String clientId, Instant issuedAt, String secret) {
        if (clientId.contains(DELIMITER)) {
            throw new IllegalArgumentException("clientId must not contain '" + DELIMITER + "'");
        }
        String payload = clientId + DELIMITER + issuedAt.getEpochSecond();
        String token = payload + DELIMITER + sign(payload, secret);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(token.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Verifies a token and extracts the identity.
     *
     * @param token  Base64url-encoded token
     * @param secret HMAC secret
     * @param ttl    maximum token age
     * @param now    current time
     * @return identity, or empty if the token is malformed, forged or expired
     */
    public static Optional<String> verify(String token, String secret, Duration ttl, Instant now) {
        String decoded;
        try {
            decoded = new String(Base64.getUrlDecoder().decode(token), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }

        String[] parts = decoded.split(DELIMITER, -1);
        if (parts.length != 3 || parts[0].isEmpty()) {
            return Optional.empty();
        }

        long issuedAt;
        try {
            issuedAt = Long.parseLong(parts[1]);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }

        String payload = parts[0] + DELIMITER + parts[1];
        byte[] expected = sign(payload, secret).getBytes(StandardCharsets.UTF_8);
        byte[] provided = parts[2].getBytes(StandardCharsets.UTF_8);
        if (!MessageDigest.isEqual(expected, provided)) {
            return Optional.empty();
        }

        long ageSec = now.getEpochSecond() - issuedAt;
        if (ageSec < 0 || ageSec > ttl.getSeconds()) {
            return Optional.empty();
        }

        return Optional.of(parts[0]);
    }

    private static String sign(String data, String secret) {
        HashFunction hmac = Hashing.hmacSha256(secret.getBytes(StandardCharsets.UTF_8));
        return hmac.hashString(data, StandardCharsets.UTF_8).toString();
    }
}
