package com.pubsubrelay.broker.channel;

import lombok.Builder;
import lombok.Value;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Parameters of a join, taken from the upgrade request's query string.
 */
@Value
@Builder
public class JoinRequest {
    String token;
    String channel;
    /**
     * Replay non-presence history with {@code id > sinceId}; {@code null} skips backlog replay.
     */
    Long sinceId;
    String contextId;
    /**
     * Raw JSON of the initial participant metadata; validated during the join.
     */
    String metadata;

    public static JoinRequest fromQuery(Map<String, List<String>> parameters) {
        return JoinRequest.builder()
                .token(first(parameters, "token"))
                .channel(first(parameters, "channel"))
                .sinceId(parseSinceId(first(parameters, "sinceId")))
                .contextId(first(parameters, "contextId"))
                .metadata(first(parameters, "metadata"))
                .build();
    }

    private static String first(Map<String, List<String>> parameters, String name) {
        return Stream.ofNullable(parameters.get(name))
                .flatMap(Collection::stream)
                .filter(value -> !value.isEmpty())
                .findFirst()
                .orElse(null);
    }

    private static Long parseSinceId(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
