package com.pubsubrelay.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import lombok.Builder;
import lombok.Value;

/**
 * {@code {"action": "publish", "type": ..., "payload": ..., "persist": true, "ref": ...}}
 */
@Value
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class PublishAction implements ClientAction {
    public static final String ACTION = "publish";

    @JsonProperty("type")
    String type;

    @JsonProperty("payload")
    JsonNode payload;

    /**
     * Defaults to {@code true} when absent.
     */
    @JsonProperty("persist")
    boolean persist;

    @JsonProperty("ref")
    JsonNode ref;

    @JsonCreator
    public PublishAction(
            @JsonProperty("type") String type,
            @JsonProperty("payload") JsonNode payload,
            @JsonProperty("persist") Boolean persist,
            @JsonProperty("ref") JsonNode ref
    ) {
        this.type = type;
        this.payload = payload != null ? payload : NullNode.getInstance();
        this.persist = persist == null || persist;
        this.ref = ref != null && !ref.isNull() ? ref : null;
    }
}
