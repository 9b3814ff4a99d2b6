package com.pubsubrelay.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

/**
 * {@code {"action": "update-metadata", "payload": {...}, "ref": ...}}
 * <p>
 * The payload is kept as an arbitrary node here; the broker rejects anything that is not a plain
 * object with an in-band error so the requester gets its {@code ref} back.
 * </p>
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class UpdateMetadataAction implements ClientAction {
    public static final String ACTION = "update-metadata";

    @JsonProperty("payload")
    JsonNode payload;

    @JsonProperty("ref")
    JsonNode ref;

    @JsonCreator
    public UpdateMetadataAction(
            @JsonProperty("payload") JsonNode payload,
            @JsonProperty("ref") JsonNode ref
    ) {
        this.payload = payload;
        this.ref = ref != null && !ref.isNull() ? ref : null;
    }
}
