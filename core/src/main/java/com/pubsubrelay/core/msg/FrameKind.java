package com.pubsubrelay.core.msg;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Discriminator of server → client frames.
 */
public enum FrameKind {
    /**
     * Historical message delivered during replay, before {@link #READY}.
     */
    REPLAY("replay"),
    /**
     * Live message that was written to the store; carries the assigned id.
     */
    PERSISTED("persisted"),
    /**
     * Live message that was never stored; no id.
     */
    EPHEMERAL("ephemeral"),
    /**
     * End-of-replay marker carrying the resolved channel contextId.
     */
    READY("ready"),
    /**
     * In-band protocol or validation failure.
     */
    ERROR("error");

    private final String wireName;

    FrameKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
