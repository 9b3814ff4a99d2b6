package com.pubsubrelay.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Roster transitions recorded as {@code "presence"} messages.
 */
public enum PresenceAction {
    JOIN("join"),
    LEAVE("leave"),
    UPDATE("update");

    private final String wireName;

    PresenceAction(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static PresenceAction fromWireName(String value) {
        for (PresenceAction action : values()) {
            if (action.wireName.equals(value)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown presence action: " + value);
    }
}
