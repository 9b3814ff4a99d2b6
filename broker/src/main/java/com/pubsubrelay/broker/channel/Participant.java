package com.pubsubrelay.broker.channel;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;
import lombok.Setter;

/**
 * Roster entry: one identity present in a channel through one or more connections.
 */
@Getter
public class Participant {
    private final String id;
    @Setter
    private ObjectNode metadata;
    private int connectionCount;

    Participant(String id, ObjectNode metadata) {
        this.id = id;
        this.metadata = metadata;
        this.connectionCount = 1;
    }

    int addConnection() {
        return ++connectionCount;
    }

    /**
     * @return remaining connection count; the participant leaves at zero
     */
    int removeConnection() {
        return --connectionCount;
    }
}
