package com.pubsubrelay.broker.channel;

import lombok.Getter;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Live state of one channel: its open connections and the roster of present identities.
 */
public class ChannelState {
    @Getter
    private final String name;
    private final Set<Connection> connections = new LinkedHashSet<>();
    private final Map<String, Participant> roster = new LinkedHashMap<>();

    ChannelState(String name) {
        this.name = name;
    }

    void addConnection(Connection connection) {
        connections.add(connection);
    }

    boolean removeConnection(Connection connection) {
        return connections.remove(connection);
    }

    Collection<Connection> getConnections() {
        return Collections.unmodifiableSet(connections);
    }

    Participant getParticipant(String clientId) {
        return roster.get(clientId);
    }

    void putParticipant(Participant participant) {
        roster.put(participant.getId(), participant);
    }

    void removeParticipant(String clientId) {
        roster.remove(clientId);
    }

    public boolean isEmpty() {
        return connections.isEmpty();
    }
}
