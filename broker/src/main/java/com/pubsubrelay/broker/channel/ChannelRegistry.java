package com.pubsubrelay.broker.channel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory map of channel name to live channel state.
 * <p>
 * Mutated only on the broker loop. The two counters mirror the map sizes so metrics gauges can
 * read them from any thread.
 * </p>
 */
public class ChannelRegistry {
    private static final Logger log = LoggerFactory.getLogger(ChannelRegistry.class);

    private final Map<String, ChannelState> channels = new HashMap<>();
    private final AtomicInteger activeChannels = new AtomicInteger();
    private final AtomicInteger activeConnections = new AtomicInteger();

    public Optional<ChannelState> find(String channel) {
        return Optional.ofNullable(channels.get(channel));
    }

    /**
     * Adds a connection, creating the channel entry on first use.
     */
    ChannelState register(Connection connection) {
        ChannelState state = channels.computeIfAbsent(connection.getChannel(), name -> {
            activeChannels.incrementAndGet();
            log.debug("Channel {} became active", name);
            return new ChannelState(name);
        });
        state.addConnection(connection);
        activeConnections.incrementAndGet();
        return state;
    }

    /**
     * Removes a connection; the channel entry is dropped once it has no connections left.
     *
     * @return the channel state the connection belonged to, if any
     */
    Optional<ChannelState> unregister(Connection connection) {
        ChannelState state = channels.get(connection.getChannel());
        if (state == null || !state.removeConnection(connection)) {
            return Optional.ofNullable(state);
        }
        activeConnections.decrementAndGet();
        if (state.isEmpty()) {
            channels.remove(state.getName());
            activeChannels.decrementAndGet();
            log.debug("Channel {} became inactive", state.getName());
        }
        return Optional.of(state);
    }

    List<Connection> allConnections() {
        List<Connection> all = new ArrayList<>();
        channels.values().forEach(state -> all.addAll(state.getConnections()));
        return all;
    }

    public int getActiveChannels() {
        return activeChannels.get();
    }

    public int getActiveConnections() {
        return activeConnections.get();
    }
}
