package com.pubsubrelay.broker.channel;

import com.fasterxml.jackson.databind.JsonNode;
import com.pubsubrelay.broker.metrics.MetricsService;
import com.pubsubrelay.core.codec.WireCodec;
import com.pubsubrelay.core.msg.ServerFrame;
import com.pubsubrelay.core.msg.WireFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans a frame out to every open connection of a channel.
 * <p>
 * The frame is encoded at most twice: once carrying the originator's {@code ref}, delivered only
 * to the originator, and once without it for everybody else.
 * </p>
 */
public class Broadcaster {
    private static final Logger log = LoggerFactory.getLogger(Broadcaster.class);

    private final MetricsService metricsService;

    public Broadcaster(MetricsService metricsService) {
        this.metricsService = metricsService;
    }

    /**
     * @param channel target channel
     * @param frame   frame without {@code ref}
     * @param origin  requesting connection, or {@code null} for server-originated events
     * @param ref     correlation id for the origin's copy, may be {@code null}
     * @return number of connections the frame was queued for
     */
    public int broadcast(ChannelState channel, ServerFrame frame, Connection origin, JsonNode ref) {
        WireFrame shared = WireCodec.encode(frame.withRef(null));
        WireFrame own = origin != null && ref != null ? WireCodec.encode(frame.withRef(ref)) : shared;

        int delivered = 0;
        for (Connection connection : channel.getConnections()) {
            if (!connection.isOpen()) {
                continue;
            }
            connection.send(connection == origin ? own : shared);
            delivered++;
        }
        log.debug("Broadcast {} {} to {} connection(s) of {}", frame.getKind(), frame.getType(), delivered,
                channel.getName());
        return delivered;
    }

    /**
     * Sends a frame to a single connection, ignoring its state.
     */
    public void unicast(Connection connection, ServerFrame frame) {
        connection.send(WireCodec.encode(frame));
    }

    public void sendError(Connection connection, String message, JsonNode ref) {
        metricsService.recordErrorFrame(message);
        unicast(connection, ServerFrame.error(message, ref));
    }
}
