package com.pubsubrelay.core.metrics;

/**
 * Micrometer metric names used by the broker.
 * <p>
 * <b>Naming convention:</b> {@code relay.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 *   <li>Timers: {@code .latency} suffix</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: Connections that reached the ready state.
     * <p>
     * Tags: nodeId
     * </p>
     */
    public static final String CONNECTIONS_OPENED_TOTAL = "relay.broker.connections.opened.total";

    /**
     * Counter: Join attempts closed before ready.
     * <p>
     * Tags: nodeId, reason (close reason text)
     * </p>
     */
    public static final String CONNECTIONS_REJECTED_TOTAL = "relay.broker.connections.rejected.total";

    /**
     * Gauge: Open connections across all channels.
     */
    public static final String CONNECTIONS_ACTIVE = "relay.broker.connections.active";

    /**
     * Gauge: Channels with at least one open connection.
     */
    public static final String CHANNELS_ACTIVE = "relay.broker.channels.active";

    /**
     * Counter: Client publishes fanned out.
     * <p>
     * Tags: nodeId, type (persisted/ephemeral)
     * </p>
     */
    public static final String PUBLISH_TOTAL = "relay.broker.publish.total";

    /**
     * Counter: Frames delivered during replay.
     */
    public static final String REPLAY_FRAMES_TOTAL = "relay.broker.replay.frames.total";

    /**
     * Counter: In-band error frames sent.
     * <p>
     * Tags: nodeId, reason
     * </p>
     */
    public static final String ERROR_FRAMES_TOTAL = "relay.broker.error.frames.total";

    /**
     * Timer: Store insert plus fan-out of one publish.
     */
    public static final String PUBLISH_LATENCY = "relay.broker.publish.latency";

    /**
     * Counter: Bytes received from WebSocket clients.
     */
    public static final String NETWORK_INBOUND_WS_BYTES = "relay.broker.network.inbound.ws.bytes";

    /**
     * Counter: Bytes sent to WebSocket clients.
     */
    public static final String NETWORK_OUTBOUND_WS_BYTES = "relay.broker.network.outbound.ws.bytes";

    /**
     * Distribution Summary: Inbound frame size distribution (bytes).
     */
    public static final String MESSAGE_SIZE_INBOUND = "relay.broker.message.size.inbound";

    /**
     * Distribution Summary: Outbound frame size distribution (bytes).
     */
    public static final String MESSAGE_SIZE_OUTBOUND = "relay.broker.message.size.outbound";
}
