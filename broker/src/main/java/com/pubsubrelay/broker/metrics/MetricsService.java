package com.pubsubrelay.broker.metrics;

import com.pubsubrelay.core.metrics.MetricsNames;
import com.pubsubrelay.core.metrics.MetricsTags;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralized metrics for a broker node.
 */
public class MetricsService {

    private final MeterRegistry registry;
    private final String nodeId;

    private final Counter connectionsOpened;
    private final Counter publishPersisted;
    private final Counter publishEphemeral;
    private final Counter replayFrames;

    private final Counter networkInboundWs;
    private final Counter networkOutboundWs;
    private final DistributionSummary messageSizeInbound;
    private final DistributionSummary messageSizeOutbound;

    private final Timer publishLatency;

    public MetricsService(MeterRegistry registry, String nodeId) {
        this.registry = registry;
        this.nodeId = nodeId;

        connectionsOpened = Counter.builder(MetricsNames.CONNECTIONS_OPENED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Connections that completed replay and received ready")
            .register(registry);

        publishPersisted = Counter.builder(MetricsNames.PUBLISH_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.TYPE, "persisted")
            .description("Publishes stored and fanned out")
            .register(registry);

        publishEphemeral = Counter.builder(MetricsNames.PUBLISH_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.TYPE, "ephemeral")
            .description("Publishes fanned out without storage")
            .register(registry);

        replayFrames = Counter.builder(MetricsNames.REPLAY_FRAMES_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .register(registry);

        networkInboundWs = Counter.builder(MetricsNames.NETWORK_INBOUND_WS_BYTES)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Total bytes received from WebSocket clients")
            .baseUnit("bytes")
            .register(registry);

        networkOutboundWs = Counter.builder(MetricsNames.NETWORK_OUTBOUND_WS_BYTES)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Total bytes sent to WebSocket clients")
            .baseUnit("bytes")
            .register(registry);

        messageSizeInbound = DistributionSummary.builder(MetricsNames.MESSAGE_SIZE_INBOUND)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Inbound frame size distribution")
            .baseUnit("bytes")
            .register(registry);

        messageSizeOutbound = DistributionSummary.builder(MetricsNames.MESSAGE_SIZE_OUTBOUND)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Outbound frame size distribution")
            .baseUnit("bytes")
            .register(registry);

        // Percentile histogram for p95/p99 of store insert + fan-out
        publishLatency = Timer.builder(MetricsNames.PUBLISH_LATENCY)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Store insert plus fan-out of one publish")
            .publishPercentileHistogram()
            .serviceLevelObjectives(
                Duration.ofMillis(1),
                Duration.ofMillis(5),
                Duration.ofMillis(10),
                Duration.ofMillis(50),
                Duration.ofMillis(100)
            )
            .register(registry);
    }

    /**
     * Registers gauges over live registry sizes.
     */
    public void bindActivityGauges(Supplier<Number> activeConnections, Supplier<Number> activeChannels) {
        Gauge.builder(MetricsNames.CONNECTIONS_ACTIVE, activeConnections)
            .tag(MetricsTags.NODE_ID, nodeId)
            .register(registry);
        Gauge.builder(MetricsNames.CHANNELS_ACTIVE, activeChannels)
            .tag(MetricsTags.NODE_ID, nodeId)
            .register(registry);
    }

    public void recordConnectionOpened() {
        connectionsOpened.increment();
    }

    /**
     * @param reason close reason text, e.g. {@code "unauthorized"}
     */
    public void recordConnectionRejected(String reason) {
        Counter.builder(MetricsNames.CONNECTIONS_REJECTED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.REASON, reason)
            .register(registry)
            .increment();
    }

    public void recordPublish(boolean persisted) {
        (persisted ? publishPersisted : publishEphemeral).increment();
    }

    public void recordReplayFrames(int count) {
        replayFrames.increment(count);
    }

    public void recordErrorFrame(String reason) {
        Counter.builder(MetricsNames.ERROR_FRAMES_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.REASON, reason)
            .register(registry)
            .increment();
    }

    /**
     * @param startNanos {@link System#nanoTime()} before the store insert
     */
    public void recordPublishLatency(long startNanos) {
        publishLatency.record(Duration.ofNanos(System.nanoTime() - startNanos));
    }

    public void recordNetworkInboundWs(long bytes) {
        networkInboundWs.increment(bytes);
        messageSizeInbound.record(bytes);
    }

    public void recordNetworkOutboundWs(long bytes) {
        networkOutboundWs.increment(bytes);
        messageSizeOutbound.record(bytes);
    }
}
