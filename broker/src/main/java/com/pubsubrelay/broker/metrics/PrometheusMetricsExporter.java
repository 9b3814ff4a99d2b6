package com.pubsubrelay.broker.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.netty.Metrics;

/**
 * Exposes broker meters in Prometheus text format for {@code GET /metrics}.
 * <p>
 * {@link #attachedToNetty(String)} joins Reactor Netty's global composite registry so broker
 * meters and Netty server meters are scraped together; {@link #standalone(String)} keeps a private
 * registry, which lets several brokers live in one JVM (tests).
 * </p>
 */
public class PrometheusMetricsExporter implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsExporter.class);

    public static final String CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

    /**
     * Registry broker meters are registered on.
     */
    @Getter
    private final MeterRegistry registry;
    private final PrometheusMeterRegistry prometheusRegistry;
    private final CompositeMeterRegistry parent;

    private PrometheusMetricsExporter(MeterRegistry registry, PrometheusMeterRegistry prometheusRegistry,
                                      CompositeMeterRegistry parent) {
        this.registry = registry;
        this.prometheusRegistry = prometheusRegistry;
        this.parent = parent;
    }

    public static PrometheusMetricsExporter attachedToNetty(String nodeId) {
        PrometheusMeterRegistry prometheus = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        prometheus.config().commonTags("node_id", nodeId);

        MeterRegistry global = Metrics.REGISTRY;
        CompositeMeterRegistry parent = null;
        if (global instanceof CompositeMeterRegistry composite) {
            composite.add(prometheus);
            parent = composite;
            log.info("Prometheus registry attached to the Reactor Netty global registry");
        }
        return new PrometheusMetricsExporter(parent != null ? parent : prometheus, prometheus, parent);
    }

    public static PrometheusMetricsExporter standalone(String nodeId) {
        PrometheusMeterRegistry prometheus = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        prometheus.config().commonTags("node_id", nodeId);
        return new PrometheusMetricsExporter(prometheus, prometheus, null);
    }

    public String scrape() {
        return prometheusRegistry.scrape();
    }

    @Override
    public void close() {
        if (parent != null) {
            parent.remove(prometheusRegistry);
        }
        prometheusRegistry.close();
    }
}
