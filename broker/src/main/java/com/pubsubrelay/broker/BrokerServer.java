package com.pubsubrelay.broker;

import com.pubsubrelay.broker.auth.TokenValidator;
import com.pubsubrelay.broker.channel.ChannelBroker;
import com.pubsubrelay.broker.config.BrokerConfig;
import com.pubsubrelay.broker.http.HttpServer;
import com.pubsubrelay.broker.metrics.MetricsService;
import com.pubsubrelay.broker.metrics.PrometheusMetricsExporter;
import com.pubsubrelay.broker.store.MessageStore;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One broker instance: store, channel broker and HTTP/WebSocket server wired together.
 * <p>
 * The store is built by the caller and handed in; the server owns it from {@link #start()} on and
 * closes it during {@link #stop()}.
 * </p>
 */
public class BrokerServer {
    private static final Logger log = LoggerFactory.getLogger(BrokerServer.class);

    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    private final BrokerConfig config;
    private final MessageStore store;
    private final PrometheusMetricsExporter metricsExporter;
    @Getter
    private final ChannelBroker broker;
    private final HttpServer httpServer;
    private final AtomicBoolean stopped = new AtomicBoolean();

    public BrokerServer(BrokerConfig config, MessageStore store, TokenValidator tokenValidator,
                        PrometheusMetricsExporter metricsExporter) {
        this.config = config;
        this.store = store;
        this.metricsExporter = metricsExporter;
        MetricsService metricsService = new MetricsService(metricsExporter.getRegistry(), config.getNodeId());
        this.broker = new ChannelBroker(store, tokenValidator, metricsService);
        this.httpServer = new HttpServer(config, broker, metricsService, metricsExporter);
    }

    /**
     * Initializes the store and binds the server.
     *
     * @return the bound port (OS-assigned when configured as 0)
     */
    public int start() {
        store.init();
        httpServer.start();
        log.info("Broker {} ready on port {}", config.getNodeId(), httpServer.port());
        return httpServer.port();
    }

    public int getPort() {
        return httpServer.port();
    }

    /**
     * Graceful shutdown: refuse joins, terminate connections (persisting their leaves), close the
     * store, dispose the server, dispose the broker loop. Idempotent.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        log.info("Stopping broker {}", config.getNodeId());
        try {
            broker.shutdown().block(SHUTDOWN_TIMEOUT);
        } catch (RuntimeException e) {
            log.error("Broker shutdown did not complete cleanly", e);
        }
        httpServer.stop();
        broker.close();
        metricsExporter.close();
        log.info("Broker {} stopped", config.getNodeId());
    }
}
