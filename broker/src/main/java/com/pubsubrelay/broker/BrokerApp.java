package com.pubsubrelay.broker;

import com.pubsubrelay.broker.auth.HmacTokenValidator;
import com.pubsubrelay.broker.auth.StaticTokenValidator;
import com.pubsubrelay.broker.auth.TokenValidator;
import com.pubsubrelay.broker.config.BrokerConfig;
import com.pubsubrelay.broker.metrics.PrometheusMetricsExporter;
import com.pubsubrelay.broker.store.InMemoryMessageStore;
import com.pubsubrelay.broker.store.MessageStore;
import com.pubsubrelay.broker.store.SqliteMessageStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Main entry point for a broker node.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Serve WebSockets at / and /ws (query: token, channel, optional sinceId, contextId, metadata)</li>
 *   <li>Persist channel traffic and presence to the configured store</li>
 *   <li>Expose /healthz, /readyz and /metrics endpoints</li>
 *   <li>Shut down gracefully on SIGTERM</li>
 * </ul>
 * </p>
 */
public class BrokerApp {
    private static final Logger log = LoggerFactory.getLogger(BrokerApp.class);

    public static void main(String[] args) {
        BrokerConfig config = BrokerConfig.fromEnv();
        MDC.put("nodeId", config.getNodeId());

        log.info("Starting broker node: {}", config.getNodeId());
        log.info("  Store: {}", config.isMemoryStore() ? "memory" : config.getDbPath());
        log.info("  Auth: {}", config.hasTokenSecret() ? "signed access tokens" : "static tokens");

        PrometheusMetricsExporter metricsExporter = PrometheusMetricsExporter.attachedToNetty(config.getNodeId());
        BrokerServer server = new BrokerServer(config, createStore(config), createTokenValidator(config),
            metricsExporter);

        server.start();

        log.info("Broker node {} is ready on port {}", config.getNodeId(), server.getPort());

        handleShutdown(config, server);

        // Keep the application running until shutdown signal
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Main thread interrupted");
        }
    }

    static MessageStore createStore(BrokerConfig config) {
        if (config.isMemoryStore()) {
            log.warn("Using in-memory store; history is lost on restart");
            return new InMemoryMessageStore();
        }
        return new SqliteMessageStore(Path.of(config.getDbPath()));
    }

    static TokenValidator createTokenValidator(BrokerConfig config) {
        if (config.hasTokenSecret()) {
            return new HmacTokenValidator(config.getTokenSecret(), Duration.ofSeconds(config.getTokenTtlSec()));
        }
        if (config.getStaticTokens().isEmpty()) {
            log.warn("Neither TOKEN_SECRET nor STATIC_TOKENS is set; every connection will be rejected");
        }
        return new StaticTokenValidator(config.getStaticTokens());
    }

    private static void handleShutdown(BrokerConfig config, BrokerServer server) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            MDC.put("nodeId", config.getNodeId());
            log.info("Shutdown signal received, initiating graceful shutdown...");
            server.stop();
            log.info("Shutdown complete");
        }));
    }
}
